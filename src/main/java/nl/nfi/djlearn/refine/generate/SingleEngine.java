package nl.nfi.djlearn.refine.generate;

import nl.nfi.djlearn.grammar.DerivationTree;
import nl.nfi.djlearn.learn.Candidate;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Random;
import java.util.Set;

public final class SingleEngine implements GenerationEngine {

    private final Random random;

    private SingleEngine(final Random random) {
        this.random = random;
    }

    public static SingleEngine create() {
        return new SingleEngine(new Random());
    }

    public SingleEngine random(final Random random) {
        return new SingleEngine(random);
    }

    @Override
    public Set<DerivationTree> generate(final InputGenerator generator, final Collection<Candidate> candidates) {
        final Set<DerivationTree> generated = new LinkedHashSet<>();
        for (final Candidate candidate : candidates) {
            generated.addAll(generator.generate(candidate, random));
        }
        return generated;
    }
}
