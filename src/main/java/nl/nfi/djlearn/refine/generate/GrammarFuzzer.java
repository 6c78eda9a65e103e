package nl.nfi.djlearn.refine.generate;

import nl.nfi.djlearn.grammar.DerivationTree;
import nl.nfi.djlearn.grammar.Grammar;
import nl.nfi.djlearn.learn.Candidate;

import java.util.LinkedHashSet;
import java.util.Random;
import java.util.Set;

/**
 * Random grammar inputs, regardless of the candidate.
 */
public final class GrammarFuzzer implements InputGenerator {

    private final Grammar grammar;
    private final int numInputs;

    private GrammarFuzzer(final Grammar grammar, final int numInputs) {
        this.grammar = grammar;
        this.numInputs = numInputs;
    }

    public static GrammarFuzzer create(final Grammar grammar) {
        return new GrammarFuzzer(grammar, 5);
    }

    public GrammarFuzzer numInputs(final int numInputs) {
        return new GrammarFuzzer(grammar, numInputs);
    }

    @Override
    public Set<DerivationTree> generate(final Candidate candidate, final Random random) {
        final Set<DerivationTree> generated = new LinkedHashSet<>();
        for (int i = 0; i < numInputs && !Thread.currentThread().isInterrupted(); i++) {
            generated.add(grammar.fuzz(random));
        }
        return generated;
    }
}
