package nl.nfi.djlearn.refine.generate;

import nl.nfi.djlearn.common.Timers;
import nl.nfi.djlearn.common.Timers.Deadline;
import nl.nfi.djlearn.constraint.Constraint;
import nl.nfi.djlearn.constraint.ConstraintEvaluationException;
import nl.nfi.djlearn.constraint.ConstraintEvaluator;
import nl.nfi.djlearn.grammar.DerivationTree;
import nl.nfi.djlearn.grammar.Grammar;
import nl.nfi.djlearn.learn.Candidate;
import nl.nfi.djlearn.refine.mutation.MutationOperator;
import nl.nfi.djlearn.refine.mutation.ReplaceRandomSubtreeOperator;
import nl.nfi.djlearn.refine.mutation.SwapSubtreeOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Searches for inputs satisfying the candidate's constraint by fuzzing the grammar and by
 * mutating inputs already known to satisfy it, until enough distinct inputs are found or the
 * per-candidate time budget is spent.
 */
public final class ConstraintGuidedGenerator implements InputGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(ConstraintGuidedGenerator.class);

    private final Grammar grammar;
    private final List<DerivationTree> seeds;
    private final int numInputs;
    private final Duration timeout;
    private final List<MutationOperator> operators;

    private ConstraintGuidedGenerator(final Grammar grammar, final List<DerivationTree> seeds, final int numInputs, final Duration timeout) {
        this.grammar = grammar;
        this.seeds = seeds;
        this.numInputs = numInputs;
        this.timeout = timeout;
        this.operators = List.of(new ReplaceRandomSubtreeOperator(grammar), new SwapSubtreeOperator());
    }

    public static ConstraintGuidedGenerator create(final Grammar grammar) {
        return new ConstraintGuidedGenerator(grammar, List.of(), 5, Duration.ofSeconds(1));
    }

    /**
     * Known inputs to start mutating from. Those satisfying the constraint seed the search
     * but are not reported.
     */
    public ConstraintGuidedGenerator seeds(final Collection<DerivationTree> seeds) {
        return new ConstraintGuidedGenerator(grammar, List.copyOf(seeds), numInputs, timeout);
    }

    public ConstraintGuidedGenerator numInputs(final int numInputs) {
        return new ConstraintGuidedGenerator(grammar, seeds, numInputs, timeout);
    }

    public ConstraintGuidedGenerator timeout(final Duration timeout) {
        return new ConstraintGuidedGenerator(grammar, seeds, numInputs, timeout);
    }

    @Override
    public Set<DerivationTree> generate(final Candidate candidate, final Random random) {
        final Constraint constraint = candidate.constraint();
        final Deadline deadline = Timers.deadline(timeout);

        final List<DerivationTree> pool = new ArrayList<>();
        for (final DerivationTree seed : seeds) {
            if (satisfies(constraint, seed)) {
                pool.add(seed);
            }
        }
        final Set<DerivationTree> known = new LinkedHashSet<>(seeds);

        final Set<DerivationTree> found = new LinkedHashSet<>();
        long attempts = 0;
        while (found.size() < numInputs && !deadline.expired() && !Thread.currentThread().isInterrupted()) {
            attempts++;
            final DerivationTree tree = !pool.isEmpty() && random.nextBoolean()
                    ? mutate(pool.get(random.nextInt(pool.size())), random).orElseGet(() -> grammar.fuzz(random))
                    : grammar.fuzz(random);
            if (!known.contains(tree) && satisfies(constraint, tree)) {
                found.add(tree);
                known.add(tree);
                pool.add(tree);
            }
        }
        LOG.debug("Generated {} inputs for {} in {} attempts", found.size(), candidate.text(), attempts);
        return found;
    }

    private Optional<DerivationTree> mutate(final DerivationTree tree, final Random random) {
        final List<DerivationTree.Located> positions = new ArrayList<>();
        for (final DerivationTree.Located located : tree.locate()) {
            if (located.tree().symbol().isNonTerminal()) {
                positions.add(located);
            }
        }
        if (positions.isEmpty()) {
            return Optional.empty();
        }
        final DerivationTree.Located position = positions.get(random.nextInt(positions.size()));
        return operators.get(random.nextInt(operators.size())).apply(tree, position.path(), random);
    }

    private static boolean satisfies(final Constraint constraint, final DerivationTree tree) {
        try {
            return ConstraintEvaluator.check(constraint, tree);
        } catch (final ConstraintEvaluationException e) {
            return false;
        }
    }
}
