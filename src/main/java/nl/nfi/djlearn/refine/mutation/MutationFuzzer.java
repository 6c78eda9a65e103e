package nl.nfi.djlearn.refine.mutation;

import nl.nfi.djlearn.grammar.DerivationTree;
import nl.nfi.djlearn.grammar.Grammar;
import nl.nfi.djlearn.learn.LabeledInput;
import nl.nfi.djlearn.learn.Oracle;
import nl.nfi.djlearn.learn.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Evolves a population of labeled inputs by structural mutation. New inputs are labeled by
 * the oracle and join the population when they were not seen before and are not rejected.
 */
public final class MutationFuzzer {

    private static final Logger LOG = LoggerFactory.getLogger(MutationFuzzer.class);

    // iterations before the acceptance rate may stop a run
    private static final int WARM_UP_ITERATIONS = 20;
    private static final int ATTEMPTS_PER_MUTATION = 10;

    private final Grammar grammar;
    private final Oracle oracle;
    private final Collection<LabeledInput> seeds;
    private final int minMutations;
    private final int maxMutations;
    private final boolean onlyFailing;
    private final Random random;

    private final List<LabeledInput> population = new ArrayList<>();
    private final Set<LabeledInput> known = new HashSet<>();
    private final FragmentIndex fragments = new FragmentIndex();
    private final List<MutationOperator> operators;

    private MutationFuzzer(final Grammar grammar, final Oracle oracle, final Collection<LabeledInput> seeds, final int minMutations, final int maxMutations, final boolean onlyFailing, final Random random) {
        if (minMutations < 1 || maxMutations < minMutations) {
            throw new IllegalArgumentException("Invalid mutation bounds: [%d, %d]".formatted(minMutations, maxMutations));
        }
        if (seeds.isEmpty()) {
            throw new IllegalArgumentException("Mutation fuzzer needs at least one seed input");
        }
        this.grammar = grammar;
        this.oracle = oracle;
        this.seeds = List.copyOf(seeds);
        this.minMutations = minMutations;
        this.maxMutations = maxMutations;
        this.onlyFailing = onlyFailing;
        this.random = random;
        this.operators = List.of(
                new ReplaceFragmentOperator(fragments),
                new ReplaceRandomSubtreeOperator(grammar),
                new SwapSubtreeOperator()
        );
        reset();
    }

    public static MutationFuzzer create(final Grammar grammar, final Oracle oracle, final Collection<LabeledInput> seeds) {
        return new MutationFuzzer(grammar, oracle, seeds, 2, 10, false, new Random());
    }

    public MutationFuzzer mutations(final int minMutations, final int maxMutations) {
        return new MutationFuzzer(grammar, oracle, seeds, minMutations, maxMutations, onlyFailing, random);
    }

    /**
     * Also reject inputs the oracle labels passing.
     */
    public MutationFuzzer onlyFailing(final boolean onlyFailing) {
        return new MutationFuzzer(grammar, oracle, seeds, minMutations, maxMutations, onlyFailing, random);
    }

    public MutationFuzzer random(final Random random) {
        return new MutationFuzzer(grammar, oracle, seeds, minMutations, maxMutations, onlyFailing, random);
    }

    public void reset() {
        population.clear();
        known.clear();
        for (final LabeledInput seed : seeds) {
            if (known.add(seed)) {
                population.add(seed);
                fragments.add(seed.tree());
            }
        }
    }

    public List<LabeledInput> population() {
        return Collections.unmodifiableList(population);
    }

    public List<LabeledInput> run() {
        return run(500, 0.1, true, false);
    }

    /**
     * Fuzzes until the iteration budget is spent, or, after a warm up, until the share of
     * accepted inputs drops below {@code alpha}.
     *
     * @return accepted inputs, followed in generation order by rejected ones when
     * {@code yieldRejected} is set
     */
    public List<LabeledInput> run(final int iterations, final double alpha, final boolean updateFragments, final boolean yieldRejected) {
        LOG.debug("Starting mutation fuzzer with {} seeds", population.size());
        final List<LabeledInput> produced = new ArrayList<>();
        int accepted = 0;
        int i = 0;
        for (; i < iterations; i++) {
            if (i >= WARM_UP_ITERATIONS && (double) accepted / i < alpha) {
                LOG.debug("Acceptance rate dropped below {} after {} iterations", alpha, i);
                break;
            }
            final DerivationTree tree = fuzz();
            final Optional<LabeledInput> result = process(tree, updateFragments);
            if (result.isPresent()) {
                accepted++;
                produced.add(result.get());
            } else if (yieldRejected) {
                produced.add(LabeledInput.of(tree, Verdict.UNDEFINED));
            }
        }
        LOG.debug("Mutation fuzzer accepted {} of {} inputs", accepted, i);
        return produced;
    }

    /**
     * Applies a random number of mutations to a random member of the population.
     */
    public DerivationTree fuzz() {
        final int mutations = minMutations + random.nextInt(maxMutations - minMutations + 1);
        DerivationTree current = population.get(random.nextInt(population.size())).tree();
        int applied = 0;
        int attempts = 0;
        while (applied < mutations && attempts < mutations * ATTEMPTS_PER_MUTATION) {
            attempts++;
            final Optional<DerivationTree> mutated = mutate(current);
            if (mutated.isPresent()) {
                current = mutated.get();
                applied++;
            }
        }
        return current;
    }

    /**
     * Tries non-terminal positions in random order until an operator applies.
     */
    public Optional<DerivationTree> mutate(final DerivationTree tree) {
        final List<List<Integer>> paths = new ArrayList<>();
        for (final DerivationTree.Located located : tree.locate()) {
            if (located.tree().symbol().isNonTerminal()) {
                paths.add(located.path());
            }
        }
        Collections.shuffle(paths, random);
        for (final List<Integer> path : paths) {
            final MutationOperator operator = operators.get(random.nextInt(operators.size()));
            final Optional<DerivationTree> mutated = operator.apply(tree, path, random);
            if (mutated.isPresent()) {
                return mutated;
            }
        }
        return Optional.empty();
    }

    private Optional<LabeledInput> process(final DerivationTree tree, final boolean updateFragments) {
        final LabeledInput unlabeled = LabeledInput.of(tree, Verdict.UNDEFINED);
        if (known.contains(unlabeled)) {
            return Optional.empty();
        }
        final LabeledInput labeled = LabeledInput.label(tree, oracle);
        if (labeled.verdict() == Verdict.UNDEFINED || (onlyFailing && labeled.isPassing())) {
            return Optional.empty();
        }
        known.add(labeled);
        population.add(labeled);
        if (updateFragments) {
            fragments.add(tree);
        }
        return Optional.of(labeled);
    }
}
