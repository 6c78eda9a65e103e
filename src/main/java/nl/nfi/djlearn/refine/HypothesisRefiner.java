package nl.nfi.djlearn.refine;

import nl.nfi.djlearn.common.Timers;
import nl.nfi.djlearn.common.Timers.Deadline;
import nl.nfi.djlearn.grammar.DerivationTree;
import nl.nfi.djlearn.grammar.Grammar;
import nl.nfi.djlearn.grammar.Symbol;
import nl.nfi.djlearn.learn.Candidate;
import nl.nfi.djlearn.learn.ConstraintLearner;
import nl.nfi.djlearn.learn.LabeledInput;
import nl.nfi.djlearn.learn.LearningSession;
import nl.nfi.djlearn.refine.generate.ConstraintGuidedGenerator;
import nl.nfi.djlearn.refine.generate.GenerationEngine;
import nl.nfi.djlearn.refine.generate.ParallelEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Learns candidate diagnoses from seed inputs and refines them: every round the top
 * candidates and their negations are used to generate new inputs, which are labeled and fed
 * back to the learner. Candidates that only held by accident lose precision or recall on the
 * new inputs and drop out.
 */
public final class HypothesisRefiner {

    private static final Logger LOG = LoggerFactory.getLogger(HypothesisRefiner.class);

    private final ConstraintLearner learner;
    private final ExecutionHandler handler;
    private final List<String> seeds;
    private final RefinementConfig config;
    private final Set<Symbol> relevantSymbols;
    private final GenerationEngine engine;

    private HypothesisRefiner(final ConstraintLearner learner, final ExecutionHandler handler, final List<String> seeds, final RefinementConfig config, final Set<Symbol> relevantSymbols, final GenerationEngine engine) {
        this.learner = learner;
        this.handler = handler;
        this.seeds = seeds;
        this.config = config;
        this.relevantSymbols = relevantSymbols;
        this.engine = engine;
    }

    public static HypothesisRefiner create(final ConstraintLearner learner, final ExecutionHandler handler, final Collection<String> seeds) {
        return new HypothesisRefiner(learner, handler, List.copyOf(seeds), RefinementConfig.defaults(), Set.of(), null);
    }

    public HypothesisRefiner config(final RefinementConfig config) {
        return new HypothesisRefiner(learner, handler, seeds, config, relevantSymbols, engine);
    }

    public HypothesisRefiner relevantSymbols(final Set<Symbol> relevantSymbols) {
        return new HypothesisRefiner(learner, handler, seeds, config, Set.copyOf(relevantSymbols), engine);
    }

    /**
     * Defaults to a {@link ParallelEngine} with the configured number of workers, bounded by
     * the time left.
     */
    public HypothesisRefiner engine(final GenerationEngine engine) {
        return new HypothesisRefiner(learner, handler, seeds, config, relevantSymbols, engine);
    }

    /**
     * Runs the refinement loop until the iteration count or the timeout is reached.
     *
     * @return the best candidates found, ranked equal by the learner's fitness
     * @throws IllegalArgumentException if a seed does not parse, or the seeds do not contain
     *                                  both a failing and a passing input
     */
    public List<Candidate> explain() {
        final Deadline deadline = Timers.deadline(config.timeout());
        final Grammar grammar = learner.grammar();

        final Set<DerivationTree> trees = new LinkedHashSet<>();
        for (final String seed : seeds) {
            trees.add(grammar.parse(seed));
        }
        final Set<LabeledInput> labeledSeeds = handler.label(trees);
        if (labeledSeeds.stream().noneMatch(LabeledInput::isFailing)) {
            throw new IllegalArgumentException("Refinement needs at least one failing seed input");
        }
        if (labeledSeeds.stream().noneMatch(LabeledInput::isPassing)) {
            throw new IllegalArgumentException("Refinement needs at least one passing seed input");
        }

        final LearningSession session = learner.newSession();
        final Set<DerivationTree> known = new HashSet<>(trees);
        Collection<LabeledInput> pending = labeledSeeds;
        int iteration = 0;
        try {
            while (iteration < config.maxIterations() && !deadline.expired()) {
                LOG.info("Starting refinement iteration {}", iteration);
                learner.learn(session, pending, relevantSymbols);
                pending = List.of();

                final List<Candidate> top = top(learner.ranked(session));
                final Set<Candidate> targets = new LinkedHashSet<>(top);
                targets.addAll(Negations.negateAll(top));

                final ConstraintGuidedGenerator generator = ConstraintGuidedGenerator.create(grammar)
                        .seeds(known)
                        .numInputs(config.numInputs())
                        .timeout(config.generationTimeout());
                final Set<DerivationTree> generated = new LinkedHashSet<>(engine(deadline).generate(generator, targets));
                generated.removeAll(known);
                known.addAll(generated);

                pending = handler.label(generated);
                LOG.info("Iteration {} generated {} new inputs for {} candidates", iteration, generated.size(), targets.size());
                iteration++;
            }
            if (!pending.isEmpty()) {
                learner.learn(session, pending, relevantSymbols);
            }
        } catch (final Exception e) {
            LOG.error("Refinement stopped in iteration {}", iteration, e);
        }
        if (deadline.expired()) {
            LOG.info("Refinement timed out after {} iterations", iteration);
        }

        final List<Candidate> best = learner.config().fitness().best(session.candidates());
        LOG.info("Refinement finished with {} inputs, {} best candidates", session.allInputs().size(), best.size());
        return best;
    }

    private List<Candidate> top(final List<Candidate> ranked) {
        return ranked.subList(0, Math.min(config.topCandidates(), ranked.size()));
    }

    private GenerationEngine engine(final Deadline deadline) {
        if (engine != null) {
            return engine;
        }
        return ParallelEngine.create()
                .maxWorkers(config.workers())
                .budget(deadline.remaining());
    }
}
