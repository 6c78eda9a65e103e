package nl.nfi.djlearn.learn;

import nl.nfi.djlearn.common.Timers.TimedResult;
import nl.nfi.djlearn.constraint.Constraint;
import nl.nfi.djlearn.grammar.Grammar;
import nl.nfi.djlearn.grammar.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static nl.nfi.djlearn.common.Timers.time;

/**
 * Mines candidate constraints that separate failing from passing inputs. The learner itself
 * is immutable; all state accumulated across calls lives in a {@link LearningSession}.
 */
public final class ConstraintLearner {

    private static final Logger LOG = LoggerFactory.getLogger(ConstraintLearner.class);

    private final Grammar grammar;
    private final List<Constraint> templates;
    private final LearnerConfig config;
    private final RelevanceReducer reducer;

    private ConstraintLearner(final Grammar grammar, final List<Constraint> templates, final LearnerConfig config, final RelevanceReducer reducer) {
        this.grammar = grammar;
        this.templates = templates;
        this.config = config;
        this.reducer = reducer;
    }

    public static ConstraintLearner forGrammar(final Grammar grammar) {
        return new ConstraintLearner(grammar, TemplateRepository.defaults().all(), LearnerConfig.defaults(), null);
    }

    public ConstraintLearner templates(final Collection<Constraint> templates) {
        return new ConstraintLearner(grammar, List.copyOf(templates), config, reducer);
    }

    public ConstraintLearner config(final LearnerConfig config) {
        return new ConstraintLearner(grammar, templates, config, reducer);
    }

    public ConstraintLearner reducer(final RelevanceReducer reducer) {
        return new ConstraintLearner(grammar, templates, config, reducer);
    }

    public Grammar grammar() {
        return grammar;
    }

    public LearnerConfig config() {
        return config;
    }

    public LearningSession newSession() {
        return new LearningSession();
    }

    public List<Candidate> learn(final LearningSession session, final Collection<LabeledInput> inputs) {
        return learn(session, inputs, Set.of());
    }

    /**
     * Parses and labels the texts before learning from them.
     */
    public List<Candidate> learnFromStrings(final LearningSession session, final Collection<String> texts, final Set<Symbol> relevantSymbols, final Oracle oracle) {
        final List<LabeledInput> inputs = new ArrayList<>();
        for (final String text : texts) {
            inputs.add(LabeledInput.label(grammar.parse(text), oracle));
        }
        return learn(session, inputs, relevantSymbols);
    }

    /**
     * Learns from the inputs merged with everything the session saw before and returns all
     * candidates ranked equal to the best one.
     *
     * @param relevantSymbols symbols to instantiate templates with, derived from the failing
     *                        inputs when empty
     */
    public List<Candidate> learn(final LearningSession session, final Collection<LabeledInput> inputs, final Set<Symbol> relevantSymbols) {
        final List<LabeledInput> added = session.merge(inputs);
        if (session.failingInputs().isEmpty()) {
            throw new IllegalArgumentException("Cannot learn without failing inputs");
        }
        LOG.info("Learning from {} new inputs ({} failing, {} passing in total)", added.size(), session.failingInputs().size(), session.passingInputs().size());

        final Set<Symbol> relevant = relevantSymbols(session, relevantSymbols);
        LOG.debug("Relevant symbols: {}", relevant);

        final List<LabeledInput> positives = capped(session.failingInputs());
        final ValueMaps values = ValueMaps.extract(relevant, positives);
        final TimedResult<List<Constraint>> instantiated = time(() -> TemplateInstantiator
                .create(relevant, grammar.reachability(), values, positives)
                .instantiate(templates));
        LOG.debug("Instantiated {} constraints in {} ms", instantiated.value().size(), instantiated.duration().toMillis());

        final CandidateSet candidates = session.mutableCandidates();
        recheck(session, candidates);

        int rejected = 0;
        for (final Constraint constraint : instantiated.value()) {
            final Candidate candidate = Candidate.of(constraint);
            if (candidates.contains(candidate) || session.isRemoved(candidate)) {
                continue;
            }
            if (admit(session, candidate)) {
                candidates.add(candidate);
            } else {
                session.remove(candidate);
                rejected++;
            }
        }
        LOG.debug("Kept {} candidates, rejected {}", candidates.size(), rejected);

        combine(candidates);

        final List<Candidate> best = config.fitness().best(candidates);
        if (!best.isEmpty()) {
            LOG.info("Best of {} candidates: {} tied at {}", candidates.size(), best.size(), best.get(0));
        }
        return best;
    }

    /**
     * All kept candidates sorted by the configured fitness.
     */
    public List<Candidate> ranked(final LearningSession session) {
        return config.fitness().sort(session.candidates());
    }

    private void recheck(final LearningSession session, final CandidateSet candidates) {
        for (final Candidate candidate : new ArrayList<>(candidates)) {
            if (candidate.isConjunction() || candidate.isDisjunction()) {
                // combinations are rebuilt from the surviving operands
                candidates.remove(candidate);
            } else if (!admit(session, candidate)) {
                LOG.debug("Dropping candidate {}", candidate.text());
                session.remove(candidate);
            }
        }
    }

    private boolean admit(final LearningSession session, final Candidate candidate) {
        candidate.evaluate(session.failingInputs());
        if (candidate.recall() < config.minRecall()) {
            return false;
        }
        candidate.evaluate(session.passingInputs());
        return true;
    }

    private void combine(final CandidateSet candidates) {
        final List<Candidate> operands = new ArrayList<>(candidates);
        if (config.maxConjunctionSize() >= 2) {
            candidates.addAll(ConjunctionProcessor.create(config.maxConjunctionSize(), config.minPrecision()).process(operands));
        }
        if (config.maxDisjunctionSize() >= 2) {
            candidates.addAll(DisjunctionProcessor.create(config.maxDisjunctionSize(), config.minRecall()).process(operands));
        }
    }

    private Set<Symbol> relevantSymbols(final LearningSession session, final Set<Symbol> given) {
        if (given != null && !given.isEmpty()) {
            return given;
        }
        if (reducer != null) {
            final Set<LabeledInput> all = session.allInputs();
            FeatureCollector.forGrammar(grammar).annotate(all);
            return reducer.reduce(all);
        }
        if (config.useAllNonTerminals()) {
            return grammar.nonTerminals();
        }
        final Set<Symbol> symbols = new LinkedHashSet<>();
        for (final LabeledInput input : session.failingInputs()) {
            symbols.addAll(input.tree().nonTerminalSymbols());
        }
        return symbols;
    }

    private List<LabeledInput> capped(final Set<LabeledInput> failing) {
        final List<LabeledInput> sorted = new ArrayList<>(failing);
        sorted.sort(Comparator.<LabeledInput>comparingInt(input -> input.tree().toString().length())
                .thenComparing(input -> input.tree().toString()));
        return sorted.subList(0, Math.min(config.positiveLearningSize(), sorted.size()));
    }
}
