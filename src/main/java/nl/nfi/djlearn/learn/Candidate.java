package nl.nfi.djlearn.learn;

import nl.nfi.djlearn.constraint.Constraint;
import nl.nfi.djlearn.constraint.ConstraintEvaluationException;
import nl.nfi.djlearn.constraint.ConstraintEvaluator;
import nl.nfi.djlearn.constraint.ConstraintPrinter;
import nl.nfi.djlearn.constraint.Constraints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BinaryOperator;

/**
 * A concrete constraint together with the results of checking it against labeled inputs.
 * Candidates are equal when their constraints have the same canonical text.
 */
public final class Candidate {

    private static final Logger LOG = LoggerFactory.getLogger(Candidate.class);

    private final Constraint constraint;
    private final String text;
    private final List<Boolean> failingResults = new ArrayList<>();
    private final List<Boolean> passingResults = new ArrayList<>();
    private final Map<LabeledInput, Boolean> cache = new LinkedHashMap<>();

    private Candidate(final Constraint constraint) {
        this.constraint = constraint;
        this.text = ConstraintPrinter.print(constraint);
    }

    public static Candidate of(final Constraint constraint) {
        return new Candidate(constraint);
    }

    public Constraint constraint() {
        return constraint;
    }

    public String text() {
        return text;
    }

    public int size() {
        return Constraints.size(constraint);
    }

    public boolean isConjunction() {
        return constraint instanceof Constraint.Conjunction;
    }

    public boolean isDisjunction() {
        return constraint instanceof Constraint.Disjunction;
    }

    /**
     * Checks the constraint against every input not seen before. Inputs on which the
     * constraint cannot be evaluated count as not satisfied.
     */
    public void evaluate(final Collection<LabeledInput> inputs) {
        for (final LabeledInput input : inputs) {
            if (input.verdict() == Verdict.UNDEFINED || cache.containsKey(input)) {
                continue;
            }
            record(input, check(input));
        }
    }

    private boolean check(final LabeledInput input) {
        try {
            return ConstraintEvaluator.check(constraint, input.tree());
        } catch (final ConstraintEvaluationException e) {
            LOG.debug("Constraint {} not evaluable on {}: {}", text, input.tree(), e.getMessage());
            return false;
        }
    }

    private void record(final LabeledInput input, final boolean result) {
        cache.put(input, result);
        if (input.isFailing()) {
            failingResults.add(result);
        } else {
            passingResults.add(result);
        }
    }

    public Map<LabeledInput, Boolean> cache() {
        return Collections.unmodifiableMap(cache);
    }

    public boolean holdsFor(final LabeledInput input) {
        final Boolean result = cache.get(input);
        if (result == null) {
            throw new IllegalArgumentException("Candidate was not evaluated on input: %s".formatted(input));
        }
        return result;
    }

    public double precision() {
        final long truePositives = count(failingResults, true);
        final long falsePositives = count(passingResults, true);
        final long predicted = truePositives + falsePositives;
        return predicted == 0 ? 0.0 : (double) truePositives / predicted;
    }

    public double recall() {
        return failingResults.isEmpty() ? 0.0 : (double) count(failingResults, true) / failingResults.size();
    }

    public double specificity() {
        return passingResults.isEmpty() ? 0.0 : (double) count(passingResults, false) / passingResults.size();
    }

    public int failingCount() {
        return failingResults.size();
    }

    public int passingCount() {
        return passingResults.size();
    }

    private static long count(final List<Boolean> results, final boolean value) {
        return results.stream().filter(result -> result == value).count();
    }

    public Candidate and(final Candidate other) {
        return combine(List.of(this, other), Constraints.and(List.of(constraint, other.constraint)), Boolean::logicalAnd);
    }

    public Candidate or(final Candidate other) {
        return combine(List.of(this, other), Constraints.or(List.of(constraint, other.constraint)), Boolean::logicalOr);
    }

    /**
     * The negated candidate, with every cached result complemented.
     */
    public Candidate negate() {
        final Candidate negated = new Candidate(Constraints.negate(constraint));
        cache.forEach((input, result) -> negated.record(input, !result));
        return negated;
    }

    public static Candidate conjunction(final List<Candidate> operands) {
        return combine(operands, Constraints.and(constraints(operands)), Boolean::logicalAnd);
    }

    public static Candidate disjunction(final List<Candidate> operands) {
        return combine(operands, Constraints.or(constraints(operands)), Boolean::logicalOr);
    }

    private static List<Constraint> constraints(final List<Candidate> candidates) {
        final List<Constraint> constraints = new ArrayList<>(candidates.size());
        for (final Candidate candidate : candidates) {
            constraints.add(candidate.constraint);
        }
        return constraints;
    }

    private static Candidate combine(final List<Candidate> operands, final Constraint constraint, final BinaryOperator<Boolean> operator) {
        final Candidate first = operands.get(0);
        for (final Candidate operand : operands) {
            if (!operand.cache.keySet().equals(first.cache.keySet())) {
                throw new IllegalArgumentException("Cannot combine candidates evaluated on different inputs: %s and %s".formatted(first, operand));
            }
        }
        final Candidate combined = new Candidate(constraint);
        first.cache.forEach((input, result) -> {
            boolean value = result;
            for (int i = 1; i < operands.size(); i++) {
                value = operator.apply(value, operands.get(i).cache.get(input));
            }
            combined.record(input, value);
        });
        return combined;
    }

    @Override
    public boolean equals(final Object o) {
        return this == o || (o instanceof Candidate other && text.equals(other.text));
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return "%s (precision %.3f, recall %.3f)".formatted(text, precision(), recall());
    }
}
