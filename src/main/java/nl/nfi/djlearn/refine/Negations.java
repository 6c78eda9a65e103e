package nl.nfi.djlearn.refine;

import nl.nfi.djlearn.constraint.Constraint;
import nl.nfi.djlearn.constraint.Constraints;
import nl.nfi.djlearn.learn.Candidate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Negated variants of candidates, used to look for counter examples.
 */
public final class Negations {

    private Negations() {
    }

    public static Set<Candidate> negateAll(final Collection<Candidate> candidates) {
        final Set<Candidate> negated = new LinkedHashSet<>();
        for (final Candidate candidate : candidates) {
            negated.addAll(negate(candidate));
        }
        return negated;
    }

    /**
     * A conjunction of n operands yields every non-empty selection of operands negated
     * (2^n - 1 variants), a disjunction yields n variants with a single negated operand, a
     * comparison gets its operator flipped and anything else is wrapped in a negation.
     * Single negations keep the complemented results of the candidate.
     */
    public static List<Candidate> negate(final Candidate candidate) {
        if (!candidate.isConjunction() && !candidate.isDisjunction()) {
            return List.of(candidate.negate());
        }
        final List<Candidate> negated = new ArrayList<>();
        for (final Constraint constraint : negate(candidate.constraint())) {
            negated.add(Candidate.of(constraint));
        }
        return negated;
    }

    public static List<Constraint> negate(final Constraint constraint) {
        if (constraint instanceof Constraint.Conjunction conjunction) {
            return signFlips(conjunction.operands());
        }
        if (constraint instanceof Constraint.Disjunction disjunction) {
            return singleFlips(disjunction.operands());
        }
        return List.of(negateLeaf(constraint));
    }

    private static List<Constraint> signFlips(final List<Constraint> operands) {
        final List<Constraint> variants = new ArrayList<>();
        final int n = operands.size();
        for (int mask = 1; mask < (1 << n); mask++) {
            final List<Constraint> flipped = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                flipped.add((mask & (1 << i)) != 0 ? negateLeaf(operands.get(i)) : operands.get(i));
            }
            variants.add(Constraints.and(flipped));
        }
        return variants;
    }

    private static List<Constraint> singleFlips(final List<Constraint> operands) {
        final List<Constraint> variants = new ArrayList<>();
        for (int i = 0; i < operands.size(); i++) {
            final List<Constraint> flipped = new ArrayList<>(operands);
            flipped.set(i, negateLeaf(operands.get(i)));
            variants.add(Constraints.or(flipped));
        }
        return variants;
    }

    private static Constraint negateLeaf(final Constraint constraint) {
        return Constraints.negate(constraint);
    }
}
