package nl.nfi.djlearn.learn;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Orderings used to rank candidates. Each ordering sorts the fittest candidate first.
 */
public enum Fitness {

    RECALL_PRECISION(Comparator.comparingDouble(Candidate::recall)
            .thenComparingDouble(Candidate::precision)
            .reversed()),

    RECALL_PRECISION_SIZE(Comparator.comparingDouble(Candidate::recall)
            .thenComparingDouble(Candidate::precision)
            .reversed()
            .thenComparingInt(Candidate::size)),

    RECALL_PRECISION_LENGTH(Comparator.comparingDouble(Candidate::recall)
            .thenComparingDouble(Candidate::precision)
            .reversed()
            .thenComparingInt(candidate -> candidate.text().length())),

    RECALL_SPECIFICITY_SIZE(Comparator.comparingDouble(Candidate::recall)
            .thenComparingDouble(Candidate::specificity)
            .reversed()
            .thenComparingInt(Candidate::size)),

    F1_SIZE(Comparator.comparingDouble(Fitness::f1)
            .reversed()
            .thenComparingInt(Candidate::size));

    private final Comparator<Candidate> order;

    Fitness(final Comparator<Candidate> order) {
        this.order = order;
    }

    public Comparator<Candidate> order() {
        return order;
    }

    /**
     * Candidates sorted fittest first, ties broken by canonical text.
     */
    public List<Candidate> sort(final Collection<Candidate> candidates) {
        final List<Candidate> sorted = new ArrayList<>(candidates);
        sorted.sort(order.thenComparing(Candidate::text));
        return sorted;
    }

    /**
     * All candidates that rank equal to the fittest one.
     */
    public List<Candidate> best(final Collection<Candidate> candidates) {
        final List<Candidate> sorted = sort(candidates);
        final List<Candidate> best = new ArrayList<>();
        for (final Candidate candidate : sorted) {
            if (!best.isEmpty() && order.compare(best.get(0), candidate) != 0) {
                break;
            }
            best.add(candidate);
        }
        return best;
    }

    private static double f1(final Candidate candidate) {
        final double precision = candidate.precision();
        final double recall = candidate.recall();
        return precision + recall == 0.0 ? 0.0 : 2 * precision * recall / (precision + recall);
    }
}
