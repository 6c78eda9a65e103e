package nl.nfi.djlearn.learn;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Builds conjunctions of up to {@code maxSize} candidates and keeps those whose precision
 * exceeds the floor and the precision of each operand.
 */
public final class ConjunctionProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(ConjunctionProcessor.class);

    private final int maxSize;
    private final double minPrecision;

    private ConjunctionProcessor(final int maxSize, final double minPrecision) {
        this.maxSize = maxSize;
        this.minPrecision = minPrecision;
    }

    public static ConjunctionProcessor create(final int maxSize, final double minPrecision) {
        return new ConjunctionProcessor(maxSize, minPrecision);
    }

    public List<Candidate> process(final Collection<Candidate> candidates) {
        final List<Candidate> operands = new ArrayList<>();
        for (final Candidate candidate : candidates) {
            if (!candidate.isConjunction()) {
                operands.add(candidate);
            }
        }
        operands.sort(Comparator.comparing(Candidate::text));

        final List<Candidate> accepted = new ArrayList<>();
        for (int k = 2; k <= maxSize; k++) {
            Combinations.forEach(operands, k, combination -> {
                final Candidate conjunction = Candidate.conjunction(combination);
                if (improves(conjunction, combination)) {
                    accepted.add(conjunction);
                }
            });
        }
        LOG.debug("Kept {} conjunctions out of {} operands", accepted.size(), operands.size());
        return accepted;
    }

    private boolean improves(final Candidate conjunction, final List<Candidate> operands) {
        final double precision = conjunction.precision();
        if (precision <= minPrecision) {
            return false;
        }
        for (final Candidate operand : operands) {
            if (precision <= operand.precision()) {
                return false;
            }
        }
        return true;
    }
}
