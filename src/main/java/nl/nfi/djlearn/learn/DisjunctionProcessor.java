package nl.nfi.djlearn.learn;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Builds disjunctions of up to {@code maxSize} candidates, accepted by a pluggable
 * {@link DisjunctionValidation}.
 */
public final class DisjunctionProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(DisjunctionProcessor.class);

    private final int maxSize;
    private final DisjunctionValidation validation;

    private DisjunctionProcessor(final int maxSize, final DisjunctionValidation validation) {
        this.maxSize = maxSize;
        this.validation = validation;
    }

    public static DisjunctionProcessor create(final int maxSize, final double minRecall) {
        return new DisjunctionProcessor(maxSize, DisjunctionValidation.recallImprovement(minRecall));
    }

    public DisjunctionProcessor validation(final DisjunctionValidation validation) {
        return new DisjunctionProcessor(maxSize, validation);
    }

    public List<Candidate> process(final Collection<Candidate> candidates) {
        final List<Candidate> operands = new ArrayList<>();
        for (final Candidate candidate : candidates) {
            if (!candidate.isDisjunction()) {
                operands.add(candidate);
            }
        }
        operands.sort(Comparator.comparing(Candidate::text));

        final List<Candidate> accepted = new ArrayList<>();
        for (int k = 2; k <= maxSize; k++) {
            Combinations.forEach(operands, k, combination -> {
                final Candidate disjunction = Candidate.disjunction(combination);
                if (validation.accept(disjunction, combination)) {
                    accepted.add(disjunction);
                }
            });
        }
        LOG.debug("Kept {} disjunctions out of {} operands", accepted.size(), operands.size());
        return accepted;
    }
}
