package nl.nfi.djlearn.learn;

import java.util.List;

/**
 * Decides whether a disjunction of candidates is worth keeping.
 */
@FunctionalInterface
public interface DisjunctionValidation {

    boolean accept(Candidate disjunction, List<Candidate> operands);

    /**
     * Recall exceeds the floor and the recall of every operand.
     */
    static DisjunctionValidation recallImprovement(final double minRecall) {
        return (disjunction, operands) -> disjunction.recall() > minRecall
                && operands.stream().allMatch(operand -> disjunction.recall() > operand.recall());
    }

    static DisjunctionValidation precisionFloor(final double minPrecision) {
        return (disjunction, operands) -> disjunction.precision() >= minPrecision
                && operands.stream().anyMatch(operand -> disjunction.recall() > operand.recall());
    }

    /**
     * Recall gain over the best operand outweighs the precision lost against it.
     */
    static DisjunctionValidation recallGainOutweighsPrecisionLoss(final double weight) {
        return (disjunction, operands) -> {
            double bestRecall = 0.0;
            double bestPrecision = 0.0;
            for (final Candidate operand : operands) {
                bestRecall = Math.max(bestRecall, operand.recall());
                bestPrecision = Math.max(bestPrecision, operand.precision());
            }
            final double gain = disjunction.recall() - bestRecall;
            final double loss = bestPrecision - disjunction.precision();
            return gain > 0.0 && gain > weight * loss;
        };
    }

    static DisjunctionValidation minimumSpecificity(final double minSpecificity) {
        return (disjunction, operands) -> disjunction.specificity() >= minSpecificity
                && operands.stream().allMatch(operand -> disjunction.recall() > operand.recall());
    }

    /**
     * Precision drops at most the tolerance below the operands' average precision.
     */
    static DisjunctionValidation averagePrecisionDrop(final double tolerance) {
        return (disjunction, operands) -> {
            final double average = operands.stream().mapToDouble(Candidate::precision).average().orElse(0.0);
            return average - disjunction.precision() <= tolerance
                    && operands.stream().allMatch(operand -> disjunction.recall() > operand.recall());
        };
    }
}
