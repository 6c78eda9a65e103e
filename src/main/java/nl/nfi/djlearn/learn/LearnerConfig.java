package nl.nfi.djlearn.learn;

import nl.nfi.djlearn.common.ini.IniSection;

public record LearnerConfig(
        double minPrecision,
        double minRecall,
        int maxConjunctionSize,
        int maxDisjunctionSize,
        int positiveLearningSize,
        boolean useAllNonTerminals,
        Fitness fitness
) {

    public static final String SECTION = "LEARNER";

    public LearnerConfig {
        if (minPrecision < 0.0 || minPrecision > 1.0) {
            throw new IllegalArgumentException("Minimum precision must be within [0, 1]: %s".formatted(minPrecision));
        }
        if (minRecall < 0.0 || minRecall > 1.0) {
            throw new IllegalArgumentException("Minimum recall must be within [0, 1]: %s".formatted(minRecall));
        }
        if (positiveLearningSize < 1) {
            throw new IllegalArgumentException("Positive learning size must be positive: %d".formatted(positiveLearningSize));
        }
    }

    public static LearnerConfig defaults() {
        return new LearnerConfig(0.6, 0.9, 2, 1, 5, false, Fitness.RECALL_PRECISION_SIZE);
    }

    public static LearnerConfig loadFrom(final IniSection section) {
        final LearnerConfig defaults = defaults();
        return new LearnerConfig(
                section.getDouble("min_precision", defaults.minPrecision),
                section.getDouble("min_recall", defaults.minRecall),
                section.getInt("max_conjunction_size", defaults.maxConjunctionSize),
                section.getInt("max_disjunction_size", defaults.maxDisjunctionSize),
                section.getInt("positive_learning_size", defaults.positiveLearningSize),
                section.getBoolean("use_all_non_terminals", defaults.useAllNonTerminals),
                Fitness.valueOf(section.getString("fitness", defaults.fitness.name()).toUpperCase())
        );
    }

    public LearnerConfig minPrecision(final double minPrecision) {
        return new LearnerConfig(minPrecision, minRecall, maxConjunctionSize, maxDisjunctionSize, positiveLearningSize, useAllNonTerminals, fitness);
    }

    public LearnerConfig minRecall(final double minRecall) {
        return new LearnerConfig(minPrecision, minRecall, maxConjunctionSize, maxDisjunctionSize, positiveLearningSize, useAllNonTerminals, fitness);
    }

    public LearnerConfig maxConjunctionSize(final int maxConjunctionSize) {
        return new LearnerConfig(minPrecision, minRecall, maxConjunctionSize, maxDisjunctionSize, positiveLearningSize, useAllNonTerminals, fitness);
    }

    public LearnerConfig maxDisjunctionSize(final int maxDisjunctionSize) {
        return new LearnerConfig(minPrecision, minRecall, maxConjunctionSize, maxDisjunctionSize, positiveLearningSize, useAllNonTerminals, fitness);
    }

    public LearnerConfig positiveLearningSize(final int positiveLearningSize) {
        return new LearnerConfig(minPrecision, minRecall, maxConjunctionSize, maxDisjunctionSize, positiveLearningSize, useAllNonTerminals, fitness);
    }

    public LearnerConfig useAllNonTerminals(final boolean useAllNonTerminals) {
        return new LearnerConfig(minPrecision, minRecall, maxConjunctionSize, maxDisjunctionSize, positiveLearningSize, useAllNonTerminals, fitness);
    }

    public LearnerConfig fitness(final Fitness fitness) {
        return new LearnerConfig(minPrecision, minRecall, maxConjunctionSize, maxDisjunctionSize, positiveLearningSize, useAllNonTerminals, fitness);
    }
}
