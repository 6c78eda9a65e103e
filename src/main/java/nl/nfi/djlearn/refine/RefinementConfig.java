package nl.nfi.djlearn.refine;

import nl.nfi.djlearn.common.ini.IniSection;

import java.time.Duration;

import static java.lang.Math.max;

public record RefinementConfig(
        int maxIterations,
        Duration timeout,
        int topCandidates,
        int workers,
        int numInputs,
        Duration generationTimeout
) {

    public static final String SECTION = "REFINEMENT";

    public RefinementConfig {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("Maximum number of iterations must be positive: %d".formatted(maxIterations));
        }
        if (topCandidates < 1) {
            throw new IllegalArgumentException("Number of top candidates must be positive: %d".formatted(topCandidates));
        }
        if (workers < 1) {
            throw new IllegalArgumentException("Number of workers must be positive: %d".formatted(workers));
        }
        if (numInputs < 1) {
            throw new IllegalArgumentException("Number of inputs per candidate must be positive: %d".formatted(numInputs));
        }
    }

    public static RefinementConfig defaults() {
        return new RefinementConfig(10, Duration.ofSeconds(3600), 5, max(1, Runtime.getRuntime().availableProcessors() - 1), 5, Duration.ofSeconds(1));
    }

    public static RefinementConfig loadFrom(final IniSection section) {
        final RefinementConfig defaults = defaults();
        return new RefinementConfig(
                section.getInt("max_iterations", defaults.maxIterations),
                Duration.ofSeconds(section.getLong("timeout_seconds", defaults.timeout.toSeconds())),
                section.getInt("top_candidates", defaults.topCandidates),
                section.getInt("workers", defaults.workers),
                section.getInt("num_inputs", defaults.numInputs),
                Duration.ofMillis(section.getLong("generation_timeout_millis", defaults.generationTimeout.toMillis()))
        );
    }

    public RefinementConfig maxIterations(final int maxIterations) {
        return new RefinementConfig(maxIterations, timeout, topCandidates, workers, numInputs, generationTimeout);
    }

    public RefinementConfig timeout(final Duration timeout) {
        return new RefinementConfig(maxIterations, timeout, topCandidates, workers, numInputs, generationTimeout);
    }

    public RefinementConfig topCandidates(final int topCandidates) {
        return new RefinementConfig(maxIterations, timeout, topCandidates, workers, numInputs, generationTimeout);
    }

    public RefinementConfig workers(final int workers) {
        return new RefinementConfig(maxIterations, timeout, topCandidates, workers, numInputs, generationTimeout);
    }

    public RefinementConfig numInputs(final int numInputs) {
        return new RefinementConfig(maxIterations, timeout, topCandidates, workers, numInputs, generationTimeout);
    }

    public RefinementConfig generationTimeout(final Duration generationTimeout) {
        return new RefinementConfig(maxIterations, timeout, topCandidates, workers, numInputs, generationTimeout);
    }
}
