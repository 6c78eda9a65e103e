package nl.nfi.djlearn.refine.generate;

import nl.nfi.djlearn.grammar.DerivationTree;
import nl.nfi.djlearn.learn.Candidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static java.lang.Math.max;
import static java.lang.Math.min;

/**
 * Spreads the candidates over a fixed pool of worker threads. Each worker takes candidates
 * from a shared queue until it is drained; generated inputs are collected in a concurrent
 * set. A candidate whose generation fails is logged and skipped. When the overall budget runs out the workers are interrupted and whatever they
 * produced so far is returned.
 */
public final class ParallelEngine implements GenerationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ParallelEngine.class);

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(1);

    private final int maxWorkers;
    private final Duration budget;
    private final long seed;

    private ParallelEngine(final int maxWorkers, final Duration budget, final long seed) {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("Number of workers must be positive: %d".formatted(maxWorkers));
        }
        this.maxWorkers = maxWorkers;
        this.budget = budget;
        this.seed = seed;
    }

    public static ParallelEngine create() {
        return new ParallelEngine(max(1, Runtime.getRuntime().availableProcessors() - 1), Duration.ofMinutes(1), new Random().nextLong());
    }

    public ParallelEngine maxWorkers(final int maxWorkers) {
        return new ParallelEngine(maxWorkers, budget, seed);
    }

    public ParallelEngine budget(final Duration budget) {
        return new ParallelEngine(maxWorkers, budget, seed);
    }

    /**
     * Worker i draws from {@code new Random(seed + i)}.
     */
    public ParallelEngine seed(final long seed) {
        return new ParallelEngine(maxWorkers, budget, seed);
    }

    @Override
    public Set<DerivationTree> generate(final InputGenerator generator, final Collection<Candidate> candidates) {
        if (candidates.isEmpty()) {
            return Set.of();
        }
        final int numWorkers = min(maxWorkers, candidates.size());
        final BlockingQueue<Optional<Candidate>> workItems = new LinkedBlockingQueue<>();
        candidates.forEach(candidate -> workItems.add(Optional.of(candidate)));
        for (int i = 0; i < numWorkers; i++) {
            // poison pill per worker
            workItems.add(Optional.empty());
        }
        final Set<DerivationTree> generated = ConcurrentHashMap.newKeySet();

        final ExecutorService executorService = Executors.newFixedThreadPool(numWorkers);
        try {
            for (int i = 0; i < numWorkers; i++) {
                final int threadId = i;
                final Random random = new Random(seed + i);
                executorService.submit(() -> {
                    LOG.debug("Starting generator thread with id [{}]", threadId);
                    try {
                        while (!Thread.currentThread().isInterrupted()) {
                            final Optional<Candidate> workItem = workItems.take();
                            if (workItem.isEmpty()) {
                                return;
                            }
                            try {
                                generated.addAll(generator.generate(workItem.get(), random));
                            } catch (final Throwable t) {
                                LOG.error("Exception in worker thread [{}] for candidate {}", threadId, workItem.get().text(), t);
                            }
                        }
                    } catch (final InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });
            }
            executorService.shutdown();
            if (!executorService.awaitTermination(budget.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Generation budget of {} ms exceeded, interrupting workers", budget.toMillis());
                executorService.shutdownNow();
                executorService.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (final InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }

        LOG.debug("Generated {} inputs for {} candidates using {} workers", generated.size(), candidates.size(), numWorkers);
        return new LinkedHashSet<>(generated);
    }
}
