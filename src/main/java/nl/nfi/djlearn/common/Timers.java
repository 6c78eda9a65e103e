package nl.nfi.djlearn.common;

import java.time.Duration;

public final class Timers {

    private Timers() {
    }

    public static <T, X extends Exception> TimedResult<T> time(final Expression<T, X> executable) throws X {
        final long start = System.nanoTime();
        final T result = executable.execute();
        return new TimedResult<>(result, Duration.ofNanos(System.nanoTime() - start));
    }

    /**
     * Wall clock deadline, checked cooperatively.
     */
    public static Deadline deadline(final Duration budget) {
        return new Deadline(System.nanoTime() + budget.toNanos());
    }

    @FunctionalInterface
    public interface Expression<T, X extends Exception> {
        T execute() throws X;
    }

    public record TimedResult<T>(T value, Duration duration) {
    }

    public record Deadline(long nanoTime) {

        public boolean expired() {
            return System.nanoTime() - nanoTime >= 0;
        }

        public Duration remaining() {
            return Duration.ofNanos(Math.max(0, nanoTime - System.nanoTime()));
        }
    }
}
