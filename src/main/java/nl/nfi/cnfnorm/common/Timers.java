package nl.nfi.cnfnorm.common;

import java.time.Duration;

public final class Timers {

    public static <T, X extends Exception> TimedResult<T> time(final Expression<T, X> executable) throws X {
        final long start = System.nanoTime();
        final T result = executable.execute();
        return new TimedResult<>(result, Duration.ofNanos(System.nanoTime() - start));
    }

    @FunctionalInterface
    public interface Expression<T, X extends Exception> {
        T execute() throws X;
    }

    public record TimedResult<T>(T value, Duration duration) {

        // fractional milliseconds, most stages finish well below one
        public double millis() {
            return duration.toNanos() / 1_000_000.0;
        }
    }
}
