package agentyard.coordinator.util;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential delay policy: {@code initial * 2^(attempt-1)}, capped at
 * {@code max}.
 */
public final class Backoff {

    private final Duration initial;
    private final Duration max;

    private Backoff(Duration initial, Duration max) {
        this.initial = Objects.requireNonNull(initial, "initial");
        this.max = Objects.requireNonNull(max, "max");
        if (initial.isNegative() || max.compareTo(initial) < 0) {
            throw new IllegalArgumentException("require 0 <= initial <= max, got " + initial + ", " + max);
        }
    }

    public static Backoff exponential(Duration initial, Duration max) {
        return new Backoff(initial, max);
    }

    /**
     * @param attempt 1-based attempt number
     */
    public Duration delayFor(int attempt) {
        if (attempt <= 1) {
            return initial;
        }
        // 2^30 already overflows any sane cap
        int exponent = Math.min(attempt - 1, 30);
        long millis = initial.toMillis() * (1L << exponent);
        if (millis <= 0 || millis > max.toMillis()) {
            return max;
        }
        return Duration.ofMillis(millis);
    }

    /**
     * Sleep for the attempt's delay, but never past {@code remaining}.
     */
    public void pause(int attempt, Duration remaining) throws InterruptedException {
        Duration delay = delayFor(attempt);
        if (remaining.compareTo(delay) < 0) {
            delay = remaining;
        }
        if (!delay.isNegative() && !delay.isZero()) {
            Thread.sleep(delay.toMillis());
        }
    }

    @Override
    public String toString() {
        return "Backoff{initial=" + initial + ", max=" + max + "}";
    }
}
