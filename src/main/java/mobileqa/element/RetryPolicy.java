package mobileqa.element;

import mobileqa.session.SessionConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounds for one retried operation: an overall deadline, an attempt budget
 * and an exponential delay between attempts.
 *
 * @param timeout      deadline measured from the first attempt
 * @param initialDelay delay after the first failed attempt
 * @param maxAttempts  attempt budget, at least 1
 * @param multiplier   factor applied to the delay after each further failure, at least 1
 * @param maxDelay     upper bound for any single delay
 */
public record RetryPolicy(Duration timeout, Duration initialDelay, int maxAttempts,
                          double multiplier, Duration maxDelay) {

    public RetryPolicy {
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(initialDelay, "initialDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        if (timeout.isNegative() || initialDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Retry durations must not be negative");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1.0, got " + multiplier);
        }
    }

    public static RetryPolicy from(SessionConfig config) {
        return new RetryPolicy(config.getElementTimeout(), config.getPollInterval(),
                config.getMaxAttempts(), config.getBackoffMultiplier(), config.getMaxPollInterval());
    }

    /** A single attempt with no waiting. */
    public static RetryPolicy once() {
        return new RetryPolicy(Duration.ZERO, Duration.ZERO, 1, 1.0, Duration.ZERO);
    }

    /** Same policy with another deadline. */
    public RetryPolicy withTimeout(Duration newTimeout) {
        return new RetryPolicy(newTimeout, initialDelay, maxAttempts, multiplier, maxDelay);
    }

    /** Delay to wait after failed attempt number {@code attempt} (1-based). */
    public Duration delayAfter(int attempt) {
        double millis = initialDelay.toMillis() * Math.pow(multiplier, Math.max(0, attempt - 1));
        return Duration.ofMillis((long) Math.min(millis, maxDelay.toMillis()));
    }
}
