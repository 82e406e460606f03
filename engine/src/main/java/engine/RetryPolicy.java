package engine;

import java.time.Duration;
import java.util.Objects;

public record RetryPolicy(int maximumAttempts, Duration initialInterval, double backoffCoefficient) {
    public static final RetryPolicy NONE = new RetryPolicy(1, Duration.ZERO, 1.0);

    public RetryPolicy {
        Objects.requireNonNull(initialInterval, "initialInterval");
        if (maximumAttempts < 1) {
            throw new IllegalArgumentException("maximumAttempts must be at least 1");
        }
        if (initialInterval.isNegative()) {
            throw new IllegalArgumentException("initialInterval must not be negative");
        }
        if (backoffCoefficient < 1.0) {
            throw new IllegalArgumentException("backoffCoefficient must be at least 1");
        }
    }

    public long delayBeforeRetryMs(int failedAttempts) {
        return (long) (initialInterval.toMillis() * Math.pow(backoffCoefficient, failedAttempts - 1));
    }
}
