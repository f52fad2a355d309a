package com.webmon.core.retry;

import java.time.Duration;
import java.util.Objects;

public record RetryPolicy(int tries, Duration delay, double backoff, Duration maxInterval) {
    public static final RetryPolicy STORAGE_DEFAULT =
            new RetryPolicy(5, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(30));

    public RetryPolicy {
        Objects.requireNonNull(delay, "delay is required");
        Objects.requireNonNull(maxInterval, "maxInterval is required");
        if (tries < 1) {
            throw new IllegalArgumentException("tries must be >= 1 but was " + tries);
        }
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative");
        }
        if (backoff < 1.0) {
            throw new IllegalArgumentException("backoff must be >= 1 but was " + backoff);
        }
        if (maxInterval.compareTo(delay) < 0) {
            throw new IllegalArgumentException("maxInterval must be >= delay");
        }
    }

    public Duration delayAfterAttempt(int attempt) {
        double millis = delay.toMillis() * Math.pow(backoff, attempt - 1);
        if (millis >= maxInterval.toMillis()) {
            return maxInterval;
        }
        return Duration.ofMillis(Math.round(millis));
    }
}
