package com.example.realtime.client;

import java.time.Duration;
import java.util.function.DoubleSupplier;

/**
 * Bounded exponential backoff for client reconnects.
 */
public class RetryPolicy {

    public static final int DEFAULT_MAX_ATTEMPTS = 5;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(5);
    public static final double DEFAULT_JITTER = 0.2;

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double jitter;
    private final DoubleSupplier random;

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, double jitter, DoubleSupplier random) {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must not be negative");
        }
        if (baseDelay.isNegative() || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("Delays must satisfy 0 <= base <= max");
        }
        if (jitter < 0 || jitter >= 1) {
            throw new IllegalArgumentException("jitter must be in [0, 1)");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.jitter = jitter;
        this.random = random;
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY, DEFAULT_JITTER, Math::random);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public boolean allowsAttempt(int attempt) {
        return attempt >= 1 && attempt <= maxAttempts;
    }

    /**
     * Delay before retry number {@code attempt} (1-based): base doubled per attempt, capped, then
     * spread by up to +/- jitter without exceeding the cap.
     */
    public Duration delayFor(int attempt) {
        int shift = Math.min(Math.max(attempt - 1, 0), 30);
        long nominal = Math.min(baseDelay.toMillis() << shift, maxDelay.toMillis());
        double factor = 1 + jitter * (2 * random.getAsDouble() - 1);
        long jittered = Math.round(nominal * factor);
        return Duration.ofMillis(Math.max(0, Math.min(jittered, maxDelay.toMillis())));
    }
}
