package com.example.realtime.event;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Delay before the n-th consecutive reconnect attempt. With a multiplier of 1 and no jitter the
 * delay is fixed.
 */
public final class ReconnectPolicy {

    private final Duration initialDelay;
    private final double multiplier;
    private final Duration maxDelay;
    private final double jitter;

    public ReconnectPolicy(Duration initialDelay, double multiplier, Duration maxDelay, double jitter) {
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("Initial reconnect delay must be non-negative");
        }
        this.initialDelay = initialDelay;
        this.multiplier = Math.max(multiplier, 1.0);
        this.maxDelay = maxDelay == null || maxDelay.compareTo(initialDelay) < 0 ? initialDelay : maxDelay;
        this.jitter = Math.max(jitter, 0.0);
    }

    public static ReconnectPolicy fixed(Duration delay) {
        return new ReconnectPolicy(delay, 1.0, delay, 0.0);
    }

    /**
     * @param attempt 1 for the first attempt after a failure
     */
    public Duration delayFor(int attempt) {
        int exponent = Math.max(attempt, 1) - 1;
        double base = initialDelay.toMillis() * Math.pow(multiplier, exponent);
        long capped = (long) Math.min(base, maxDelay.toMillis());
        if (jitter > 0 && capped > 0) {
            capped += ThreadLocalRandom.current().nextLong((long) (capped * jitter) + 1);
        }
        return Duration.ofMillis(capped);
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }
}
