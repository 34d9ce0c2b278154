package com.rollup.service.flush;

import java.time.Duration;

/**
 * Exponential backoff between flush attempts: {@code min(base * 2^attempt, MAX_RETRY_DELAY)}.
 */
public final class BackoffPolicy {

    public static final Duration MAX_RETRY_DELAY = Duration.ofSeconds(30);

    // 2^30 already exceeds any sane base delay, keeps the shift inside a long
    private static final int MAX_SHIFT = 30;

    private final Duration baseDelay;

    public BackoffPolicy(Duration baseDelay) {
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("Base delay must be zero or positive");
        }
        this.baseDelay = baseDelay;
    }

    /**
     * Delay to wait after the given zero-based failed attempt.
     */
    public Duration delayFor(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("Attempt must not be negative: " + attempt);
        }
        long baseMillis = baseDelay.toMillis();
        if (baseMillis == 0) {
            return Duration.ZERO;
        }
        long factor = 1L << Math.min(attempt, MAX_SHIFT);
        long maxMillis = MAX_RETRY_DELAY.toMillis();
        if (baseMillis > maxMillis / factor) {
            return MAX_RETRY_DELAY;
        }
        return Duration.ofMillis(baseMillis * factor);
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }
}
