package com.taskpilot.core.scheduler;

import java.time.Duration;

/**
 * Exponential backoff with a ceiling, and the attempt budget per task.
 *
 * @param base        delay after the first failed attempt
 * @param cap         maximum delay
 * @param maxAttempts attempts a task may consume before it is blocked
 */
public record RetryPolicy(Duration base, Duration cap, int maxAttempts) {

    public static final Duration DEFAULT_BASE = Duration.ofSeconds(15);
    public static final Duration DEFAULT_CAP = Duration.ofMinutes(3);

    public RetryPolicy {
        if (base == null || base.isNegative()) {
            throw new IllegalArgumentException("base must be a non-negative duration");
        }
        if (cap == null || cap.compareTo(base) < 0) {
            throw new IllegalArgumentException("cap must be at least base");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
    }

    public static RetryPolicy withMaxAttempts(int maxAttempts) {
        return new RetryPolicy(DEFAULT_BASE, DEFAULT_CAP, maxAttempts);
    }

    /**
     * Delay before the next attempt after {@code attempt} attempts have been consumed.
     * Attempts of 1 or less yield the base delay.
     */
    public Duration backoff(int attempt) {
        int exponent = Math.max(0, attempt - 1);
        // 2^31 overflows; anything that large is past the cap anyway
        if (exponent >= 31) {
            return cap;
        }
        long delayMs = base.toMillis() * (1L << exponent);
        if (delayMs < 0 || delayMs > cap.toMillis()) {
            return cap;
        }
        return Duration.ofMillis(delayMs);
    }

    public boolean isRetryable(int attemptsConsumed) {
        return attemptsConsumed < maxAttempts;
    }
}
