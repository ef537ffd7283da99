package com.mlorenc.project.board.core;

import java.time.Duration;

/**
 * Bounded exponential backoff: the wait after failed attempt {@code n} is
 * {@code baseDelay * 2^(n-1)}, no jitter.
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay) {

    public static final RetryPolicy DEFAULT = new RetryPolicy(3, Duration.ofSeconds(2));

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be zero or positive");
        }
    }

    public Duration delayAfterAttempt(int attempt) {
        return baseDelay.multipliedBy(1L << (attempt - 1));
    }
}
