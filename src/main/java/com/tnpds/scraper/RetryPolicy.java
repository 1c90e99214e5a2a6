package com.tnpds.scraper;

import java.time.Duration;

/**
 * Attempts per shop and the fixed pause between them.
 */
public record RetryPolicy(int maxAttempts, Duration pause) {
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        pause = pause == null ? Duration.ZERO : pause;
    }

    public RetryPolicy withMaxAttempts(int value) {
        return new RetryPolicy(value, pause);
    }
}
