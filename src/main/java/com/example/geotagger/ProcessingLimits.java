package com.example.geotagger;

import java.time.Duration;

/**
 * Throughput settings for a processor pass.
 *
 * @param maxPerMinute hard ceiling on mutations in any trailing minute
 * @param baseSleep    centre of the jitter pause after each mutation
 * @param limiter      stops the pass once enough mutations have succeeded
 */
public record ProcessingLimits(int maxPerMinute, Duration baseSleep, ProcessingLimiter limiter) {
    public ProcessingLimits {
        if (maxPerMinute <= 0) {
            throw new IllegalArgumentException("maxPerMinute must be > 0");
        }
        if (baseSleep == null || baseSleep.isNegative()) {
            throw new IllegalArgumentException("baseSleep must not be negative");
        }
        limiter = limiter == null ? ProcessingLimiter.NO_LIMIT : limiter;
    }
}
