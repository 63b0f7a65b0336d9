package com.example.geotagger;

public interface ProcessingLimiter {
    /**
     * Returns true if processing should stop after the given number of successful mutations.
     */
    boolean shouldStop(long successfulMutations);

    /**
     * Never stops early; the whole queue is drained.
     */
    ProcessingLimiter NO_LIMIT = successfulMutations -> false;

    /**
     * Stops once {@code maxEdits} mutations have succeeded.
     */
    static ProcessingLimiter maxEdits(int maxEdits) {
        if (maxEdits <= 0) {
            throw new IllegalArgumentException("maxEdits must be > 0");
        }
        return successfulMutations -> successfulMutations >= maxEdits;
    }
}
