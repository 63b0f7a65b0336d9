package com.example.geotagger;

/**
 * End-of-run counters for one processor pass.
 */
public record ProcessingReport(
        int updated,
        int skippedAlreadySatisfied,
        int skippedNoSource,
        int errors
) {
    public int total() {
        return updated + skippedAlreadySatisfied + skippedNoSource + errors;
    }
}
