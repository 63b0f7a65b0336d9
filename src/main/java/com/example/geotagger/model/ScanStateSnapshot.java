package com.example.geotagger.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;

/**
 * Serializable checkpoint document for {@link ScanState}.
 */
public record ScanStateSnapshot(
        @JsonProperty("needs_mutation") List<ItemRecord> needsMutation,
        @JsonProperty("needs_alternate_action") List<String> needsAlternateAction,
        @JsonProperty("continuation") JsonNode continuation,
        @JsonProperty("scan_complete") boolean scanComplete,
        @JsonProperty("saved_at") Instant savedAt
) {
    /**
     * Captures the current contents of the aggregate.
     */
    public static ScanStateSnapshot from(ScanState state, Instant savedAt) {
        return new ScanStateSnapshot(
                state.needsMutation(),
                List.copyOf(state.needsAlternateAction()),
                state.continuation().map(ContinuationCursor::token).orElse(null),
                state.scanComplete(),
                savedAt
        );
    }

    /**
     * Rebuilds the aggregate.
     *
     * @throws IllegalArgumentException if either collection holds a null element
     */
    public ScanState toState() {
        requireNoNullElements(needsMutation, "needs_mutation");
        requireNoNullElements(needsAlternateAction, "needs_alternate_action");
        return new ScanState(
                needsMutation == null ? List.of() : needsMutation,
                needsAlternateAction == null ? List.of() : needsAlternateAction,
                ContinuationCursor.ofNullable(continuation),
                scanComplete
        );
    }

    private static void requireNoNullElements(List<?> values, String field) {
        if (values != null && values.contains(null)) {
            throw new IllegalArgumentException("Checkpoint field " + field + " contains a null entry");
        }
    }
}
