package com.example.geotagger.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * Opaque resume position handed out by a listing gateway. Only the gateway that
 * produced it looks inside; everyone else threads it back and persists it.
 */
public record ContinuationCursor(JsonNode token) {
    public ContinuationCursor {
        Objects.requireNonNull(token, "token");
    }

    /**
     * Wraps a JSON value, treating JSON null or a missing node as "no cursor".
     */
    public static ContinuationCursor ofNullable(JsonNode token) {
        if (token == null || token.isNull() || token.isMissingNode()) {
            return null;
        }
        return new ContinuationCursor(token);
    }
}
