package com.example.geotagger.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One candidate unit of work: a file page and what is known about its coordinates.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ItemRecord(
        @JsonProperty("id") String id,
        @JsonProperty("has_alt_source") boolean hasAltCoordinateSource,
        @JsonProperty("has_embedded") boolean hasEmbeddedCoordinate,
        @JsonProperty("lat") Double lat,
        @JsonProperty("lon") Double lon,
        @JsonProperty("source_url") String sourceUrl,
        @JsonProperty("author") String author
) {
    public ItemRecord {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Item id must not be blank.");
        }
    }

    /**
     * Creates a record that only carries an id, as written by older checkpoints.
     */
    public static ItemRecord bare(String id) {
        return new ItemRecord(id, false, false, null, null, null, null);
    }

    /**
     * True when the page has a coordinate and the payload does not.
     */
    @JsonIgnore
    public boolean isEligibleForMutation() {
        return hasAltCoordinateSource && !hasEmbeddedCoordinate;
    }

    @JsonIgnore
    public boolean hasValidCoordinate() {
        return lat != null && lon != null && Coordinates.isValid(lat, lon);
    }
}
