package com.example.geotagger.model;

/**
 * Per-item detail as reported by the remote repository.
 */
public record ItemDetail(
        String id,
        boolean missing,
        boolean redirect,
        Double lat,
        Double lon,
        boolean hasEmbeddedCoordinate,
        String sourceUrl,
        String author
) {
    public static ItemDetail missing(String id) {
        return new ItemDetail(id, true, false, null, null, false, null, null);
    }

    public boolean hasAltCoordinateSource() {
        return lat != null && lon != null;
    }

    public ItemRecord toRecord() {
        return new ItemRecord(id, hasAltCoordinateSource(), hasEmbeddedCoordinate, lat, lon, sourceUrl, author);
    }
}
