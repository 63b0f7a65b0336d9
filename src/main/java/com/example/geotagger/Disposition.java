package com.example.geotagger;

/**
 * Where a classified item goes.
 */
public enum Disposition {
    /** Page has a coordinate, payload does not. */
    NEEDS_MUTATION,
    /** Payload has a coordinate, page does not. Handled by a different tool. */
    NEEDS_ALTERNATE_ACTION,
    /** Excluded before looking at coordinates. */
    INELIGIBLE,
    /** Both coordinates present, or neither. */
    NO_ACTION;

    public static Disposition of(boolean hasAltCoordinateSource, boolean hasEmbeddedCoordinate) {
        if (hasAltCoordinateSource && !hasEmbeddedCoordinate) {
            return NEEDS_MUTATION;
        }
        if (hasEmbeddedCoordinate && !hasAltCoordinateSource) {
            return NEEDS_ALTERNATE_ACTION;
        }
        return NO_ACTION;
    }
}
