package com.example.geotagger.mutation;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes a decimal coordinate into a local image file in place.
 */
@FunctionalInterface
public interface GpsTagWriter {
    void write(Path image, double lat, double lon) throws IOException;
}
