package com.example.geotagger.gateway;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Connection settings for {@link CommonsClient}.
 */
public record CommonsSettings(
        String apiUrl,
        String userAgent,
        Optional<Path> downloadDirectory,
        Duration timeout
) {
}
