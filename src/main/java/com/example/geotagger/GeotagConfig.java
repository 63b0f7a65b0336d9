package com.example.geotagger;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Immutable runtime settings for a geotagging run.
 */
public record GeotagConfig(
        String apiUrl,
        String userAgent,
        String commonsUser,
        String commonsPassword,
        String targetUser,
        Optional<String> category,
        int maxDepth,
        Optional<Path> fileList,
        Optional<String> authorFilter,
        Path checkpointFile,
        Optional<Integer> maxEdits,
        Duration baseSleep,
        int maxEditsPerMinute,
        Duration pageDelay,
        boolean publish,
        boolean dryRun,
        boolean resume,
        boolean rescan,
        Optional<Path> downloadDirectory
) {
    @Override
    public String toString() {
        // Keeps the password out of log lines.
        return "GeotagConfig[apiUrl=" + apiUrl + ", user=" + commonsUser + ", targetUser=" + targetUser
                + ", category=" + category.orElse("-") + ", fileList=" + fileList.map(Path::toString).orElse("-")
                + ", checkpoint=" + checkpointFile + ", maxEdits=" + maxEdits.map(String::valueOf).orElse("unlimited")
                + ", publish=" + publish + ", dryRun=" + dryRun + "]";
    }
}
