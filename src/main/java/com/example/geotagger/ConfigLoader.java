package com.example.geotagger;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

public class ConfigLoader {
    static final String USER_ENV = "COMMONS_USER";
    static final String PASSWORD_ENV = "COMMONS_PASS";
    private static final String DEFAULT_API_URL = "https://commons.wikimedia.org/w/api.php";
    private static final String DEFAULT_USER_AGENT = "CommonsGeotagger/1.0";
    private static final String DEFAULT_CHECKPOINT = "gps_scan.json";
    private static final int DEFAULT_MAX_EDITS = 19;
    private static final double DEFAULT_BASE_SLEEP_SECONDS = 10.0;
    private static final int DEFAULT_MAX_EDITS_PER_MINUTE = 30;
    private static final long DEFAULT_PAGE_DELAY_MILLIS = 1000;
    private static final int DEFAULT_MAX_DEPTH = 1;

    private final ObjectMapper mapper;
    private final Map<String, String> environment;

    public ConfigLoader() {
        this(System.getenv());
    }

    ConfigLoader(Map<String, String> environment) {
        this.environment = environment;
        mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public GeotagConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);

        String user = environment.get(USER_ENV);
        String password = environment.get(PASSWORD_ENV);
        if (user == null || user.isBlank() || password == null || password.isBlank()) {
            throw new IllegalArgumentException(USER_ENV + " and " + PASSWORD_ENV + " must be set in the environment.");
        }

        String targetUser = optionalString(raw.targetUser, user);
        Optional<String> category = Optional.ofNullable(raw.category).filter(value -> !value.isBlank());
        int maxDepth = raw.maxDepth != null ? raw.maxDepth : DEFAULT_MAX_DEPTH;
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0.");
        }
        // Relative paths resolve against the config file's directory.
        Path base = path.toAbsolutePath().getParent();
        Optional<Path> fileList = Optional.ofNullable(raw.fileList)
                .filter(value -> !value.isBlank())
                .map(base::resolve);
        Optional<String> authorFilter = Optional.of(optionalString(raw.authorFilter, targetUser));
        Path checkpointFile = base.resolve(optionalString(raw.checkpointFile, DEFAULT_CHECKPOINT));

        int maxEditsValue = raw.maxEdits != null ? raw.maxEdits : DEFAULT_MAX_EDITS;
        Optional<Integer> maxEdits = maxEditsValue > 0 ? Optional.of(maxEditsValue) : Optional.empty();
        double baseSleepSeconds = raw.baseSleepSeconds != null ? raw.baseSleepSeconds : DEFAULT_BASE_SLEEP_SECONDS;
        if (baseSleepSeconds < 0) {
            throw new IllegalArgumentException("baseSleepSeconds must be >= 0.");
        }
        int maxEditsPerMinute = raw.maxEditsPerMinute != null && raw.maxEditsPerMinute > 0
                ? raw.maxEditsPerMinute
                : DEFAULT_MAX_EDITS_PER_MINUTE;
        long pageDelayMillis = raw.pageDelayMillis != null && raw.pageDelayMillis >= 0
                ? raw.pageDelayMillis
                : DEFAULT_PAGE_DELAY_MILLIS;

        return new GeotagConfig(
                optionalString(raw.apiUrl, DEFAULT_API_URL),
                optionalString(raw.userAgent, DEFAULT_USER_AGENT),
                user,
                password,
                targetUser,
                category,
                maxDepth,
                fileList,
                authorFilter,
                checkpointFile,
                maxEdits,
                Duration.ofMillis(Math.round(baseSleepSeconds * 1000)),
                maxEditsPerMinute,
                Duration.ofMillis(pageDelayMillis),
                raw.publish != null && raw.publish,
                raw.dryRun != null && raw.dryRun,
                raw.resume == null || raw.resume,
                raw.rescan != null && raw.rescan,
                Optional.ofNullable(raw.downloadDirectory).filter(value -> !value.isBlank()).map(base::resolve)
        );
    }

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    private static class RawConfig {
        public String apiUrl;
        public String userAgent;
        public String targetUser;
        public String category;
        public Integer maxDepth;
        public String fileList;
        public String authorFilter;
        public String checkpointFile;
        public Integer maxEdits;
        public Double baseSleepSeconds;
        public Integer maxEditsPerMinute;
        public Long pageDelayMillis;
        public Boolean publish;
        public Boolean dryRun;
        public Boolean resume;
        public Boolean rescan;
        public String downloadDirectory;
    }
}
