package com.example.geotagger;

import com.example.geotagger.model.ScanState;
import com.example.geotagger.model.ScanStateSnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Persists {@link ScanState} to a single JSON file. Saves are atomic with respect to a crash:
 * readers only ever see the previous or the new document.
 */
public final class CheckpointStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(CheckpointStore.class);
    private static final DateTimeFormatter BACKUP_STAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss")
            .withZone(ZoneOffset.UTC);
    static final String TEMP_SUFFIX = ".tmp";

    private final ObjectMapper mapper;
    private final Path checkpointPath;
    private final Clock clock;

    public CheckpointStore(Path checkpointPath) {
        this(checkpointPath, Clock.systemUTC());
    }

    CheckpointStore(Path checkpointPath, Clock clock) {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.checkpointPath = checkpointPath.toAbsolutePath().normalize();
        this.clock = clock;
    }

    /**
     * Returns the last saved state. A missing file yields an empty state; an unreadable one is moved
     * aside and also yields an empty state.
     */
    public ScanState load() throws IOException {
        removeStaleTempFiles();
        if (!Files.exists(checkpointPath)) {
            return new ScanState();
        }
        try {
            JsonNode root = mapper.readTree(checkpointPath.toFile());
            if (root == null || root.isMissingNode()) {
                throw new CorruptCheckpointException("Checkpoint file has no content");
            }
            if (root.isNull()) {
                return new ScanState();
            }
            if (!root.isObject()) {
                throw new CorruptCheckpointException("Checkpoint root is not a JSON object");
            }
            upgradeLegacyEntries((ObjectNode) root);
            ScanStateSnapshot snapshot = mapper.treeToValue(root, ScanStateSnapshot.class);
            ScanState state = snapshot.toState();
            LOGGER.info("Loaded checkpoint {} ({} queued, {} flagged for template, cursor {})",
                    checkpointPath, state.queueSize(), state.needsAlternateAction().size(),
                    state.continuation().isPresent() ? "present" : "absent");
            return state;
        } catch (JsonProcessingException | CorruptCheckpointException | IllegalArgumentException ex) {
            Path backup = quarantine();
            LOGGER.warn("Corrupted checkpoint moved to {}, starting fresh.", backup, ex);
            return new ScanState();
        }
    }

    /**
     * Writes the state to a temporary sibling file, forces it to disk and renames it over the checkpoint.
     *
     * @throws StorageIOException if any step fails; the previous checkpoint is left untouched
     */
    public void save(ScanState state) throws StorageIOException {
        Path directory = checkpointPath.getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, checkpointPath.getFileName().toString() + ".", TEMP_SUFFIX);
            byte[] payload = mapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsBytes(ScanStateSnapshot.from(state, clock.instant()));
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
                 OutputStream out = Channels.newOutputStream(channel)) {
                out.write(payload);
                out.flush();
                channel.force(true);
            }
            moveIntoPlace(temp);
            temp = null;
        } catch (IOException ex) {
            throw new StorageIOException("Failed to write checkpoint " + checkpointPath, ex);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    /**
     * Takes an exclusive advisory lock next to the checkpoint so two runs never share it.
     */
    public Lock lock() throws IOException {
        Path lockPath = checkpointPath.resolveSibling(checkpointPath.getFileName() + ".lock");
        Files.createDirectories(lockPath.getParent());
        FileChannel channel = FileChannel.open(lockPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        FileLock fileLock;
        try {
            fileLock = channel.tryLock();
        } catch (OverlappingFileLockException ex) {
            fileLock = null;
        }
        if (fileLock == null) {
            channel.close();
            throw new IllegalStateException("Checkpoint " + checkpointPath + " is in use by another run.");
        }
        return new Lock(channel, fileLock);
    }

    /**
     * Exposes the underlying checkpoint file path.
     */
    public Path path() {
        return checkpointPath;
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, checkpointPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            LOGGER.warn("Atomic rename not supported for {}, falling back to replace.", checkpointPath);
            Files.move(temp, checkpointPath, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private Path quarantine() throws IOException {
        String stamp = BACKUP_STAMP.format(clock.instant());
        Path backup = checkpointPath.resolveSibling(checkpointPath.getFileName() + ".corrupt." + stamp + ".bak");
        Files.move(checkpointPath, backup, StandardCopyOption.REPLACE_EXISTING);
        return backup;
    }

    // Leftovers from a save interrupted before the rename.
    private void removeStaleTempFiles() throws IOException {
        Path directory = checkpointPath.getParent();
        if (directory == null || !Files.isDirectory(directory)) {
            return;
        }
        String glob = checkpointPath.getFileName().toString() + ".*" + TEMP_SUFFIX;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, glob)) {
            for (Path stale : stream) {
                LOGGER.info("Removing incomplete checkpoint write {}", stale);
                deleteQuietly(stale);
            }
        }
    }

    // Older checkpoints stored queue entries as bare titles.
    private void upgradeLegacyEntries(ObjectNode root) {
        JsonNode queue = root.get("needs_mutation");
        if (queue == null || !queue.isArray()) {
            return;
        }
        ArrayNode upgraded = mapper.createArrayNode();
        for (JsonNode entry : queue) {
            if (entry.isTextual()) {
                upgraded.addObject().put("id", entry.asText());
            } else {
                upgraded.add(entry);
            }
        }
        root.set("needs_mutation", upgraded);
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException ex) {
            LOGGER.warn("Failed to delete {}", path, ex);
        }
    }

    /**
     * Held for the duration of a run.
     */
    public static final class Lock implements AutoCloseable {
        private final FileChannel channel;
        private final FileLock fileLock;

        private Lock(FileChannel channel, FileLock fileLock) {
            this.channel = channel;
            this.fileLock = fileLock;
        }

        @Override
        public void close() throws IOException {
            try {
                fileLock.release();
            } finally {
                channel.close();
            }
        }
    }

    private static final class CorruptCheckpointException extends Exception {
        private CorruptCheckpointException(String message) {
            super(message);
        }
    }
}
