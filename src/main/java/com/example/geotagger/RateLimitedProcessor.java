package com.example.geotagger;

import com.example.geotagger.model.ItemRecord;
import com.example.geotagger.model.ScanState;
import com.example.geotagger.mutation.ItemProcessingException;
import com.example.geotagger.mutation.MutationAction;
import com.example.geotagger.mutation.MutationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Drains the mutation queue one item at a time. Every item leaves the queue exactly once,
 * whatever its outcome, and the checkpoint is rewritten after each one.
 */
public class RateLimitedProcessor {
    private static final Logger LOGGER = LoggerFactory.getLogger(RateLimitedProcessor.class);
    private static final Duration WINDOW = Duration.ofSeconds(60);

    private final CheckpointStore checkpointStore;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Random random;

    public RateLimitedProcessor(CheckpointStore checkpointStore) {
        this(checkpointStore, Clock.systemUTC(), Sleeper.SYSTEM, new Random());
    }

    RateLimitedProcessor(CheckpointStore checkpointStore, Clock clock, Sleeper sleeper, Random random) {
        this.checkpointStore = checkpointStore;
        this.clock = clock;
        this.sleeper = sleeper;
        this.random = random;
    }

    /**
     * Processes queued items in random order until the queue is empty or the limiter says stop.
     *
     * @throws StorageIOException if a checkpoint write fails; the run must not continue
     */
    public ProcessingReport process(ScanState state, ProcessingLimits limits, MutationAction action)
            throws StorageIOException, InterruptedException {
        SlidingWindowRateLimiter rateLimiter = new SlidingWindowRateLimiter(
                limits.maxPerMinute(), WINDOW, limits.baseSleep(), clock, sleeper, random);

        List<ItemRecord> items = new ArrayList<>(state.needsMutation());
        Collections.shuffle(items, random);
        int total = items.size();

        int updated = 0;
        int skippedAlreadySatisfied = 0;
        int skippedNoSource = 0;
        int errors = 0;

        for (int index = 1; index <= total; index++) {
            ItemRecord item = items.get(index - 1);
            // Queue entries can be stale; the flags are checked again before touching anything.
            if (!item.hasAltCoordinateSource()) {
                skippedNoSource++;
                LOGGER.info("[{}/{}] Skipping {} (no page coordinates)", index, total, item.id());
                retire(state, item);
                continue;
            }
            if (item.hasEmbeddedCoordinate()) {
                skippedAlreadySatisfied++;
                LOGGER.info("[{}/{}] Skipping {} (GPS already present)", index, total, item.id());
                retire(state, item);
                continue;
            }

            rateLimiter.acquire();
            LOGGER.info("[{}/{}] Processing {}", index, total, item.id());
            try {
                MutationResult result = action.apply(item);
                if (result.isSuccess()) {
                    updated++;
                } else {
                    errors++;
                    LOGGER.warn("Could not process {}: {}", item.id(), result.getReason());
                }
            } catch (ItemProcessingException | RuntimeException ex) {
                errors++;
                LOGGER.warn("Error processing {}", item.id(), ex);
            }
            retire(state, item);

            if (limits.limiter().shouldStop(updated)) {
                LOGGER.info("Edit budget reached after {} updates; {} items left queued.", updated, state.queueSize());
                break;
            }
            rateLimiter.pause();
        }

        return new ProcessingReport(updated, skippedAlreadySatisfied, skippedNoSource, errors);
    }

    private void retire(ScanState state, ItemRecord item) throws StorageIOException {
        if (!state.retire(item.id())) {
            LOGGER.warn("{} was no longer queued", item.id());
        }
        checkpointStore.save(state);
    }
}
