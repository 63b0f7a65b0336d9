package com.example.geotagger;

import com.example.geotagger.gateway.CrawlScope;
import com.example.geotagger.gateway.GatewayException;
import com.example.geotagger.gateway.ListingGateway;
import com.example.geotagger.model.ContinuationCursor;
import com.example.geotagger.model.ListingPage;
import com.example.geotagger.model.RawEntry;
import com.example.geotagger.model.ScanState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Walks a listing page by page, classifies unseen entries into the scan state and checkpoints
 * after every page so an interrupted crawl resumes from the last persisted cursor.
 */
public class Crawler {
    private static final Logger LOGGER = LoggerFactory.getLogger(Crawler.class);
    private static final int PROGRESS_INTERVAL = 500;

    private final ListingGateway gateway;
    private final ItemClassifier classifier;
    private final CheckpointStore checkpointStore;
    private final Sleeper sleeper;
    private final Duration pageDelay;

    public Crawler(ListingGateway gateway,
                   ItemClassifier classifier,
                   CheckpointStore checkpointStore,
                   Sleeper sleeper,
                   Duration pageDelay) {
        this.gateway = gateway;
        this.classifier = classifier;
        this.checkpointStore = checkpointStore;
        this.sleeper = sleeper;
        this.pageDelay = pageDelay;
    }

    /**
     * Crawls {@code scope} starting from the cursor stored in {@code state}. A completed scan is
     * reused while its queue holds work and repeated from the start once the queue is empty.
     *
     * @throws GatewayException when a listing or detail call fails; the checkpoint still holds every
     *                          page completed before the failure
     * @throws StorageIOException when the checkpoint cannot be written
     */
    public ScanState crawl(CrawlScope scope, ScanState state) throws IOException, InterruptedException {
        int dropped = state.dropEntriesWithoutSource();
        if (dropped > 0) {
            LOGGER.info("Dropped {} stale queue entries without page coordinates.", dropped);
        }
        if (state.scanComplete()) {
            if (state.queueSize() > 0) {
                LOGGER.info("Scan of {} already complete, reusing {} queued items.", scope.describe(), state.queueSize());
                return state;
            }
            // A finished scan with nothing left to process starts over to pick up new entries.
            LOGGER.info("Previous scan of {} is complete and its queue is empty; scanning again.", scope.describe());
            state.restartScan();
        }

        LOGGER.info("Scanning {}{}", scope.describe(), state.continuation().isPresent() ? " (resuming)" : "");
        long scanned = 0;
        long nextProgress = PROGRESS_INTERVAL;
        while (true) {
            ContinuationCursor cursor = state.continuation().orElse(null);
            ListingPage page = gateway.listPage(scope, cursor);

            List<RawEntry> fresh = unseen(page.entries(), state);
            for (Classification classification : classifier.classifyAll(fresh)) {
                route(classification, state);
            }
            scanned += page.entries().size();
            if (scanned >= nextProgress) {
                LOGGER.info("Scanned {} entries so far ({} queued, {} flagged for template).",
                        scanned, state.queueSize(), state.needsAlternateAction().size());
                nextProgress = (scanned / PROGRESS_INTERVAL + 1) * PROGRESS_INTERVAL;
            }

            state.setContinuation(page.nextCursor().orElse(null));
            state.setScanComplete(page.isLast());
            // Persist before the next listing call so a crash never loses a finished page.
            checkpointStore.save(state);

            if (page.isLast() || page.entries().isEmpty()) {
                break;
            }
            sleeper.sleep(pageDelay);
        }

        LOGGER.info("Scan complete. Scanned {} entries (needs EXIF={}, needs template={}).",
                scanned, state.queueSize(), state.needsAlternateAction().size());
        return state;
    }

    private List<RawEntry> unseen(List<RawEntry> entries, ScanState state) {
        Set<String> pageIds = new HashSet<>();
        List<RawEntry> fresh = new ArrayList<>();
        for (RawEntry entry : entries) {
            if (state.contains(entry.id()) || !pageIds.add(entry.id())) {
                continue;
            }
            fresh.add(entry);
        }
        return fresh;
    }

    private void route(Classification classification, ScanState state) {
        if (classification.disposition() == Disposition.NEEDS_MUTATION) {
            state.addNeedsMutation(classification.record());
        } else if (classification.disposition() == Disposition.NEEDS_ALTERNATE_ACTION) {
            state.addNeedsAlternateAction(classification.record().id());
        }
    }
}
