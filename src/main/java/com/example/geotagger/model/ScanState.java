package com.example.geotagger.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Crawl and queue progress. This is the only unit the checkpoint store persists.
 * Not thread-safe: a single run owns it.
 */
public final class ScanState {
    private final Map<String, ItemRecord> needsMutation = new LinkedHashMap<>();
    private final Set<String> needsAlternateAction = new LinkedHashSet<>();
    private ContinuationCursor continuation;
    private boolean scanComplete;

    public ScanState() {
    }

    public ScanState(Collection<ItemRecord> needsMutation,
                     Collection<String> needsAlternateAction,
                     ContinuationCursor continuation,
                     boolean scanComplete) {
        for (ItemRecord record : needsMutation) {
            addNeedsMutation(record);
        }
        for (String id : needsAlternateAction) {
            addNeedsAlternateAction(id);
        }
        this.continuation = continuation;
        this.scanComplete = scanComplete;
    }

    /**
     * Queues a record for mutation. Returns false if the id is already known to either collection.
     */
    public boolean addNeedsMutation(ItemRecord record) {
        if (contains(record.id())) {
            return false;
        }
        needsMutation.put(record.id(), record);
        return true;
    }

    public boolean addNeedsAlternateAction(String id) {
        if (contains(id)) {
            return false;
        }
        return needsAlternateAction.add(id);
    }

    public boolean contains(String id) {
        return needsMutation.containsKey(id) || needsAlternateAction.contains(id);
    }

    /**
     * Removes a record from the mutation queue. Returns false if it was not queued.
     */
    public boolean retire(String id) {
        return needsMutation.remove(id) != null;
    }

    /**
     * Drops queued records that no longer have an alternate coordinate source.
     */
    public int dropEntriesWithoutSource() {
        int before = needsMutation.size();
        needsMutation.values().removeIf(record -> !record.hasAltCoordinateSource());
        return before - needsMutation.size();
    }

    public List<ItemRecord> needsMutation() {
        return Collections.unmodifiableList(new ArrayList<>(needsMutation.values()));
    }

    public Set<String> needsAlternateAction() {
        return Collections.unmodifiableSet(needsAlternateAction);
    }

    public int queueSize() {
        return needsMutation.size();
    }

    public Optional<ContinuationCursor> continuation() {
        return Optional.ofNullable(continuation);
    }

    public void setContinuation(ContinuationCursor continuation) {
        this.continuation = continuation;
    }

    public boolean scanComplete() {
        return scanComplete;
    }

    public void setScanComplete(boolean scanComplete) {
        this.scanComplete = scanComplete;
    }

    /**
     * Forgets the cursor and completion flag so the next crawl starts from the first page.
     * Queued entries are kept and continue to deduplicate the new scan.
     */
    public void restartScan() {
        this.continuation = null;
        this.scanComplete = false;
    }
}
