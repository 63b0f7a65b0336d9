package com.example.geotagger;

import com.example.geotagger.gateway.FatalAuthException;
import com.example.geotagger.gateway.TransientFetchException;
import com.example.geotagger.gateway.UserUploadsScope;
import com.example.geotagger.model.ItemRecord;
import com.example.geotagger.model.ScanState;
import org.apache.tika.Tika;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CrawlerTest {
    private static final UserUploadsScope SCOPE = new UserUploadsScope("Alice");

    @Test
    void routesEntriesAcrossPages() throws Exception {
        FakeRepository repository = new FakeRepository()
                .page("A.jpg", "B.jpg")
                .page("C.jpg")
                .item("A.jpg", true, false)
                .item("B.jpg", false, true)
                .item("C.jpg", true, true);
        CheckpointStore store = store();
        FakeTime time = new FakeTime();

        ScanState state = crawler(repository, store, time).crawl(SCOPE, new ScanState());

        assertEquals(List.of("A.jpg"), ids(state));
        assertEquals(Set.of("B.jpg"), state.needsAlternateAction());
        assertTrue(state.scanComplete());
        assertTrue(state.continuation().isEmpty());
        assertEquals(List.of(Duration.ofSeconds(1)), time.sleeps());

        ScanState persisted = store.load();
        assertEquals(List.of("A.jpg"), ids(persisted));
        assertTrue(persisted.scanComplete());
    }

    @Test
    void neverQueuesAnIdTwice() throws Exception {
        FakeRepository repository = new FakeRepository()
                .page("A.jpg", "B.jpg", "A.jpg")
                .page("B.jpg", "C.jpg", "A.jpg")
                .page("D.jpg", "C.jpg")
                .item("A.jpg", true, false)
                .item("B.jpg", false, true)
                .item("C.jpg", true, false)
                .item("D.jpg", true, false);
        ScanState state = new ScanState(
                List.of(new ItemRecord("D.jpg", true, false, 1.0, 1.0, null, null)), List.of(), null, false);

        crawler(repository, store(), new FakeTime()).crawl(SCOPE, state);

        List<String> queued = ids(state);
        Set<String> all = new HashSet<>(queued);
        assertEquals(queued.size(), all.size());
        for (String id : state.needsAlternateAction()) {
            assertTrue(all.add(id), id + " is in both collections");
        }
        assertEquals(List.of("D.jpg", "A.jpg", "C.jpg"), queued);
        assertEquals(Set.of("B.jpg"), state.needsAlternateAction());
        // Only unseen entries are looked up.
        assertEquals(List.of(2, 1), repository.detailBatchSizes);
    }

    @Test
    void transientFailureResumesFromLastSavedPage() throws Exception {
        FakeRepository repository = new FakeRepository()
                .page("A.jpg")
                .page("B.jpg")
                .page("C.jpg")
                .item("A.jpg", true, false)
                .item("B.jpg", true, false)
                .item("C.jpg", true, false)
                .failOnPage(2, new TransientFetchException("HTTP 503"));
        CheckpointStore store = store();

        assertThrows(TransientFetchException.class,
                () -> crawler(repository, store, new FakeTime()).crawl(SCOPE, new ScanState()));

        ScanState saved = store.load();
        assertEquals(List.of("A.jpg", "B.jpg"), ids(saved));
        assertEquals(2, saved.continuation().orElseThrow().token().asInt());
        assertFalse(saved.scanComplete());

        repository.clearFailures();
        repository.requestedPages.clear();
        ScanState resumed = crawler(repository, store, new FakeTime()).crawl(SCOPE, saved);

        assertEquals(List.of(2), repository.requestedPages);
        assertEquals(List.of("A.jpg", "B.jpg", "C.jpg"), ids(resumed));
        assertTrue(store.load().scanComplete());
    }

    @Test
    void authFailurePropagatesAndKeepsCheckpoint() throws Exception {
        FakeRepository repository = new FakeRepository()
                .page("A.jpg")
                .page("B.jpg")
                .item("A.jpg", true, false)
                .failOnPage(1, new FatalAuthException("notloggedin"));
        CheckpointStore store = store();

        assertThrows(FatalAuthException.class,
                () -> crawler(repository, store, new FakeTime()).crawl(SCOPE, new ScanState()));

        ScanState saved = store.load();
        assertEquals(List.of("A.jpg"), ids(saved));
        assertEquals(1, saved.continuation().orElseThrow().token().asInt());
    }

    @Test
    void completedScanWithQueuedWorkIsReused() throws Exception {
        FakeRepository repository = new FakeRepository().page("A.jpg").item("A.jpg", true, false);
        ScanState state = new ScanState(
                List.of(new ItemRecord("Queued.jpg", true, false, 1.0, 1.0, null, null)), List.of(), null, true);

        crawler(repository, store(), new FakeTime()).crawl(SCOPE, state);

        assertTrue(repository.requestedPages.isEmpty());
        assertEquals(List.of("Queued.jpg"), ids(state));
    }

    @Test
    void completedScanWithEmptyQueueScansAgain() throws Exception {
        FakeRepository repository = new FakeRepository()
                .page("A.jpg")
                .page("B.jpg")
                .item("A.jpg", true, false)
                .item("B.jpg", true, false);
        ScanState state = new ScanState(List.of(), List.of("T.jpg"), null, true);

        crawler(repository, store(), new FakeTime()).crawl(SCOPE, state);

        assertEquals(List.of(0, 1), repository.requestedPages);
        assertEquals(List.of("A.jpg", "B.jpg"), ids(state));
        assertTrue(state.scanComplete());
    }

    @Test
    void staleEntriesAreDroppedEvenWhenScanIsComplete() throws Exception {
        FakeRepository repository = new FakeRepository().page("A.jpg").item("A.jpg", true, false);
        ScanState state = new ScanState(
                List.of(ItemRecord.bare("Legacy.jpg"), new ItemRecord("Keep.jpg", true, false, 1.0, 1.0, null, null)),
                List.of(), null, true);

        crawler(repository, store(), new FakeTime()).crawl(SCOPE, state);

        assertTrue(repository.requestedPages.isEmpty());
        assertEquals(List.of("Keep.jpg"), ids(state));
    }

    @Test
    void onlyStaleEntriesLeftMeansScanAgain() throws Exception {
        FakeRepository repository = new FakeRepository().page("A.jpg").item("A.jpg", true, false);
        ScanState state = new ScanState(List.of(ItemRecord.bare("Legacy.jpg")), List.of(), null, true);

        crawler(repository, store(), new FakeTime()).crawl(SCOPE, state);

        assertEquals(List.of(0), repository.requestedPages);
        assertEquals(List.of("A.jpg"), ids(state));
    }

    @Test
    void emptyPageEndsCrawlWithoutMarkingComplete() throws Exception {
        FakeRepository repository = new FakeRepository()
                .page()
                .page("A.jpg")
                .item("A.jpg", true, false);

        ScanState state = crawler(repository, store(), new FakeTime()).crawl(SCOPE, new ScanState());

        assertEquals(List.of(0), repository.requestedPages);
        assertFalse(state.scanComplete());
        assertEquals(1, state.continuation().orElseThrow().token().asInt());
    }

    @Test
    void dropsStaleEntriesBeforeScanning() throws Exception {
        FakeRepository repository = new FakeRepository().page();
        ScanState state = new ScanState(
                List.of(ItemRecord.bare("Legacy.jpg"), new ItemRecord("Keep.jpg", true, false, 1.0, 1.0, null, null)),
                List.of(), null, false);

        crawler(repository, store(), new FakeTime()).crawl(SCOPE, state);

        assertEquals(List.of("Keep.jpg"), ids(state));
    }

    private Crawler crawler(FakeRepository repository, CheckpointStore store, FakeTime time) {
        ItemClassifier classifier = new ItemClassifier(repository, new EligibilityFilter(new Tika(), Optional.empty()));
        return new Crawler(repository, classifier, store, time, Duration.ofSeconds(1));
    }

    private CheckpointStore store() throws Exception {
        Path dir = Files.createTempDirectory("crawler-test");
        return new CheckpointStore(dir.resolve("gps_scan.json"));
    }

    private List<String> ids(ScanState state) {
        return state.needsMutation().stream().map(ItemRecord::id).toList();
    }
}
