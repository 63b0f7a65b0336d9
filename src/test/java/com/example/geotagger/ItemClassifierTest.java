package com.example.geotagger;

import com.example.geotagger.model.ItemDetail;
import com.example.geotagger.model.RawEntry;
import org.apache.tika.Tika;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ItemClassifierTest {
    private final Tika tika = new Tika();

    @Test
    void routesByCoordinateSignals() throws Exception {
        FakeRepository repository = new FakeRepository()
                .item("A.jpg", true, false)
                .item("B.jpg", false, true)
                .item("C.jpg", true, true)
                .item("D.jpg", false, false);
        ItemClassifier classifier = new ItemClassifier(repository, new EligibilityFilter(tika, Optional.empty()));

        List<Classification> results = classifier.classifyAll(List.of(
                new RawEntry("A.jpg"), new RawEntry("B.jpg"), new RawEntry("C.jpg"), new RawEntry("D.jpg")));

        assertEquals(Disposition.NEEDS_MUTATION, results.get(0).disposition());
        assertEquals(Disposition.NEEDS_ALTERNATE_ACTION, results.get(1).disposition());
        assertEquals(Disposition.NO_ACTION, results.get(2).disposition());
        assertEquals(Disposition.NO_ACTION, results.get(3).disposition());
        assertEquals(48.85, results.get(0).record().lat());
        assertEquals("https://upload.example.org/A.jpg", results.get(0).record().sourceUrl());
    }

    @Test
    void classificationIsIdempotent() throws Exception {
        FakeRepository repository = new FakeRepository().item("A.jpg", true, false);
        ItemClassifier classifier = new ItemClassifier(repository, new EligibilityFilter(tika, Optional.of("alice")));

        Classification first = classifier.classify(new RawEntry("A.jpg"));
        Classification second = classifier.classify(new RawEntry("A.jpg"));

        assertEquals(first, second);
    }

    @Test
    void excludesIneligibleEntries() throws Exception {
        FakeRepository repository = new FakeRepository()
                .item("Photo.png", true, false)
                .item(new ItemDetail("Moved.jpg", false, true, 1.0, 2.0, false, null, null))
                .item(new ItemDetail("Other.jpg", false, false, 1.0, 2.0, false, "u", "Bob Smith"))
                .item(new ItemDetail("Mine.jpg", false, false, 1.0, 2.0, false, "u", "Own work by ALICE"))
                .item(new ItemDetail("Anon.JPEG", false, false, 1.0, 2.0, false, "u", null));
        ItemClassifier classifier = new ItemClassifier(repository, new EligibilityFilter(tika, Optional.of("Alice")));

        List<Classification> results = classifier.classifyAll(List.of(
                new RawEntry("Photo.png"), new RawEntry("Moved.jpg"), new RawEntry("Other.jpg"),
                new RawEntry("Gone.jpg"), new RawEntry("Mine.jpg"), new RawEntry("Anon.JPEG")));

        assertEquals(Disposition.INELIGIBLE, results.get(0).disposition());
        assertEquals("not a JPEG", results.get(0).reason());
        assertEquals("redirect", results.get(1).reason());
        assertEquals("author mismatch", results.get(2).reason());
        assertEquals("page missing", results.get(3).reason());
        assertEquals(Disposition.NEEDS_MUTATION, results.get(4).disposition());
        assertEquals(Disposition.NEEDS_MUTATION, results.get(5).disposition());
    }

    @Test
    void fetchesDetailsInBatchesOfFifty() throws Exception {
        FakeRepository repository = new FakeRepository();
        List<RawEntry> entries = new ArrayList<>();
        for (int i = 0; i < 120; i++) {
            repository.item("F" + i + ".jpg", true, false);
            entries.add(new RawEntry("F" + i + ".jpg"));
        }
        ItemClassifier classifier = new ItemClassifier(repository, new EligibilityFilter(tika, Optional.empty()));

        List<Classification> results = classifier.classifyAll(entries);

        assertEquals(List.of(50, 50, 20), repository.detailBatchSizes);
        assertEquals(120, results.size());
        assertEquals("F119.jpg", results.get(119).record().id());
    }
}
