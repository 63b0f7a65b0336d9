package com.example.geotagger.model;

import java.util.List;
import java.util.Optional;

/**
 * One bounded page of a listing. An absent next cursor means the listing is exhausted.
 */
public record ListingPage(List<RawEntry> entries, Optional<ContinuationCursor> nextCursor) {
    public ListingPage {
        entries = List.copyOf(entries);
        nextCursor = nextCursor == null ? Optional.empty() : nextCursor;
    }

    public static ListingPage last(List<RawEntry> entries) {
        return new ListingPage(entries, Optional.empty());
    }

    public boolean isLast() {
        return nextCursor.isEmpty();
    }
}
