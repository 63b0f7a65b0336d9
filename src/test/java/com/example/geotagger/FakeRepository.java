package com.example.geotagger;

import com.example.geotagger.gateway.CrawlScope;
import com.example.geotagger.gateway.GatewayException;
import com.example.geotagger.gateway.ItemDetailSource;
import com.example.geotagger.gateway.ListingGateway;
import com.example.geotagger.model.ContinuationCursor;
import com.example.geotagger.model.ItemDetail;
import com.example.geotagger.model.ListingPage;
import com.example.geotagger.model.RawEntry;
import com.fasterxml.jackson.databind.node.IntNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory listing and detail source. Pages are addressed by index; the cursor is the next index.
 */
final class FakeRepository implements ListingGateway, ItemDetailSource {
    private final List<List<String>> pages = new ArrayList<>();
    private final Map<String, ItemDetail> details = new HashMap<>();
    private final Map<Integer, GatewayException> failures = new HashMap<>();
    final List<Integer> requestedPages = new ArrayList<>();
    final List<Integer> detailBatchSizes = new ArrayList<>();

    FakeRepository page(String... ids) {
        pages.add(List.of(ids));
        return this;
    }

    FakeRepository item(ItemDetail detail) {
        details.put(detail.id(), detail);
        return this;
    }

    /**
     * Registers a JPEG with the given coordinate flags.
     */
    FakeRepository item(String id, boolean pageCoordinate, boolean exifCoordinate) {
        return item(new ItemDetail(id, false, false,
                pageCoordinate ? 48.85 : null, pageCoordinate ? 2.35 : null,
                exifCoordinate, "https://upload.example.org/" + id, "Alice"));
    }

    FakeRepository failOnPage(int index, GatewayException failure) {
        failures.put(index, failure);
        return this;
    }

    void clearFailures() {
        failures.clear();
    }

    @Override
    public ListingPage listPage(CrawlScope scope, ContinuationCursor cursor) throws GatewayException {
        int index = cursor == null ? 0 : cursor.token().asInt();
        requestedPages.add(index);
        GatewayException failure = failures.get(index);
        if (failure != null) {
            throw failure;
        }
        List<RawEntry> entries = index < pages.size()
                ? pages.get(index).stream().map(RawEntry::new).toList()
                : List.of();
        if (index + 1 >= pages.size()) {
            return ListingPage.last(entries);
        }
        return new ListingPage(entries, Optional.of(new ContinuationCursor(IntNode.valueOf(index + 1))));
    }

    @Override
    public List<ItemDetail> fetchDetails(List<String> ids) {
        detailBatchSizes.add(ids.size());
        List<ItemDetail> result = new ArrayList<>();
        for (String id : ids) {
            result.add(details.getOrDefault(id, ItemDetail.missing(id)));
        }
        return result;
    }
}
