package com.example.geotagger;

import com.example.geotagger.gateway.GatewayException;
import com.example.geotagger.gateway.ItemDetailSource;
import com.example.geotagger.model.ItemDetail;
import com.example.geotagger.model.ItemRecord;
import com.example.geotagger.model.RawEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fetches details for raw listing entries and sorts them into queues.
 */
public class ItemClassifier {
    private static final Logger LOGGER = LoggerFactory.getLogger(ItemClassifier.class);

    private final ItemDetailSource detailSource;
    private final EligibilityFilter filter;
    private final int batchSize;

    public ItemClassifier(ItemDetailSource detailSource, EligibilityFilter filter) {
        this(detailSource, filter, ItemDetailSource.MAX_BATCH);
    }

    ItemClassifier(ItemDetailSource detailSource, EligibilityFilter filter, int batchSize) {
        if (batchSize <= 0 || batchSize > ItemDetailSource.MAX_BATCH) {
            throw new IllegalArgumentException("batchSize must be in [1, " + ItemDetailSource.MAX_BATCH + "]");
        }
        this.detailSource = detailSource;
        this.filter = filter;
        this.batchSize = batchSize;
    }

    public Classification classify(RawEntry entry) throws GatewayException {
        return classifyAll(List.of(entry)).get(0);
    }

    /**
     * Classifies entries in input order, fetching details in fixed-size batches.
     */
    public List<Classification> classifyAll(List<RawEntry> entries) throws GatewayException {
        List<Classification> results = new ArrayList<>(entries.size());
        for (int start = 0; start < entries.size(); start += batchSize) {
            List<RawEntry> batch = entries.subList(start, Math.min(entries.size(), start + batchSize));
            List<String> ids = batch.stream().map(RawEntry::id).toList();
            Map<String, ItemDetail> details = new HashMap<>();
            for (ItemDetail detail : detailSource.fetchDetails(ids)) {
                details.put(detail.id(), detail);
            }
            for (String id : ids) {
                ItemDetail detail = details.getOrDefault(id, ItemDetail.missing(id));
                results.add(classifyDetail(detail));
            }
        }
        return results;
    }

    Classification classifyDetail(ItemDetail detail) {
        ItemRecord record = detail.toRecord();
        Optional<String> rejection = filter.rejectionReason(detail);
        if (rejection.isPresent()) {
            LOGGER.debug("Excluding {}: {}", detail.id(), rejection.get());
            return new Classification(record, Disposition.INELIGIBLE, rejection.get());
        }
        Disposition disposition = Disposition.of(record.hasAltCoordinateSource(), record.hasEmbeddedCoordinate());
        return new Classification(record, disposition, null);
    }
}
