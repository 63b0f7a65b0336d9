package com.example.geotagger.mutation;

import com.example.geotagger.model.ItemRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports what would be written without downloading or uploading anything.
 */
public class DryRunMutationAction implements MutationAction {
    private static final Logger LOGGER = LoggerFactory.getLogger(DryRunMutationAction.class);

    @Override
    public MutationResult apply(ItemRecord record) {
        if (!record.hasValidCoordinate()) {
            return MutationResult.failure("invalid coordinates " + record.lat() + ", " + record.lon());
        }
        LOGGER.info("Dry run: would write GPS {}, {} to {}", record.lat(), record.lon(), record.id());
        return MutationResult.success("dry run");
    }
}
