package com.example.geotagger.mutation;

import com.example.geotagger.model.ItemRecord;

/**
 * Applies the coordinate to one item. Implementations must tolerate being invoked
 * more than once for the same item.
 */
@FunctionalInterface
public interface MutationAction {
    MutationResult apply(ItemRecord record) throws ItemProcessingException;
}
