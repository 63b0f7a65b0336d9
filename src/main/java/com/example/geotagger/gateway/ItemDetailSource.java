package com.example.geotagger.gateway;

import com.example.geotagger.model.ItemDetail;

import java.util.List;

public interface ItemDetailSource {
    /**
     * Largest number of ids a single {@link #fetchDetails(List)} call accepts.
     */
    int MAX_BATCH = 50;

    /**
     * Fetches details for up to {@link #MAX_BATCH} ids. Ids the repository does not know come back as
     * {@link ItemDetail#missing(String)}.
     */
    List<ItemDetail> fetchDetails(List<String> ids) throws GatewayException;
}
