package com.example.geotagger.gateway;

import com.example.geotagger.model.ContinuationCursor;
import com.example.geotagger.model.ListingPage;

/**
 * One paginated listing call against the remote repository.
 */
public interface ListingGateway {
    /**
     * Lists the next page of {@code scope}, starting at {@code cursor} or at the beginning when it is null.
     *
     * @throws TransientFetchException on network failure, server errors or throttling
     * @throws FatalAuthException when the session is not authorized
     */
    ListingPage listPage(CrawlScope scope, ContinuationCursor cursor) throws GatewayException;
}
