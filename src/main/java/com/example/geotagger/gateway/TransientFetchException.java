package com.example.geotagger.gateway;

/**
 * Retryable failure: network trouble, server errors, throttling or replication lag.
 */
public class TransientFetchException extends GatewayException {
    public TransientFetchException(String message) {
        super(message);
    }

    public TransientFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
