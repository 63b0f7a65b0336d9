package com.example.geotagger.gateway;

import java.io.IOException;

/**
 * Failure talking to the remote repository.
 */
public abstract class GatewayException extends IOException {
    protected GatewayException(String message) {
        super(message);
    }

    protected GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
