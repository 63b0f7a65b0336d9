package com.example.geotagger.gateway;

/**
 * The remote repository refused our credentials or session. Retrying will not help.
 */
public class FatalAuthException extends GatewayException {
    public FatalAuthException(String message) {
        super(message);
    }
}
