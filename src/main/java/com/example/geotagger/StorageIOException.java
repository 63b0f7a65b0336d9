package com.example.geotagger;

import java.io.IOException;

/**
 * The checkpoint could not be written. Continuing would risk losing queue progress.
 */
public class StorageIOException extends IOException {
    public StorageIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
