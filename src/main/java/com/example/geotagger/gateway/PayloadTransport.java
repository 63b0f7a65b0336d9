package com.example.geotagger.gateway;

import com.example.geotagger.model.ItemRecord;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Moves item payloads between the remote repository and local disk.
 */
public interface PayloadTransport {
    /**
     * Downloads the payload of {@code record} into a local file owned by the caller.
     */
    Path download(ItemRecord record) throws IOException;

    /**
     * Uploads {@code file} as a new revision of {@code record}.
     */
    void publish(ItemRecord record, Path file, String comment) throws IOException;
}
