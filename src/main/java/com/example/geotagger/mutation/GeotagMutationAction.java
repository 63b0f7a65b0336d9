package com.example.geotagger.mutation;

import com.example.geotagger.gateway.PayloadTransport;
import com.example.geotagger.model.ItemRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Downloads an item, writes its page coordinate into the file's EXIF GPS block and,
 * when publishing is on, uploads the result as a new revision. Writing the same
 * coordinate twice yields the same file, so repeats are harmless.
 */
public class GeotagMutationAction implements MutationAction {
    private static final Logger LOGGER = LoggerFactory.getLogger(GeotagMutationAction.class);
    static final String UPLOAD_COMMENT = "Adding geolocation";

    private final PayloadTransport transport;
    private final GpsTagWriter writer;
    private final boolean publish;

    public GeotagMutationAction(PayloadTransport transport, GpsTagWriter writer, boolean publish) {
        this.transport = transport;
        this.writer = writer;
        this.publish = publish;
    }

    @Override
    public MutationResult apply(ItemRecord record) throws ItemProcessingException {
        if (!record.hasValidCoordinate()) {
            return MutationResult.failure("invalid coordinates " + record.lat() + ", " + record.lon());
        }
        if (record.sourceUrl() == null) {
            return MutationResult.failure("no download url");
        }

        Path local = null;
        try {
            local = transport.download(record);
            writer.write(local, record.lat(), record.lon());
            if (publish) {
                transport.publish(record, local, UPLOAD_COMMENT);
                return MutationResult.success("uploaded");
            }
            return MutationResult.success("written locally");
        } catch (IOException ex) {
            throw new ItemProcessingException(record.id(), "Failed to geotag " + record.id(), ex);
        } finally {
            if (local != null) {
                cleanup(local);
            }
        }
    }

    private void cleanup(Path local) {
        try {
            Files.deleteIfExists(local);
        } catch (IOException ex) {
            LOGGER.warn("Failed to delete {}", local, ex);
        }
    }
}
