package com.example.geotagger;

import com.example.geotagger.gateway.CommonsClient;
import com.example.geotagger.gateway.CommonsSettings;
import com.example.geotagger.gateway.FatalAuthException;
import com.example.geotagger.gateway.TransientFetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);
    private static final Duration HTTP_TIMEOUT = Duration.ofSeconds(30);

    private App() {
    }

    public static void main(String[] args) throws Exception {
        // Basic CLI contract: a single JSON config file path is required.
        if (args.length < 1) {
            LOGGER.error("Usage: java -jar commons-geotagger.jar <config.json>");
            System.exit(1);
        }
        GeotagConfig config = new ConfigLoader().load(Path.of(args[0]));
        LOGGER.info("Starting with {}", config);

        CheckpointStore checkpointStore = new CheckpointStore(config.checkpointFile());
        CommonsSettings settings = new CommonsSettings(
                config.apiUrl(), config.userAgent(), config.downloadDirectory(), HTTP_TIMEOUT);
        try (CheckpointStore.Lock lock = checkpointStore.lock();
             CommonsClient client = CommonsClient.login(settings, config.commonsUser(), config.commonsPassword())) {
            new GeotagEngine(config, checkpointStore, client, client, client).run();
        } catch (FatalAuthException ex) {
            LOGGER.error("Authorization failed, aborting: {}", ex.getMessage());
            System.exit(2);
        } catch (TransientFetchException ex) {
            LOGGER.error("Listing failed; rerun to resume from {}", checkpointStore.path(), ex);
            System.exit(3);
        }
    }
}
