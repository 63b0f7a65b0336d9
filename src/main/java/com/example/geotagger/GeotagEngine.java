package com.example.geotagger;

import com.example.geotagger.gateway.CategoryScope;
import com.example.geotagger.gateway.CrawlScope;
import com.example.geotagger.gateway.ExplicitListScope;
import com.example.geotagger.gateway.ItemDetailSource;
import com.example.geotagger.gateway.ListingGateway;
import com.example.geotagger.gateway.PayloadTransport;
import com.example.geotagger.gateway.UserUploadsScope;
import com.example.geotagger.model.ScanState;
import com.example.geotagger.mutation.DryRunMutationAction;
import com.example.geotagger.mutation.ExifGpsWriter;
import com.example.geotagger.mutation.GeotagMutationAction;
import com.example.geotagger.mutation.MutationAction;
import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Random;

/**
 * Orchestrates one run: restore the checkpoint, crawl the configured scope into the queue,
 * then drain the queue through the mutation action under the configured rate limits.
 */
public final class GeotagEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(GeotagEngine.class);
    private static final int TEMPLATE_EXAMPLES = 5;

    private final GeotagConfig config;
    private final CheckpointStore checkpointStore;
    private final ListingGateway gateway;
    private final ItemDetailSource detailSource;
    private final PayloadTransport transport;
    private final TitleListReader titleListReader;
    private final Sleeper sleeper;
    private final Clock clock;
    private final Random random;

    public GeotagEngine(GeotagConfig config,
                        CheckpointStore checkpointStore,
                        ListingGateway gateway,
                        ItemDetailSource detailSource,
                        PayloadTransport transport) {
        this(config, checkpointStore, gateway, detailSource, transport, Sleeper.SYSTEM, Clock.systemUTC(), new Random());
    }

    GeotagEngine(GeotagConfig config,
                 CheckpointStore checkpointStore,
                 ListingGateway gateway,
                 ItemDetailSource detailSource,
                 PayloadTransport transport,
                 Sleeper sleeper,
                 Clock clock,
                 Random random) {
        this.config = config;
        this.checkpointStore = checkpointStore;
        this.gateway = gateway;
        this.detailSource = detailSource;
        this.transport = transport;
        this.titleListReader = new TitleListReader();
        this.sleeper = sleeper;
        this.clock = clock;
        this.random = random;
    }

    /**
     * Executes a run and returns the processor's counters.
     */
    public ProcessingReport run() throws IOException, InterruptedException {
        ScanState state = config.resume() ? checkpointStore.load() : new ScanState();
        CrawlScope scope = resolveScope();
        // An explicit list is always scanned; it is cheap and the user asked for exactly these files.
        if (config.rescan() || scope instanceof ExplicitListScope) {
            state.restartScan();
        }

        EligibilityFilter filter = new EligibilityFilter(new Tika(), config.authorFilter());
        ItemClassifier classifier = new ItemClassifier(detailSource, filter);
        Crawler crawler = new Crawler(gateway, classifier, checkpointStore, sleeper, config.pageDelay());
        crawler.crawl(scope, state);

        LOGGER.info("{}: {} need EXIF GPS, {} need page template.",
                scope.describe(), state.queueSize(), state.needsAlternateAction().size());
        if (!state.needsAlternateAction().isEmpty()) {
            List<String> examples = state.needsAlternateAction().stream().limit(TEMPLATE_EXAMPLES).toList();
            LOGGER.info("Examples needing template (up to {}): {}", TEMPLATE_EXAMPLES, examples);
        }

        ProcessingLimits limits = new ProcessingLimits(
                config.maxEditsPerMinute(),
                config.baseSleep(),
                config.maxEdits().map(ProcessingLimiter::maxEdits).orElse(ProcessingLimiter.NO_LIMIT));
        RateLimitedProcessor processor = new RateLimitedProcessor(checkpointStore, clock, sleeper, random);
        ProcessingReport report = processor.process(state, limits, mutationAction());

        LOGGER.info("Finished. Updated: {}, skipped (has GPS): {}, skipped (no GPS source): {}, errors: {}.",
                report.updated(), report.skippedAlreadySatisfied(), report.skippedNoSource(), report.errors());
        return report;
    }

    CrawlScope resolveScope() throws IOException {
        if (config.fileList().isPresent()) {
            return new ExplicitListScope(titleListReader.read(config.fileList().get()));
        }
        if (config.category().isPresent()) {
            return new CategoryScope(config.category().get(), config.maxDepth());
        }
        return new UserUploadsScope(config.targetUser());
    }

    private MutationAction mutationAction() {
        if (config.dryRun()) {
            LOGGER.info("Dry run: no files will be downloaded or uploaded.");
            return new DryRunMutationAction();
        }
        return new GeotagMutationAction(transport, new ExifGpsWriter(), config.publish());
    }
}
