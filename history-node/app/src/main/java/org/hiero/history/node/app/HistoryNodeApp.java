// SPDX-License-Identifier: Apache-2.0
package org.hiero.history.node.app;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.swirlds.config.api.Configuration;
import com.swirlds.config.api.ConfigurationBuilder;
import com.swirlds.config.extensions.sources.ClasspathFileConfigSource;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.logging.LogManager;
import org.hiero.history.node.app.config.AutomaticEnvironmentVariableConfigSource;
import org.hiero.history.node.app.logging.ConfigLogger;
import org.hiero.history.node.backfill.BackfillStatusTracker;
import org.hiero.history.node.base.ratelimit.LeakyBucketRateLimiter;
import org.hiero.history.node.base.ratelimit.RateLimiterConfig;
import org.hiero.history.node.base.store.InMemoryHistoryStore;
import org.hiero.history.node.base.stream.BlobsSidecarEncoder;
import org.hiero.history.node.range.BlobsSidecarsByRangeHandler;
import org.hiero.history.node.range.RangeAccessConfig;
import org.hiero.history.node.spi.store.BackfillDatabase;
import org.hiero.history.node.spi.store.BlobStore;
import org.hiero.history.node.spi.store.StorageException;

/** Main class for the history node, wires backfill status tracking and range serving together */
public final class HistoryNodeApp {
    /** The classpath properties file configuration is read from */
    static final String APPLICATION_PROPERTIES = "app.properties";
    /** Every config data type the app reads */
    static final List<Class<? extends Record>> CONFIG_DATA_TYPES =
            List.of(RangeAccessConfig.class, RateLimiterConfig.class);
    /** The logger for this class. */
    private static final System.Logger LOGGER = System.getLogger(HistoryNodeApp.class.getName());

    /** The lifecycle states of the app */
    public enum State {
        STARTING,
        RUNNING,
        SHUTTING_DOWN
    }

    private final AtomicReference<State> state = new AtomicReference<>(State.STARTING);
    private final RateLimiterConfig rateLimiterConfig;
    /** The single tracker for the node, shared by everything that needs the backfill status */
    private final BackfillStatusTracker backfillStatusTracker;
    private final LeakyBucketRateLimiter rateLimiter;
    private final BlobsSidecarsByRangeHandler blobsSidecarsByRangeHandler;
    private ScheduledExecutorService scheduler;

    /**
     * Create the app and all its services. Nothing runs until {@link #start()}.
     *
     * @param configuration the loaded configuration
     * @param backfillDatabase storage for the backfill status
     * @param blobStore storage sidecars are served from
     * @param clock clock for stream deadlines
     */
    HistoryNodeApp(
            @NonNull final Configuration configuration,
            @NonNull final BackfillDatabase backfillDatabase,
            @NonNull final BlobStore blobStore,
            @NonNull final Clock clock) {
        final RangeAccessConfig rangeAccessConfig = configuration.getConfigData(RangeAccessConfig.class);
        rateLimiterConfig = configuration.getConfigData(RateLimiterConfig.class);
        backfillStatusTracker = new BackfillStatusTracker(backfillDatabase);
        rateLimiter = new LeakyBucketRateLimiter();
        rateLimiter.registerTopic(
                BlobsSidecarsByRangeHandler.PROTOCOL_ID,
                rangeAccessConfig.blockBatchLimit(),
                (long) rangeAccessConfig.blockBatchLimitBurstFactor() * rangeAccessConfig.blockBatchLimit());
        blobsSidecarsByRangeHandler = new BlobsSidecarsByRangeHandler(
                rangeAccessConfig, Objects.requireNonNull(blobStore), rateLimiter, new BlobsSidecarEncoder(), clock);
    }

    /**
     * Load the logging configuration from the classpath, unless an external one is given with the
     * {@code java.util.logging.config.file} system property.
     */
    static void loadLoggingConfiguration() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            LOGGER.log(INFO, "External logging configuration found");
            return;
        }
        try (InputStream loggingConfigIn =
                HistoryNodeApp.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (loggingConfigIn != null) {
                LogManager.getLogManager().readConfiguration(loggingConfigIn);
                LOGGER.log(INFO, "Using default logging configuration");
            } else {
                LOGGER.log(INFO, "No logging configuration found");
            }
        } catch (IOException e) {
            LOGGER.log(WARNING, "Failed to load logging configuration", e);
        }
    }

    /**
     * Build the configuration from the environment and {@value #APPLICATION_PROPERTIES}, environment values winning.
     *
     * @param envVarGetter looks up environment variables
     * @return the configuration
     * @throws IOException if {@value #APPLICATION_PROPERTIES} could not be read
     */
    @NonNull
    static Configuration loadConfiguration(@NonNull final Function<String, String> envVarGetter) throws IOException {
        ConfigurationBuilder builder = ConfigurationBuilder.create()
                .withSource(new AutomaticEnvironmentVariableConfigSource(CONFIG_DATA_TYPES, envVarGetter))
                .withSource(new ClasspathFileConfigSource(Path.of(APPLICATION_PROPERTIES)));
        for (final Class<? extends Record> configType : CONFIG_DATA_TYPES) {
            builder = builder.withConfigDataType(configType);
        }
        final Configuration configuration = builder.build();
        ConfigLogger.log(configuration, CONFIG_DATA_TYPES);
        return configuration;
    }

    /**
     * Load the backfill status and start the periodic rate limiter cleanup.
     *
     * @throws StorageException if the backfill status could not be loaded
     * @throws IllegalStateException if the app has already been started or stopped
     */
    synchronized void start() throws StorageException {
        if (state.get() != State.STARTING) {
            throw new IllegalStateException("History Node cannot start, state is " + state.get());
        }
        LOGGER.log(INFO, "Starting History Node");
        backfillStatusTracker.reload();
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            final Thread thread = new Thread(runnable, "rate-limiter-prune");
            thread.setDaemon(false);
            return thread;
        });
        final long pruneInterval = rateLimiterConfig.pruneInterval();
        scheduler.scheduleAtFixedRate(this::pruneRateLimiter, pruneInterval, pruneInterval, TimeUnit.MILLISECONDS);
        state.set(State.RUNNING);
        LOGGER.log(
                INFO,
                "Started History Node : State = {0}, genesis sync = {1}, backfill status = {2}",
                state.get(),
                backfillStatusTracker.isGenesisSync(),
                backfillStatusTracker.status());
    }

    /**
     * Stop background work. Safe to call more than once.
     */
    synchronized void stop() {
        state.set(State.SHUTTING_DOWN);
        LOGGER.log(INFO, "Shutting down History Node");
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    LOGGER.log(WARNING, "Rate limiter cleanup did not stop in time");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOGGER.log(INFO, "Shutdown interrupted");
            }
            scheduler = null;
        }
        LOGGER.log(INFO, "Bye bye");
    }

    private void pruneRateLimiter() {
        final int dropped = rateLimiter.pruneIdleBuckets();
        LOGGER.log(DEBUG, "Dropped {0} idle rate limit buckets", dropped);
    }

    @NonNull
    public State state() {
        return state.get();
    }

    @NonNull
    public BackfillStatusTracker backfillStatusTracker() {
        return backfillStatusTracker;
    }

    @NonNull
    public BlobsSidecarsByRangeHandler blobsSidecarsByRangeHandler() {
        return blobsSidecarsByRangeHandler;
    }

    @NonNull
    public LeakyBucketRateLimiter rateLimiter() {
        return rateLimiter;
    }

    /**
     * Main entrypoint for the history node
     *
     * @param args Command line arguments. Not used at present.
     * @throws StorageException if the backfill status could not be loaded
     * @throws IOException if the configuration could not be read
     */
    public static void main(final String[] args) throws StorageException, IOException {
        loadLoggingConfiguration();
        final Configuration configuration = loadConfiguration(System::getenv);
        final InMemoryHistoryStore store = new InMemoryHistoryStore();
        final HistoryNodeApp app = new HistoryNodeApp(configuration, store, store, Clock.systemUTC());
        Runtime.getRuntime().addShutdownHook(new Thread(app::stop, "history-node-shutdown"));
        app.start();
    }
}
