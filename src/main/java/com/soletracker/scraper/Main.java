package com.soletracker.scraper;

import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Main entry point for the sneaker release ingestion pipeline.
 * <p>
 * Modes (first argument):
 * <ul>
 *   <li>{@code run} (default): one orchestrated run; exits with status 1 when the run had no data or nothing persisted.</li>
 *   <li>{@code schedule}: a run every {@code pipeline.intervalMinutes} until the process is stopped.</li>
 *   <li>{@code export}: writes the configured namespace to CSV under {@code export.dir}.</li>
 *   <li>{@code db}: starts the embedded PostgreSQL for local inspection and waits for Enter.</li>
 * </ul>
 *
 * @author Sole Tracker Ingest Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    /**
     * Storage wiring of a process: the JDBC service (when a database is configured) and the embedded server it may run on.
     */
    private record Storage(PostgresService postgres, EmbeddedPostgres embedded) implements AutoCloseable {
        @Override
        public void close() {
            if (embedded != null) {
                try {
                    embedded.close();
                    logger.info("Embedded PostgreSQL stopped.");
                } catch (IOException e) {
                    logger.warn("Failed to stop embedded PostgreSQL: {}", e.getMessage());
                }
            }
        }
    }

    /**
     * Namespaces written by the enabled sources, plus the default one.
     */
    static Set<String> namespaces(PipelineConfig config, List<SourceConfig> sources) {
        Set<String> namespaces = new LinkedHashSet<>();
        namespaces.add(config.namespace());
        for (SourceConfig source : sources) {
            if (source.isEnabled()) namespaces.add(source.namespaceOr(config.namespace()));
        }
        return namespaces;
    }

    /**
     * Opens the configured database: an embedded server when {@code db.embedded=true}, else {@code db.url} if set.
     * Tables are ensured for every given namespace with its conflict key.
     */
    private static Storage openStorage(PipelineConfig config, Collection<String> namespaces) throws IOException, StoreException {
        EmbeddedPostgres embedded = null;
        String url = config.jdbcUrl();
        String user = config.jdbcUser();
        String password = config.jdbcPassword();
        if (config.embeddedDb()) {
            embedded = PostgresService.startEmbedded(config.embeddedDataDir(), config.embeddedPort());
            url = PostgresService.jdbcUrl(embedded);
            user = "postgres";
            password = "postgres";
        }
        if (url == null || url.isBlank()) return new Storage(null, embedded);
        PostgresService postgres = new PostgresService(url, user, password);
        for (String namespace : namespaces) {
            postgres.createTables(namespace, config.conflictKey(namespace));
        }
        return new Storage(postgres, embedded);
    }

    /**
     * Wires the orchestrator for the configured sink target.
     */
    static IngestionOrchestrator createOrchestrator(PipelineConfig config, List<SourceConfig> sources,
                                                    PostgresService postgres, PlaywrightRenderer renderer) {
        IngestionOrchestrator.Builder builder = IngestionOrchestrator.builder(config, sources)
            .pageTransport(new HttpPageTransport(config.userAgent()))
            .renderTransport(renderer);
        String target = config.sinkTarget();
        if (target.equals("postgrest")) {
            PostgrestUpsertTarget rest = new PostgrestUpsertTarget(config.postgrestUrl(), config.postgrestApiKey());
            builder.primaryTarget(rest).store(postgres != null ? postgres : rest).fallbackTarget(postgres);
        } else if (postgres != null) {
            builder.primaryTarget(postgres.nativeUpsert()).fallbackTarget(postgres).store(postgres);
        } else {
            throw new IllegalStateException("sink.target=" + target + " needs db.url or db.embedded=true");
        }
        if (postgres != null) builder.statsRecorder(postgres::insertRunStats);
        return builder.build();
    }

    private static int runOnce(PipelineConfig config) throws IOException, StoreException {
        List<SourceConfig> sources = config.loadSources();
        try (Storage storage = openStorage(config, namespaces(config, sources));
             PlaywrightRenderer renderer = new PlaywrightRenderer(config.userAgent(), config.renderSettleWait())) {
            RunStats stats = createOrchestrator(config, sources, storage.postgres(), renderer).run();
            logger.info("Run {} finished: {} ({} fetched, {} blocked, {} persisted, {} failed to persist)",
                stats.runId(), stats.outcome(), stats.pagesFetched(), stats.blocked(), stats.persisted(), stats.persistFailed());
            return exitCode(stats);
        }
    }

    /**
     * 0 for {@code OK} and {@code PARTIAL}, 1 for {@code NO_DATA} and {@code ALL_FAILED}.
     */
    static int exitCode(RunStats stats) {
        return switch (stats.outcome()) {
            case OK, PARTIAL -> 0;
            case NO_DATA, ALL_FAILED -> 1;
        };
    }

    private static void schedule(PipelineConfig config) throws IOException, StoreException, InterruptedException {
        List<SourceConfig> sources = config.loadSources();
        long interval = config.intervalMinutes();
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try (Storage storage = openStorage(config, namespaces(config, sources));
             PlaywrightRenderer renderer = new PlaywrightRenderer(config.userAgent(), config.renderSettleWait())) {
            IngestionOrchestrator orchestrator = createOrchestrator(config, sources, storage.postgres(), renderer);
            scheduler.scheduleWithFixedDelay(() -> {
                try {
                    RunStats stats = orchestrator.run();
                    logger.info("Scheduled run {} finished: {}", stats.runId(), stats.outcome());
                } catch (RuntimeException e) {
                    logger.error("Scheduled run failed: {}", e.getMessage(), e);
                }
            }, 0, interval, TimeUnit.MINUTES);
            logger.info("Scheduled a run every {} minutes. Stop the process to end.", interval);
            Runtime.getRuntime().addShutdownHook(new Thread(scheduler::shutdownNow));
            while (!scheduler.awaitTermination(1, TimeUnit.HOURS)) {
                logger.debug("Scheduler still running.");
            }
        } finally {
            scheduler.shutdownNow();
        }
    }

    private static void export(PipelineConfig config) throws IOException, StoreException {
        String namespace = config.namespace();
        try (Storage storage = openStorage(config, List.of(namespace))) {
            CanonicalStore store = storage.postgres() != null ? storage.postgres()
                : new PostgrestUpsertTarget(config.postgrestUrl(), config.postgrestApiKey());
            List<CanonicalRecord> records = store.readAll(namespace);
            Path file = new CanonicalCsvExporter(Paths.get(config.exportDir())).export(namespace, records);
            System.out.println("Exported " + records.size() + " records to " + file);
        }
    }

    private static void databaseOnly(PipelineConfig config) throws IOException, StoreException {
        int port = config.embeddedPort();
        String dataDir = config.embeddedDataDir();
        try (EmbeddedPostgres postgres = PostgresService.startEmbedded(dataDir, port)) {
            new PostgresService(PostgresService.jdbcUrl(postgres), "postgres", "postgres")
                .createTables(config.namespace(), config.conflictKey(config.namespace()));
            System.out.println("Embedded Postgres started.");
            System.out.println("JDBC URL: " + PostgresService.jdbcUrl(postgres));
            System.out.println("DB user: postgres");
            System.out.println("DB password: postgres");
            System.out.println("Data directory: " + dataDir);
            System.out.println("Press Enter to stop the embedded DB and exit.");
            System.in.read();
        }
    }

    /**
     * Main application entry point.
     * @param args Command-line arguments; the first selects the mode
     */
    public static void main(String[] args) {
        String mode = (args != null && args.length > 0) ? args[0].trim().toLowerCase(Locale.ROOT) : "run";
        PipelineConfig config = PipelineConfig.load();
        int exit = 0;
        try {
            switch (mode) {
                case "run" -> exit = runOnce(config);
                case "schedule" -> schedule(config);
                case "export" -> export(config);
                case "db", "database" -> databaseOnly(config);
                default -> {
                    System.err.println("Unknown mode '" + mode + "'. Use one of: run, schedule, export, db");
                    exit = 2;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted, shutting down.");
        } catch (IOException | StoreException | IllegalStateException e) {
            logger.error("{} failed: {}", mode, e.getMessage());
            exit = 1;
        }
        if (exit != 0) System.exit(exit);
    }
}
