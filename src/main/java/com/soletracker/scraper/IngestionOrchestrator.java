package com.soletracker.scraper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.soletracker.sitesources.NormalizationException;
import com.soletracker.sitesources.NormalizationResult;
import com.soletracker.sitesources.NormalizerRegistry;
import com.soletracker.sitesources.SourceContext;
import com.soletracker.sitesources.SourceNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs every enabled source through fetch, normalize, reconcile and upsert, and reports the run.
 * <p>
 * Workflow per run:
 * <ul>
 *   <li>Creates a fresh {@link RunContext} (counters, crawl policy cache, deadline) and the run-scoped
 *   {@link PolitenessGate}, {@link ResilientFetcher} and {@link UpsertSink}.</li>
 *   <li>Each source fetches its pages in order, one request at a time, and normalizes each payload.</li>
 *   <li>The source's records are reconciled against the canonical set of its namespace, loaded from the
 *   {@link CanonicalStore} on first use, and the touched records are upserted under the namespace's conflict key.
 *   If the namespace cannot be read, its records are not reconciled in this run and count as failed to persist.</li>
 *   <li>With {@code pipeline.workers > 1} sources fetch and normalize on a fixed pool; reconcile and upsert stay
 *   serialized behind one lock.</li>
 *   <li>The run ends with one JSON {@code RUN_STATS} log line and, when configured, a {@code scrape_runs} row.</li>
 * </ul>
 *
 * @author Sole Tracker Ingest Team
 * @since 1.0
 */
public class IngestionOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(IngestionOrchestrator.class);

    /**
     * Destination of finished run statistics.
     */
    @FunctionalInterface
    public interface RunStatsRecorder {
        void record(RunStats stats) throws StoreException;
    }

    private final PipelineConfig config;
    private final List<SourceConfig> sources;
    private final NormalizerRegistry normalizers;
    private final PageTransport pageTransport;
    private final RenderTransport renderTransport;
    private final CrawlPolicySource policySource;
    private final CanonicalStore store;
    private final UpsertTarget primaryTarget;
    private final UpsertTarget fallbackTarget;
    private final RunStatsRecorder statsRecorder;
    private final Sleeper sleeper;
    private final Clock clock;

    private final ReentrantLock reconcileLock = new ReentrantLock();

    private IngestionOrchestrator(Builder b) {
        this.config = b.config;
        this.sources = List.copyOf(b.sources);
        this.normalizers = b.normalizers == null ? NormalizerRegistry.defaults() : b.normalizers;
        this.pageTransport = b.pageTransport;
        this.renderTransport = b.renderTransport;
        this.policySource = b.policySource == null
            ? new HttpCrawlPolicySource(b.pageTransport, b.config.userAgent()) : b.policySource;
        this.store = b.store;
        this.primaryTarget = b.primaryTarget;
        this.fallbackTarget = b.fallbackTarget;
        this.statsRecorder = b.statsRecorder;
        this.sleeper = b.sleeper == null ? Sleeper.SYSTEM : b.sleeper;
        this.clock = b.clock == null ? Clock.systemUTC() : b.clock;
    }

    public static Builder builder(PipelineConfig config, List<SourceConfig> sources) {
        return new Builder(config, sources);
    }

    /** Run-scoped collaborators. */
    private record Run(RunContext context, ResilientFetcher fetcher, UpsertSink sink, Reconciler reconciler,
                       Map<String, Map<String, CanonicalRecord>> canonical) {}

    /**
     * Executes one run over all enabled sources.
     * @return the run's statistics; never throws for source, fetch, parse or storage failures
     */
    public RunStats run() {
        RunContext context = new RunContext(clock, config.runTimeout());
        PolitenessGate gate = new PolitenessGate(context, policySource, config.denylist());
        ResilientFetcher fetcher = new ResilientFetcher(context, gate, pageTransport, renderTransport,
            config.retryPolicy(), sleeper, config.minDelay(), config.scrollCycles());
        UpsertSink sink = new UpsertSink(primaryTarget, fallbackTarget, config.conflictKey(),
            config.maxWriteAttempts(), sleeper, context);
        Map<String, Double> trust = new HashMap<>();
        sources.forEach(s -> trust.put(s.id(), s.trust()));
        Run run = new Run(context, fetcher, sink, new Reconciler(trust, clock), new HashMap<>());

        List<SourceConfig> active = new ArrayList<>();
        for (SourceConfig source : sources) {
            if (!source.isEnabled()) {
                logger.info("Source '{}' is disabled, skipping.", source.id());
            } else if (normalizers.find(source.type()).isEmpty()) {
                logger.error("Source '{}' has unknown type '{}', skipping. Known types: {}", source.id(), source.type(), normalizers.types());
            } else {
                active.add(source);
            }
        }
        logger.info("Run {} started with {} sources ({} workers).", context.runId(), active.size(), config.workers());

        if (config.workers() > 1 && active.size() > 1) {
            runPooled(run, active);
        } else {
            for (SourceConfig source : active) {
                if (context.isExpired()) {
                    logger.warn("Run deadline reached; {} not started.", source.id());
                    continue;
                }
                try {
                    runSource(run, source);
                } catch (RuntimeException e) {
                    logger.error("Source pipeline '{}' failed unexpectedly: {}", source.id(), e.toString(), e);
                }
            }
        }

        RunStats stats = context.snapshot(clock.instant());
        report(stats);
        return stats;
    }

    private void runPooled(Run run, List<SourceConfig> active) {
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(config.workers(), active.size()));
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (SourceConfig source : active) {
                Callable<Void> task = () -> {
                    runSource(run, source);
                    return null;
                };
                futures.add(pool.submit(task));
            }
            for (Future<?> f : futures) {
                try {
                    f.get();
                } catch (ExecutionException e) {
                    logger.error("Source pipeline failed unexpectedly: {}", e.getCause() == null ? e.getMessage() : e.getCause().toString());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for source pipelines.");
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Fetch and normalize one source, then reconcile and upsert its records.
     */
    private void runSource(Run run, SourceConfig source) {
        List<RawRecord> records = collect(run, source);
        if (records.isEmpty()) {
            logger.info("Source '{}' produced no records.", source.id());
            return;
        }
        String namespace = source.namespaceOr(config.namespace());
        reconcileLock.lock();
        try {
            Optional<Map<String, CanonicalRecord>> canonical = canonicalSet(run, namespace);
            if (canonical.isEmpty()) {
                run.context().persistFailed.addAndGet(records.size());
                logger.error("Not reconciling {} records from '{}': namespace {} could not be read.",
                    records.size(), source.id(), namespace);
                return;
            }
            ReconcileResult result = run.reconciler().reconcile(canonical.get(), records);
            run.context().droppedWithoutKey.addAndGet(result.droppedWithoutKey());
            run.context().clustersCreated.addAndGet(result.clustersCreated());
            run.context().clustersUpdated.addAndGet(result.clustersUpdated());
            SinkReport report = run.sink().upsertAll(namespace, config.conflictKey(namespace), result.touched());
            logger.info("Source '{}': {} records, {} clusters, {} persisted, {} failed to persist.",
                source.id(), records.size(), result.touched().size(), report.persisted(), report.failed());
        } finally {
            reconcileLock.unlock();
        }
    }

    private List<RawRecord> collect(Run run, SourceConfig source) {
        SourceNormalizer normalizer = normalizers.forType(source.type());
        RunContext context = run.context();
        List<RawRecord> records = new ArrayList<>();
        for (String url : source.urls()) {
            if (context.isExpired()) {
                logger.warn("Run deadline reached; stopping '{}' before {}", source.id(), url);
                break;
            }
            FetchRequest request = new FetchRequest(url, "GET", source.fetchMode(), config.requestTimeout(), source.waitSelector());
            FetchOutcome outcome = run.fetcher().fetch(request, source.minDelay(config.minDelay()));
            if (!(outcome instanceof FetchOutcome.Success success)) continue;
            try {
                NormalizationResult result = normalizer.normalize(success.payload(),
                    SourceContext.of(source, url, clock.instant()));
                records.addAll(result.records());
                context.recordsNormalized.addAndGet(result.records().size());
                context.parseFailed.addAndGet(result.failedCount());
            } catch (NormalizationException e) {
                context.parseFailed.incrementAndGet();
                logger.warn("Could not normalize {} from '{}': {}", url, source.id(), e.getMessage());
            }
        }
        return records;
    }

    private Optional<Map<String, CanonicalRecord>> canonicalSet(Run run, String namespace) {
        Map<String, CanonicalRecord> cached = run.canonical().get(namespace);
        if (cached != null) return Optional.of(cached);
        Map<String, CanonicalRecord> loaded = new LinkedHashMap<>();
        if (store != null) {
            try {
                for (CanonicalRecord record : store.readAll(namespace)) loaded.put(record.id(), record);
            } catch (StoreException e) {
                logger.error("Failed to read canonical namespace {}: {}", namespace, e.getMessage());
                return Optional.empty();
            }
        }
        run.canonical().put(namespace, loaded);
        return Optional.of(loaded);
    }

    private void report(RunStats stats) {
        try {
            logger.info("RUN_STATS {}", CanonicalRecordCodec.mapper().writeValueAsString(stats));
        } catch (JsonProcessingException e) {
            logger.warn("Failed to serialize run statistics: {}", e.getMessage());
            logger.info("RUN_STATS {}", stats);
        }
        if (statsRecorder != null) {
            try {
                statsRecorder.record(stats);
            } catch (StoreException e) {
                logger.error("Failed to record run statistics: {}", e.getMessage());
            }
        }
    }

    public static final class Builder {
        private final PipelineConfig config;
        private final List<SourceConfig> sources;
        private NormalizerRegistry normalizers;
        private PageTransport pageTransport;
        private RenderTransport renderTransport;
        private CrawlPolicySource policySource;
        private CanonicalStore store;
        private UpsertTarget primaryTarget;
        private UpsertTarget fallbackTarget;
        private RunStatsRecorder statsRecorder;
        private Sleeper sleeper;
        private Clock clock;

        private Builder(PipelineConfig config, List<SourceConfig> sources) {
            this.config = config;
            this.sources = sources == null ? List.of() : sources;
        }

        public Builder normalizers(NormalizerRegistry normalizers) { this.normalizers = normalizers; return this; }
        public Builder pageTransport(PageTransport transport) { this.pageTransport = transport; return this; }
        public Builder renderTransport(RenderTransport transport) { this.renderTransport = transport; return this; }
        public Builder policySource(CrawlPolicySource source) { this.policySource = source; return this; }
        public Builder store(CanonicalStore store) { this.store = store; return this; }
        public Builder primaryTarget(UpsertTarget target) { this.primaryTarget = target; return this; }
        public Builder fallbackTarget(UpsertTarget target) { this.fallbackTarget = target; return this; }
        public Builder statsRecorder(RunStatsRecorder recorder) { this.statsRecorder = recorder; return this; }
        public Builder sleeper(Sleeper sleeper) { this.sleeper = sleeper; return this; }
        public Builder clock(Clock clock) { this.clock = clock; return this; }

        public IngestionOrchestrator build() {
            if (config == null) throw new IllegalStateException("Pipeline config is required");
            if (pageTransport == null) throw new IllegalStateException("A page transport is required");
            if (primaryTarget == null) throw new IllegalStateException("A primary upsert target is required");
            return new IngestionOrchestrator(this);
        }
    }
}
