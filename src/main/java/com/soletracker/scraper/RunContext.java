package com.soletracker.scraper;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * State owned by one orchestrated run: shared counters, the per-domain crawl policy cache and the run deadline.
 * <p>
 * Passed explicitly into {@link PolitenessGate}, {@link ResilientFetcher} and {@link UpsertSink}; a new run
 * gets a new context, so nothing leaks between runs. Counters are atomic and the policy cache is a
 * concurrent map, which keeps the context safe when sources run on a worker pool.
 *
 * @author Sole Tracker Ingest Team
 * @since 1.0
 */
public class RunContext {
    private final String runId;
    private final Clock clock;
    private final Instant startedAt;
    private final Instant deadline;

    final ConcurrentMap<String, CompletableFuture<CrawlPolicy>> policyCache = new ConcurrentHashMap<>();

    public final AtomicLong pagesFetched = new AtomicLong();
    public final AtomicLong blocked = new AtomicLong();
    public final AtomicLong fetchErrors = new AtomicLong();
    public final AtomicLong rateLimitWaits = new AtomicLong();
    public final AtomicLong recordsNormalized = new AtomicLong();
    public final AtomicLong parseFailed = new AtomicLong();
    public final AtomicLong droppedWithoutKey = new AtomicLong();
    public final AtomicLong clustersCreated = new AtomicLong();
    public final AtomicLong clustersUpdated = new AtomicLong();
    public final AtomicLong inserted = new AtomicLong();
    public final AtomicLong updated = new AtomicLong();
    public final AtomicLong skippedWithoutKey = new AtomicLong();
    public final AtomicLong persistFailed = new AtomicLong();
    public final AtomicBoolean fallbackUsed = new AtomicBoolean();

    public RunContext(Clock clock, Duration runTimeout) {
        this.runId = UUID.randomUUID().toString();
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.startedAt = this.clock.instant();
        this.deadline = runTimeout == null || runTimeout.isZero() || runTimeout.isNegative()
            ? null : startedAt.plus(runTimeout);
    }

    /**
     * Context without a deadline, on the system clock.
     */
    public RunContext() {
        this(Clock.systemUTC(), null);
    }

    public String runId() {
        return runId;
    }

    public Clock clock() {
        return clock;
    }

    public Instant startedAt() {
        return startedAt;
    }

    /**
     * Crawl policy already loaded for an origin, empty while it is still loading or was never requested.
     */
    public Optional<CrawlPolicy> cachedPolicy(String origin) {
        CompletableFuture<CrawlPolicy> policy = policyCache.get(origin);
        return policy == null || !policy.isDone() || policy.isCompletedExceptionally()
            ? Optional.empty() : Optional.of(policy.join());
    }

    public boolean isExpired() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    /**
     * Time left before the deadline, or {@code null} when the run is unbounded.
     */
    public Duration remaining() {
        if (deadline == null) return null;
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    /**
     * Snapshots the counters into an immutable statistics record.
     */
    public RunStats snapshot(Instant finishedAt) {
        return new RunStats(runId, startedAt, finishedAt,
            pagesFetched.get(), blocked.get(), fetchErrors.get(), rateLimitWaits.get(),
            recordsNormalized.get(), parseFailed.get(), droppedWithoutKey.get(),
            clustersCreated.get(), clustersUpdated.get(),
            inserted.get(), updated.get(), skippedWithoutKey.get(), persistFailed.get(),
            fallbackUsed.get());
    }
}
