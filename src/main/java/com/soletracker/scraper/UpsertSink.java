package com.soletracker.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Writes canonical records by natural key.
 * <p>
 * Workflow per batch:
 * <ul>
 *   <li>Records without a value for the natural key are skipped and counted, never written.</li>
 *   <li>Each record goes to the primary target. The first {@link ErrorKind#AUTH_ERROR} switches the rest of the
 *   batch to the fallback target; the primary is not tried again until the next batch.</li>
 *   <li>Other failures are retried up to {@code maxWriteAttempts}; {@link ErrorKind#NOT_FOUND} is not retried.</li>
 *   <li>A record that still fails is counted and the batch carries on.</li>
 * </ul>
 *
 * @author Sole Tracker Ingest Team
 * @since 1.0
 */
public class UpsertSink {
    private static final Logger logger = LoggerFactory.getLogger(UpsertSink.class);

    public static final int DEFAULT_MAX_WRITE_ATTEMPTS = 3;

    private final UpsertTarget primary;
    private final UpsertTarget fallback;
    private final String conflictKey;
    private final int maxWriteAttempts;
    private final Sleeper sleeper;
    private final RunContext context;

    /**
     * @param primary native upsert path
     * @param fallback direct write path used after an authorization failure, may be null
     * @param conflictKey natural key column ({@code id} or {@code url})
     * @param maxWriteAttempts attempts per record for retryable failures
     * @param sleeper waits between retries
     * @param context run counters
     */
    public UpsertSink(UpsertTarget primary, UpsertTarget fallback, String conflictKey, int maxWriteAttempts,
                      Sleeper sleeper, RunContext context) {
        if (primary == null) throw new IllegalArgumentException("Primary upsert target is required");
        this.primary = primary;
        this.fallback = fallback;
        this.conflictKey = conflictKey == null || conflictKey.isBlank() ? "id" : conflictKey;
        this.maxWriteAttempts = Math.max(1, maxWriteAttempts);
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
        this.context = context == null ? new RunContext() : context;
    }

    private static final class Batch {
        boolean useFallback;
    }

    /**
     * Writes one record as a batch of its own.
     */
    public UpsertOutcome upsert(String table, CanonicalRecord record) {
        return write(table, conflictKey, record, new Batch());
    }

    public SinkReport upsertAll(String table, Collection<CanonicalRecord> records) {
        return upsertAll(table, conflictKey, records);
    }

    /**
     * Writes a batch keyed on {@code naturalKey} instead of the sink's default conflict key.
     */
    public SinkReport upsertAll(String table, String naturalKey, Collection<CanonicalRecord> records) {
        String key = naturalKey == null || naturalKey.isBlank() ? conflictKey : naturalKey;
        Batch batch = new Batch();
        int inserted = 0, updated = 0, skipped = 0, failed = 0;
        List<UpsertOutcome> problems = new ArrayList<>();
        for (CanonicalRecord record : records) {
            UpsertOutcome outcome = write(table, key, record, batch);
            switch (outcome.status()) {
                case INSERTED -> inserted++;
                case UPDATED -> updated++;
                case SKIPPED -> { skipped++; problems.add(outcome); }
                case FAILED -> { failed++; problems.add(outcome); }
            }
        }
        logger.info("Upserted batch into {}: {} inserted, {} updated, {} skipped, {} failed{}",
            table, inserted, updated, skipped, failed, batch.useFallback ? " (fallback path)" : "");
        return new SinkReport(inserted, updated, skipped, failed, batch.useFallback, problems);
    }

    private UpsertOutcome write(String table, String conflictKey, CanonicalRecord record, Batch batch) {
        Map<String, Object> row = CanonicalRowMapper.toRow(record);
        Object key = row.get(conflictKey);
        if (key == null || key.toString().isBlank()) {
            context.skippedWithoutKey.incrementAndGet();
            logger.warn("Skipping {}: no value for natural key '{}'", record.id(), conflictKey);
            return UpsertOutcome.skipped(record.id(), "missing natural key " + conflictKey);
        }

        int attempts = 0;
        String lastError = null;
        while (attempts < maxWriteAttempts) {
            UpsertTarget target = batch.useFallback ? fallback : primary;
            try {
                attempts++;
                UpsertOutcome.Status status = target.write(table, conflictKey, row);
                if (status == UpsertOutcome.Status.INSERTED) context.inserted.incrementAndGet();
                else context.updated.incrementAndGet();
                return UpsertOutcome.written(record.id(), status, target.name(), attempts);
            } catch (StoreException e) {
                lastError = e.kind() + ": " + e.getMessage();
                if (e.kind() == ErrorKind.AUTH_ERROR && !batch.useFallback && fallback != null) {
                    batch.useFallback = true;
                    context.fallbackUsed.set(true);
                    attempts--;
                    logger.warn("{} rejected credentials ({}); switching to {} for the rest of this batch.",
                        primary.name(), e.getMessage(), fallback.name());
                    continue;
                }
                if (e.kind() == ErrorKind.NOT_FOUND || e.kind() == ErrorKind.AUTH_ERROR) break;
                logger.warn("Write of {} via {} failed (attempt {}/{}): {}", record.id(), target.name(),
                    attempts, maxWriteAttempts, e.getMessage());
                if (attempts < maxWriteAttempts && !pause(attempts)) break;
            }
        }
        context.persistFailed.incrementAndGet();
        String targetName = (batch.useFallback ? fallback : primary).name();
        logger.error("Giving up on {} after {} attempt(s): {}", record.id(), attempts, lastError);
        return UpsertOutcome.failed(record.id(), lastError, targetName, attempts);
    }

    private boolean pause(int attempt) {
        try {
            sleeper.sleep(Duration.ofMillis(250L << Math.min(attempt, 6)));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
