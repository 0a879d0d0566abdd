package com.soletracker.scraper;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Immutable statistics of one run, emitted as a structured record when the run completes.
 * <p>
 * {@link #outcome()} separates "no data" (nothing was fetched, likely a source availability problem)
 * from "all failed" (data was fetched but nothing could be persisted).
 *
 * @author Sole Tracker Ingest Team
 * @since 1.0
 */
public record RunStats(
    String runId,
    Instant startedAt,
    Instant finishedAt,
    long pagesFetched,
    long blocked,
    long fetchErrors,
    long rateLimitWaits,
    long recordsNormalized,
    long parseFailed,
    long droppedWithoutKey,
    long clustersCreated,
    long clustersUpdated,
    long inserted,
    long updated,
    long skippedWithoutKey,
    long persistFailed,
    boolean fallbackUsed
) {
    public enum Outcome { OK, PARTIAL, NO_DATA, ALL_FAILED }

    public long persisted() {
        return inserted + updated;
    }

    @JsonProperty("outcome")
    public Outcome outcome() {
        if (pagesFetched == 0) return Outcome.NO_DATA;
        long failures = fetchErrors + parseFailed + persistFailed;
        if (persisted() == 0 && failures > 0) return Outcome.ALL_FAILED;
        if (failures > 0 || blocked > 0 || skippedWithoutKey > 0) return Outcome.PARTIAL;
        return Outcome.OK;
    }
}
