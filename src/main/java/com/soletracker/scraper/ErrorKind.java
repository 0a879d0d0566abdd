package com.soletracker.scraper;

/**
 * Failure taxonomy shared by the fetch, normalize and persistence stages.
 * <p>
 * Propagation rules:
 * <ul>
 *   <li>{@link #PARSE_ERROR} and per-record {@link #PERSISTENCE_ERROR} are skipped and counted, never abort a batch.</li>
 *   <li>{@link #TRANSPORT_ERROR} and {@link #RATE_LIMITED} are retried inside the fetch attempt budget.</li>
 *   <li>{@link #AUTH_ERROR} switches the sink to its fallback write path for the rest of the batch.</li>
 *   <li>{@link #NOT_FOUND} is terminal and never retried.</li>
 * </ul>
 *
 * @author Sole Tracker Ingest Team
 * @since 1.0
 */
public enum ErrorKind {
    POLITENESS_BLOCKED,
    RATE_LIMITED,
    TRANSPORT_ERROR,
    TIMEOUT,
    NOT_FOUND,
    PARSE_ERROR,
    AUTH_ERROR,
    PERSISTENCE_ERROR
}
