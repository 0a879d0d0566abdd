package com.soletracker.scraper;

import java.time.Duration;

/**
 * Result of one {@link ResilientFetcher#fetch(FetchRequest)} call.
 * Politeness refusals ({@link Blocked}) are reported apart from network failures ({@link Failed}).
 */
public sealed interface FetchOutcome
    permits FetchOutcome.Success, FetchOutcome.Blocked, FetchOutcome.RateLimited, FetchOutcome.Failed {

    record Success(String payload, int statusCode, int attempts) implements FetchOutcome {}

    record Blocked(String reason) implements FetchOutcome {}

    /** Returned only when the rate-limit wait budget is spent; ordinary 429s are waited out and retried. */
    record RateLimited(Duration retryAfter) implements FetchOutcome {}

    record Failed(ErrorKind error, String detail, int attemptCount) implements FetchOutcome {}

    default boolean isSuccess() {
        return this instanceof Success;
    }
}
