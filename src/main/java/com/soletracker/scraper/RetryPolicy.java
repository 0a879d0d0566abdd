package com.soletracker.scraper;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.function.IntFunction;
import java.util.function.IntPredicate;

/**
 * Retry behaviour of {@link ResilientFetcher}.
 *
 * @param maxAttempts attempts per fetch, counting only transport errors and retryable statuses
 * @param backoff wait after the n-th failed attempt (1-based)
 * @param retryableStatus which HTTP error statuses are retried; 404 and 429 are handled separately
 * @param defaultRetryAfter wait after a 429 without a usable {@code Retry-After} header
 * @param maxRateLimitWaits 429 waits allowed per fetch before giving up with {@link FetchOutcome.RateLimited}
 */
public record RetryPolicy(int maxAttempts,
                          IntFunction<Duration> backoff,
                          IntPredicate retryableStatus,
                          Duration defaultRetryAfter,
                          int maxRateLimitWaits) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_RETRY_AFTER = Duration.ofSeconds(90);
    public static final int DEFAULT_MAX_RATE_LIMIT_WAITS = 5;

    public RetryPolicy {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be at least 1");
        if (maxRateLimitWaits < 0) throw new IllegalArgumentException("maxRateLimitWaits cannot be negative");
        backoff = backoff == null ? RetryPolicy::exponentialBackoff : backoff;
        retryableStatus = retryableStatus == null ? status -> status >= 400 : retryableStatus;
        defaultRetryAfter = defaultRetryAfter == null ? DEFAULT_RETRY_AFTER : defaultRetryAfter;
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, null, null, DEFAULT_RETRY_AFTER, DEFAULT_MAX_RATE_LIMIT_WAITS);
    }

    public RetryPolicy withMaxAttempts(int attempts) {
        return new RetryPolicy(attempts, backoff, retryableStatus, defaultRetryAfter, maxRateLimitWaits);
    }

    public RetryPolicy withBackoff(IntFunction<Duration> fn) {
        return new RetryPolicy(maxAttempts, fn, retryableStatus, defaultRetryAfter, maxRateLimitWaits);
    }

    public RetryPolicy withDefaultRetryAfter(Duration wait) {
        return new RetryPolicy(maxAttempts, backoff, retryableStatus, wait, maxRateLimitWaits);
    }

    public RetryPolicy withMaxRateLimitWaits(int waits) {
        return new RetryPolicy(maxAttempts, backoff, retryableStatus, defaultRetryAfter, waits);
    }

    /** {@code 2^attempt} seconds. */
    public static Duration exponentialBackoff(int attempt) {
        return Duration.ofSeconds(1L << Math.min(Math.max(attempt, 0), 20));
    }

    public Duration backoffAfter(int attempt) {
        return backoff.apply(attempt);
    }

    public boolean isRetryable(int status) {
        return retryableStatus.test(status);
    }

    /**
     * Wait requested by a {@code Retry-After} header, given as delta-seconds or an HTTP date.
     * Dates in the past give zero; unparsable values give empty.
     */
    public static Optional<Duration> parseRetryAfter(String value, Clock clock) {
        if (value == null || value.isBlank()) return Optional.empty();
        String v = value.trim();
        try {
            long seconds = Long.parseLong(v);
            return seconds < 0 ? Optional.empty() : Optional.of(Duration.ofSeconds(seconds));
        } catch (NumberFormatException notSeconds) {
            try {
                Instant at = ZonedDateTime.parse(v, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
                Duration wait = Duration.between(clock.instant(), at);
                return Optional.of(wait.isNegative() ? Duration.ZERO : wait);
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        }
    }
}
