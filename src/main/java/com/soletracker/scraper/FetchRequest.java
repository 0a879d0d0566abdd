package com.soletracker.scraper;

import java.time.Duration;

/**
 * One logical fetch.
 *
 * @param url absolute URL to retrieve
 * @param method HTTP method, {@code GET} for almost every source
 * @param mode static request or headless render
 * @param timeout per-request timeout
 * @param waitSelector CSS selector a rendered page must show before extraction (may be null)
 */
public record FetchRequest(String url, String method, FetchMode mode, Duration timeout, String waitSelector) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    public FetchRequest {
        if (url == null || url.isBlank()) throw new IllegalArgumentException("Fetch URL cannot be blank");
        method = method == null || method.isBlank() ? "GET" : method.toUpperCase(java.util.Locale.ROOT);
        mode = mode == null ? FetchMode.STATIC : mode;
        timeout = timeout == null || timeout.isZero() || timeout.isNegative() ? DEFAULT_TIMEOUT : timeout;
    }

    public static FetchRequest get(String url) {
        return new FetchRequest(url, "GET", FetchMode.STATIC, DEFAULT_TIMEOUT, null);
    }

    public static FetchRequest rendered(String url, String waitSelector) {
        return new FetchRequest(url, "GET", FetchMode.RENDERED, DEFAULT_TIMEOUT, waitSelector);
    }
}
