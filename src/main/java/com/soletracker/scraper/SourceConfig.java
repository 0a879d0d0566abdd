package com.soletracker.scraper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * One configured source, as read from {@code sources.json}.
 *
 * @param id stable source identifier, recorded in provenance and contributing sources
 * @param type normalizer variant: {@code shopify-json}, {@code generic-html} or {@code feed-xml}
 * @param urls pages to fetch, in order
 * @param mode {@code static} or {@code rendered}
 * @param waitSelector selector a rendered page must show before extraction
 * @param trustWeight merge weight of this source's scalar values (default 1.0)
 * @param minDelayMillis minimum spacing between requests, overriding the global default
 * @param enabled disabled sources are skipped by the orchestrator
 * @param selectors CSS selectors for {@code generic-html} sources
 * @param namespace canonical namespace (table) the source feeds
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SourceConfig(String id,
                           String type,
                           List<String> urls,
                           String mode,
                           String waitSelector,
                           Double trustWeight,
                           Long minDelayMillis,
                           Boolean enabled,
                           Map<String, String> selectors,
                           String namespace) {

    public static final double DEFAULT_TRUST_WEIGHT = 1.0;

    public SourceConfig {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("Source id cannot be blank");
        if (type == null || type.isBlank()) throw new IllegalArgumentException("Source '" + id + "' has no type");
        urls = urls == null ? List.of() : List.copyOf(urls);
        selectors = selectors == null ? Map.of() : Map.copyOf(selectors);
    }

    public FetchMode fetchMode() {
        return mode != null && mode.trim().toLowerCase(Locale.ROOT).equals("rendered") ? FetchMode.RENDERED : FetchMode.STATIC;
    }

    public double trust() {
        return trustWeight == null ? DEFAULT_TRUST_WEIGHT : trustWeight;
    }

    public boolean isEnabled() {
        return enabled == null || enabled;
    }

    /**
     * @return configured spacing, or {@code fallback} when the source sets none
     */
    public Duration minDelay(Duration fallback) {
        return minDelayMillis == null ? fallback : Duration.ofMillis(minDelayMillis);
    }

    public String namespaceOr(String fallback) {
        return namespace == null || namespace.isBlank() ? fallback : namespace;
    }

    public String selector(String name) {
        return selectors.get(name);
    }
}
