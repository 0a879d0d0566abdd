package com.soletracker.sitesources;

import com.soletracker.scraper.SourceConfig;

import java.net.URI;
import java.time.Instant;
import java.util.Map;

/**
 * What a normalizer knows about the payload it is given.
 *
 * @param sourceId configured source id
 * @param pageUrl URL the payload was fetched from, used to resolve relative links
 * @param fetchedAt fetch time, stamped on every record and used as "now" by the heuristics
 * @param selectors CSS selectors of {@code generic-html} sources
 */
public record SourceContext(String sourceId, String pageUrl, Instant fetchedAt, Map<String, String> selectors) {

    public SourceContext {
        selectors = selectors == null ? Map.of() : Map.copyOf(selectors);
    }

    public static SourceContext of(SourceConfig source, String pageUrl, Instant fetchedAt) {
        return new SourceContext(source.id(), pageUrl, fetchedAt, source.selectors());
    }

    public String selector(String name) {
        String s = selectors.get(name);
        return s == null || s.isBlank() ? null : s;
    }

    /**
     * {@code scheme://host[:port]} of the page URL, or empty when it has none.
     */
    public String origin() {
        if (pageUrl == null) return "";
        try {
            URI uri = URI.create(pageUrl);
            if (uri.getScheme() == null || uri.getHost() == null) return "";
            return uri.getScheme() + "://" + uri.getHost() + (uri.getPort() >= 0 ? ":" + uri.getPort() : "");
        } catch (IllegalArgumentException e) {
            return "";
        }
    }
}
