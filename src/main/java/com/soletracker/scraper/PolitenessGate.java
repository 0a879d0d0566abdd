package com.soletracker.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Decides whether a URL may be fetched and how long to wait between requests to its domain.
 * <p>
 * Workflow:
 * <ul>
 *   <li>On first use of an origin, loads its crawl policy through the {@link CrawlPolicySource} and caches it in
 *   the {@link RunContext} for the rest of the run. Concurrent first use loads the policy once; callers for the
 *   same origin wait for that load, other origins are not held up by it.</li>
 *   <li>If the policy cannot be retrieved the origin is treated as allowing everything and a WARN is logged
 *   for operator review. Whether to fail closed instead is an open compliance question.</li>
 *   <li>Paths matching the configured denylist are refused whatever the policy says.</li>
 * </ul>
 *
 * @author Sole Tracker Ingest Team
 * @since 1.0
 */
public class PolitenessGate {
    private static final Logger logger = LoggerFactory.getLogger(PolitenessGate.class);

    private final RunContext context;
    private final CrawlPolicySource policySource;
    private final List<String> denylist;

    /**
     * @param context run-scoped owner of the policy cache
     * @param policySource retrieves policies for origins not yet cached
     * @param denylist robots-style path patterns that are never fetched (e.g. {@code /raffle/*})
     */
    public PolitenessGate(RunContext context, CrawlPolicySource policySource, List<String> denylist) {
        this.context = context;
        this.policySource = policySource;
        this.denylist = denylist == null ? List.of() : List.copyOf(denylist);
    }

    public boolean allowed(String url) {
        return blockReason(url).isEmpty();
    }

    /**
     * @return crawl delay published for the URL's origin, if any
     */
    public Optional<Duration> crawlDelay(String url) {
        Optional<URI> uri = parse(url);
        if (uri.isEmpty()) return Optional.empty();
        return policyFor(origin(uri.get())).crawlDelay();
    }

    /**
     * Why a URL may not be fetched, or empty when it may.
     */
    public Optional<String> blockReason(String url) {
        Optional<URI> parsed = parse(url);
        if (parsed.isEmpty()) return Optional.of("invalid URL");
        URI uri = parsed.get();
        String path = pathAndQuery(uri);
        for (String pattern : denylist) {
            if (CrawlPolicy.matches(pattern, path)) {
                return Optional.of("path " + path + " matches denylist pattern " + pattern);
            }
        }
        if (!policyFor(origin(uri)).isAllowed(path)) {
            return Optional.of("path " + path + " disallowed by robots.txt of " + uri.getHost());
        }
        return Optional.empty();
    }

    private CrawlPolicy policyFor(String origin) {
        CompletableFuture<CrawlPolicy> pending = new CompletableFuture<>();
        CompletableFuture<CrawlPolicy> existing = context.policyCache.putIfAbsent(origin, pending);
        if (existing != null) return existing.join();
        try {
            pending.complete(loadPolicy(origin));
        } catch (RuntimeException e) {
            pending.completeExceptionally(e);
            throw e;
        }
        return pending.join();
    }

    private CrawlPolicy loadPolicy(String origin) {
        try {
            return policySource.load(origin);
        } catch (TransportException e) {
            logger.warn("Crawl policy for {} could not be retrieved ({}); allowing all paths for this run.",
                origin, e.getMessage());
            return CrawlPolicy.unverified();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while loading crawl policy for {}; allowing all paths for this run.", origin);
            return CrawlPolicy.unverified();
        }
    }

    private static Optional<URI> parse(String url) {
        if (url == null || url.isBlank()) return Optional.empty();
        try {
            URI uri = new URI(url.trim());
            if (uri.getScheme() == null || uri.getHost() == null) return Optional.empty();
            return Optional.of(uri);
        } catch (URISyntaxException e) {
            logger.warn("Rejecting malformed URL '{}': {}", url, e.getMessage());
            return Optional.empty();
        }
    }

    static String origin(URI uri) {
        String origin = uri.getScheme().toLowerCase(Locale.ROOT) + "://" + uri.getHost().toLowerCase(Locale.ROOT);
        return uri.getPort() >= 0 ? origin + ":" + uri.getPort() : origin;
    }

    private static String pathAndQuery(URI uri) {
        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) path = "/";
        return uri.getRawQuery() == null ? path : path + "?" + uri.getRawQuery();
    }
}
