package com.soletracker.scraper;

/**
 * Retrieves the crawl policy of one origin ({@code scheme://host[:port]}).
 * <p>
 * Implementations return {@link CrawlPolicy#allowAll()} when the origin publishes no policy and throw
 * when the policy could not be retrieved; {@link PolitenessGate} decides what a failure means.
 */
@FunctionalInterface
public interface CrawlPolicySource {

    CrawlPolicy load(String origin) throws TransportException, InterruptedException;
}
