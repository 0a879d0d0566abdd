package com.soletracker.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * {@link CrawlPolicySource} that reads {@code /robots.txt} over the static transport.
 * <p>
 * 404 and 410 mean the origin publishes no rules. Any other non-2xx status is a retrieval failure.
 */
public class HttpCrawlPolicySource implements CrawlPolicySource {
    private static final Logger logger = LoggerFactory.getLogger(HttpCrawlPolicySource.class);

    private static final Duration POLICY_TIMEOUT = Duration.ofSeconds(15);

    private final PageTransport transport;
    private final String userAgent;

    public HttpCrawlPolicySource(PageTransport transport, String userAgent) {
        this.transport = transport;
        this.userAgent = userAgent;
    }

    @Override
    public CrawlPolicy load(String origin) throws TransportException, InterruptedException {
        String robotsUrl = origin + "/robots.txt";
        TransportResponse response = transport.send("GET", robotsUrl, POLICY_TIMEOUT);
        int status = response.statusCode();
        if (status == 404 || status == 410) {
            logger.info("No robots.txt at {} (HTTP {}), no crawl rules apply.", origin, status);
            return CrawlPolicy.allowAll();
        }
        if (!response.isSuccessful()) {
            throw new TransportException("robots.txt request to " + robotsUrl + " returned HTTP " + status);
        }
        CrawlPolicy policy = CrawlPolicyParser.parse(response.body(), userAgent);
        logger.debug("Loaded {} crawl rules for {} (crawl-delay {})", policy.rules().size(), origin,
            policy.crawlDelay().map(Duration::toString).orElse("none"));
        return policy;
    }
}
