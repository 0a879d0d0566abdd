package com.soletracker.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Fetches one page under the politeness, pacing and retry rules of a run.
 * <p>
 * Workflow per {@link #fetch(FetchRequest, Duration)}:
 * <ul>
 *   <li>Asks the {@link PolitenessGate}; a refused URL returns {@link FetchOutcome.Blocked} without touching the network.</li>
 *   <li>Sleeps {@code max(minDelay, crawlDelay)} before every request.</li>
 *   <li>HTTP 429 waits for {@code Retry-After} (or the policy default) and retries without spending an attempt.</li>
 *   <li>HTTP 404 fails at once with {@link ErrorKind#NOT_FOUND}.</li>
 *   <li>Transport errors and other error statuses back off and retry until {@link RetryPolicy#maxAttempts()}.</li>
 *   <li>When the run deadline would pass during a wait, returns {@link ErrorKind#TIMEOUT} without sleeping or sending.</li>
 * </ul>
 * Rendered requests go through the {@link RenderTransport}, which also performs the scroll cycles.
 *
 * @author Sole Tracker Ingest Team
 * @since 1.0
 */
public class ResilientFetcher {
    private static final Logger logger = LoggerFactory.getLogger(ResilientFetcher.class);

    public static final int DEFAULT_SCROLL_CYCLES = 3;

    private final RunContext context;
    private final PolitenessGate gate;
    private final PageTransport pageTransport;
    private final RenderTransport renderTransport;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final Duration minDelay;
    private final int scrollCycles;

    public ResilientFetcher(RunContext context, PolitenessGate gate, PageTransport pageTransport,
                            RenderTransport renderTransport, RetryPolicy retryPolicy, Sleeper sleeper,
                            Duration minDelay, int scrollCycles) {
        this.context = context;
        this.gate = gate;
        this.pageTransport = pageTransport;
        this.renderTransport = renderTransport;
        this.retryPolicy = retryPolicy == null ? RetryPolicy.defaults() : retryPolicy;
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
        this.minDelay = minDelay == null ? Duration.ZERO : minDelay;
        this.scrollCycles = Math.max(0, scrollCycles);
    }

    public FetchOutcome fetch(FetchRequest request) {
        return fetch(request, minDelay);
    }

    /**
     * @param request what to fetch
     * @param sourceMinDelay minimum spacing configured for the request's source
     * @return the typed outcome; never throws for network conditions
     */
    public FetchOutcome fetch(FetchRequest request, Duration sourceMinDelay) {
        String url = request.url();
        Optional<String> blockReason = gate.blockReason(url);
        if (blockReason.isPresent()) {
            context.blocked.incrementAndGet();
            logger.info("Blocked {}: {}", url, blockReason.get());
            return new FetchOutcome.Blocked(blockReason.get());
        }
        Duration pace = max(sourceMinDelay == null ? minDelay : sourceMinDelay, gate.crawlDelay(url).orElse(Duration.ZERO));

        int attempts = 0;
        int rateLimitWaits = 0;
        try {
            while (true) {
                if (!waitWithinDeadline(pace)) return timedOut(url, attempts);

                TransportResponse response;
                try {
                    response = send(request);
                } catch (TransportException e) {
                    attempts++;
                    logger.warn("Attempt {}/{} for {} failed: {}", attempts, retryPolicy.maxAttempts(), url, e.getMessage());
                    if (attempts >= retryPolicy.maxAttempts()) {
                        return failed(ErrorKind.TRANSPORT_ERROR, e.getMessage(), attempts, url);
                    }
                    if (!waitWithinDeadline(retryPolicy.backoffAfter(attempts))) return timedOut(url, attempts);
                    continue;
                }

                int status = response.statusCode();
                if (status == 429) {
                    Duration retryAfter = response.header("Retry-After")
                        .flatMap(v -> RetryPolicy.parseRetryAfter(v, context.clock()))
                        .orElse(retryPolicy.defaultRetryAfter());
                    if (rateLimitWaits >= retryPolicy.maxRateLimitWaits()) {
                        context.fetchErrors.incrementAndGet();
                        logger.warn("Giving up on {} after {} rate-limit waits.", url, rateLimitWaits);
                        return new FetchOutcome.RateLimited(retryAfter);
                    }
                    rateLimitWaits++;
                    context.rateLimitWaits.incrementAndGet();
                    logger.info("Rate limited on {}; waiting {}s before retrying.", url, retryAfter.toSeconds());
                    if (!waitWithinDeadline(retryAfter)) return timedOut(url, attempts);
                    continue;
                }

                attempts++;
                if (status < 400) {
                    context.pagesFetched.incrementAndGet();
                    return new FetchOutcome.Success(response.body(), status, attempts);
                }
                if (status == 404) {
                    return failed(ErrorKind.NOT_FOUND, "HTTP 404", attempts, url);
                }
                if (!retryPolicy.isRetryable(status) || attempts >= retryPolicy.maxAttempts()) {
                    return failed(ErrorKind.TRANSPORT_ERROR, "HTTP " + status, attempts, url);
                }
                logger.warn("Attempt {}/{} for {} returned HTTP {}", attempts, retryPolicy.maxAttempts(), url, status);
                if (!waitWithinDeadline(retryPolicy.backoffAfter(attempts))) return timedOut(url, attempts);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failed(ErrorKind.TIMEOUT, "interrupted", attempts, url);
        }
    }

    private TransportResponse send(FetchRequest request) throws TransportException, InterruptedException {
        Duration timeout = request.timeout();
        Duration remaining = context.remaining();
        if (remaining != null && remaining.compareTo(timeout) < 0) timeout = remaining;
        if (request.mode() == FetchMode.RENDERED) {
            if (renderTransport == null) throw new TransportException("No headless renderer configured for " + request.url());
            return renderTransport.render(request.url(), request.waitSelector(), timeout, scrollCycles);
        }
        return pageTransport.send(request.method(), request.url(), timeout);
    }

    /**
     * Sleeps unless the wait would run past the deadline.
     *
     * @return false when the deadline leaves no room for the wait (nothing was slept)
     */
    private boolean waitWithinDeadline(Duration wait) throws InterruptedException {
        if (context.isExpired()) return false;
        Duration remaining = context.remaining();
        if (remaining != null && wait.compareTo(remaining) >= 0 && !wait.isZero()) return false;
        sleeper.sleep(wait);
        return true;
    }

    private FetchOutcome timedOut(String url, int attempts) {
        return failed(ErrorKind.TIMEOUT, "run deadline reached", attempts, url);
    }

    private FetchOutcome failed(ErrorKind kind, String detail, int attempts, String url) {
        context.fetchErrors.incrementAndGet();
        logger.warn("Fetch of {} failed with {} after {} attempt(s): {}", url, kind, attempts, detail);
        return new FetchOutcome.Failed(kind, detail, attempts);
    }

    private static Duration max(Duration a, Duration b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
