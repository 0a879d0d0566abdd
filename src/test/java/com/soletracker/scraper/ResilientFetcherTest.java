package com.soletracker.scraper;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ResilientFetcherTest {

    private static final String URL = "https://shop.example.com/products.json";

    private final RunContext context = new RunContext();
    private final RecordingSleeper sleeper = new RecordingSleeper();
    private final ScriptedTransport transport = new ScriptedTransport();

    private ResilientFetcher fetcher(CrawlPolicySource policies, RetryPolicy retry, Duration minDelay) {
        PolitenessGate gate = new PolitenessGate(context, policies, List.of("/raffle/*"));
        return new ResilientFetcher(context, gate, transport, null, retry, sleeper, minDelay, 0);
    }

    private ResilientFetcher fetcher() {
        return fetcher(origin -> CrawlPolicy.allowAll(), RetryPolicy.defaults(), Duration.ZERO);
    }

    @Test
    public void testSuccessOnFirstAttempt() {
        transport.respond(200, "{\"products\":[]}");

        FetchOutcome outcome = fetcher().fetch(FetchRequest.get(URL));

        FetchOutcome.Success success = assertInstanceOf(FetchOutcome.Success.class, outcome);
        assertEquals("{\"products\":[]}", success.payload());
        assertEquals(1, success.attempts());
        assertEquals(1, context.pagesFetched.get());
        assertTrue(sleeper.nonZeroWaits().isEmpty());
    }

    @Test
    public void testTransportErrorsExhaustAttempts() {
        transport.fail("connection reset").fail("connection reset").fail("connection reset").respond(200, "late");

        FetchOutcome outcome = fetcher().fetch(FetchRequest.get(URL));

        FetchOutcome.Failed failed = assertInstanceOf(FetchOutcome.Failed.class, outcome);
        assertEquals(ErrorKind.TRANSPORT_ERROR, failed.error());
        assertEquals(3, failed.attemptCount());
        assertEquals(3, transport.calls.size(), "no fourth attempt after the last failure");
        assertEquals(List.of(Duration.ofSeconds(2), Duration.ofSeconds(4)), sleeper.nonZeroWaits());
        assertEquals(1, context.fetchErrors.get());
        assertEquals(0, context.pagesFetched.get());
    }

    @Test
    public void testServerErrorRecoversOnRetry() {
        transport.respond(503, "busy").respond(200, "ok");

        FetchOutcome outcome = fetcher().fetch(FetchRequest.get(URL));

        FetchOutcome.Success success = assertInstanceOf(FetchOutcome.Success.class, outcome);
        assertEquals(2, success.attempts());
        assertEquals(0, context.fetchErrors.get());
    }

    @Test
    public void testNotFoundIsNotRetried() {
        transport.respond(404, "gone");

        FetchOutcome outcome = fetcher().fetch(FetchRequest.get(URL));

        FetchOutcome.Failed failed = assertInstanceOf(FetchOutcome.Failed.class, outcome);
        assertEquals(ErrorKind.NOT_FOUND, failed.error());
        assertEquals(1, failed.attemptCount());
        assertEquals(1, transport.calls.size());
    }

    @Test
    public void testRateLimitHonorsRetryAfterWithoutCountingAttempt() {
        transport.respond(429, "", "Retry-After", "7").respond(200, "ok");

        FetchOutcome outcome = fetcher().fetch(FetchRequest.get(URL));

        FetchOutcome.Success success = assertInstanceOf(FetchOutcome.Success.class, outcome);
        assertEquals(1, success.attempts(), "a 429 is not an attempt");
        assertEquals(List.of(Duration.ofSeconds(7)), sleeper.nonZeroWaits());
        assertEquals(1, context.rateLimitWaits.get());
        assertEquals(2, transport.calls.size());
    }

    @Test
    public void testRateLimitWithoutHeaderUsesDefaultWait() {
        transport.respond(429, "").respond(200, "ok");

        fetcher().fetch(FetchRequest.get(URL));

        assertEquals(List.of(RetryPolicy.DEFAULT_RETRY_AFTER), sleeper.nonZeroWaits());
    }

    @Test
    public void testRateLimitGivesUpAfterWaitBudget() {
        transport.respond(429, "", "Retry-After", "1");
        RetryPolicy retry = RetryPolicy.defaults().withMaxRateLimitWaits(2);

        FetchOutcome outcome = fetcher(origin -> CrawlPolicy.allowAll(), retry, Duration.ZERO).fetch(FetchRequest.get(URL));

        FetchOutcome.RateLimited limited = assertInstanceOf(FetchOutcome.RateLimited.class, outcome);
        assertEquals(Duration.ofSeconds(1), limited.retryAfter());
        assertEquals(3, transport.calls.size());
        assertEquals(2, context.rateLimitWaits.get());
        assertEquals(1, context.fetchErrors.get());
    }

    @Test
    public void testDisallowedUrlMakesNoNetworkCall() {
        CrawlPolicySource policies = origin -> CrawlPolicyParser.parse("User-agent: *\nDisallow: /account", "bot");

        FetchOutcome robots = fetcher(policies, RetryPolicy.defaults(), Duration.ZERO)
            .fetch(FetchRequest.get("https://shop.example.com/account/orders"));
        FetchOutcome denied = fetcher(policies, RetryPolicy.defaults(), Duration.ZERO)
            .fetch(FetchRequest.get("https://shop.example.com/raffle/entry"));

        assertInstanceOf(FetchOutcome.Blocked.class, robots);
        assertInstanceOf(FetchOutcome.Blocked.class, denied);
        assertTrue(transport.calls.isEmpty());
        assertEquals(2, context.blocked.get());
        assertEquals(0, context.fetchErrors.get());
    }

    @Test
    public void testPacingUsesLargerOfCrawlDelayAndMinimumDelay() {
        CrawlPolicySource policies = origin -> CrawlPolicyParser.parse("User-agent: *\nCrawl-delay: 5", "bot");
        transport.respond(200, "a").respond(200, "b").respond(200, "c");
        ResilientFetcher fetcher = fetcher(policies, RetryPolicy.defaults(), Duration.ofSeconds(1));

        fetcher.fetch(FetchRequest.get(URL));
        fetcher.fetch(FetchRequest.get(URL), Duration.ofSeconds(12));

        assertEquals(List.of(Duration.ofSeconds(5), Duration.ofSeconds(12)), sleeper.waits);
    }

    @Test
    public void testPacingAppliesBeforeEveryAttempt() {
        transport.fail("reset").respond(200, "ok");
        ResilientFetcher fetcher = fetcher(origin -> CrawlPolicy.allowAll(), RetryPolicy.defaults(), Duration.ofSeconds(3));

        fetcher.fetch(FetchRequest.get(URL));

        assertEquals(List.of(Duration.ofSeconds(3), Duration.ofSeconds(2), Duration.ofSeconds(3)), sleeper.waits);
    }

    @Test
    public void testRunDeadlineStopsRetrying() {
        MutableClock clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
        RunContext bounded = new RunContext(clock, Duration.ofSeconds(10));
        RecordingSleeper clockSleeper = new RecordingSleeper(clock);
        transport.fail("timeout");
        PolitenessGate gate = new PolitenessGate(bounded, origin -> CrawlPolicy.allowAll(), List.of());
        ResilientFetcher fetcher = new ResilientFetcher(bounded, gate, transport, null,
            RetryPolicy.defaults().withMaxAttempts(10), clockSleeper, Duration.ZERO, 0);

        FetchOutcome outcome = fetcher.fetch(FetchRequest.get(URL));

        FetchOutcome.Failed failed = assertInstanceOf(FetchOutcome.Failed.class, outcome);
        assertEquals(ErrorKind.TIMEOUT, failed.error());
        assertEquals(3, failed.attemptCount());
        assertEquals(List.of(Duration.ofSeconds(2), Duration.ofSeconds(4)), clockSleeper.nonZeroWaits(),
            "the 8s backoff would overrun the deadline and is not slept");
    }

    @Test
    public void testRenderedRequestUsesRenderer() {
        RenderTransport renderer = (url, waitSelector, timeout, scrollCycles) ->
            TransportResponse.of(200, "<html>" + waitSelector + ":" + scrollCycles + "</html>");
        PolitenessGate gate = new PolitenessGate(context, origin -> CrawlPolicy.allowAll(), List.of());
        ResilientFetcher fetcher = new ResilientFetcher(context, gate, transport, renderer,
            RetryPolicy.defaults(), sleeper, Duration.ZERO, 2);

        FetchOutcome outcome = fetcher.fetch(FetchRequest.rendered(URL, ".grid"));

        FetchOutcome.Success success = assertInstanceOf(FetchOutcome.Success.class, outcome);
        assertEquals("<html>.grid:2</html>", success.payload());
        assertTrue(transport.calls.isEmpty());
    }

    @Test
    public void testRenderedRequestWithoutRendererFails() {
        FetchOutcome outcome = fetcher().fetch(FetchRequest.rendered(URL, null));

        FetchOutcome.Failed failed = assertInstanceOf(FetchOutcome.Failed.class, outcome);
        assertEquals(ErrorKind.TRANSPORT_ERROR, failed.error());
        assertTrue(transport.calls.isEmpty());
    }
}
