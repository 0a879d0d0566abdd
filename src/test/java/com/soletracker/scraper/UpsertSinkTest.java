package com.soletracker.scraper;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class UpsertSinkTest {

    private final RunContext context = new RunContext();
    private final RecordingSleeper sleeper = new RecordingSleeper();
    private final FakeUpsertTarget primary = new FakeUpsertTarget("primary");
    private final FakeUpsertTarget fallback = new FakeUpsertTarget("fallback");

    private static CanonicalRecord record(String id, String url) {
        return CanonicalRecord.restore(id, url == null ? Map.of("name", id) : Map.of("name", id, "url", url),
            Map.of(), List.of("kith"), Instant.parse("2025-03-01T12:00:00Z"));
    }

    private UpsertSink sink(String conflictKey) {
        return new UpsertSink(primary, fallback, conflictKey, 3, sleeper, context);
    }

    @Test
    public void testInsertThenUpdate() {
        UpsertSink sink = sink("id");

        UpsertOutcome first = sink.upsert("sneakers", record("sku::A1", null));
        UpsertOutcome second = sink.upsert("sneakers", record("sku::A1", null));

        assertEquals(UpsertOutcome.Status.INSERTED, first.status());
        assertEquals(UpsertOutcome.Status.UPDATED, second.status());
        assertEquals(1, context.inserted.get());
        assertEquals(1, context.updated.get());
    }

    @Test
    public void testAuthFailureSwitchesBatchToFallback() {
        primary.failAlways(ErrorKind.AUTH_ERROR);

        SinkReport report = sink("id").upsertAll("sneakers",
            List.of(record("sku::A1", null), record("sku::A2", null), record("sku::A3", null)));

        assertEquals(3, report.inserted());
        assertTrue(report.fallbackUsed());
        assertEquals(1, primary.calls, "primary is not retried after rejecting credentials");
        assertEquals(3, fallback.writes.size());
        assertTrue(context.fallbackUsed.get());
        assertEquals(0, context.persistFailed.get());
    }

    @Test
    public void testNewBatchStartsOnPrimaryAgain() {
        UpsertSink sink = sink("id");
        primary.failNext(ErrorKind.AUTH_ERROR);

        sink.upsertAll("sneakers", List.of(record("sku::A1", null)));
        SinkReport second = sink.upsertAll("sneakers", List.of(record("sku::A2", null)));

        assertFalse(second.fallbackUsed());
        assertEquals(1, primary.writes.size());
    }

    @Test
    public void testMissingNaturalKeyIsSkipped() {
        SinkReport report = sink("url").upsertAll("sneakers",
            List.of(record("sku::A1", "https://kith.example/products/a1"), record("sku::A2", null)));

        assertEquals(1, report.inserted());
        assertEquals(1, report.skipped());
        assertEquals(1, context.skippedWithoutKey.get());
        assertEquals("sku::A2", report.failures().get(0).recordId());
        assertEquals(1, primary.calls);
    }

    @Test
    public void testTransientErrorsAreRetried() {
        primary.failNext(ErrorKind.TRANSPORT_ERROR, ErrorKind.PERSISTENCE_ERROR);

        UpsertOutcome outcome = sink("id").upsert("sneakers", record("sku::A1", null));

        assertEquals(UpsertOutcome.Status.INSERTED, outcome.status());
        assertEquals(3, outcome.attempts());
        assertEquals(List.of(Duration.ofMillis(500), Duration.ofMillis(1000)), sleeper.waits);
    }

    @Test
    public void testPersistentFailureDoesNotAbortBatch() {
        primary.failNext(ErrorKind.TRANSPORT_ERROR, ErrorKind.TRANSPORT_ERROR, ErrorKind.TRANSPORT_ERROR);

        SinkReport report = sink("id").upsertAll("sneakers", List.of(record("sku::A1", null), record("sku::A2", null)));

        assertEquals(1, report.failed());
        assertEquals(1, report.inserted());
        assertEquals(1, context.persistFailed.get());
        assertEquals(3, report.failures().get(0).attempts());
        assertFalse(report.fallbackUsed());
    }

    @Test
    public void testMissingTableIsNotRetried() {
        primary.failNext(ErrorKind.NOT_FOUND);

        UpsertOutcome outcome = sink("id").upsert("sneakers", record("sku::A1", null));

        assertEquals(UpsertOutcome.Status.FAILED, outcome.status());
        assertEquals(1, outcome.attempts());
        assertTrue(outcome.reason().startsWith("NOT_FOUND"));
        assertTrue(sleeper.waits.isEmpty());
    }

    @Test
    public void testAuthFailureOnFallbackIsTerminal() {
        primary.failAlways(ErrorKind.AUTH_ERROR);
        fallback.failAlways(ErrorKind.AUTH_ERROR);

        SinkReport report = sink("id").upsertAll("sneakers", List.of(record("sku::A1", null), record("sku::A2", null)));

        assertEquals(2, report.failed());
        assertEquals(1, primary.calls);
        assertEquals(2, fallback.calls);
    }

    @Test
    public void testAuthFailureWithoutFallbackFails() {
        primary.failAlways(ErrorKind.AUTH_ERROR);
        UpsertSink sink = new UpsertSink(primary, null, "id", 3, sleeper, context);

        UpsertOutcome outcome = sink.upsert("sneakers", record("sku::A1", null));

        assertEquals(UpsertOutcome.Status.FAILED, outcome.status());
        assertEquals(1, primary.calls);
        assertFalse(context.fallbackUsed.get());
    }
}
