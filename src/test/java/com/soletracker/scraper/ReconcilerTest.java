package com.soletracker.scraper;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ReconcilerTest {

    private static final Instant T0 = Instant.parse("2025-03-01T08:00:00Z");
    private static final String SKU = "DZ5485-612";

    private final Reconciler reconciler = new Reconciler(Map.of("nike", 3.0, "kith", 2.0, "blog", 0.5),
        new MutableClock(Instant.parse("2025-03-01T12:00:00Z")));

    private static RawRecord.Builder raw(String source, int minutes) {
        return RawRecord.builder(source, T0.plusSeconds(60L * minutes));
    }

    private RawRecord a() {
        return raw("kith", 0).key(DedupKey.sku(SKU)).key(DedupKey.name("Air Jordan 1 Chicago"))
            .field("name", "Air Jordan 1 High OG 'Chicago'").field("price", 180.0)
            .field("status", "announced").field("release_date", "2025-03-01")
            .field("images", List.of("https://img/a.jpg")).field("sources", List.of("kith")).build();
    }

    private RawRecord b() {
        return raw("nike", 5).key(DedupKey.sku(SKU.toLowerCase()))
            .field("name", "Air Jordan 1 Retro High OG").field("price", 170.0)
            .field("status", "upcoming").field("release_date", "2025-03-08")
            .field("images", List.of("https://img/b.jpg", "https://img/a.jpg")).field("sources", List.of("nike")).build();
    }

    private RawRecord c() {
        return raw("blog", 10).key(DedupKey.sku(" " + SKU + " "))
            .field("status", "sold_out").field("release_date", "2025-03-15")
            .field("images", List.of("https://img/c.jpg")).field("sources", List.of("blog")).build();
    }

    private Map<String, CanonicalRecord> merge(List<List<RawRecord>> passes) {
        Map<String, CanonicalRecord> canonical = new LinkedHashMap<>();
        for (List<RawRecord> pass : passes) reconciler.reconcile(canonical, pass);
        return canonical;
    }

    @Test
    public void testFieldRules() {
        Map<String, CanonicalRecord> canonical = merge(List.of(List.of(a(), b(), c())));

        assertEquals(1, canonical.size());
        CanonicalRecord record = canonical.get("sku::" + SKU);
        assertNotNull(record);
        assertEquals("Air Jordan 1 Retro High OG", record.field("name"), "highest trust wins scalars");
        assertEquals(170.0, record.field("price"));
        assertEquals("upcoming", record.field("status"), "status rank beats trust and recency");
        assertEquals("2025-03-15", record.field("release_date"), "latest date wins regardless of trust");
        assertEquals(List.of("https://img/a.jpg", "https://img/b.jpg", "https://img/c.jpg"), record.field("images"));
        assertEquals(List.of("kith", "nike", "blog"), List.copyOf(record.contributingSources()));
        assertEquals("nike", record.provenanceOf("name").sourceId());
        assertEquals("blog", record.provenanceOf("release_date").sourceId());
        assertEquals(Instant.parse("2025-03-01T12:00:00Z"), record.mergedAt());
    }

    @Test
    public void testStatusAnnouncedUpcomingSoldOut() {
        Map<String, CanonicalRecord> canonical = merge(List.of(List.of(
            raw("blog", 0).key(DedupKey.sku(SKU)).field("status", "announced").build(),
            raw("blog", 1).key(DedupKey.sku(SKU)).field("status", "upcoming").build(),
            raw("blog", 2).key(DedupKey.sku(SKU)).field("status", "sold_out").build())));

        assertEquals("upcoming", canonical.get("sku::" + SKU).field("status"));
    }

    @Test
    public void testEqualTrustPrefersEarliestFetch() {
        Map<String, CanonicalRecord> canonical = merge(List.of(List.of(
            raw("shop-b", 9).key(DedupKey.sku(SKU)).field("colorway", "Varsity Red").build(),
            raw("shop-a", 1).key(DedupKey.sku(SKU)).field("colorway", "Chicago").build())));

        assertEquals("Chicago", canonical.get("sku::" + SKU).field("colorway"));
    }

    @Test
    public void testRepriceFromSameSourceReplacesOldPrice() {
        Map<String, CanonicalRecord> canonical = merge(List.of(
            List.of(raw("kith", 0).key(DedupKey.sku(SKU)).field("price", 180.0).field("currency", "USD")
                .field("name", "Air Jordan 1 Chicago").build()),
            List.of(raw("kith", 7 * 24 * 60).key(DedupKey.sku(SKU)).field("price", 129.0).field("currency", "USD")
                .field("name", "Air Jordan 1 Chicago Sale").build())));

        CanonicalRecord record = canonical.get("sku::" + SKU);
        assertEquals(129.0, record.field("price"));
        assertEquals(T0.plusSeconds(7L * 24 * 3600), record.provenanceOf("price").fetchedAt());
        assertEquals("Air Jordan 1 Chicago", record.field("name"), "names keep the first sighting");
    }

    @Test
    public void testTrustedPriceIsNotReplacedByLaterLessTrustedOne() {
        Map<String, CanonicalRecord> canonical = merge(List.of(
            List.of(raw("nike", 0).key(DedupKey.sku(SKU)).field("price", 180.0).build()),
            List.of(raw("blog", 60).key(DedupKey.sku(SKU)).field("price", 150.0).build())));

        assertEquals(180.0, canonical.get("sku::" + SKU).field("price"));
    }

    @Test
    public void testIdempotent() {
        Map<String, CanonicalRecord> once = merge(List.of(List.of(a(), b(), c())));
        Map<String, CanonicalRecord> twice = merge(List.of(List.of(a(), b(), c()), List.of(a(), b(), c())));

        assertEquals(once, twice);
    }

    @Test
    public void testAssociativeAcrossPasses() {
        Map<String, CanonicalRecord> left = merge(List.of(List.of(a(), b()), List.of(c())));
        Map<String, CanonicalRecord> right = merge(List.of(List.of(a()), List.of(b(), c())));

        assertEquals(left, right);
        CanonicalRecord record = left.get("sku::" + SKU);
        assertEquals("nike", record.provenanceOf("price").sourceId());
    }

    @Test
    public void testAssociativeWhenFetchOrderDiffersFromBatchOrder() {
        RawRecord late = raw("a", 10).key(DedupKey.sku(SKU)).field("images", List.of("a.jpg")).build();
        RawRecord early = raw("b", 0).key(DedupKey.sku(SKU)).field("images", List.of("b.jpg")).build();
        RawRecord middle = raw("c", 5).key(DedupKey.sku(SKU)).field("images", List.of("c.jpg")).build();

        CanonicalRecord left = merge(List.of(List.of(late, early), List.of(middle))).get("sku::" + SKU);
        CanonicalRecord right = merge(List.of(List.of(late), List.of(early, middle))).get("sku::" + SKU);

        assertEquals(List.of("b.jpg", "c.jpg", "a.jpg"), left.field("images"));
        assertEquals(left.field("images"), right.field("images"));
        assertEquals(List.of("b", "c", "a"), List.copyOf(left.contributingSources()));
        assertEquals(List.copyOf(left.contributingSources()), List.copyOf(right.contributingSources()));
        assertEquals(left.fieldProvenance(), right.fieldProvenance());
    }

    @Test
    public void testBatchOrderDoesNotMatter() {
        Map<String, CanonicalRecord> forward = merge(List.of(List.of(a(), b(), c())));
        Map<String, CanonicalRecord> backward = merge(List.of(List.of(c(), b(), a())));

        assertEquals(forward, backward);
        assertEquals(forward.get("sku::" + SKU).field("images"), backward.get("sku::" + SKU).field("images"));
    }

    @Test
    public void testKeyPriority() {
        RawRecord withSku = raw("kith", 0).key(DedupKey.sku(SKU)).key(DedupKey.name("Dunk Low Panda")).field("name", "Dunk Low Panda").build();
        RawRecord nameOnly = raw("blog", 1).key(DedupKey.name("Dunk  Low - PANDA")).field("name", "Dunk Low Panda").build();
        RawRecord blankSku = raw("blog", 2).key(new DedupKey(KeyKind.SKU, "   ")).key(DedupKey.hash("ABC123")).build();
        RawRecord noKey = raw("blog", 3).field("name", "mystery").build();

        Map<String, CanonicalRecord> canonical = new HashMap<>();
        ReconcileResult result = reconciler.reconcile(canonical, List.of(withSku, nameOnly, blankSku, noKey));

        assertEquals(3, canonical.size());
        assertTrue(canonical.containsKey("sku::" + SKU));
        assertTrue(canonical.containsKey("name::dunk_low_panda"), "name keys never join a sku cluster");
        assertTrue(canonical.containsKey("hash::abc123"));
        assertEquals(3, result.clustersCreated());
        assertEquals(1, result.droppedWithoutKey());
    }

    @Test
    public void testExistingRecordUpdatedInPlace() {
        Map<String, CanonicalRecord> canonical = merge(List.of(List.of(a())));
        CanonicalRecord before = canonical.get("sku::" + SKU);

        ReconcileResult result = reconciler.reconcile(canonical, List.of(b()));

        assertSame(before, canonical.get("sku::" + SKU));
        assertEquals(0, result.clustersCreated());
        assertEquals(1, result.clustersUpdated());
        assertEquals(List.of(before), result.touched());
        assertEquals(170.0, before.field("price"));
    }

    @Test
    public void testRestoredRecordWithoutProvenanceLosesToIncoming() {
        Map<String, CanonicalRecord> canonical = new HashMap<>();
        canonical.put("sku::" + SKU, CanonicalRecord.restore("sku::" + SKU,
            Map.of("price", 999.0, "images", List.of("https://img/old.jpg")), Map.of(), List.of("legacy"), null));

        reconciler.reconcile(canonical, List.of(raw("blog", 0).key(DedupKey.sku(SKU)).field("price", 150.0).build()));

        CanonicalRecord record = canonical.get("sku::" + SKU);
        assertEquals(150.0, record.field("price"));
        assertEquals("https://img/old.jpg", ((List<?>) record.field("images")).get(0));
        assertTrue(record.contributingSources().containsAll(List.of("legacy", "blog")));
    }

    @Test
    public void testEmptyBatch() {
        Map<String, CanonicalRecord> canonical = new HashMap<>();

        ReconcileResult result = reconciler.reconcile(canonical, List.of());

        assertTrue(canonical.isEmpty());
        assertTrue(result.touched().isEmpty());
    }
}
