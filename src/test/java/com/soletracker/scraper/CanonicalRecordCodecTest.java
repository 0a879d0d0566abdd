package com.soletracker.scraper;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class CanonicalRecordCodecTest {

    private static final Instant T0 = Instant.parse("2025-03-01T08:00:00Z");
    private static final String ID = "sku::FV5029-141";

    private final Reconciler reconciler = new Reconciler(Map.of(), new MutableClock(T0));

    private static RawRecord sighting(String source, int minutes, String image) {
        return RawRecord.builder(source, T0.plusSeconds(60L * minutes))
            .key(DedupKey.sku("FV5029-141"))
            .field("images", List.of(image))
            .build();
    }

    private static CanonicalRecord storedAndReadBack(CanonicalRecord record) throws StoreException {
        Map<String, Object> row = CanonicalRowMapper.toRow(record);
        JsonNode fields = CanonicalRecordCodec.readTree(CanonicalRecordCodec.toJson(row.get("fields")));
        JsonNode provenance = CanonicalRecordCodec.readTree(CanonicalRecordCodec.toJson(row.get("field_provenance")));
        JsonNode sources = CanonicalRecordCodec.readTree(CanonicalRecordCodec.toJson(row.get("contributing_sources")));
        return CanonicalRecordCodec.decode(record.id(), fields, provenance, sources, record.mergedAt());
    }

    @Test
    public void testSightingsSurviveStorage() throws StoreException {
        Map<String, CanonicalRecord> canonical = new LinkedHashMap<>();
        reconciler.reconcile(canonical, List.of(sighting("kith", 10, "kith.jpg")));

        CanonicalRecord back = storedAndReadBack(canonical.get(ID));

        assertEquals(canonical.get(ID).firstSeen(), back.firstSeen());
        assertEquals(T0.plusSeconds(600), back.firstSeenOf("images").get("kith.jpg").fetchedAt());
        assertEquals("kith", back.firstSeenOf(CanonicalRecord.SOURCES).get("kith").sourceId());
        assertFalse(back.fieldProvenance().containsKey(CanonicalRecordCodec.FIRST_SEEN));
    }

    @Test
    public void testEarlierSightingAfterReloadMovesToFront() throws StoreException {
        Map<String, CanonicalRecord> stored = new LinkedHashMap<>();
        reconciler.reconcile(stored, List.of(sighting("kith", 10, "kith.jpg")));
        Map<String, CanonicalRecord> reloaded = new LinkedHashMap<>();
        reloaded.put(ID, storedAndReadBack(stored.get(ID)));

        reconciler.reconcile(reloaded, List.of(sighting("nike", 0, "nike.jpg")));

        CanonicalRecord record = reloaded.get(ID);
        assertEquals(List.of("nike.jpg", "kith.jpg"), record.field("images"));
        assertEquals(List.of("nike", "kith"), List.copyOf(record.contributingSources()));
    }

    @Test
    public void testLegacyRowWithoutSightingsKeepsStoredOrderFirst() throws StoreException {
        JsonNode fields = CanonicalRecordCodec.readTree("{\"images\":[\"old-2.jpg\",\"old-1.jpg\"]}");
        JsonNode sources = CanonicalRecordCodec.readTree("[\"legacy\"]");
        Map<String, CanonicalRecord> canonical = new LinkedHashMap<>();
        canonical.put(ID, CanonicalRecordCodec.decode(ID, fields, null, sources, null));

        reconciler.reconcile(canonical, List.of(sighting("kith", 0, "kith.jpg")));

        CanonicalRecord record = canonical.get(ID);
        assertEquals(List.of("old-2.jpg", "old-1.jpg", "kith.jpg"), record.field("images"));
        assertEquals(List.of("legacy", "kith"), List.copyOf(record.contributingSources()));
    }
}
