package com.soletracker.scraper;

import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps a canonical record to the column values of its table row.
 * <p>
 * Search columns ({@code name}, {@code sku}, {@code status}, ...) are copied out of the field map; the full field map,
 * its provenance and the contributing sources go into JSON columns so a row can be read back without loss.
 */
public final class CanonicalRowMapper {
    private CanonicalRowMapper() {}

    public static final List<String> COLUMNS = List.of(
        "id", "name", "brand", "sku", "url", "status", "release_date", "price",
        "fields", "field_provenance", "contributing_sources", "merged_at"
    );

    public static final List<String> JSON_COLUMNS = List.of("fields", "field_provenance", "contributing_sources");

    public static Map<String, Object> toRow(CanonicalRecord record) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", record.id());
        row.put("name", text(record.field("name")));
        row.put("brand", text(record.field("brand")));
        row.put("sku", text(record.field("sku")));
        row.put("url", text(record.field("url")));
        row.put("status", text(record.field("status")));
        row.put("release_date", date(record.field("release_date")));
        row.put("price", record.field("price") instanceof Number n ? n.doubleValue() : null);
        row.put("fields", new LinkedHashMap<>(record.fields()));
        row.put("field_provenance", provenanceColumn(record));
        row.put("contributing_sources", new ArrayList<>(record.contributingSources()));
        row.put("merged_at", record.mergedAt());
        return row;
    }

    /**
     * Field provenance plus, under {@link CanonicalRecordCodec#FIRST_SEEN}, the earliest sighting of list elements
     * and contributing sources.
     */
    public static Map<String, Object> provenanceColumn(CanonicalRecord record) {
        Map<String, Object> column = new LinkedHashMap<>(record.fieldProvenance());
        if (!record.firstSeen().isEmpty()) column.put(CanonicalRecordCodec.FIRST_SEEN, record.firstSeen());
        return column;
    }

    private static String text(Object value) {
        return value == null ? null : value.toString();
    }

    private static LocalDate date(Object value) {
        if (value instanceof LocalDate d) return d;
        if (value instanceof Instant i) return i.atZone(java.time.ZoneOffset.UTC).toLocalDate();
        if (value instanceof String s) {
            try {
                return LocalDate.parse(s.length() >= 10 ? s.substring(0, 10) : s);
            } catch (DateTimeParseException e) {
                return null;
            }
        }
        return null;
    }
}
