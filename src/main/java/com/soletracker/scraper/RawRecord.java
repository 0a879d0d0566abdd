package com.soletracker.scraper;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable record representing one source's view of one item, before merging.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Produced by a {@code SourceNormalizer} for every successfully parsed raw item.</li>
 *   <li>Consumed immediately by the {@link Reconciler}; never persisted on its own.</li>
 *   <li>Field values are typed: {@code String}, {@code Double}, {@code LocalDate}, {@code Instant},
 *       {@code List<String>} or {@code Boolean}. Missing data is absent from {@code fields},
 *       never an empty string or a placeholder such as "Unknown".</li>
 * </ul>
 *
 * @param sourceId stable identifier of the emitting source
 * @param dedupKeyCandidates identity candidates, first present candidate in sku &gt; name &gt; hash order wins
 * @param fields canonical field name to typed value
 * @param fetchedAt when the payload was fetched
 *
 * @author Sole Tracker Ingest Team
 * @since 1.0
 */
public record RawRecord(
    String sourceId,
    List<DedupKey> dedupKeyCandidates,
    Map<String, Object> fields,
    Instant fetchedAt
) {
    public RawRecord {
        dedupKeyCandidates = dedupKeyCandidates == null ? List.of() : List.copyOf(dedupKeyCandidates);
        Map<String, Object> cleaned = new LinkedHashMap<>();
        if (fields != null) {
            fields.forEach((k, v) -> {
                if (k != null && v != null) cleaned.put(k, v);
            });
        }
        fields = Collections.unmodifiableMap(cleaned);
    }

    /**
     * Returns the highest priority key candidate that is still non-empty in canonical form, if any.
     */
    public Optional<DedupKey> clusterKey() {
        for (KeyKind kind : KeyKind.values()) {
            for (DedupKey candidate : dedupKeyCandidates) {
                if (candidate.kind() != kind) continue;
                DedupKey canonical = candidate.canonical();
                if (canonical.isPresent()) return Optional.of(canonical);
            }
        }
        return Optional.empty();
    }

    public Object field(String name) {
        return fields.get(name);
    }

    /**
     * Builder used by normalizers; skips null values so absent data stays absent.
     */
    public static Builder builder(String sourceId, Instant fetchedAt) {
        return new Builder(sourceId, fetchedAt);
    }

    public static final class Builder {
        private final String sourceId;
        private final Instant fetchedAt;
        private final List<DedupKey> keys = new ArrayList<>();
        private final Map<String, Object> fields = new LinkedHashMap<>();

        private Builder(String sourceId, Instant fetchedAt) {
            this.sourceId = sourceId;
            this.fetchedAt = fetchedAt;
        }

        public Builder key(DedupKey key) {
            if (key != null && key.isPresent()) keys.add(key);
            return this;
        }

        public Builder field(String name, Object value) {
            if (value instanceof String s && s.isBlank()) return this;
            if (value instanceof List<?> l && l.isEmpty()) return this;
            if (value != null) fields.put(name, value);
            return this;
        }

        public boolean hasKey() {
            return !keys.isEmpty();
        }

        public RawRecord build() {
            return new RawRecord(sourceId, keys, fields, fetchedAt);
        }
    }
}
