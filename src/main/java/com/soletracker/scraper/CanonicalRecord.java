package com.soletracker.scraper;

import java.time.Instant;
import java.util.*;

/**
 * The merged, identity-stable release record written to storage.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Created by the {@link Reconciler} on the first sighting of a cluster, with an id minted from the winning dedup key.</li>
 *   <li>Mutated in place on every later pass: {@code fields}, {@code contributingSources}, provenance and {@code mergedAt} change, the id never does.</li>
 *   <li>Per-field provenance ({@code fieldProvenance}) records which source supplied each value.</li>
 *   <li>List fields and contributing sources also keep the earliest sighting of every element ({@code firstSeen}),
 *   which fixes their order across passes.</li>
 * </ul>
 * Instances are not thread-safe; one reconciliation pass owns a canonical set at a time.
 *
 * @author Sole Tracker Ingest Team
 * @since 1.0
 */
public final class CanonicalRecord {
    /** Key of the contributing sources in {@link #firstSeen()}. */
    public static final String SOURCES = "contributing_sources";

    private final String id;
    private final Map<String, Object> fields = new LinkedHashMap<>();
    private final Map<String, FieldProvenance> fieldProvenance = new LinkedHashMap<>();
    private final Set<String> contributingSources = new LinkedHashSet<>();
    private final Map<String, Map<String, FieldProvenance>> firstSeen = new LinkedHashMap<>();
    private Instant mergedAt;

    public CanonicalRecord(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Canonical record id cannot be blank");
        }
        this.id = id;
    }

    /**
     * Mints the deterministic canonical id for a dedup key: {@code <kind>::<value>} with spaces replaced by underscores.
     * @param key winning dedup key of a cluster
     * @return id that is identical across runs for identical key material
     */
    public static String idFor(DedupKey key) {
        return key.kind().prefix() + "::" + key.value().trim().replace(' ', '_');
    }

    public String id() {
        return id;
    }

    public Map<String, Object> fields() {
        return Collections.unmodifiableMap(fields);
    }

    public Object field(String name) {
        return fields.get(name);
    }

    public Map<String, FieldProvenance> fieldProvenance() {
        return Collections.unmodifiableMap(fieldProvenance);
    }

    public FieldProvenance provenanceOf(String name) {
        return fieldProvenance.getOrDefault(name, FieldProvenance.UNKNOWN);
    }

    public Set<String> contributingSources() {
        return Collections.unmodifiableSet(contributingSources);
    }

    public Instant mergedAt() {
        return mergedAt;
    }

    /**
     * Earliest sighting of each element, per list field and for {@link #SOURCES}.
     */
    public Map<String, Map<String, FieldProvenance>> firstSeen() {
        return Collections.unmodifiableMap(firstSeen);
    }

    public Map<String, FieldProvenance> firstSeenOf(String name) {
        Map<String, FieldProvenance> seen = firstSeen.get(name);
        return seen == null ? Map.of() : Collections.unmodifiableMap(seen);
    }

    /**
     * Records a sighting of an element, keeping the earlier one by fetch time, then source id.
     */
    void noteSighting(String name, String element, FieldProvenance seen) {
        if (element == null || seen == null) return;
        firstSeen.computeIfAbsent(name, k -> new LinkedHashMap<>())
            .merge(element, seen, (current, incoming) -> SIGHTING_ORDER.compare(incoming, current) < 0 ? incoming : current);
    }

    static final Comparator<FieldProvenance> SIGHTING_ORDER = Comparator
        .comparing(FieldProvenance::fetchedAt, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(FieldProvenance::sourceId, Comparator.nullsLast(Comparator.naturalOrder()));

    void putField(String name, Object value, FieldProvenance provenance) {
        if (value == null) {
            fields.remove(name);
            fieldProvenance.remove(name);
            return;
        }
        fields.put(name, value);
        if (provenance != null) fieldProvenance.put(name, provenance);
    }

    void addContributingSource(String sourceId) {
        if (sourceId != null && !sourceId.isBlank()) contributingSources.add(sourceId);
    }

    void replaceContributingSources(List<String> ordered) {
        contributingSources.clear();
        ordered.forEach(this::addContributingSource);
    }

    void setMergedAt(Instant mergedAt) {
        this.mergedAt = mergedAt;
    }

    /**
     * Rebuilds a record read back from storage.
     */
    public static CanonicalRecord restore(String id, Map<String, Object> fields, Map<String, FieldProvenance> provenance,
                                          Collection<String> sources, Instant mergedAt) {
        return restore(id, fields, provenance, Map.of(), sources, mergedAt);
    }

    public static CanonicalRecord restore(String id, Map<String, Object> fields, Map<String, FieldProvenance> provenance,
                                          Map<String, Map<String, FieldProvenance>> firstSeen,
                                          Collection<String> sources, Instant mergedAt) {
        CanonicalRecord record = new CanonicalRecord(id);
        if (fields != null) {
            fields.forEach((k, v) -> record.putField(k, v, provenance == null ? null : provenance.get(k)));
        }
        if (firstSeen != null) {
            firstSeen.forEach((name, elements) -> elements.forEach((element, seen) -> record.noteSighting(name, element, seen)));
        }
        if (sources != null) sources.forEach(record::addContributingSource);
        record.mergedAt = mergedAt;
        return record;
    }

    /**
     * Deep copy, used by tests and by callers that need a snapshot before a pass.
     */
    public CanonicalRecord copy() {
        Map<String, Object> copiedFields = new LinkedHashMap<>();
        fields.forEach((k, v) -> copiedFields.put(k, v instanceof List<?> l ? new ArrayList<>(l) : v));
        return restore(id, copiedFields, fieldProvenance, firstSeen, contributingSources, mergedAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CanonicalRecord other)) return false;
        return id.equals(other.id)
            && fields.equals(other.fields)
            && contributingSources.equals(other.contributingSources);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, fields, contributingSources);
    }

    @Override
    public String toString() {
        return "CanonicalRecord{id=" + id + ", fields=" + fields + ", sources=" + contributingSources + "}";
    }
}
