package com.soletracker.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.function.ToDoubleFunction;

/**
 * Groups raw records into clusters by dedup key and merges every cluster into one canonical record.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Grouping: each raw record joins the cluster of its first present key in {@code sku > name > hash} order.
 *       Records without any key are dropped and counted.</li>
 *   <li>Identity: the cluster id is {@code <kind>::<value>}. An existing canonical record with that id is mutated in place;
 *       otherwise a new one is minted. A sku-keyed record never joins a name-keyed cluster, even when the names match.</li>
 *   <li>Field merge follows the rule registered in {@link CanonicalFieldRegistry}:
 *     <ul>
 *       <li>SCALAR: highest trust weight wins, then earliest fetch, then the lexically smallest value.</li>
 *       <li>LATEST: highest trust weight wins, then latest fetch, so a source's re-price replaces its old price.</li>
 *       <li>LIST_UNION: de-duplicated union ordered by each element's earliest sighting (fetch time, then source id);
 *       elements stored without a sighting keep their position ahead of the rest.</li>
 *       <li>DATE_MAX: latest date wins, regardless of trust.</li>
 *       <li>STATUS_RANK: highest {@link StatusRank}; recognized statuses beat unrecognized ones of equal rank.</li>
 *     </ul>
 *   </li>
 * </ul>
 * Every rule picks the extreme of a total order, and the winner's provenance is stored on the record,
 * so merging is commutative and associative across passes. List elements and contributing sources keep their
 * earliest sighting on the record, so their order does not depend on how records are split into passes.
 * <p>
 * The canonical map passed in is owned by the caller; reconcile it from one thread at a time.
 *
 * @author Sole Tracker Ingest Team
 * @since 1.0
 */
public class Reconciler {
    private static final Logger logger = LoggerFactory.getLogger(Reconciler.class);

    public static final double DEFAULT_TRUST_WEIGHT = 1.0;

    private static final Comparator<RawRecord> FETCH_ORDER = Comparator
        .comparing(RawRecord::fetchedAt, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(RawRecord::sourceId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final ToDoubleFunction<String> trustWeights;
    private final Clock clock;

    public Reconciler(Map<String, Double> trustWeights, Clock clock) {
        Map<String, Double> weights = trustWeights == null ? Map.of() : Map.copyOf(trustWeights);
        this.trustWeights = sourceId -> sourceId == null ? DEFAULT_TRUST_WEIGHT : weights.getOrDefault(sourceId, DEFAULT_TRUST_WEIGHT);
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public Reconciler(Map<String, Double> trustWeights) {
        this(trustWeights, Clock.systemUTC());
    }

    /**
     * Merges an incoming batch into the canonical set.
     * @param existingCanonical canonical records keyed by id; new records are added to it and existing ones mutated
     * @param incoming raw records of this pass, in fetch order
     * @return touched records and pass counters
     */
    public ReconcileResult reconcile(Map<String, CanonicalRecord> existingCanonical, List<RawRecord> incoming) {
        Objects.requireNonNull(existingCanonical, "existingCanonical");
        Map<String, List<RawRecord>> clusters = new LinkedHashMap<>();
        int dropped = 0;
        for (RawRecord raw : incoming == null ? List.<RawRecord>of() : incoming) {
            if (raw == null) continue;
            Optional<DedupKey> key = raw.clusterKey();
            if (key.isEmpty()) {
                dropped++;
                logger.warn("Dropping raw record from '{}' without any dedup key: {}", raw.sourceId(), raw.fields().get("name"));
                continue;
            }
            clusters.computeIfAbsent(CanonicalRecord.idFor(key.get()), k -> new ArrayList<>()).add(raw);
        }

        Instant now = clock.instant();
        List<CanonicalRecord> touched = new ArrayList<>();
        int created = 0;
        int updated = 0;
        for (Map.Entry<String, List<RawRecord>> cluster : clusters.entrySet()) {
            String id = cluster.getKey();
            CanonicalRecord record = existingCanonical.get(id);
            if (record == null) {
                record = new CanonicalRecord(id);
                existingCanonical.put(id, record);
                created++;
            } else {
                updated++;
            }
            List<RawRecord> members = new ArrayList<>(cluster.getValue());
            members.sort(FETCH_ORDER);
            mergeInto(record, members);
            record.setMergedAt(now);
            touched.add(record);
        }
        logger.info("Reconciled {} raw records into {} clusters ({} new, {} updated, {} dropped without key)",
            incoming == null ? 0 : incoming.size(), clusters.size(), created, updated, dropped);
        return new ReconcileResult(touched, created, updated, dropped);
    }

    private void mergeInto(CanonicalRecord record, List<RawRecord> members) {
        LinkedHashSet<String> fieldNames = new LinkedHashSet<>();
        for (RawRecord raw : members) {
            fieldNames.addAll(raw.fields().keySet());
            record.addContributingSource(raw.sourceId());
            record.noteSighting(CanonicalRecord.SOURCES, raw.sourceId(), provenanceOf(raw));
        }
        record.replaceContributingSources(
            bySighting(new ArrayList<>(record.contributingSources()), record.firstSeenOf(CanonicalRecord.SOURCES)));
        for (String fieldName : fieldNames) {
            CanonicalField field = CanonicalFieldRegistry.getField(fieldName);
            switch (field.rule) {
                case LATEST -> mergeLatest(record, fieldName, members);
                case LIST_UNION -> mergeList(record, fieldName, members);
                case DATE_MAX -> mergeDate(record, fieldName, members);
                case STATUS_RANK -> mergeStatus(record, fieldName, members);
                default -> mergeScalar(record, fieldName, members);
            }
        }
    }

    private record Candidate(Object value, FieldProvenance provenance) {}

    private Candidate currentCandidate(CanonicalRecord record, String fieldName) {
        Object current = record.field(fieldName);
        return current == null ? null : new Candidate(current, record.provenanceOf(fieldName));
    }

    private FieldProvenance provenanceOf(RawRecord raw) {
        return new FieldProvenance(raw.sourceId(), trustWeights.applyAsDouble(raw.sourceId()), raw.fetchedAt());
    }

    private Candidate candidateOf(RawRecord raw, String fieldName) {
        Object value = raw.field(fieldName);
        if (value == null) return null;
        return new Candidate(value, provenanceOf(raw));
    }

    // trust desc, then earliest fetch, then smallest value so the order is total
    private static final Comparator<Candidate> SCALAR_ORDER = Comparator
        .comparingDouble((Candidate c) -> -c.provenance().trustWeight())
        .thenComparing(c -> c.provenance().fetchedAt(), Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(c -> String.valueOf(c.value()));

    private void mergeScalar(CanonicalRecord record, String fieldName, List<RawRecord> members) {
        Candidate best = currentCandidate(record, fieldName);
        for (RawRecord raw : members) {
            Candidate c = candidateOf(raw, fieldName);
            if (c != null && (best == null || SCALAR_ORDER.compare(c, best) < 0)) best = c;
        }
        if (best != null) record.putField(fieldName, best.value(), best.provenance());
    }

    // trust desc, then latest fetch, then smallest value
    private static final Comparator<Candidate> LATEST_ORDER = Comparator
        .comparingDouble((Candidate c) -> -c.provenance().trustWeight())
        .thenComparing(c -> c.provenance().fetchedAt(), Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
        .thenComparing(c -> String.valueOf(c.value()));

    private void mergeLatest(CanonicalRecord record, String fieldName, List<RawRecord> members) {
        Candidate best = currentCandidate(record, fieldName);
        for (RawRecord raw : members) {
            Candidate c = candidateOf(raw, fieldName);
            if (c != null && (best == null || LATEST_ORDER.compare(c, best) < 0)) best = c;
        }
        if (best != null) record.putField(fieldName, best.value(), best.provenance());
    }

    private void mergeList(CanonicalRecord record, String fieldName, List<RawRecord> members) {
        LinkedHashSet<String> union = new LinkedHashSet<>(asStringList(record.field(fieldName)));
        FieldProvenance provenance = record.fieldProvenance().get(fieldName);
        for (RawRecord raw : members) {
            Object value = raw.field(fieldName);
            if (value == null) continue;
            FieldProvenance seen = provenanceOf(raw);
            for (String element : asStringList(value)) {
                union.add(element);
                record.noteSighting(fieldName, element, seen);
            }
            if (provenance == null || CanonicalRecord.SIGHTING_ORDER.compare(seen, provenance) < 0) provenance = seen;
        }
        if (!union.isEmpty()) {
            record.putField(fieldName, bySighting(new ArrayList<>(union), record.firstSeenOf(fieldName)), provenance);
        }
    }

    /**
     * Orders elements by earliest sighting, then value. Elements without a sighting keep their relative order
     * and come first.
     */
    static List<String> bySighting(List<String> elements, Map<String, FieldProvenance> seen) {
        List<String> ordered = new ArrayList<>();
        List<String> sighted = new ArrayList<>();
        for (String element : elements) {
            if (seen.containsKey(element)) sighted.add(element);
            else ordered.add(element);
        }
        sighted.sort(Comparator.comparing((String e) -> seen.get(e), CanonicalRecord.SIGHTING_ORDER)
            .thenComparing(Comparator.<String>naturalOrder()));
        ordered.addAll(sighted);
        return ordered;
    }

    private void mergeDate(CanonicalRecord record, String fieldName, List<RawRecord> members) {
        Candidate best = currentCandidate(record, fieldName);
        Instant bestInstant = best == null ? null : toInstant(best.value());
        if (best != null && bestInstant == null) {
            logger.warn("Existing value of '{}' on {} is not a date ({}); replacing it", fieldName, record.id(), best.value());
            best = null;
        }
        for (RawRecord raw : members) {
            Candidate c = candidateOf(raw, fieldName);
            if (c == null) continue;
            Instant instant = toInstant(c.value());
            if (instant == null) {
                logger.debug("Ignoring unparsable {} '{}' from {}", fieldName, c.value(), raw.sourceId());
                continue;
            }
            if (best == null || instant.isAfter(bestInstant)
                || instant.equals(bestInstant) && SCALAR_ORDER.compare(c, best) < 0) {
                best = c;
                bestInstant = instant;
            }
        }
        if (best != null) record.putField(fieldName, best.value(), best.provenance());
    }

    private static final Comparator<Candidate> STATUS_ORDER = Comparator
        .comparingInt((Candidate c) -> -StatusRank.rank(String.valueOf(c.value())))
        .thenComparing(c -> StatusRank.isRecognized(String.valueOf(c.value())) ? 0 : 1)
        .thenComparing(SCALAR_ORDER);

    private void mergeStatus(CanonicalRecord record, String fieldName, List<RawRecord> members) {
        Candidate best = currentCandidate(record, fieldName);
        for (RawRecord raw : members) {
            Candidate c = candidateOf(raw, fieldName);
            if (c != null && (best == null || STATUS_ORDER.compare(c, best) < 0)) best = c;
        }
        if (best != null) record.putField(fieldName, best.value(), best.provenance());
    }

    private static List<String> asStringList(Object value) {
        if (value == null) return List.of();
        List<String> out = new ArrayList<>();
        if (value instanceof Collection<?> c) {
            for (Object o : c) {
                if (o != null && !String.valueOf(o).isBlank()) out.add(String.valueOf(o));
            }
        } else if (!String.valueOf(value).isBlank()) {
            out.add(String.valueOf(value));
        }
        return out;
    }

    /**
     * Converts a date-like field value to an instant for comparison; null when it is not a date.
     */
    static Instant toInstant(Object value) {
        if (value instanceof Instant i) return i;
        if (value instanceof LocalDate d) return d.atStartOfDay(ZoneOffset.UTC).toInstant();
        if (value instanceof String s && !s.isBlank()) {
            try {
                return LocalDate.parse(s.trim()).atStartOfDay(ZoneOffset.UTC).toInstant();
            } catch (DateTimeParseException e) {
                try {
                    return Instant.parse(s.trim());
                } catch (DateTimeParseException notAnInstant) {
                    return null;
                }
            }
        }
        return null;
    }
}
