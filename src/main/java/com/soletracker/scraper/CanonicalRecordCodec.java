package com.soletracker.scraper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON form of canonical records as stored in the {@code fields}, {@code field_provenance} and
 * {@code contributing_sources} columns.
 * <p>
 * Reading restores Java value types from the {@link CanonicalFieldRegistry}: dates become {@link LocalDate},
 * timestamps {@link Instant}, numbers {@link Double}, lists {@code List<String>}.
 */
public final class CanonicalRecordCodec {
    private static final Logger logger = LoggerFactory.getLogger(CanonicalRecordCodec.class);

    /** Key of the element sightings inside the {@code field_provenance} column. */
    public static final String FIRST_SEEN = "_first_seen";

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private CanonicalRecordCodec() {}

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String toJson(Object value) throws StoreException {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreException(ErrorKind.PERSISTENCE_ERROR, "Failed to serialize value: " + e.getOriginalMessage(), e);
        }
    }

    public static JsonNode readTree(String json) throws StoreException {
        if (json == null || json.isBlank()) return MAPPER.nullNode();
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new StoreException(ErrorKind.PERSISTENCE_ERROR, "Stored JSON is malformed: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Rebuilds a canonical record from its stored JSON parts. Null nodes are treated as empty.
     */
    public static CanonicalRecord decode(String id, JsonNode fields, JsonNode provenance, JsonNode sources, Instant mergedAt) {
        Map<String, Object> values = new LinkedHashMap<>();
        if (fields != null && fields.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = fields.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                Object value = restoreValue(e.getKey(), e.getValue());
                if (value != null) values.put(e.getKey(), value);
            }
        }
        Map<String, FieldProvenance> prov = new LinkedHashMap<>();
        Map<String, Map<String, FieldProvenance>> firstSeen = new LinkedHashMap<>();
        if (provenance != null && provenance.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = provenance.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                if (e.getKey().equals(FIRST_SEEN)) {
                    firstSeen = readFirstSeen(e.getValue());
                    continue;
                }
                FieldProvenance p = readProvenance(e.getValue());
                if (p != null) prov.put(e.getKey(), p);
            }
        }
        List<String> contributing = new ArrayList<>();
        if (sources != null && sources.isArray()) {
            sources.forEach(n -> { if (n.isTextual()) contributing.add(n.asText()); });
        }
        return CanonicalRecord.restore(id, values, prov, firstSeen, contributing, mergedAt);
    }

    private static Map<String, Map<String, FieldProvenance>> readFirstSeen(JsonNode node) {
        Map<String, Map<String, FieldProvenance>> firstSeen = new LinkedHashMap<>();
        if (node == null || !node.isObject()) return firstSeen;
        node.fields().forEachRemaining(field -> {
            Map<String, FieldProvenance> elements = new LinkedHashMap<>();
            field.getValue().fields().forEachRemaining(element -> {
                FieldProvenance p = readProvenance(element.getValue());
                if (p != null) elements.put(element.getKey(), p);
            });
            if (!elements.isEmpty()) firstSeen.put(field.getKey(), elements);
        });
        return firstSeen;
    }

    private static FieldProvenance readProvenance(JsonNode node) {
        if (node == null || !node.isObject()) return null;
        Instant fetchedAt = parseInstant(node.path("fetchedAt").asText(null));
        if (fetchedAt == null) return null;
        String sourceId = node.hasNonNull("sourceId") ? node.get("sourceId").asText() : null;
        return new FieldProvenance(sourceId, node.path("trustWeight").asDouble(Reconciler.DEFAULT_TRUST_WEIGHT), fetchedAt);
    }

    static Object restoreValue(String fieldName, JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        CanonicalField field = CanonicalFieldRegistry.getField(fieldName);
        switch (field.type) {
            case NUMBER:
                if (node.isNumber()) return node.asDouble();
                try {
                    return Double.parseDouble(node.asText());
                } catch (NumberFormatException e) {
                    logger.warn("Dropping non-numeric stored value for {}: {}", fieldName, node.asText());
                    return null;
                }
            case BOOLEAN:
                return node.isBoolean() ? node.booleanValue() : Boolean.valueOf(node.asText());
            case DATE:
                try {
                    return LocalDate.parse(node.asText());
                } catch (DateTimeParseException e) {
                    Instant instant = parseInstant(node.asText());
                    return instant == null ? node.asText() : instant.atZone(java.time.ZoneOffset.UTC).toLocalDate();
                }
            case TIMESTAMP: {
                Instant instant = parseInstant(node.asText());
                return instant == null ? node.asText() : instant;
            }
            case TEXT_LIST: {
                List<String> list = new ArrayList<>();
                if (node.isArray()) node.forEach(n -> { if (!n.isNull()) list.add(n.asText()); });
                else list.add(node.asText());
                return list;
            }
            default:
                if (node.isNumber()) return node.numberValue();
                if (node.isBoolean()) return node.booleanValue();
                return node.isTextual() ? node.asText() : node.toString();
        }
    }

    private static Instant parseInstant(String text) {
        if (text == null || text.isBlank()) return null;
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            try {
                return java.time.OffsetDateTime.parse(text).toInstant();
            } catch (DateTimeParseException notOffset) {
                return null;
            }
        }
    }
}
