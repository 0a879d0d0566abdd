package com.soletracker.scraper;

import com.soletracker.scraper.CanonicalField.MergeRule;
import com.soletracker.scraper.CanonicalField.ValueType;

import java.util.*;

/**
 * Central registry of canonical fields and their merge rules.
 * Normalizers, the reconciler, the row mapper and the CSV exporter all read the schema from here.
 * Fields not listed are treated as free-text scalars.
 */
public final class CanonicalFieldRegistry {
    private CanonicalFieldRegistry() {}

    private static final List<CanonicalField> FIELDS = List.of(
        new CanonicalField("name", ValueType.TEXT, MergeRule.SCALAR),
        new CanonicalField("brand", ValueType.TEXT, MergeRule.SCALAR),
        new CanonicalField("sku", ValueType.TEXT, MergeRule.SCALAR),
        new CanonicalField("colorway", ValueType.TEXT, MergeRule.SCALAR),
        new CanonicalField("url", ValueType.TEXT, MergeRule.SCALAR),
        new CanonicalField("image_url", ValueType.TEXT, MergeRule.LATEST),
        new CanonicalField("description", ValueType.TEXT, MergeRule.SCALAR),
        new CanonicalField("price", ValueType.NUMBER, MergeRule.LATEST),
        new CanonicalField("currency", ValueType.TEXT, MergeRule.LATEST),
        new CanonicalField("release_type", ValueType.TEXT, MergeRule.SCALAR),
        new CanonicalField("is_raffle", ValueType.BOOLEAN, MergeRule.SCALAR),
        new CanonicalField("release_date", ValueType.DATE, MergeRule.DATE_MAX),
        new CanonicalField("published_at", ValueType.TIMESTAMP, MergeRule.DATE_MAX),
        new CanonicalField("status", ValueType.TEXT, MergeRule.STATUS_RANK),
        new CanonicalField("images", ValueType.TEXT_LIST, MergeRule.LIST_UNION),
        new CanonicalField("locations", ValueType.TEXT_LIST, MergeRule.LIST_UNION),
        new CanonicalField("sources", ValueType.TEXT_LIST, MergeRule.LIST_UNION),
        new CanonicalField("tags", ValueType.TEXT_LIST, MergeRule.LIST_UNION)
    );

    private static final Map<String, CanonicalField> BY_NAME = new LinkedHashMap<>();
    static {
        for (CanonicalField f : FIELDS) BY_NAME.put(f.fieldName, f);
    }

    /**
     * Returns the list of all registered fields.
     */
    public static List<CanonicalField> getFields() {
        return FIELDS;
    }

    /**
     * Returns the list of all field names, in schema order.
     */
    public static List<String> getFieldNames() {
        return new ArrayList<>(BY_NAME.keySet());
    }

    /**
     * Returns the field for a given name; unknown names resolve to a text scalar.
     */
    public static CanonicalField getField(String name) {
        CanonicalField f = BY_NAME.get(name);
        return f != null ? f : new CanonicalField(name, ValueType.TEXT, MergeRule.SCALAR);
    }

    public static boolean isRegistered(String name) {
        return BY_NAME.containsKey(name);
    }
}
