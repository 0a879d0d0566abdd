package com.soletracker.scraper;

/**
 * Represents one field of the canonical release schema: its value type and how
 * conflicting values from several sources are resolved.
 */
public class CanonicalField {

    public enum ValueType { TEXT, NUMBER, DATE, TIMESTAMP, TEXT_LIST, BOOLEAN }

    public enum MergeRule {
        /** First non-null value, highest trust first, earliest fetch on ties. */
        SCALAR,
        /** Highest trust first, latest fetch on ties. */
        LATEST,
        /** Union of values, de-duplicated, first-seen order. */
        LIST_UNION,
        /** Most recent value wins. */
        DATE_MAX,
        /** Highest rank in {@link StatusRank} wins. */
        STATUS_RANK
    }

    public final String fieldName;
    public final ValueType type;
    public final MergeRule rule;

    public CanonicalField(String fieldName, ValueType type, MergeRule rule) {
        this.fieldName = fieldName;
        this.type = type;
        this.rule = rule;
    }
}
