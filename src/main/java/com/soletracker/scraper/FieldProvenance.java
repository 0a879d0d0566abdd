package com.soletracker.scraper;

import java.time.Instant;

/**
 * Where the current value of a canonical field came from. Stored next to the record
 * so later passes compare incoming values against the winner's trust and fetch time.
 *
 * @param sourceId source that supplied the winning value
 * @param trustWeight configured trust weight of that source
 * @param fetchedAt fetch time of the contributing raw record
 */
public record FieldProvenance(String sourceId, double trustWeight, Instant fetchedAt) {

    /** Provenance assumed for values loaded without any; always outranked by real observations. */
    public static final FieldProvenance UNKNOWN = new FieldProvenance(null, Double.NEGATIVE_INFINITY, Instant.MAX);
}
