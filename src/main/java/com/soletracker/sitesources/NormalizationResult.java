package com.soletracker.sitesources;

import com.soletracker.scraper.RawRecord;

import java.util.List;

/**
 * Records extracted from one payload.
 *
 * @param records successfully normalized items, in payload order
 * @param failedCount items that could not be parsed
 * @param skippedCount items deliberately left out (e.g. non-sneaker products)
 */
public record NormalizationResult(List<RawRecord> records, int failedCount, int skippedCount) {

    public NormalizationResult {
        records = records == null ? List.of() : List.copyOf(records);
    }

    public static NormalizationResult empty() {
        return new NormalizationResult(List.of(), 0, 0);
    }
}
