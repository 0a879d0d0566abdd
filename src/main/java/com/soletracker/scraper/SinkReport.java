package com.soletracker.scraper;

import java.util.List;

/**
 * Totals of one upsert batch.
 *
 * @param failures outcomes of records that were skipped or failed, in batch order
 */
public record SinkReport(int inserted, int updated, int skipped, int failed, boolean fallbackUsed,
                         List<UpsertOutcome> failures) {

    public SinkReport {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public int persisted() {
        return inserted + updated;
    }
}
