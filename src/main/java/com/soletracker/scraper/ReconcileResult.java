package com.soletracker.scraper;

import java.util.List;

/**
 * Outcome of one reconciliation pass.
 *
 * @param touched canonical records created or updated by the pass, in cluster order
 * @param clustersCreated number of newly minted canonical records
 * @param clustersUpdated number of existing canonical records merged into
 * @param droppedWithoutKey raw records dropped because no dedup key was present
 */
public record ReconcileResult(List<CanonicalRecord> touched, int clustersCreated, int clustersUpdated, int droppedWithoutKey) {
    public ReconcileResult {
        touched = List.copyOf(touched);
    }
}
