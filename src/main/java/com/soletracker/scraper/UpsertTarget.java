package com.soletracker.scraper;

import java.util.Map;

/**
 * A write path of the {@link UpsertSink}.
 */
public interface UpsertTarget {

    /**
     * Writes one row, overwriting the existing row with the same natural key.
     *
     * @param table target table (the canonical namespace)
     * @param conflictKey natural key column
     * @param row column values; the key column is always present
     * @return {@link UpsertOutcome.Status#INSERTED} or {@link UpsertOutcome.Status#UPDATED}
     * @throws StoreException classified write failure
     */
    UpsertOutcome.Status write(String table, String conflictKey, Map<String, Object> row) throws StoreException;

    /** Short label used in logs. */
    String name();
}
