package com.soletracker.scraper;

/**
 * PostgreSQL operations used by the pipeline: schema setup, reading canonical namespaces, the direct write path
 * (this interface's own {@link UpsertTarget#write}), the native {@code ON CONFLICT} upsert path and run statistics.
 */
public interface PostgresServiceInterface extends CanonicalStore, UpsertTarget {

    /**
     * Creates the canonical table of a namespace and the {@code scrape_runs} table if they don't already exist.
     * @param namespace canonical namespace, used as the table name
     * @param conflictKey natural key column; a unique index is created when it is not {@code id}
     * @throws StoreException if the schema cannot be created
     */
    void createTables(String namespace, String conflictKey) throws StoreException;

    /**
     * Write path using the database's native upsert ({@code INSERT ... ON CONFLICT ... DO UPDATE}).
     */
    UpsertTarget nativeUpsert();

    /**
     * Persists the statistics of a finished run.
     * @param stats run statistics
     * @throws StoreException if the insert fails
     */
    void insertRunStats(RunStats stats) throws StoreException;
}
