package com.soletracker.scraper;

import java.util.List;

/**
 * Read side of the backing store: the canonical records already persisted in a namespace,
 * used to seed reconciliation.
 */
public interface CanonicalStore {

    List<CanonicalRecord> readAll(String namespace) throws StoreException;
}
