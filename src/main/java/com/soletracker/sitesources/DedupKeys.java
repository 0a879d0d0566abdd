package com.soletracker.sitesources;

import com.soletracker.scraper.DedupKey;
import com.soletracker.scraper.RawRecord;

/**
 * Attaches dedup key candidates in priority order: style code, normalized name, content hash.
 */
final class DedupKeys {
    private DedupKeys() {}

    static RawRecord.Builder attach(RawRecord.Builder builder, String sku, String title, String url) {
        builder.key(DedupKey.sku(sku));
        String normalized = FieldParsers.normalizeName(title);
        if (!normalized.isEmpty()) builder.key(DedupKey.name(normalized));
        if (title != null || url != null) builder.key(DedupKey.hash(FieldParsers.contentHash(title, url)));
        return builder;
    }
}
