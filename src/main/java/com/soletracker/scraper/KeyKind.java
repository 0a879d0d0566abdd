package com.soletracker.scraper;

/**
 * Kinds of dedup key, declared in grouping priority order (highest first).
 */
public enum KeyKind {
    SKU("sku"),
    NAME("name"),
    HASH("hash");

    private final String prefix;

    KeyKind(String prefix) {
        this.prefix = prefix;
    }

    /**
     * Prefix used when minting canonical ids, e.g. {@code sku::555088-134}.
     */
    public String prefix() {
        return prefix;
    }
}
