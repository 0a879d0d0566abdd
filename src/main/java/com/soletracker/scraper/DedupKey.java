package com.soletracker.scraper;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * One identity candidate of a {@link RawRecord}.
 *
 * @param kind key kind (sku, name, hash)
 * @param value key material; blank values are never used for grouping
 */
public record DedupKey(KeyKind kind, String value) {

    public static DedupKey sku(String value) {
        return new DedupKey(KeyKind.SKU, value);
    }

    public static DedupKey name(String value) {
        return new DedupKey(KeyKind.NAME, value);
    }

    public static DedupKey hash(String value) {
        return new DedupKey(KeyKind.HASH, value);
    }

    public boolean isPresent() {
        return kind != null && value != null && !value.isBlank();
    }

    /**
     * Returns this key with its value in canonical form: skus trimmed and upper-cased,
     * names run through {@link #normalizeName(String)}, hashes trimmed and lower-cased.
     */
    public DedupKey canonical() {
        if (!isPresent()) return this;
        return switch (kind) {
            case SKU -> new DedupKey(kind, value.trim().toUpperCase(Locale.ROOT));
            case NAME -> new DedupKey(kind, normalizeName(value));
            case HASH -> new DedupKey(kind, value.trim().toLowerCase(Locale.ROOT));
        };
    }

    /**
     * Lower-cases, collapses every run of non-alphanumerics into one space and trims.
     * @param name free-text product name (may be null)
     * @return normalized name, empty when nothing alphanumeric remains
     */
    public static String normalizeName(String name) {
        if (name == null) return "";
        return NON_ALNUM.matcher(name.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");
}
