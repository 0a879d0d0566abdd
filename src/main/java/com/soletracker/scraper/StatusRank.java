package com.soletracker.scraper;

import java.util.Locale;
import java.util.Map;

/**
 * Explicit rank table for the release {@code status} field.
 * Unrecognized statuses rank 0 and never override a recognized one.
 */
public final class StatusRank {
    private StatusRank() {}

    private static final Map<String, Integer> RANKS = Map.of(
        "live", 3,
        "available", 3,
        "upcoming", 2,
        "announced", 1,
        "sold_out", 0
    );

    public static int rank(String status) {
        if (status == null) return 0;
        return RANKS.getOrDefault(status.toLowerCase(Locale.ROOT), 0);
    }

    public static boolean isRecognized(String status) {
        return status != null && RANKS.containsKey(status.toLowerCase(Locale.ROOT));
    }
}
