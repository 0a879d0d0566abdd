package com.soletracker.sitesources;

import com.soletracker.scraper.StatusRank;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Keyword-list classifier for brand, release status, raffle and release type.
 * <p>
 * Best effort only. The keyword lists need tuning as retailers change their wording, and nothing in the
 * merge logic depends on how they are written.
 */
public final class ReleaseHeuristics {
    private ReleaseHeuristics() {}

    private static final List<String> SNEAKER_KEYWORDS = List.of(
        "jordan", "yeezy", "dunk", "air max", "air force", "boost", "sneaker", "shoe", "trainer",
        "runner", "foam", "gel-", "990", "550", "samba", "gazelle", "chuck", "old skool", "footwear"
    );

    // Checked in order: "air jordan" before "nike", "yeezy" before "adidas".
    private static final Map<String, String> BRANDS = new LinkedHashMap<>();
    static {
        BRANDS.put("jordan", "Jordan");
        BRANDS.put("nike", "Nike");
        BRANDS.put("yeezy", "Adidas");
        BRANDS.put("adidas", "Adidas");
        BRANDS.put("new balance", "New Balance");
        BRANDS.put("asics", "ASICS");
        BRANDS.put("puma", "Puma");
        BRANDS.put("reebok", "Reebok");
        BRANDS.put("converse", "Converse");
        BRANDS.put("vans", "Vans");
        BRANDS.put("saucony", "Saucony");
        BRANDS.put("salomon", "Salomon");
    }

    private static final Map<String, String> STATUS_ALIASES = Map.ofEntries(
        Map.entry("in_stock", "available"),
        Map.entry("instock", "available"),
        Map.entry("restocked", "available"),
        Map.entry("released", "live"),
        Map.entry("raffle_open", "live"),
        Map.entry("coming_soon", "upcoming"),
        Map.entry("preorder", "upcoming"),
        Map.entry("pre_order", "upcoming"),
        Map.entry("soldout", "sold_out"),
        Map.entry("out_of_stock", "sold_out"),
        Map.entry("outofstock", "sold_out"),
        Map.entry("raffle_closed", "sold_out"),
        Map.entry("closed", "sold_out")
    );

    /**
     * True when the title, product type or tags mention a sneaker keyword.
     */
    public static boolean isSneaker(String title, String productType, Collection<String> tags) {
        StringBuilder haystack = new StringBuilder();
        if (title != null) haystack.append(title).append(' ');
        if (productType != null) haystack.append(productType).append(' ');
        if (tags != null) tags.forEach(t -> haystack.append(t).append(' '));
        String text = haystack.toString().toLowerCase(Locale.ROOT);
        return SNEAKER_KEYWORDS.stream().anyMatch(text::contains);
    }

    /**
     * Brand named in the title, else the vendor mapped to its standard spelling, else the vendor as given.
     */
    public static String detectBrand(String title, String vendor) {
        String fromTitle = matchBrand(title);
        if (fromTitle != null) return fromTitle;
        String fromVendor = matchBrand(vendor);
        if (fromVendor != null) return fromVendor;
        return FieldParsers.clean(vendor);
    }

    private static String matchBrand(String text) {
        if (text == null) return null;
        String lower = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> e : BRANDS.entrySet()) {
            if (lower.contains(e.getKey())) return e.getValue();
        }
        return null;
    }

    public static boolean detectRaffle(String body, Collection<String> tags) {
        String text = body == null ? "" : body.toLowerCase(Locale.ROOT);
        if (text.contains("raffle") || text.contains(" entry") || text.contains(" draw")) return true;
        return tags != null && tags.stream().map(t -> t.toLowerCase(Locale.ROOT))
            .anyMatch(t -> t.equals("raffle") || t.equals("giveaway"));
    }

    /**
     * {@code raffle}, {@code online} or {@code in-store}; {@code null} when nothing hints at the channel.
     */
    public static String detectReleaseType(String body, Collection<String> tags, boolean raffle) {
        if (raffle) return "raffle";
        String text = body == null ? "" : body.toLowerCase(Locale.ROOT);
        List<String> lowerTags = tags == null ? List.of() : tags.stream().map(t -> t.toLowerCase(Locale.ROOT)).toList();
        if (lowerTags.contains("online") || text.contains("online")) return "online";
        if (lowerTags.contains("in-store") || text.contains("in store") || text.contains("in-store")) return "in-store";
        return null;
    }

    /**
     * Status of a retailer listing.
     *
     * @param publishedAt publish time of the listing, may be null
     * @param now time of the fetch
     * @param text title and body, used for "coming soon" wording
     * @param available whether any variant can be bought, null when unknown
     */
    public static String detectStatus(Instant publishedAt, Instant now, String text, Boolean available) {
        String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);
        if (publishedAt != null && now != null && publishedAt.isAfter(now)) return "upcoming";
        if (lower.contains("coming soon")) return "upcoming";
        if (Boolean.FALSE.equals(available)) return "sold_out";
        if (publishedAt != null || Boolean.TRUE.equals(available)) return "live";
        return "announced";
    }

    /**
     * Status of an editorial mention (news, calendars) that carries no stock information.
     */
    public static String statusFromText(String text) {
        String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);
        if (lower.contains("sold out")) return "sold_out";
        if (lower.contains("available now") || lower.contains("out now") || lower.contains("restock")) return "available";
        if (lower.contains("coming soon") || lower.contains("upcoming") || lower.contains("release date")) return "upcoming";
        return "announced";
    }

    /**
     * Maps retailer wording onto the ranked status vocabulary; unknown wording is kept in snake case.
     */
    public static String normalizeStatus(String raw) {
        String cleaned = FieldParsers.clean(raw);
        if (cleaned == null) return null;
        String key = cleaned.toLowerCase(Locale.ROOT).replaceAll("[\\s-]+", "_");
        if (StatusRank.isRecognized(key)) return key;
        return STATUS_ALIASES.getOrDefault(key, key);
    }
}
