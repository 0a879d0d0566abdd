package com.soletracker.sitesources;

import com.soletracker.scraper.DedupKey;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pure parsing helpers shared by the normalizers. Every parser returns {@code null} (or empty)
 * for input it cannot read; none of them substitutes a placeholder such as {@code 0} or {@code "Unknown"}.
 */
public final class FieldParsers {
    private FieldParsers() {}

    /** Nike-style codes such as {@code DZ5485-612}. */
    private static final Pattern NIKE_STYLE = Pattern.compile("\\b[A-Z0-9]{6}-[0-9]{3}\\b");
    /** Adidas-style codes such as {@code GW1234}; season codes like {@code FW2024} are not style codes. */
    private static final Pattern ADIDAS_STYLE = Pattern.compile("\\b[A-Z]{2}(?!(?:19|20)[0-9]{2}\\b)[0-9]{4}\\b");

    private static final Pattern NUMBER = Pattern.compile("-?\\d[\\d.,\\s]*");

    private static final Pattern TEXT_DATE = Pattern.compile(
        "\\b(Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Sept|Oct|Nov|Dec)[a-z]*\\.?\\s+(\\d{1,2})(?:st|nd|rd|th)?,?\\s+(\\d{4})\\b",
        Pattern.CASE_INSENSITIVE);

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
        DateTimeFormatter.ISO_LOCAL_DATE,
        DateTimeFormatter.ofPattern("yyyy/MM/dd", Locale.ROOT),
        DateTimeFormatter.ofPattern("MM/dd/yyyy", Locale.ROOT),
        DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH),
        DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.ENGLISH),
        DateTimeFormatter.ofPattern("MMMM d yyyy", Locale.ENGLISH),
        DateTimeFormatter.ofPattern("MMM d yyyy", Locale.ENGLISH),
        DateTimeFormatter.ofPattern("d MMMM yyyy", Locale.ENGLISH),
        DateTimeFormatter.ofPattern("d MMM yyyy", Locale.ENGLISH)
    );

    /**
     * Trims and collapses whitespace; blank input gives {@code null}.
     */
    public static String clean(String text) {
        if (text == null) return null;
        String collapsed = text.replaceAll("\\s+", " ").trim();
        return collapsed.isEmpty() ? null : collapsed;
    }

    /**
     * Parses a price from free text such as {@code "$1,299.99"}, {@code "€ 189,95"} or {@code "USD 220"}.
     * @return the amount, or {@code null} when no number is present (zero stays a valid price)
     */
    public static Double parsePrice(String text) {
        if (text == null) return null;
        Matcher m = NUMBER.matcher(text);
        if (!m.find()) return null;
        String raw = m.group().replaceAll("\\s", "");
        while (!raw.isEmpty() && (raw.endsWith(".") || raw.endsWith(","))) raw = raw.substring(0, raw.length() - 1);
        int lastDot = raw.lastIndexOf('.');
        int lastComma = raw.lastIndexOf(',');
        String normalized;
        if (lastDot >= 0 && lastComma >= 0) {
            normalized = lastComma > lastDot
                ? raw.replace(".", "").replace(',', '.')
                : raw.replace(",", "");
        } else if (lastComma >= 0) {
            int decimals = raw.length() - lastComma - 1;
            boolean singleComma = raw.indexOf(',') == lastComma;
            normalized = singleComma && decimals > 0 && decimals <= 2 ? raw.replace(',', '.') : raw.replace(",", "");
        } else if (lastDot >= 0 && raw.indexOf('.') != lastDot) {
            normalized = raw.replace(".", "");
        } else {
            normalized = raw;
        }
        try {
            return Double.parseDouble(normalized);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Lower-cased name with non-alphanumeric runs collapsed to single spaces.
     */
    public static String normalizeName(String name) {
        return DedupKey.normalizeName(name);
    }

    /**
     * Parses a calendar date from ISO dates, ISO timestamps or common English forms
     * ({@code March 15, 2025}, {@code 15 Mar 2025}, {@code 03/15/2025}).
     */
    public static LocalDate parseDate(String text) {
        String t = clean(text);
        if (t == null) return null;
        Instant instant = parseTimestamp(t);
        if (instant != null) return instant.atZone(ZoneOffset.UTC).toLocalDate();
        String candidate = t.replaceAll("(\\d)(st|nd|rd|th)\\b", "$1");
        for (DateTimeFormatter format : DATE_FORMATS) {
            LocalDate date = tryParse(candidate, format);
            if (date != null) return date;
        }
        return null;
    }

    private static LocalDate tryParse(String text, DateTimeFormatter format) {
        try {
            return LocalDate.parse(text, format);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Parses an instant from ISO-8601 ({@code 2025-03-15T10:00:00Z}, with offset, or local date-time taken as UTC)
     * or RFC 1123.
     */
    public static Instant parseTimestamp(String text) {
        String t = clean(text);
        if (t == null) return null;
        try {
            return OffsetDateTime.parse(t).toInstant();
        } catch (DateTimeParseException notOffset) {
            try {
                return LocalDateTime.parse(t).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException notLocal) {
                try {
                    return ZonedDateTime.parse(t, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
                } catch (DateTimeParseException notRfc) {
                    return null;
                }
            }
        }
    }

    /**
     * First English month-day-year date mentioned in running text, e.g. "drops March 15th, 2025".
     */
    public static LocalDate findDateInText(String text) {
        if (text == null) return null;
        Matcher m = TEXT_DATE.matcher(text);
        while (m.find()) {
            LocalDate date = parseDate(m.group(1) + " " + m.group(2) + ", " + m.group(3));
            if (date != null) return date;
        }
        return null;
    }

    /**
     * Manufacturer style code written as such in a title, matched in its original casing; Nike-style codes are
     * preferred. Use {@link #styleCodeFromSkuField} for values taken from a dedicated SKU field.
     */
    public static Optional<String> extractStyleCode(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        Matcher nike = NIKE_STYLE.matcher(text);
        if (nike.find()) return Optional.of(nike.group());
        Matcher adidas = ADIDAS_STYLE.matcher(text);
        if (adidas.find()) return Optional.of(adidas.group());
        return Optional.empty();
    }

    /**
     * Style code inside a dedicated SKU value such as {@code dz5485-612-9} or {@code Style: DD1391-100}, upper-cased.
     */
    public static Optional<String> styleCodeFromSkuField(String sku) {
        if (sku == null || sku.isBlank()) return Optional.empty();
        return extractStyleCode(sku.toUpperCase(Locale.ROOT));
    }

    /**
     * Last-resort identity: SHA-1 hex of the normalized title and the trimmed URL.
     */
    public static String contentHash(String title, String url) {
        String material = (title == null ? "" : normalizeName(title)) + "|" + (url == null ? "" : url.trim());
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
