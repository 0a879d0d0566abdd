package com.soletracker.sitesources;

import com.rometools.rome.feed.synd.SyndCategory;
import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEnclosure;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import com.soletracker.scraper.RawRecord;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.StringReader;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Locale;

/**
 * Normalizer for RSS and Atom feeds of sneaker news and release-calendar publishers.
 * <p>
 * Each entry becomes one record: title, link, publish time, categories as tags, and the first image found in an
 * image enclosure or in the entry's HTML. A release date is picked out of the entry text and a style code out of the title, when present.
 */
public class FeedXmlNormalizer implements SourceNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(FeedXmlNormalizer.class);

    private static final int DESCRIPTION_LIMIT = 1000;

    @Override
    public String type() {
        return "feed-xml";
    }

    @Override
    public NormalizationResult normalize(String payload, SourceContext context) throws NormalizationException {
        if (payload == null || payload.isBlank()) {
            throw new NormalizationException("Empty feed payload from " + context.pageUrl());
        }
        SyndFeed feed;
        try {
            SyndFeedInput input = new SyndFeedInput();
            feed = input.build(new StringReader(payload));
        } catch (FeedException | IllegalArgumentException e) {
            throw new NormalizationException("Unreadable feed from " + context.pageUrl() + ": " + e.getMessage(), e);
        }

        List<RawRecord> records = new ArrayList<>();
        int failed = 0;
        for (SyndEntry entry : feed.getEntries()) {
            try {
                records.add(fromEntry(entry, context));
            } catch (NormalizationException e) {
                failed++;
                logger.warn("Skipping feed entry from {}: {}", context.sourceId(), e.getMessage());
            }
        }
        logger.info("{}: normalized {} feed entries ({} failed)", context.sourceId(), records.size(), failed);
        return new NormalizationResult(records, failed, 0);
    }

    private RawRecord fromEntry(SyndEntry entry, SourceContext context) throws NormalizationException {
        String title = FieldParsers.clean(entry.getTitle());
        String link = FieldParsers.clean(entry.getLink());
        if (link == null) link = FieldParsers.clean(entry.getUri());
        if (title == null && link == null) throw new NormalizationException("entry has neither title nor link");

        String html = entryHtml(entry);
        Document body = Jsoup.parse(html, link == null ? "" : link);
        String text = FieldParsers.clean(body.text());
        String description = text != null && text.length() > DESCRIPTION_LIMIT ? text.substring(0, DESCRIPTION_LIMIT) : text;

        Date published = entry.getPublishedDate() != null ? entry.getPublishedDate() : entry.getUpdatedDate();
        Instant publishedAt = published == null ? null : published.toInstant();
        String fullText = (title == null ? "" : title) + " " + (text == null ? "" : text);
        LocalDate releaseDate = FieldParsers.findDateInText(fullText);
        String sku = FieldParsers.extractStyleCode(title).orElse(null);

        List<String> tags = new ArrayList<>();
        for (SyndCategory category : entry.getCategories()) {
            String name = FieldParsers.clean(category.getName());
            if (name != null && !tags.contains(name)) tags.add(name);
        }
        String image = enclosureImage(entry);
        if (image == null) {
            Element img = body.selectFirst("img[src]");
            if (img != null) image = FieldParsers.clean(img.absUrl("src").isEmpty() ? img.attr("src") : img.absUrl("src"));
        }
        boolean raffle = ReleaseHeuristics.detectRaffle(fullText, tags);

        RawRecord.Builder builder = RawRecord.builder(context.sourceId(), context.fetchedAt())
            .field("name", title)
            .field("brand", ReleaseHeuristics.detectBrand(title, null))
            .field("sku", sku)
            .field("url", link)
            .field("image_url", image)
            .field("images", image == null ? List.of() : List.of(image))
            .field("description", description)
            .field("release_date", releaseDate)
            .field("published_at", publishedAt)
            .field("status", ReleaseHeuristics.statusFromText(fullText))
            .field("release_type", ReleaseHeuristics.detectReleaseType(fullText, tags, raffle))
            .field("is_raffle", raffle)
            .field("tags", tags)
            .field("sources", List.of(context.sourceId()));
        return DedupKeys.attach(builder, sku, title, link).build();
    }

    private static String entryHtml(SyndEntry entry) {
        StringBuilder html = new StringBuilder();
        if (entry.getDescription() != null && entry.getDescription().getValue() != null) {
            html.append(entry.getDescription().getValue());
        }
        for (SyndContent content : entry.getContents()) {
            if (content.getValue() != null) html.append(' ').append(content.getValue());
        }
        return html.toString();
    }

    private static String enclosureImage(SyndEntry entry) {
        for (SyndEnclosure enclosure : entry.getEnclosures()) {
            String type = enclosure.getType() == null ? "" : enclosure.getType().toLowerCase(Locale.ROOT);
            if (type.startsWith("image/") && enclosure.getUrl() != null) return FieldParsers.clean(enclosure.getUrl());
        }
        return null;
    }
}
