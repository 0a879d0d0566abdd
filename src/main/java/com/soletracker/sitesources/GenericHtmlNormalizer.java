package com.soletracker.sitesources;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.soletracker.scraper.RawRecord;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jsoup.select.Selector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Normalizer for plain retailer and release-calendar pages, driven by the CSS selectors of the source.
 * <p>
 * Selector keys: {@code item} (one element per product), and inside it {@code title}, {@code link}, {@code date},
 * {@code image}, {@code price}, {@code sku}, {@code excerpt} and {@code status}. When {@code item} is not configured
 * or matches nothing, products are read from schema.org {@code Product} blocks in JSON-LD scripts instead.
 *
 * @author Sole Tracker Ingest Team
 * @since 1.0
 */
public class GenericHtmlNormalizer implements SourceNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(GenericHtmlNormalizer.class);

    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public String type() {
        return "generic-html";
    }

    @Override
    public NormalizationResult normalize(String payload, SourceContext context) throws NormalizationException {
        if (payload == null || payload.isBlank()) {
            throw new NormalizationException("Empty HTML payload from " + context.pageUrl());
        }
        Document doc = Jsoup.parse(payload, context.pageUrl() == null ? "" : context.pageUrl());

        Elements items = new Elements();
        String itemSelector = context.selector("item");
        if (itemSelector != null) {
            try {
                items = doc.select(itemSelector);
            } catch (Selector.SelectorParseException e) {
                throw new NormalizationException("Invalid item selector '" + itemSelector + "' for " + context.sourceId(), e);
            }
        }
        if (items.isEmpty()) {
            NormalizationResult fromJsonLd = fromJsonLd(doc, context);
            logger.info("{}: no item elements on {}, read {} products from JSON-LD", context.sourceId(),
                context.pageUrl(), fromJsonLd.records().size());
            return fromJsonLd;
        }

        List<RawRecord> records = new ArrayList<>();
        int failed = 0;
        for (Element item : items) {
            try {
                records.add(fromElement(item, context));
            } catch (NormalizationException | Selector.SelectorParseException e) {
                failed++;
                logger.warn("Skipping item from {}: {}", context.sourceId(), e.getMessage());
            }
        }
        logger.info("{}: normalized {} items from {} ({} failed)", context.sourceId(), records.size(), context.pageUrl(), failed);
        return new NormalizationResult(records, failed, 0);
    }

    private RawRecord fromElement(Element item, SourceContext context) throws NormalizationException {
        String title = text(item, context.selector("title"));
        String url = link(item, context.selector("link"));
        if (title == null && url == null) throw new NormalizationException("item has neither title nor link");

        String excerpt = text(item, context.selector("excerpt"));
        String dateText = attrOrText(item, context.selector("date"), "datetime");
        LocalDate releaseDate = FieldParsers.parseDate(dateText);
        if (releaseDate == null) releaseDate = FieldParsers.findDateInText(excerpt);
        String skuText = text(item, context.selector("sku"));
        String sku = FieldParsers.styleCodeFromSkuField(skuText)
            .or(() -> FieldParsers.extractStyleCode(title))
            .orElse(skuText == null ? null : skuText.toUpperCase(Locale.ROOT));
        String image = image(item, context.selector("image"));
        String statusText = text(item, context.selector("status"));
        String fullText = (title == null ? "" : title) + " " + (excerpt == null ? "" : excerpt);
        String status = statusText != null
            ? ReleaseHeuristics.normalizeStatus(statusText)
            : ReleaseHeuristics.statusFromText(fullText);
        boolean raffle = ReleaseHeuristics.detectRaffle(fullText, List.of());

        RawRecord.Builder builder = RawRecord.builder(context.sourceId(), context.fetchedAt())
            .field("name", title)
            .field("brand", ReleaseHeuristics.detectBrand(title, null))
            .field("sku", sku)
            .field("url", url)
            .field("image_url", image)
            .field("images", image == null ? List.of() : List.of(image))
            .field("description", excerpt)
            .field("price", FieldParsers.parsePrice(text(item, context.selector("price"))))
            .field("release_date", releaseDate)
            .field("status", status)
            .field("release_type", ReleaseHeuristics.detectReleaseType(fullText, List.of(), raffle))
            .field("is_raffle", raffle)
            .field("sources", List.of(context.sourceId()));
        return DedupKeys.attach(builder, sku, title, url).build();
    }

    private NormalizationResult fromJsonLd(Document doc, SourceContext context) {
        List<RawRecord> records = new ArrayList<>();
        int failed = 0;
        for (Element script : doc.select("script[type=application/ld+json]")) {
            JsonNode root;
            try {
                root = mapper.readTree(script.data());
            } catch (JsonProcessingException e) {
                failed++;
                logger.warn("Unreadable JSON-LD block on {}: {}", context.pageUrl(), e.getOriginalMessage());
                continue;
            }
            List<JsonNode> products = new ArrayList<>();
            collectProducts(root, products);
            for (JsonNode product : products) {
                RawRecord record = fromProduct(product, doc, context);
                if (record == null) failed++;
                else records.add(record);
            }
        }
        return new NormalizationResult(records, failed, 0);
    }

    private static void collectProducts(JsonNode node, List<JsonNode> out) {
        if (node == null) return;
        if (node.isArray()) {
            node.forEach(n -> collectProducts(n, out));
            return;
        }
        if (!node.isObject()) return;
        JsonNode type = node.get("@type");
        boolean isProduct = type != null && (type.isTextual() && type.asText().equalsIgnoreCase("Product")
            || type.isArray() && type.toString().toLowerCase(Locale.ROOT).contains("\"product\""));
        if (isProduct) out.add(node);
        if (node.has("@graph")) collectProducts(node.get("@graph"), out);
    }

    private static RawRecord fromProduct(JsonNode product, Document doc, SourceContext context) {
        String title = FieldParsers.clean(product.path("name").asText(null));
        String url = FieldParsers.clean(product.path("url").asText(null));
        if (url == null) url = FieldParsers.clean(context.pageUrl());
        else url = doc.baseUri().isEmpty() ? url : absolute(doc, url);
        if (title == null && url == null) return null;

        String skuText = FieldParsers.clean(product.path("sku").asText(product.path("mpn").asText(null)));
        String sku = FieldParsers.styleCodeFromSkuField(skuText).orElse(skuText == null ? null : skuText.toUpperCase(Locale.ROOT));
        JsonNode brandNode = product.path("brand");
        String brand = brandNode.isObject() ? brandNode.path("name").asText(null) : brandNode.asText(null);

        List<String> images = new ArrayList<>();
        JsonNode imageNode = product.path("image");
        if (imageNode.isArray()) imageNode.forEach(i -> addImage(images, i));
        else addImage(images, imageNode);

        JsonNode offers = product.path("offers");
        JsonNode offer = offers.isArray() ? offers.path(0) : offers;
        Double price = offer.has("price") ? FieldParsers.parsePrice(offer.path("price").asText())
            : offer.has("lowPrice") ? FieldParsers.parsePrice(offer.path("lowPrice").asText()) : null;
        String availability = offer.path("availability").asText("");
        String status = availabilityStatus(availability);
        LocalDate releaseDate = FieldParsers.parseDate(product.path("releaseDate").asText(null));
        String description = FieldParsers.clean(product.path("description").asText(null));

        RawRecord.Builder builder = RawRecord.builder(context.sourceId(), context.fetchedAt())
            .field("name", title)
            .field("brand", ReleaseHeuristics.detectBrand(title, brand))
            .field("sku", sku)
            .field("url", url)
            .field("image_url", images.isEmpty() ? null : images.get(0))
            .field("images", images)
            .field("description", description)
            .field("price", price)
            .field("currency", FieldParsers.clean(offer.path("priceCurrency").asText(null)))
            .field("release_date", releaseDate)
            .field("status", status)
            .field("sources", List.of(context.sourceId()));
        return DedupKeys.attach(builder, sku, title, url).build();
    }

    private static void addImage(List<String> images, JsonNode node) {
        String src = node.isObject() ? node.path("url").asText(null) : node.asText(null);
        String cleaned = FieldParsers.clean(src);
        if (cleaned != null && !images.contains(cleaned)) images.add(cleaned);
    }

    /**
     * schema.org availability URIs to the ranked status vocabulary.
     */
    static String availabilityStatus(String availability) {
        String a = availability.toLowerCase(Locale.ROOT);
        if (a.isEmpty()) return null;
        if (a.endsWith("instock") || a.endsWith("limitedavailability") || a.endsWith("onlineonly")) return "available";
        if (a.endsWith("preorder") || a.endsWith("presale")) return "upcoming";
        if (a.endsWith("outofstock") || a.endsWith("soldout") || a.endsWith("discontinued")) return "sold_out";
        return ReleaseHeuristics.normalizeStatus(a.substring(a.lastIndexOf('/') + 1));
    }

    private static String absolute(Document doc, String href) {
        Element anchor = doc.createElement("a").attr("href", href);
        String abs = anchor.absUrl("href");
        return abs.isEmpty() ? href : abs;
    }

    private static String text(Element item, String selector) {
        if (selector == null) return null;
        Element el = item.selectFirst(selector);
        return el == null ? null : FieldParsers.clean(el.text());
    }

    private static String attrOrText(Element item, String selector, String attr) {
        if (selector == null) return null;
        Element el = item.selectFirst(selector);
        if (el == null) return null;
        String value = FieldParsers.clean(el.attr(attr));
        return value != null ? value : FieldParsers.clean(el.text());
    }

    private static String link(Element item, String selector) {
        Element el = selector == null ? item.selectFirst("a[href]") : item.selectFirst(selector);
        if (el == null) return null;
        if (!el.hasAttr("href")) {
            Element inner = el.selectFirst("a[href]");
            if (inner == null) return null;
            el = inner;
        }
        String abs = el.absUrl("href");
        return FieldParsers.clean(abs.isEmpty() ? el.attr("href") : abs);
    }

    private static String image(Element item, String selector) {
        Element el = selector == null ? item.selectFirst("img") : item.selectFirst(selector);
        if (el == null) return null;
        for (String attr : List.of("src", "data-src", "data-original")) {
            if (el.hasAttr(attr)) {
                String abs = el.absUrl(attr);
                String value = FieldParsers.clean(abs.isEmpty() ? el.attr(attr) : abs);
                if (value != null && !value.startsWith("data:")) return value;
            }
        }
        return null;
    }
}
