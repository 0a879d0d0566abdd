package com.soletracker.sitesources;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.soletracker.scraper.RawRecord;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Normalizer for Shopify storefronts' public {@code /products.json}.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Skips products whose title, type and tags carry no sneaker keyword (counted as skipped, not failed).</li>
 *   <li>Takes the style code from the first variant's SKU, then from the title, then the raw SKU. The description is never searched for one.</li>
 *   <li>Derives status, raffle flag and release type from {@code published_at}, availability, tags and body text.</li>
 * </ul>
 *
 * @author Sole Tracker Ingest Team
 * @since 1.0
 */
public class ShopifyJsonNormalizer implements SourceNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(ShopifyJsonNormalizer.class);

    private static final int DESCRIPTION_LIMIT = 1000;

    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public String type() {
        return "shopify-json";
    }

    @Override
    public NormalizationResult normalize(String payload, SourceContext context) throws NormalizationException {
        JsonNode root;
        try {
            root = mapper.readTree(payload == null ? "" : payload);
        } catch (JsonProcessingException e) {
            throw new NormalizationException("Shopify payload from " + context.pageUrl() + " is not JSON: " + e.getOriginalMessage(), e);
        }
        JsonNode products = root == null ? null : root.get("products");
        if (products == null || !products.isArray()) {
            throw new NormalizationException("Shopify payload from " + context.pageUrl() + " has no products array");
        }

        List<RawRecord> records = new ArrayList<>();
        int failed = 0;
        int skipped = 0;
        for (JsonNode product : products) {
            try {
                RawRecord record = normalizeProduct(product, context);
                if (record == null) {
                    skipped++;
                } else {
                    records.add(record);
                }
            } catch (NormalizationException e) {
                failed++;
                logger.warn("Skipping product from {}: {}", context.sourceId(), e.getMessage());
            }
        }
        logger.info("{}: normalized {} products ({} skipped, {} failed)", context.sourceId(), records.size(), skipped, failed);
        return new NormalizationResult(records, failed, skipped);
    }

    /**
     * @return the record, or {@code null} when the product is not a sneaker
     */
    RawRecord normalizeProduct(JsonNode product, SourceContext context) throws NormalizationException {
        if (product == null || !product.isObject()) throw new NormalizationException("product entry is not an object");
        String title = FieldParsers.clean(product.path("title").asText(null));
        String handle = FieldParsers.clean(product.path("handle").asText(null));
        if (title == null && handle == null) throw new NormalizationException("product has neither title nor handle");

        List<String> tags = tags(product.get("tags"));
        String productType = product.path("product_type").asText(null);
        if (!ReleaseHeuristics.isSneaker(title, productType, tags)) return null;

        String bodyHtml = product.path("body_html").asText("");
        String bodyText = FieldParsers.clean(Jsoup.parse(bodyHtml).text());
        String description = bodyText != null && bodyText.length() > DESCRIPTION_LIMIT
            ? bodyText.substring(0, DESCRIPTION_LIMIT) : bodyText;

        JsonNode variants = product.path("variants");
        JsonNode first = variants.isArray() && variants.size() > 0 ? variants.get(0) : null;
        String variantSku = first == null ? null : FieldParsers.clean(first.path("sku").asText(null));
        String sku = FieldParsers.styleCodeFromSkuField(variantSku)
            .or(() -> FieldParsers.extractStyleCode(title))
            .orElse(variantSku);
        Double price = first == null ? null : FieldParsers.parsePrice(first.path("price").asText(null));
        Boolean available = null;
        if (variants.isArray() && variants.size() > 0) {
            available = false;
            for (JsonNode v : variants) {
                if (v.path("available").asBoolean(false)) available = true;
            }
        }

        List<String> images = new ArrayList<>();
        for (JsonNode image : product.path("images")) {
            String src = FieldParsers.clean(image.path("src").asText(null));
            if (src != null && !images.contains(src)) images.add(src);
        }

        String origin = context.origin();
        String url = handle == null ? (origin.isEmpty() ? null : origin) : origin + "/products/" + handle;
        Instant publishedAt = FieldParsers.parseTimestamp(product.path("published_at").asText(null));
        boolean raffle = ReleaseHeuristics.detectRaffle(bodyHtml, tags);
        String text = (title == null ? "" : title) + " " + (description == null ? "" : description);

        RawRecord.Builder builder = RawRecord.builder(context.sourceId(), context.fetchedAt())
            .field("name", title)
            .field("brand", ReleaseHeuristics.detectBrand(title, product.path("vendor").asText(null)))
            .field("sku", sku == null ? null : sku.toUpperCase(Locale.ROOT))
            .field("url", url)
            .field("image_url", images.isEmpty() ? null : images.get(0))
            .field("images", images)
            .field("description", description)
            .field("price", price)
            .field("release_date", publishedAt == null ? null : publishedAt.atZone(ZoneOffset.UTC).toLocalDate())
            .field("published_at", publishedAt)
            .field("status", ReleaseHeuristics.detectStatus(publishedAt, context.fetchedAt(), text, available))
            .field("release_type", ReleaseHeuristics.detectReleaseType(bodyHtml, tags, raffle))
            .field("is_raffle", raffle)
            .field("tags", tags)
            .field("sources", List.of(context.sourceId()));
        return DedupKeys.attach(builder, sku, title, url).build();
    }

    /**
     * Shopify returns tags as an array on newer storefronts and as a comma-separated string on older ones.
     */
    private static List<String> tags(JsonNode node) {
        List<String> tags = new ArrayList<>();
        if (node == null || node.isNull()) return tags;
        if (node.isArray()) {
            node.forEach(t -> { String c = FieldParsers.clean(t.asText(null)); if (c != null) tags.add(c); });
        } else {
            Arrays.stream(node.asText("").split(",")).map(FieldParsers::clean).filter(Objects::nonNull).forEach(tags::add);
        }
        return tags;
    }
}
