package com.soletracker.sitesources;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Normalizer variants by configuration type.
 */
public class NormalizerRegistry {
    private final Map<String, SourceNormalizer> byType = new LinkedHashMap<>();

    /**
     * Registry with the built-in variants: {@code shopify-json}, {@code generic-html} and {@code feed-xml}.
     */
    public static NormalizerRegistry defaults() {
        return new NormalizerRegistry()
            .register(new ShopifyJsonNormalizer())
            .register(new GenericHtmlNormalizer())
            .register(new FeedXmlNormalizer());
    }

    public NormalizerRegistry register(SourceNormalizer normalizer) {
        byType.put(normalizer.type().toLowerCase(Locale.ROOT), normalizer);
        return this;
    }

    public Optional<SourceNormalizer> find(String type) {
        if (type == null) return Optional.empty();
        return Optional.ofNullable(byType.get(type.trim().toLowerCase(Locale.ROOT)));
    }

    public SourceNormalizer forType(String type) {
        return find(type).orElseThrow(() -> new IllegalArgumentException(
            "No normalizer for source type '" + type + "'; known types: " + byType.keySet()));
    }

    public Set<String> types() {
        return byType.keySet();
    }
}
