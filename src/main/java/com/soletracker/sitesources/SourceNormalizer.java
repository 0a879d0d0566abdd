package com.soletracker.sitesources;

/**
 * Turns the raw payload of one source family into {@link com.soletracker.scraper.RawRecord}s.
 * <p>
 * Implementations tolerate missing fields (absent data stays absent), always attach a dedup key
 * (style code, else normalized name, else content hash) and count per-item failures instead of
 * failing the payload.
 */
public interface SourceNormalizer {

    /**
     * Configuration tag selecting this variant, e.g. {@code shopify-json}.
     */
    String type();

    /**
     * @param payload fetched document
     * @param context source and fetch details
     * @return records plus failed and skipped counts
     * @throws NormalizationException when the payload as a whole is unreadable
     */
    NormalizationResult normalize(String payload, SourceContext context) throws NormalizationException;
}
