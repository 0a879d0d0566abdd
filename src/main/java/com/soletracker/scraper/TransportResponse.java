package com.soletracker.scraper;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Raw response of the transport layer: status, body and headers (case-insensitive lookup).
 */
public record TransportResponse(int statusCode, String body, Map<String, List<String>> headers) {

    public TransportResponse {
        Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) headers.forEach((k, v) -> { if (k != null) copy.put(k, v == null ? List.of() : List.copyOf(v)); });
        headers = copy;
        body = body == null ? "" : body;
    }

    public static TransportResponse of(int statusCode, String body) {
        return new TransportResponse(statusCode, body, Map.of());
    }

    public Optional<String> header(String name) {
        List<String> values = headers.get(name.toLowerCase(Locale.ROOT));
        return values == null || values.isEmpty() ? Optional.empty() : Optional.ofNullable(values.get(0));
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }
}
