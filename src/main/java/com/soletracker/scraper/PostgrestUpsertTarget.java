package com.soletracker.scraper;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Primary write path against a PostgREST endpoint (as exposed by Supabase).
 * <p>
 * An upsert is a {@code PATCH ?key=eq.value} returning the matched rows, followed by a {@code POST} when nothing
 * matched. Status codes map onto {@link ErrorKind}: 401/403 are {@code AUTH_ERROR}, 404 (unknown table) is
 * {@code NOT_FOUND}, other 4xx are {@code PERSISTENCE_ERROR} and 5xx or I/O failures are {@code TRANSPORT_ERROR}.
 * Also serves as a {@link CanonicalStore} by reading whole tables.
 *
 * @author Sole Tracker Ingest Team
 * @since 1.0
 */
public class PostgrestUpsertTarget implements UpsertTarget, CanonicalStore {
    private static final Logger logger = LoggerFactory.getLogger(PostgrestUpsertTarget.class);

    private final HttpClient client;
    private final String baseUrl;
    private final String apiKey;
    private final Duration timeout;

    public PostgrestUpsertTarget(String baseUrl, String apiKey) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(15)).build(), baseUrl, apiKey, Duration.ofSeconds(30));
    }

    public PostgrestUpsertTarget(HttpClient client, String baseUrl, String apiKey, Duration timeout) {
        if (baseUrl == null || baseUrl.isBlank()) throw new IllegalArgumentException("PostgREST base URL is required");
        this.client = client;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey == null ? "" : apiKey;
        this.timeout = timeout;
    }

    @Override
    public String name() {
        return "postgrest";
    }

    @Override
    public UpsertOutcome.Status write(String table, String conflictKey, Map<String, Object> row) throws StoreException {
        String body = CanonicalRecordCodec.toJson(row);
        String key = String.valueOf(row.get(conflictKey));
        String filter = "?" + encode(conflictKey) + "=eq." + encode(key);

        HttpResponse<String> patched = send(request(table + filter)
            .header("Prefer", "return=representation")
            .method("PATCH", HttpRequest.BodyPublishers.ofString(body)));
        check(patched, "PATCH", table);
        JsonNode matched = CanonicalRecordCodec.readTree(patched.body());
        if (matched.isArray() && matched.size() > 0) {
            logger.debug("Updated {}={} in {}", conflictKey, key, table);
            return UpsertOutcome.Status.UPDATED;
        }

        HttpResponse<String> posted = send(request(table)
            .header("Prefer", "return=minimal")
            .POST(HttpRequest.BodyPublishers.ofString(body)));
        check(posted, "POST", table);
        logger.debug("Inserted {}={} into {}", conflictKey, key, table);
        return UpsertOutcome.Status.INSERTED;
    }

    @Override
    public List<CanonicalRecord> readAll(String namespace) throws StoreException {
        HttpResponse<String> response = send(request(namespace + "?select=id,fields,field_provenance,contributing_sources,merged_at").GET());
        check(response, "GET", namespace);
        JsonNode rows = CanonicalRecordCodec.readTree(response.body());
        List<CanonicalRecord> records = new ArrayList<>();
        if (rows.isArray()) {
            for (JsonNode row : rows) {
                String id = row.path("id").asText(null);
                if (id == null || id.isBlank()) continue;
                String mergedAt = row.path("merged_at").asText(null);
                records.add(CanonicalRecordCodec.decode(id, row.get("fields"), row.get("field_provenance"),
                    row.get("contributing_sources"), parseTimestamp(mergedAt)));
            }
        }
        logger.info("Read {} canonical records from {}", records.size(), namespace);
        return records;
    }

    private HttpRequest.Builder request(String pathAndQuery) {
        return HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + "/" + pathAndQuery))
            .timeout(timeout)
            .header("apikey", apiKey)
            .header("Authorization", "Bearer " + apiKey)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json");
    }

    private HttpResponse<String> send(HttpRequest.Builder builder) throws StoreException {
        try {
            return client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new StoreException(ErrorKind.TRANSPORT_ERROR, "PostgREST request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreException(ErrorKind.TIMEOUT, "Interrupted during PostgREST request", e);
        }
    }

    private static void check(HttpResponse<String> response, String method, String table) throws StoreException {
        int status = response.statusCode();
        if (status >= 200 && status < 300) return;
        String detail = method + " " + table + " returned HTTP " + status + ": " + abbreviate(response.body());
        if (status == 401 || status == 403) throw new StoreException(ErrorKind.AUTH_ERROR, detail);
        if (status == 404) throw new StoreException(ErrorKind.NOT_FOUND, detail);
        if (status >= 500) throw new StoreException(ErrorKind.TRANSPORT_ERROR, detail);
        throw new StoreException(ErrorKind.PERSISTENCE_ERROR, detail);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }

    private static Instant parseTimestamp(String text) {
        if (text == null || text.isBlank()) return null;
        try {
            return java.time.OffsetDateTime.parse(text).toInstant();
        } catch (java.time.format.DateTimeParseException e) {
            logger.debug("Unparsable merged_at '{}'", text);
            return null;
        }
    }
}
