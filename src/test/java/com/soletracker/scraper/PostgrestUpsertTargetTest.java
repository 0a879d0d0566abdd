package com.soletracker.scraper;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the PostgREST target against a small in-process HTTP server that mimics the table endpoints.
 */
public class PostgrestUpsertTargetTest {

    private static final String API_KEY = "service-key";

    private HttpServer server;
    private final Map<String, JsonNode> rows = new LinkedHashMap<>();
    private final List<String> requests = new ArrayList<>();
    private PostgrestUpsertTarget target;

    @BeforeEach
    public void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/sneakers", this::handleTable);
        server.createContext("/missing", exchange -> respond(exchange, 404, "{\"message\":\"relation does not exist\"}"));
        server.start();
        target = new PostgrestUpsertTarget("http://127.0.0.1:" + server.getAddress().getPort() + "/", API_KEY);
    }

    @AfterEach
    public void tearDown() {
        server.stop(0);
    }

    private void handleTable(HttpExchange exchange) throws IOException {
        String method = exchange.getRequestMethod();
        requests.add(method + " " + exchange.getRequestURI());
        if (!API_KEY.equals(exchange.getRequestHeaders().getFirst("apikey"))) {
            respond(exchange, 401, "{\"message\":\"JWT invalid\"}");
            return;
        }
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        String query = exchange.getRequestURI().getRawQuery();
        switch (method) {
            case "PATCH" -> {
                String id = URLDecoder.decode(query.substring("id=eq.".length()), StandardCharsets.UTF_8);
                ArrayNode matched = CanonicalRecordCodec.mapper().createArrayNode();
                if (rows.containsKey(id)) {
                    JsonNode row = CanonicalRecordCodec.mapper().readTree(body);
                    rows.put(id, row);
                    matched.add(row);
                }
                respond(exchange, 200, matched.toString());
            }
            case "POST" -> {
                JsonNode row = CanonicalRecordCodec.mapper().readTree(body);
                rows.put(row.get("id").asText(), row);
                respond(exchange, 201, "");
            }
            case "GET" -> {
                ArrayNode all = CanonicalRecordCodec.mapper().createArrayNode();
                rows.values().forEach(all::add);
                respond(exchange, 200, all.toString());
            }
            default -> respond(exchange, 405, "");
        }
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        }
        exchange.close();
    }

    private static CanonicalRecord record() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("name", "Nike Dunk Low Panda");
        fields.put("price", 110.0);
        fields.put("release_date", LocalDate.parse("2025-03-15"));
        fields.put("images", List.of("https://img/1.jpg"));
        Map<String, FieldProvenance> provenance = Map.of("price",
            new FieldProvenance("kith", 2.0, Instant.parse("2025-03-01T08:00:00Z")));
        return CanonicalRecord.restore("sku::DD1391-100", fields, provenance, List.of("kith"),
            Instant.parse("2025-03-01T12:00:00Z"));
    }

    @Test
    public void testPatchMissesThenPostInserts() throws StoreException {
        Map<String, Object> row = CanonicalRowMapper.toRow(record());

        assertEquals(UpsertOutcome.Status.INSERTED, target.write("sneakers", "id", row));
        assertEquals(UpsertOutcome.Status.UPDATED, target.write("sneakers", "id", row));

        assertEquals(List.of(
            "PATCH /sneakers?id=eq.sku%3A%3ADD1391-100",
            "POST /sneakers",
            "PATCH /sneakers?id=eq.sku%3A%3ADD1391-100"), requests);
        assertEquals(1, rows.size());
    }

    @Test
    public void testReadAllRestoresRecords() throws StoreException {
        target.write("sneakers", "id", CanonicalRowMapper.toRow(record()));

        List<CanonicalRecord> restored = target.readAll("sneakers");

        assertEquals(1, restored.size());
        CanonicalRecord back = restored.get(0);
        assertEquals(record(), back);
        assertEquals("kith", back.provenanceOf("price").sourceId());
        assertEquals(Instant.parse("2025-03-01T12:00:00Z"), back.mergedAt());
    }

    @Test
    public void testRejectedKeyIsAuthError() {
        PostgrestUpsertTarget badKey = new PostgrestUpsertTarget(
            "http://127.0.0.1:" + server.getAddress().getPort(), "anon-key");

        StoreException e = assertThrows(StoreException.class,
            () -> badKey.write("sneakers", "id", CanonicalRowMapper.toRow(record())));

        assertEquals(ErrorKind.AUTH_ERROR, e.kind());
    }

    @Test
    public void testMissingTableIsNotFound() {
        StoreException e = assertThrows(StoreException.class,
            () -> target.write("missing", "id", CanonicalRowMapper.toRow(record())));

        assertEquals(ErrorKind.NOT_FOUND, e.kind());
    }

    @Test
    public void testUnreachableServerIsTransportError() throws IOException {
        HttpServer closed = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        int port = closed.getAddress().getPort();
        closed.stop(0);
        PostgrestUpsertTarget offline = new PostgrestUpsertTarget("http://127.0.0.1:" + port, API_KEY);

        StoreException e = assertThrows(StoreException.class, () -> offline.readAll("sneakers"));

        assertEquals(ErrorKind.TRANSPORT_ERROR, e.kind());
    }
}
