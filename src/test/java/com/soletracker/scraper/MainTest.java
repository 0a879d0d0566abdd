package com.soletracker.scraper;

import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;
import java.time.Instant;
import java.util.*;

/**
 * Entry point wiring, exit codes and file helpers.
 */
public class MainTest {

    private static RunStats stats(long pages, long errors, long inserted) {
        return new RunStats("run-1", Instant.EPOCH, Instant.EPOCH, pages, 0, errors, 0, pages, 0, 0,
            inserted, 0, inserted, 0, 0, 0, false);
    }

    @Test
    void testSanitizeFilename() {
        String input = "sneakers:EU/launch?*<>|";
        String sanitized = Utils.sanitizeFilename(input);
        assertEquals("sneakers_EU_launch_____", sanitized);
    }

    @Test
    void testSingleLine() {
        assertEquals("Drops Friday at 10am", Utils.singleLine(" Drops Friday\r\nat 10am "));
        assertEquals("", Utils.singleLine(null));
    }

    @Test
    void testExitCodes() {
        assertEquals(0, Main.exitCode(stats(3, 0, 3)));
        assertEquals(0, Main.exitCode(stats(3, 1, 2)));
        assertEquals(1, Main.exitCode(stats(0, 0, 0)));
        assertEquals(1, Main.exitCode(stats(3, 3, 0)));
    }

    @Test
    void testJdbcWiringNeedsDatabase() {
        PipelineConfig config = PipelineConfig.of(new Properties());
        assertThrows(IllegalStateException.class, () -> Main.createOrchestrator(config, List.of(), null, null));
    }

    @Test
    void testPostgrestWiringWithoutDatabase() {
        Properties props = new Properties();
        props.setProperty("sink.target", "postgrest");
        props.setProperty("postgrest.url", "http://localhost:3000");
        PipelineConfig config = PipelineConfig.of(props);
        assertDoesNotThrow(() -> Main.createOrchestrator(config, List.of(), null, null));
    }

    @Test
    void testNamespacesCoverEnabledSources() {
        PipelineConfig config = PipelineConfig.of(new Properties());
        List<SourceConfig> sources = List.of(
            new SourceConfig("kith", "shopify-json", List.of("https://kith.example/products.json"), "static", null, 1.0,
                null, true, Map.of(), null),
            new SourceConfig("hb", "feed-xml", List.of("https://hb.example/feed"), "static", null, 1.0, null, true,
                Map.of(), "news"),
            new SourceConfig("old", "feed-xml", List.of("https://old.example/feed"), "static", null, 1.0, null, false,
                Map.of(), "archive"));

        assertEquals(Set.of(config.namespace(), "news"), Main.namespaces(config, sources));
    }
}
