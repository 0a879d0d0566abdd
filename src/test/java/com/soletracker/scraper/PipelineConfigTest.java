package com.soletracker.scraper;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class PipelineConfigTest {

    @Test
    public void testEnvironmentOverridesSystemPropertyOverridesFile() {
        Properties file = new Properties();
        file.setProperty("sink.target", "jdbc");
        file.setProperty("pipeline.workers", "1");
        file.setProperty("fetch.minDelayMillis", "1000");
        Map<String, String> env = Map.of("SINK_TARGET", "postgrest");
        Map<String, String> sys = Map.of("sink.target", "ignored", "pipeline.workers", "4");

        PipelineConfig config = new PipelineConfig(file, env::get, sys::get);

        assertEquals("postgrest", config.sinkTarget());
        assertEquals(4, config.workers());
        assertEquals(Duration.ofSeconds(1), config.minDelay());
    }

    @Test
    public void testDefaultsWhenUnset() {
        PipelineConfig config = PipelineConfig.of(new Properties());

        assertEquals(PipelineConfig.DEFAULT_USER_AGENT, config.userAgent());
        assertEquals("sneakers", config.namespace());
        assertEquals("id", config.conflictKey());
        assertNull(config.runTimeout());
        assertEquals(List.of("/raffle/*", "/api/*", "/user/*", "/account/*"), config.denylist());
        assertEquals(3, config.retryPolicy().maxAttempts());
    }

    @Test
    public void testInvalidNumbersFallBack() {
        Properties file = new Properties();
        file.setProperty("pipeline.workers", "many");
        file.setProperty("pipeline.runTimeoutMinutes", "15");
        file.setProperty("politeness.denylist", " /a/* , ,/b ");

        PipelineConfig config = PipelineConfig.of(file);

        assertEquals(1, config.workers());
        assertEquals(Duration.ofMinutes(15), config.runTimeout());
        assertEquals(List.of("/a/*", "/b"), config.denylist());
    }

    @Test
    public void testEnvName() {
        assertEquals("DB_EMBEDDED_PORT", PipelineConfig.envName("db.embedded.port"));
    }

    @Test
    public void testBundledDefaultsLoad() throws IOException {
        PipelineConfig config = PipelineConfig.load();

        List<SourceConfig> sources = config.loadSources();

        assertFalse(sources.isEmpty());
        assertTrue(sources.stream().anyMatch(s -> s.type().equals("shopify-json")));
        assertTrue(sources.stream().allMatch(s -> !s.urls().isEmpty()));
    }

    @Test
    public void testNewsNamespaceKeysOnUrl() throws IOException {
        PipelineConfig config = PipelineConfig.load();

        assertEquals("url", config.conflictKey("news"));
        assertEquals("id", config.conflictKey("sneakers"));
        SourceConfig hypebeast = config.loadSources().stream()
            .filter(s -> s.id().equals("hypebeast-footwear"))
            .findFirst().orElseThrow();
        assertEquals("news", hypebeast.namespaceOr(config.namespace()));
    }

    @Test
    public void testConflictKeyFallsBackToDefault() {
        Properties props = new Properties();
        props.setProperty("sink.conflictKey", "sku");

        assertEquals("sku", PipelineConfig.of(props).conflictKey("archive"));
    }

    @Test
    public void testSourcesFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("sources.json");
        Files.writeString(file, "[{\"id\":\"kith\",\"type\":\"shopify-json\",\"urls\":[\"https://kith.example/products.json\"],"
            + "\"trustWeight\":2.5,\"minDelayMillis\":3000,\"comment\":\"ignored\"},"
            + "{\"id\":\"cal\",\"type\":\"generic-html\",\"urls\":[],\"mode\":\"rendered\",\"enabled\":false,"
            + "\"selectors\":{\"item\":\".card\"}}]");
        Properties props = new Properties();
        props.setProperty("ingest.sources.file", file.toString());

        List<SourceConfig> sources = PipelineConfig.of(props).loadSources();

        assertEquals(2, sources.size());
        SourceConfig kith = sources.get(0);
        assertEquals(2.5, kith.trust());
        assertEquals(Duration.ofSeconds(3), kith.minDelay(Duration.ZERO));
        assertEquals(FetchMode.STATIC, kith.fetchMode());
        assertTrue(kith.isEnabled());
        SourceConfig cal = sources.get(1);
        assertEquals(FetchMode.RENDERED, cal.fetchMode());
        assertFalse(cal.isEnabled());
        assertEquals(".card", cal.selector("item"));
        assertEquals(1.0, cal.trust());
    }

    @Test
    public void testMissingSourcesFile() {
        Properties props = new Properties();
        props.setProperty("ingest.sources.file", "/definitely/not/here.json");

        assertThrows(IOException.class, () -> PipelineConfig.of(props).loadSources());
    }
}
