package com.soletracker.scraper;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.function.UnaryOperator;

/**
 * Pipeline settings.
 * <p>
 * Defaults come from {@code ingest.properties} on the classpath. Every key can be overridden by an environment
 * variable (dots become underscores, upper-cased: {@code sink.table} is {@code SINK_TABLE}) or by a system
 * property of the same name as the key. Environment wins over system properties, which win over the file.
 *
 * @author Sole Tracker Ingest Team
 * @since 1.0
 */
public class PipelineConfig {
    private static final Logger logger = LoggerFactory.getLogger(PipelineConfig.class);

    public static final String DEFAULT_USER_AGENT = "Live-Sneaker-Tracker-Bot/1.0 (+https://soletracker.example/bot)";
    public static final String PROPERTIES_RESOURCE = "ingest.properties";
    public static final String SOURCES_RESOURCE = "sources.json";

    private final Properties defaults;
    private final UnaryOperator<String> env;
    private final UnaryOperator<String> sysProps;

    public PipelineConfig(Properties defaults, UnaryOperator<String> env, UnaryOperator<String> sysProps) {
        this.defaults = defaults == null ? new Properties() : defaults;
        this.env = env == null ? key -> null : env;
        this.sysProps = sysProps == null ? key -> null : sysProps;
    }

    /**
     * Settings from a properties object only, without environment or system property overrides.
     */
    public static PipelineConfig of(Properties properties) {
        return new PipelineConfig(properties, null, null);
    }

    /**
     * Loads {@code ingest.properties} from the classpath, with environment and system property overrides.
     */
    public static PipelineConfig load() {
        Properties props = new Properties();
        try (InputStream in = PipelineConfig.class.getClassLoader().getResourceAsStream(PROPERTIES_RESOURCE)) {
            if (in != null) {
                props.load(in);
            } else {
                logger.warn("{} not found on classpath, using built-in defaults.", PROPERTIES_RESOURCE);
            }
        } catch (IOException e) {
            logger.warn("Failed to read {}: {}. Using built-in defaults.", PROPERTIES_RESOURCE, e.getMessage());
        }
        return new PipelineConfig(props, System::getenv, System::getProperty);
    }

    static String envName(String key) {
        return key.replace('.', '_').replace('-', '_').toUpperCase(Locale.ROOT);
    }

    public String get(String key, String defaultVal) {
        String ev = env.apply(envName(key));
        if (ev != null && !ev.isBlank()) return ev.trim();
        String prop = sysProps.apply(key);
        if (prop != null && !prop.isBlank()) return prop.trim();
        String file = defaults.getProperty(key);
        return file != null && !file.isBlank() ? file.trim() : defaultVal;
    }

    public int getInt(String key, int defaultVal) {
        String v = get(key, null);
        if (v == null) return defaultVal;
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer for {}: '{}', using {}", key, v, defaultVal);
            return defaultVal;
        }
    }

    public long getLong(String key, long defaultVal) {
        String v = get(key, null);
        if (v == null) return defaultVal;
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException e) {
            logger.warn("Invalid number for {}: '{}', using {}", key, v, defaultVal);
            return defaultVal;
        }
    }

    public boolean getBoolean(String key, boolean defaultVal) {
        String v = get(key, null);
        return v == null ? defaultVal : Boolean.parseBoolean(v);
    }

    public List<String> getList(String key, List<String> defaultVal) {
        String v = get(key, null);
        if (v == null) return defaultVal;
        return Arrays.stream(v.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
    }

    public String userAgent() {
        return get("fetch.userAgent", DEFAULT_USER_AGENT);
    }

    public Duration minDelay() {
        return Duration.ofMillis(getLong("fetch.minDelayMillis", 1000));
    }

    public Duration requestTimeout() {
        return Duration.ofSeconds(getLong("fetch.timeoutSeconds", 30));
    }

    public int scrollCycles() {
        return getInt("render.scrollCycles", ResilientFetcher.DEFAULT_SCROLL_CYCLES);
    }

    public Duration renderSettleWait() {
        return Duration.ofMillis(getLong("render.settleMillis", 2000));
    }

    public RetryPolicy retryPolicy() {
        return RetryPolicy.defaults()
            .withMaxAttempts(getInt("fetch.maxAttempts", RetryPolicy.DEFAULT_MAX_ATTEMPTS))
            .withDefaultRetryAfter(Duration.ofSeconds(getLong("fetch.defaultRetryAfterSeconds",
                RetryPolicy.DEFAULT_RETRY_AFTER.toSeconds())))
            .withMaxRateLimitWaits(getInt("fetch.maxRateLimitWaits", RetryPolicy.DEFAULT_MAX_RATE_LIMIT_WAITS));
    }

    public List<String> denylist() {
        return getList("politeness.denylist", List.of("/raffle/*", "/api/*", "/user/*", "/account/*"));
    }

    public String namespace() {
        return get("pipeline.namespace", "sneakers");
    }

    public int workers() {
        return Math.max(1, getInt("pipeline.workers", 1));
    }

    public long intervalMinutes() {
        return Math.max(1, getLong("pipeline.intervalMinutes", 60));
    }

    /**
     * @return run deadline, or {@code null} when runs are unbounded
     */
    public Duration runTimeout() {
        long minutes = getLong("pipeline.runTimeoutMinutes", 0);
        return minutes > 0 ? Duration.ofMinutes(minutes) : null;
    }

    /** {@code postgrest} (REST upsert, JDBC fallback) or {@code jdbc} (native upsert). */
    public String sinkTarget() {
        return get("sink.target", "jdbc").toLowerCase(Locale.ROOT);
    }

    public String conflictKey() {
        return get("sink.conflictKey", "id");
    }

    /**
     * Natural key of one namespace: {@code sink.conflictKey.<namespace>}, else {@link #conflictKey()}.
     */
    public String conflictKey(String namespace) {
        return get("sink.conflictKey." + namespace, conflictKey());
    }

    public int maxWriteAttempts() {
        return Math.max(1, getInt("sink.maxWriteAttempts", UpsertSink.DEFAULT_MAX_WRITE_ATTEMPTS));
    }

    public String jdbcUrl() {
        return get("db.url", "");
    }

    public String jdbcUser() {
        return get("db.user", "postgres");
    }

    public String jdbcPassword() {
        return get("db.password", "");
    }

    public boolean embeddedDb() {
        return getBoolean("db.embedded", false);
    }

    public int embeddedPort() {
        return getInt("db.embedded.port", 5432);
    }

    public String embeddedDataDir() {
        return get("db.embedded.dataDir", "scraped-data/pgdata");
    }

    public String postgrestUrl() {
        return get("postgrest.url", "");
    }

    public String postgrestApiKey() {
        return get("postgrest.apiKey", "");
    }

    public String exportDir() {
        return get("export.dir", "scraped-data");
    }

    /**
     * Reads the source list from {@code ingest.sources.file} when set, else from {@code sources.json} on the classpath.
     *
     * @throws IOException if the file cannot be read or parsed
     */
    public List<SourceConfig> loadSources() throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        TypeReference<List<SourceConfig>> listType = new TypeReference<>() {};
        String file = get("ingest.sources.file", "");
        if (!file.isBlank()) {
            Path path = Paths.get(file);
            if (!Files.exists(path)) throw new IOException("Sources file not found: " + path.toAbsolutePath());
            List<SourceConfig> sources = mapper.readValue(path.toFile(), listType);
            logger.info("Loaded {} sources from {}", sources.size(), path);
            return sources;
        }
        try (InputStream in = PipelineConfig.class.getClassLoader().getResourceAsStream(SOURCES_RESOURCE)) {
            if (in == null) throw new IOException(SOURCES_RESOURCE + " not found on classpath");
            List<SourceConfig> sources = mapper.readValue(in, listType);
            logger.info("Loaded {} sources from classpath {}", sources.size(), SOURCES_RESOURCE);
            return sources;
        }
    }
}
