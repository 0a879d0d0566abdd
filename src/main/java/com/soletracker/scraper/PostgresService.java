package com.soletracker.scraper;

import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Paths;
import java.sql.*;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Service for interacting with the PostgreSQL database that holds canonical records and run statistics.
 * <p>
 * Workflow:
 * <ul>
 *   <li>One table per canonical namespace: search columns plus JSONB columns for fields, provenance and sources.</li>
 *   <li>{@link #write} is the direct path: look the row up by natural key, then UPDATE or INSERT in one transaction.</li>
 *   <li>{@link #nativeUpsert()} is the conflict-aware path using {@code INSERT ... ON CONFLICT ... DO UPDATE}.</li>
 *   <li>{@code scrape_runs} keeps one row of statistics per run.</li>
 * </ul>
 * SQL states of class 28 (invalid authorization) and 42501 (insufficient privilege) are reported as
 * {@link ErrorKind#AUTH_ERROR}, class 08 (connection) as {@link ErrorKind#TRANSPORT_ERROR}.
 *
 * @author Sole Tracker Ingest Team
 * @since 1.0
 */
@SuppressWarnings("SqlResolve")
public class PostgresService implements PostgresServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(PostgresService.class);

    private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]{0,62}");

    private final String url;
    private final String user;
    private final String password;

    /**
     * Constructs a PostgresService with the given connection parameters.
     * @param url JDBC URL
     * @param user Database user
     * @param password Database password
     */
    public PostgresService(String url, String user, String password) {
        this.url = url;
        this.user = user;
        this.password = password;
    }

    /**
     * Opens a new database connection.
     * @return Connection
     * @throws SQLException if connection fails
     */
    public Connection connect() throws SQLException {
        return DriverManager.getConnection(url, user, password);
    }

    @Override
    public String name() {
        return "jdbc-direct";
    }

    @Override
    public void createTables(String namespace, String conflictKey) throws StoreException {
        String table = identifier(namespace);
        String canonicalTable = "CREATE TABLE IF NOT EXISTS " + table + " (" +
                "id TEXT PRIMARY KEY, " +
                "name TEXT, brand TEXT, sku TEXT, url TEXT, status TEXT, " +
                "release_date DATE, price NUMERIC, " +
                "fields JSONB NOT NULL DEFAULT '{}'::jsonb, " +
                "field_provenance JSONB, " +
                "contributing_sources JSONB, " +
                "merged_at TIMESTAMPTZ" +
                ")";
        String runsTable = "CREATE TABLE IF NOT EXISTS scrape_runs (" +
                "run_id TEXT PRIMARY KEY, " +
                "started_at TIMESTAMPTZ, finished_at TIMESTAMPTZ, " +
                "outcome TEXT, stats JSONB" +
                ")";
        try (Connection conn = connect(); Statement stmt = conn.createStatement()) {
            stmt.execute(canonicalTable);
            stmt.execute(runsTable);
            if (conflictKey != null && !conflictKey.equals("id")) {
                String column = identifier(conflictKey);
                stmt.execute("CREATE UNIQUE INDEX IF NOT EXISTS " + table + "_" + column + "_key ON " + table + " (" + column + ")");
            }
            logger.info("Tables ensured for namespace '{}'.", table);
        } catch (SQLException e) {
            throw classify("Error creating tables for " + table, e);
        }
    }

    @Override
    public List<CanonicalRecord> readAll(String namespace) throws StoreException {
        String table = identifier(namespace);
        String sql = "SELECT id, fields::text, field_provenance::text, contributing_sources::text, merged_at FROM " + table + " ORDER BY id";
        List<CanonicalRecord> records = new ArrayList<>();
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql); ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                Timestamp mergedAt = rs.getTimestamp(5);
                records.add(CanonicalRecordCodec.decode(
                    rs.getString(1),
                    CanonicalRecordCodec.readTree(rs.getString(2)),
                    CanonicalRecordCodec.readTree(rs.getString(3)),
                    CanonicalRecordCodec.readTree(rs.getString(4)),
                    mergedAt == null ? null : mergedAt.toInstant()));
            }
        } catch (SQLException e) {
            throw classify("Error reading canonical records from " + table, e);
        }
        logger.info("Read {} canonical records from {}", records.size(), table);
        return records;
    }

    /**
     * Direct write: select by natural key, then UPDATE or INSERT within one transaction.
     */
    @Override
    public UpsertOutcome.Status write(String table, String conflictKey, Map<String, Object> row) throws StoreException {
        String t = identifier(table);
        String key = identifier(conflictKey);
        List<String> columns = columnsOf(row);
        try (Connection conn = connect()) {
            conn.setAutoCommit(false);
            try {
                boolean exists;
                try (PreparedStatement ps = conn.prepareStatement("SELECT 1 FROM " + t + " WHERE " + key + " = ? FOR UPDATE")) {
                    bind(ps, 1, conflictKey, row.get(conflictKey));
                    try (ResultSet rs = ps.executeQuery()) {
                        exists = rs.next();
                    }
                }
                UpsertOutcome.Status status;
                if (exists) {
                    String assignments = columns.stream().map(c -> c + " = " + placeholder(c)).collect(Collectors.joining(", "));
                    try (PreparedStatement ps = conn.prepareStatement("UPDATE " + t + " SET " + assignments + " WHERE " + key + " = ?")) {
                        int i = 1;
                        for (String c : columns) bind(ps, i++, c, row.get(c));
                        bind(ps, i, conflictKey, row.get(conflictKey));
                        ps.executeUpdate();
                    }
                    status = UpsertOutcome.Status.UPDATED;
                } else {
                    try (PreparedStatement ps = conn.prepareStatement(insertSql(t, columns))) {
                        int i = 1;
                        for (String c : columns) bind(ps, i++, c, row.get(c));
                        ps.executeUpdate();
                    }
                    status = UpsertOutcome.Status.INSERTED;
                }
                conn.commit();
                return status;
            } catch (SQLException | StoreException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw classify("Direct write to " + t + " failed", e);
        }
    }

    @Override
    public UpsertTarget nativeUpsert() {
        return new UpsertTarget() {
            @Override
            public UpsertOutcome.Status write(String table, String conflictKey, Map<String, Object> row) throws StoreException {
                return upsertOnConflict(table, conflictKey, row);
            }

            @Override
            public String name() {
                return "jdbc-upsert";
            }
        };
    }

    UpsertOutcome.Status upsertOnConflict(String table, String conflictKey, Map<String, Object> row) throws StoreException {
        String t = identifier(table);
        String key = identifier(conflictKey);
        List<String> columns = columnsOf(row);
        String updates = columns.stream()
            .filter(c -> !c.equals(key) && !c.equals("id"))
            .map(c -> c + " = EXCLUDED." + c)
            .collect(Collectors.joining(", "));
        String sql = insertSql(t, columns) + " ON CONFLICT (" + key + ") DO UPDATE SET " + updates + " RETURNING (xmax = 0) AS inserted";
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            int i = 1;
            for (String c : columns) bind(ps, i++, c, row.get(c));
            try (ResultSet rs = ps.executeQuery()) {
                boolean inserted = rs.next() && rs.getBoolean(1);
                return inserted ? UpsertOutcome.Status.INSERTED : UpsertOutcome.Status.UPDATED;
            }
        } catch (SQLException e) {
            throw classify("Upsert into " + t + " failed", e);
        }
    }

    @Override
    public void insertRunStats(RunStats stats) throws StoreException {
        String sql = "INSERT INTO scrape_runs (run_id, started_at, finished_at, outcome, stats) VALUES (?, ?, ?, ?, ?) " +
                "ON CONFLICT (run_id) DO UPDATE SET finished_at = EXCLUDED.finished_at, outcome = EXCLUDED.outcome, stats = EXCLUDED.stats";
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, stats.runId());
            ps.setObject(2, toOffset(stats.startedAt()));
            ps.setObject(3, toOffset(stats.finishedAt()));
            ps.setString(4, stats.outcome().name());
            ps.setObject(5, CanonicalRecordCodec.toJson(stats), Types.OTHER);
            ps.executeUpdate();
            logger.info("Recorded run {} ({})", stats.runId(), stats.outcome());
        } catch (SQLException e) {
            throw classify("Error recording run statistics", e);
        }
    }

    private static List<String> columnsOf(Map<String, Object> row) throws StoreException {
        List<String> columns = new ArrayList<>();
        for (String column : row.keySet()) columns.add(identifier(column));
        return columns;
    }

    private static String insertSql(String table, List<String> columns) {
        return "INSERT INTO " + table + " (" + String.join(", ", columns) + ") VALUES (" +
                columns.stream().map(PostgresService::placeholder).collect(Collectors.joining(", ")) + ")";
    }

    private static String placeholder(String column) {
        return CanonicalRowMapper.JSON_COLUMNS.contains(column) ? "?::jsonb" : "?";
    }

    private static void bind(PreparedStatement ps, int index, String column, Object value) throws SQLException, StoreException {
        if (CanonicalRowMapper.JSON_COLUMNS.contains(column)) {
            ps.setString(index, value == null ? null : CanonicalRecordCodec.toJson(value));
        } else if (value == null) {
            ps.setNull(index, Types.NULL);
        } else if (value instanceof Instant instant) {
            ps.setObject(index, toOffset(instant));
        } else if (value instanceof LocalDate date) {
            ps.setObject(index, date);
        } else if (value instanceof Double d) {
            ps.setDouble(index, d);
        } else if (value instanceof Boolean b) {
            ps.setBoolean(index, b);
        } else {
            ps.setString(index, value.toString());
        }
    }

    private static OffsetDateTime toOffset(Instant instant) {
        return instant == null ? null : instant.atOffset(ZoneOffset.UTC);
    }

    static String identifier(String name) throws StoreException {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new StoreException(ErrorKind.PERSISTENCE_ERROR, "Invalid table or column name: " + name);
        }
        return name;
    }

    static StoreException classify(String message, SQLException e) {
        String state = e.getSQLState() == null ? "" : e.getSQLState();
        ErrorKind kind;
        if (state.startsWith("28") || state.equals("42501")) kind = ErrorKind.AUTH_ERROR;
        else if (state.equals("42P01")) kind = ErrorKind.NOT_FOUND;
        else if (state.startsWith("08")) kind = ErrorKind.TRANSPORT_ERROR;
        else kind = ErrorKind.PERSISTENCE_ERROR;
        logger.error("{}: {} (SQLState {})", message, e.getMessage(), state);
        return new StoreException(kind, message + ": " + e.getMessage(), e);
    }

    /**
     * Starts an embedded PostgreSQL instance on a specific port for local use and returns it.
     * @param dataDir directory under which to store DB data
     * @param port port number for the Postgres server
     * @return EmbeddedPostgres instance
     * @throws IOException if the server cannot be started
     */
    public static EmbeddedPostgres startEmbedded(String dataDir, int port) throws IOException {
        EmbeddedPostgres postgres = EmbeddedPostgres.builder()
            .setDataDirectory(Paths.get(dataDir))
            .setCleanDataDirectory(false)
            .setPort(port)
            .start();
        logger.info("Embedded PostgreSQL started at {} on port {}", dataDir, port);
        return postgres;
    }

    /**
     * JDBC URL of an embedded instance, with the default {@code postgres} database.
     */
    public static String jdbcUrl(EmbeddedPostgres postgres) {
        return String.format("jdbc:postgresql://localhost:%d/postgres", postgres.getPort());
    }
}
