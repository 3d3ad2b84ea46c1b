package io.harvestcore.storage;

import io.harvestcore.config.HarvestConfig;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;

public final class Database {
    private static final String MIGRATION_SCHEMA_VERSION = "harvestcore.schema.migration.v1";
    public static final int DEFAULT_BUSY_TIMEOUT_MS = 10_000;

    private final HarvestConfig config;
    private final String jdbcUrl;
    private final Properties connectionProperties;

    public Database(HarvestConfig config) {
        this(config, DEFAULT_BUSY_TIMEOUT_MS);
    }

    public Database(HarvestConfig config, int busyTimeoutMs) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
        SQLiteConfig sqlite = new SQLiteConfig();
        // busy_timeout is per connection, so it travels with every open.
        sqlite.setBusyTimeout(busyTimeoutMs);
        sqlite.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        sqlite.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        this.connectionProperties = sqlite.toProperties();
    }

    public HarvestConfig config() {
        return config;
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, connectionProperties);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS work_items (
                        run_id TEXT NOT NULL,
                        item_key TEXT NOT NULL,
                        status TEXT NOT NULL DEFAULT 'pending',
                        owner TEXT,
                        lease_time_ms INTEGER,
                        attempt_count INTEGER NOT NULL DEFAULT 0,
                        lease_expiries INTEGER NOT NULL DEFAULT 0,
                        last_error TEXT,
                        result_json TEXT,
                        claim_token TEXT,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(run_id, item_key)
                    )
                    """);
            ensureWorkItemColumns(conn);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS pipeline_runs (
                        run_id TEXT PRIMARY KEY,
                        status TEXT NOT NULL,
                        driver_owner TEXT,
                        heartbeat_at_ms INTEGER,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            ensurePipelineRunColumns(conn);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS pipeline_steps (
                        run_id TEXT NOT NULL,
                        step_number INTEGER NOT NULL,
                        step_name TEXT NOT NULL,
                        completed INTEGER NOT NULL DEFAULT 0,
                        started_at_ms INTEGER,
                        completed_at_ms INTEGER,
                        duration_ms INTEGER,
                        outputs_json TEXT NOT NULL DEFAULT '[]',
                        metadata_json TEXT NOT NULL DEFAULT '{}',
                        PRIMARY KEY(run_id, step_number)
                    )
                    """);
            ensurePipelineStepColumns(conn);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS stuck_watch (
                        run_id TEXT PRIMARY KEY,
                        remaining INTEGER NOT NULL,
                        since_ms INTEGER NOT NULL
                    )
                    """);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);

            st.execute("CREATE INDEX IF NOT EXISTS idx_work_items_claim ON work_items(run_id, status, attempt_count, item_key)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_work_items_lease ON work_items(run_id, status, lease_time_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_work_items_token ON work_items(claim_token)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_pipeline_steps_run ON pipeline_steps(run_id, completed)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void ensureWorkItemColumns(Connection conn) throws SQLException {
        Set<String> columns = tableColumns(conn, "work_items");
        try (Statement st = conn.createStatement()) {
            if (!columns.contains("claim_token")) {
                st.execute("ALTER TABLE work_items ADD COLUMN claim_token TEXT");
            }
            if (!columns.contains("result_json")) {
                st.execute("ALTER TABLE work_items ADD COLUMN result_json TEXT");
            }
            if (!columns.contains("lease_expiries")) {
                st.execute("ALTER TABLE work_items ADD COLUMN lease_expiries INTEGER NOT NULL DEFAULT 0");
            }
        }
    }

    private void ensurePipelineRunColumns(Connection conn) throws SQLException {
        Set<String> columns = tableColumns(conn, "pipeline_runs");
        try (Statement st = conn.createStatement()) {
            if (!columns.contains("driver_owner")) {
                st.execute("ALTER TABLE pipeline_runs ADD COLUMN driver_owner TEXT");
            }
            if (!columns.contains("heartbeat_at_ms")) {
                st.execute("ALTER TABLE pipeline_runs ADD COLUMN heartbeat_at_ms INTEGER");
            }
        }
    }

    private void ensurePipelineStepColumns(Connection conn) throws SQLException {
        Set<String> columns = tableColumns(conn, "pipeline_steps");
        try (Statement st = conn.createStatement()) {
            if (!columns.contains("started_at_ms")) {
                st.execute("ALTER TABLE pipeline_steps ADD COLUMN started_at_ms INTEGER");
            }
            if (!columns.contains("metadata_json")) {
                st.execute("ALTER TABLE pipeline_steps ADD COLUMN metadata_json TEXT NOT NULL DEFAULT '{}'");
            }
        }
    }

    private Set<String> tableColumns(Connection conn, String table) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(" + table + ")")) {
            while (rs.next()) {
                columns.add(rs.getString("name").toLowerCase(Locale.ROOT));
            }
        }
        return columns;
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_schema_migrations_applied ON schema_migrations(applied_at_ms)");
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20260301_001_work_item_owner_index",
                "Index work items by owner for heartbeat and fenced terminal writes",
                List.of("CREATE INDEX IF NOT EXISTS idx_work_items_owner ON work_items(run_id, owner)")
        ));
        steps.add(new MigrationStep(
                "20260301_002_normalize_status_case",
                "Lower-case legacy upper-case work item statuses",
                List.of("UPDATE work_items SET status=lower(status) WHERE status<>lower(status)")
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        String checksum = checksum(step);
        try (Statement st = conn.createStatement()) {
            for (String sql : step.sql()) {
                st.execute(sql);
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, checksum);
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    public List<SchemaMigrationRow> listSchemaMigrations(int limit) {
        String sql = """
                SELECT version,description,checksum,applied_at_ms,success
                FROM schema_migrations
                ORDER BY applied_at_ms DESC, version DESC
                LIMIT ?
                """;
        int safeLimit = Math.max(1, limit);
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, safeLimit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new SchemaMigrationRow(
                            rs.getString("version"),
                            rs.getString("description"),
                            rs.getString("checksum"),
                            rs.getLong("applied_at_ms"),
                            rs.getInt("success") == 1
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list schema migrations", e);
        }
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
