package io.archivemirror.storage;

import io.archivemirror.config.MirrorSyncConfig;

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
    private static final String MIGRATION_SCHEMA_VERSION = "archivemirror.schema.migration.v1";
    private final MirrorSyncConfig config;
    private final String jdbcUrl;
    private final Properties connectionProperties;

    public Database(MirrorSyncConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
        this.connectionProperties = new Properties();
        // Applied per connection by the driver; write transactions take the lock up front.
        connectionProperties.setProperty("busy_timeout", "5000");
        connectionProperties.setProperty("foreign_keys", "true");
        connectionProperties.setProperty("transaction_mode", "IMMEDIATE");
    }

    public MirrorSyncConfig config() {
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
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS mirrors (
                        mirror_id TEXT PRIMARY KEY,
                        name TEXT NOT NULL,
                        status TEXT NOT NULL,
                        credential TEXT NOT NULL UNIQUE,
                        direct_url TEXT NOT NULL,
                        tunnel_url TEXT,
                        capacity INTEGER NOT NULL,
                        last_heartbeat_ms INTEGER NOT NULL DEFAULT 0,
                        last_sync_at_ms INTEGER NOT NULL DEFAULT 0,
                        reported_file_count INTEGER NOT NULL DEFAULT 0,
                        reported_bytes INTEGER NOT NULL DEFAULT 0,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        status_changed_at_ms INTEGER NOT NULL
                    )
                    """);
            ensureMirrorColumns(conn);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS pairing_codes (
                        code TEXT PRIMARY KEY,
                        issued_at_ms INTEGER NOT NULL,
                        expires_at_ms INTEGER NOT NULL,
                        consumed INTEGER NOT NULL DEFAULT 0,
                        consumed_at_ms INTEGER NOT NULL DEFAULT 0,
                        mirror_id TEXT
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS catalog_entries (
                        entry_id TEXT PRIMARY KEY,
                        file_name TEXT NOT NULL,
                        content_hash TEXT NOT NULL,
                        size_bytes INTEGER NOT NULL,
                        popularity INTEGER NOT NULL DEFAULT 0,
                        approved INTEGER NOT NULL DEFAULT 0,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS mirror_files (
                        mirror_id TEXT NOT NULL,
                        entry_id TEXT NOT NULL,
                        state TEXT NOT NULL,
                        synced_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(mirror_id, entry_id),
                        FOREIGN KEY(mirror_id) REFERENCES mirrors(mirror_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS sync_log (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        mirror_id TEXT NOT NULL,
                        entry_id TEXT NOT NULL,
                        action TEXT NOT NULL,
                        detail TEXT NOT NULL DEFAULT '',
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS local_files (
                        entry_id TEXT PRIMARY KEY,
                        file_name TEXT NOT NULL,
                        content_hash TEXT NOT NULL,
                        size_bytes INTEGER NOT NULL,
                        popularity INTEGER NOT NULL DEFAULT 0,
                        created_at_ms INTEGER NOT NULL,
                        state TEXT NOT NULL,
                        synced_at_ms INTEGER NOT NULL,
                        download_count INTEGER NOT NULL DEFAULT 0
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS agent_state (
                        state_key TEXT PRIMARY KEY,
                        state_value TEXT NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);

            st.execute("CREATE INDEX IF NOT EXISTS idx_mirrors_status_heartbeat ON mirrors(status, last_heartbeat_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_pairing_codes_expires ON pairing_codes(consumed, expires_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_catalog_approved_rank ON catalog_entries(approved, popularity)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_mirror_files_entry_state ON mirror_files(entry_id, state)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_sync_log_mirror_time ON sync_log(mirror_id, created_at_ms)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void ensureMirrorColumns(Connection conn) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(mirrors)")) {
            while (rs.next()) {
                columns.add(rs.getString("name").toLowerCase(Locale.ROOT));
            }
        }
        try (Statement st = conn.createStatement()) {
            if (!columns.contains("reported_file_count")) {
                st.execute("ALTER TABLE mirrors ADD COLUMN reported_file_count INTEGER NOT NULL DEFAULT 0");
            }
            if (!columns.contains("reported_bytes")) {
                st.execute("ALTER TABLE mirrors ADD COLUMN reported_bytes INTEGER NOT NULL DEFAULT 0");
            }
            if (!columns.contains("last_sync_at_ms")) {
                st.execute("ALTER TABLE mirrors ADD COLUMN last_sync_at_ms INTEGER NOT NULL DEFAULT 0");
            }
        }
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
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20261019_001_routing_indexes",
                "Index verified copies for download routing",
                List.of(
                        "CREATE INDEX IF NOT EXISTS idx_mirror_files_mirror_state ON mirror_files(mirror_id, state)",
                        "CREATE INDEX IF NOT EXISTS idx_local_files_state ON local_files(state)"
                )
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
        try (Statement st = conn.createStatement()) {
            for (String sql : step.sql()) {
                st.execute(sql);
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, checksum(step));
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
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
            validatePragma(st, "foreign_keys", "1");
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
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, limit));
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
