package io.idlequeue.storage;

import io.idlequeue.config.EngineSettings;
import io.idlequeue.config.IdleQueueConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

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
import java.util.List;

public final class Database {
    private static final Logger log = LoggerFactory.getLogger(Database.class);
    private static final String MIGRATION_SCHEMA_VERSION = "idlequeue.schema.migration.v1";
    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;

    private final IdleQueueConfig config;
    private final String jdbcUrl;
    private final int retryAttempts;
    private final long retryBaseBackoffMs;

    public Database(IdleQueueConfig config) {
        this(config, EngineSettings.DEFAULT_STORE_RETRY_ATTEMPTS, EngineSettings.DEFAULT_STORE_RETRY_BASE_BACKOFF_MS);
    }

    public Database(IdleQueueConfig config, int retryAttempts, long retryBaseBackoffMs) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
        this.retryAttempts = Math.max(1, retryAttempts);
        this.retryBaseBackoffMs = Math.max(1L, retryBaseBackoffMs);
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        Connection c = DriverManager.getConnection(jdbcUrl);
        try (Statement st = c.createStatement()) {
            st.execute("PRAGMA busy_timeout=5000");
        }
        return c;
    }

    /**
     * Runs {@code work} on a fresh connection. Lock contention is retried with doubling backoff; anything else fails fast.
     */
    public <T> T withConnection(String operation, SqlWork<T> work) {
        return withRetry(operation, () -> {
            try (Connection c = openConnection()) {
                return work.apply(c);
            }
        });
    }

    /**
     * Runs {@code work} inside a single transaction. Every write it makes commits together or not at all.
     */
    public <T> T inTransaction(String operation, SqlWork<T> work) {
        return withRetry(operation, () -> {
            try (Connection c = openConnection()) {
                c.setAutoCommit(false);
                try {
                    T result = work.apply(c);
                    c.commit();
                    return result;
                } catch (SQLException | RuntimeException e) {
                    c.rollback();
                    throw e;
                } finally {
                    c.setAutoCommit(true);
                }
            }
        });
    }

    private <T> T withRetry(String operation, Attempt<T> attempt) {
        long backoff = retryBaseBackoffMs;
        for (int i = 1; ; i++) {
            try {
                return attempt.run();
            } catch (SQLException e) {
                boolean retryable = isLockContention(e);
                if (!retryable || i >= retryAttempts) {
                    throw new StoreException("Failed " + operation, e, retryable);
                }
                log.debug("Store contention on {} (attempt {}/{}), retrying in {} ms", operation, i, retryAttempts, backoff);
                sleep(backoff, operation, e);
                backoff = backoff * 2L;
            }
        }
    }

    static boolean isLockContention(SQLException e) {
        int primary = e.getErrorCode() & 0xff;
        if (primary == SQLITE_BUSY || primary == SQLITE_LOCKED) {
            return true;
        }
        String message = e.getMessage();
        return message != null && (message.contains("SQLITE_BUSY") || message.contains("SQLITE_LOCKED"));
    }

    private void sleep(long millis, String operation, SQLException cause) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new StoreException("Interrupted while retrying " + operation, cause, true);
        }
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
            Files.createDirectories(config.outboxRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS task_queues (
                        player_id TEXT PRIMARY KEY,
                        body TEXT NOT NULL,
                        is_running INTEGER NOT NULL DEFAULT 0,
                        is_paused INTEGER NOT NULL DEFAULT 0,
                        version INTEGER NOT NULL,
                        checksum TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS characters (
                        user_id TEXT PRIMARY KEY,
                        name TEXT NOT NULL,
                        level INTEGER NOT NULL DEFAULT 1,
                        experience INTEGER NOT NULL DEFAULT 0,
                        currency INTEGER NOT NULL DEFAULT 0,
                        stats TEXT NOT NULL,
                        specialization TEXT NOT NULL,
                        current_activity TEXT,
                        last_active_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS inventory (
                        user_id TEXT NOT NULL,
                        item_id TEXT NOT NULL,
                        quantity INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(user_id, item_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS connections (
                        connection_id TEXT PRIMARY KEY,
                        player_id TEXT NOT NULL,
                        connected_at_ms INTEGER NOT NULL,
                        last_ping_ms INTEGER NOT NULL,
                        last_heartbeat_ms INTEGER NOT NULL,
                        queue_version INTEGER NOT NULL DEFAULT 0,
                        is_healthy INTEGER NOT NULL DEFAULT 1
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS pending_notifications (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        player_id TEXT NOT NULL,
                        message_id TEXT NOT NULL,
                        body TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL,
                        expires_at_ms INTEGER NOT NULL
                    )
                    """);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);

            st.execute("CREATE INDEX IF NOT EXISTS idx_task_queues_running ON task_queues(is_running, player_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_connections_player ON connections(player_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_pending_notifications_player ON pending_notifications(player_id, created_at_ms)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
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
                "20261001_001_connection_activity_index",
                "Index connections by last activity for stale sweeps",
                List.of(
                        "CREATE INDEX IF NOT EXISTS idx_connections_heartbeat ON connections(is_healthy, last_heartbeat_ms)",
                        "CREATE INDEX IF NOT EXISTS idx_pending_notifications_expiry ON pending_notifications(expires_at_ms)"
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
        log.info("Applied schema migration {}", step.version());
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

    public List<SchemaMigrationRow> listSchemaMigrations() {
        return withConnection("list schema migrations", c -> {
            List<SchemaMigrationRow> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT version,description,checksum,applied_at_ms,success FROM schema_migrations ORDER BY version");
                 ResultSet rs = ps.executeQuery()) {
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
        });
    }

    @FunctionalInterface
    private interface Attempt<T> {
        T run() throws SQLException;
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
