package io.agentflow.storage;

import io.agentflow.config.AgentFlowConfig;
import io.agentflow.error.InfrastructureException;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashSet;
import java.util.Properties;
import java.util.Set;

public final class Database {
    static final int BUSY_TIMEOUT_MS = 5_000;

    private final AgentFlowConfig config;
    private final String jdbcUrl;

    public Database(AgentFlowConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    /**
     * Every connection waits on a locked database instead of failing fast, and begins write
     * transactions with {@code BEGIN IMMEDIATE} so concurrent writers serialize on the lock.
     */
    public Connection openConnection() throws SQLException {
        Properties props = new Properties();
        props.setProperty("busy_timeout", Integer.toString(BUSY_TIMEOUT_MS));
        props.setProperty("transaction_mode", "IMMEDIATE");
        props.setProperty("foreign_keys", "true");
        return DriverManager.getConnection(jdbcUrl, props);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
            Files.createDirectories(config.agentsDir());
        } catch (IOException e) {
            throw new InfrastructureException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schedules (
                        id TEXT PRIMARY KEY,
                        agent_id TEXT NOT NULL,
                        owner_id TEXT NOT NULL,
                        schedule_type TEXT NOT NULL,
                        interval_minutes INTEGER,
                        cron_expression TEXT,
                        webhook_endpoint TEXT,
                        timezone TEXT NOT NULL DEFAULT 'UTC',
                        enabled INTEGER NOT NULL DEFAULT 1,
                        max_executions_per_day INTEGER NOT NULL DEFAULT 100,
                        retry_on_failure INTEGER NOT NULL DEFAULT 0,
                        notification_preferences TEXT NOT NULL DEFAULT '{}',
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS scheduled_executions (
                        id TEXT PRIMARY KEY,
                        schedule_id TEXT NOT NULL,
                        agent_id TEXT NOT NULL,
                        owner_id TEXT NOT NULL,
                        scheduled_for_ms INTEGER NOT NULL,
                        status TEXT NOT NULL,
                        queue_item_id TEXT,
                        execution_result TEXT,
                        execution_time_ms INTEGER,
                        error_message TEXT,
                        started_at_ms INTEGER,
                        completed_at_ms INTEGER,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        FOREIGN KEY(schedule_id) REFERENCES schedules(id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS execution_queue (
                        seq INTEGER PRIMARY KEY AUTOINCREMENT,
                        id TEXT NOT NULL UNIQUE,
                        organization_id TEXT NOT NULL,
                        agent_id TEXT NOT NULL,
                        owner_id TEXT NOT NULL,
                        source TEXT NOT NULL DEFAULT 'manual',
                        schedule_execution_id TEXT,
                        status TEXT NOT NULL,
                        priority INTEGER NOT NULL,
                        payload TEXT NOT NULL DEFAULT '{}',
                        retry_count INTEGER NOT NULL DEFAULT 0,
                        max_retries INTEGER NOT NULL DEFAULT 0,
                        result TEXT,
                        last_error TEXT,
                        claimed_by TEXT,
                        available_at_ms INTEGER NOT NULL,
                        started_at_ms INTEGER,
                        completed_at_ms INTEGER,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        CHECK (retry_count >= 0 AND retry_count <= max_retries)
                    )
                    """);
            ensureQueueColumns(conn);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS agent_runtime_state (
                        agent_id TEXT PRIMARY KEY,
                        owner_id TEXT NOT NULL,
                        is_running INTEGER NOT NULL DEFAULT 0,
                        auto_schedule INTEGER NOT NULL DEFAULT 0,
                        schedule_interval_minutes INTEGER NOT NULL DEFAULT 60,
                        schedule_id TEXT,
                        last_started_at_ms INTEGER,
                        last_stopped_at_ms INTEGER,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS runtime_metrics (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        runtime_id TEXT NOT NULL,
                        organization_id TEXT NOT NULL,
                        captured_at_ms INTEGER NOT NULL,
                        execution_count INTEGER NOT NULL,
                        error_count INTEGER NOT NULL,
                        avg_response_time_ms REAL NOT NULL,
                        memory_usage_mb REAL NOT NULL,
                        active_containers INTEGER NOT NULL,
                        executions_per_minute INTEGER NOT NULL,
                        success_rate REAL NOT NULL,
                        error_rate REAL NOT NULL,
                        health_score REAL NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS queue_claim_conflicts (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        queue_item_id TEXT NOT NULL,
                        worker_id TEXT NOT NULL,
                        actual_status TEXT,
                        occurred_at_ms INTEGER NOT NULL
                    )
                    """);

            st.execute("CREATE INDEX IF NOT EXISTS idx_queue_dispatch ON execution_queue(organization_id, status, priority, available_at_ms, seq)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_queue_agent_status ON execution_queue(agent_id, status)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_queue_schedule_execution ON execution_queue(schedule_execution_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_sched_exec_schedule_status ON scheduled_executions(schedule_id, status, scheduled_for_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_sched_exec_due ON scheduled_executions(status, scheduled_for_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_schedules_agent ON schedules(agent_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_runtime_metrics_runtime_time ON runtime_metrics(runtime_id, captured_at_ms)");
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to initialize SQLite schema", e);
        }
    }

    private void ensureQueueColumns(Connection conn) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(execution_queue)")) {
            while (rs.next()) {
                columns.add(rs.getString("name").toLowerCase());
            }
        }
        try (Statement st = conn.createStatement()) {
            if (!columns.contains("source")) {
                st.execute("ALTER TABLE execution_queue ADD COLUMN source TEXT NOT NULL DEFAULT 'manual'");
            }
            if (!columns.contains("available_at_ms")) {
                st.execute("ALTER TABLE execution_queue ADD COLUMN available_at_ms INTEGER NOT NULL DEFAULT 0");
            }
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
            validatePragma(st, "foreign_keys", "1");
        } catch (SQLException e) {
            throw new InfrastructureException("Failed to apply SQLite pragmas", e);
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
}
