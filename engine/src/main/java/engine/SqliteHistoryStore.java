package engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.sql.DataSource;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;
import org.sqlite.SQLiteOpenMode;

public final class SqliteHistoryStore implements HistoryStore {
    private static final int DEFAULT_BUSY_RETRIES = 8;
    private static final long DEFAULT_RETRY_BACKOFF_MS = 40L;
    private static final int SQLITE_BUSY_TIMEOUT_MS = 5_000;
    private static final TypeReference<LinkedHashMap<String, List<JsonNode>>> SIGNALS =
            new TypeReference<>() {
            };

    private final DataSource dataSource;
    private final JsonCodec jsonCodec;
    private final int busyRetries;
    private final long retryBackoffMs;

    public SqliteHistoryStore(Path dbPath) {
        this("jdbc:sqlite:" + dbPath.toAbsolutePath(), DEFAULT_BUSY_RETRIES, DEFAULT_RETRY_BACKOFF_MS);
    }

    public SqliteHistoryStore(String jdbcUrl, int busyRetries, long retryBackoffMs) {
        this.dataSource = createDataSource(Objects.requireNonNull(jdbcUrl, "jdbcUrl"));
        this.jsonCodec = new JsonCodec();
        this.busyRetries = busyRetries;
        this.retryBackoffMs = retryBackoffMs;
    }

    @Override
    public void initialize() throws HistoryStoreException {
        executeWithBusyRetry("initialize", () -> {
            try (Connection connection = openConnection(); Statement statement = connection.createStatement()) {
                statement.execute("""
                        CREATE TABLE IF NOT EXISTS workflows (
                            workflow_id TEXT PRIMARY KEY,
                            workflow_type TEXT NOT NULL,
                            status TEXT NOT NULL,
                            input_json TEXT,
                            result_json TEXT,
                            failure TEXT,
                            signals_json TEXT,
                            updated_at_ms INTEGER NOT NULL
                        )
                        """);
                statement.execute("""
                        CREATE TABLE IF NOT EXISTS history (
                            workflow_id TEXT NOT NULL,
                            position INTEGER NOT NULL,
                            step_name TEXT NOT NULL,
                            kind TEXT NOT NULL,
                            status TEXT NOT NULL,
                            input_json TEXT,
                            output_json TEXT,
                            error TEXT,
                            recorded_at_ms INTEGER NOT NULL,
                            PRIMARY KEY (workflow_id, position)
                        ) WITHOUT ROWID
                        """);
                statement.execute("""
                        CREATE INDEX IF NOT EXISTS idx_workflows_status
                        ON workflows (status)
                        """);
            }
            return null;
        });
    }

    @Override
    public void save(Map<String, HistoryLog> logs) throws HistoryStoreException {
        executeWithBusyRetry("save", () -> {
            try (Connection connection = openConnection()) {
                beginImmediate(connection);
                try {
                    long now = System.currentTimeMillis();
                    for (HistoryLog log : logs.values()) {
                        upsertWorkflow(connection, log, now);
                        upsertEntries(connection, log);
                    }
                    commit(connection);
                } catch (SQLException | RuntimeException e) {
                    rollback(connection, e);
                    throw e;
                }
            }
            return null;
        });
    }

    @Override
    public Map<String, HistoryLog> load() throws HistoryStoreException {
        return executeWithBusyRetry("load", () -> {
            try (Connection connection = openConnection()) {
                Map<String, List<HistoryEntry>> entries = selectEntries(connection);
                Map<String, HistoryLog> logs = new LinkedHashMap<>();
                try (PreparedStatement statement = connection.prepareStatement("""
                        SELECT workflow_id,
                               workflow_type,
                               status,
                               input_json,
                               result_json,
                               failure,
                               signals_json
                        FROM workflows
                        ORDER BY workflow_id
                        """);
                     ResultSet rs = statement.executeQuery()) {
                    while (rs.next()) {
                        String workflowId = rs.getString("workflow_id");
                        logs.put(workflowId, HistoryLog.restore(
                                workflowId,
                                rs.getString("workflow_type"),
                                jsonCodec.readTree(rs.getString("input_json")),
                                WorkflowStatus.valueOf(rs.getString("status")),
                                jsonCodec.readTree(rs.getString("result_json")),
                                rs.getString("failure"),
                                entries.getOrDefault(workflowId, List.of()),
                                readSignals(rs.getString("signals_json"))));
                    }
                }
                return logs;
            }
        });
    }

    private void upsertWorkflow(Connection connection, HistoryLog log, long now) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("""
                INSERT INTO workflows (
                    workflow_id,
                    workflow_type,
                    status,
                    input_json,
                    result_json,
                    failure,
                    signals_json,
                    updated_at_ms
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT(workflow_id) DO UPDATE SET
                    status = excluded.status,
                    result_json = excluded.result_json,
                    failure = excluded.failure,
                    signals_json = excluded.signals_json,
                    updated_at_ms = excluded.updated_at_ms
                """)) {
            statement.setString(1, log.workflowId());
            statement.setString(2, log.workflowType());
            statement.setString(3, log.status().name());
            statement.setString(4, toJsonOrNull(log.input()));
            statement.setString(5, toJsonOrNull(log.result()));
            statement.setString(6, log.failure());
            statement.setString(7, jsonCodec.toJson(log.pendingSignals()));
            statement.setLong(8, now);
            statement.executeUpdate();
        }
    }

    private void upsertEntries(Connection connection, HistoryLog log) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("""
                INSERT INTO history (
                    workflow_id,
                    position,
                    step_name,
                    kind,
                    status,
                    input_json,
                    output_json,
                    error,
                    recorded_at_ms
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT(workflow_id, position) DO UPDATE SET
                    status = excluded.status,
                    input_json = excluded.input_json,
                    output_json = excluded.output_json,
                    error = excluded.error,
                    recorded_at_ms = excluded.recorded_at_ms
                """)) {
            for (int position = 0; position < log.size(); position++) {
                HistoryEntry entry = log.entry(position);
                statement.setString(1, log.workflowId());
                statement.setInt(2, position);
                statement.setString(3, entry.stepName());
                statement.setString(4, entry.kind().name());
                statement.setString(5, entry.status().name());
                statement.setString(6, toJsonOrNull(entry.input()));
                statement.setString(7, toJsonOrNull(entry.output()));
                statement.setString(8, entry.error());
                statement.setLong(9, entry.recordedAtMs());
                statement.addBatch();
            }
            statement.executeBatch();
        }
    }

    private Map<String, List<HistoryEntry>> selectEntries(Connection connection) throws SQLException {
        Map<String, List<HistoryEntry>> entries = new LinkedHashMap<>();
        try (PreparedStatement statement = connection.prepareStatement("""
                SELECT workflow_id,
                       step_name,
                       kind,
                       status,
                       input_json,
                       output_json,
                       error,
                       recorded_at_ms
                FROM history
                ORDER BY workflow_id, position
                """);
             ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                String workflowId = rs.getString("workflow_id");
                entries.computeIfAbsent(workflowId, ignored -> new ArrayList<>()).add(new HistoryEntry(
                        workflowId,
                        rs.getString("step_name"),
                        StepKind.valueOf(rs.getString("kind")),
                        StepStatus.valueOf(rs.getString("status")),
                        jsonCodec.readTree(rs.getString("input_json")),
                        jsonCodec.readTree(rs.getString("output_json")),
                        rs.getString("error"),
                        rs.getLong("recorded_at_ms")));
            }
        }
        return entries;
    }

    private Map<String, List<JsonNode>> readSignals(String json) throws SQLException {
        if (json == null) {
            return Map.of();
        }
        try {
            return jsonCodec.fromJson(json, SIGNALS);
        } catch (JsonProcessingException e) {
            throw new SQLException("Stored signal inbox is not valid JSON", e);
        }
    }

    private String toJsonOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : jsonCodec.toJson(node);
    }

    private Connection openConnection() throws SQLException {
        return dataSource.getConnection();
    }

    private static void beginImmediate(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute("BEGIN IMMEDIATE");
        }
    }

    private static void commit(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute("COMMIT");
        }
    }

    private static void rollback(Connection connection, Exception cause) {
        try (Statement statement = connection.createStatement()) {
            statement.execute("ROLLBACK");
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
        }
    }

    private <T> T executeWithBusyRetry(String operation, SqlSupplier<T> supplier) throws HistoryStoreException {
        for (int attempt = 0; ; attempt++) {
            try {
                return supplier.get();
            } catch (SQLException e) {
                if (!isBusy(e) || attempt == busyRetries) {
                    throw new HistoryStoreException("SQLite " + operation + " failed (SQLState="
                            + e.getSQLState() + ", code=" + e.getErrorCode() + ")", e);
                }
                sleep(retryBackoffMs * (attempt + 1));
            }
        }
    }

    private boolean isBusy(SQLException e) {
        if (e instanceof SQLiteException sqliteException) {
            SQLiteErrorCode resultCode = sqliteException.getResultCode();
            if (resultCode == SQLiteErrorCode.SQLITE_BUSY || resultCode == SQLiteErrorCode.SQLITE_LOCKED) {
                return true;
            }
        }
        String message = e.getMessage();
        return e.getErrorCode() == 5
                || (message != null
                && (message.contains("SQLITE_BUSY")
                || message.contains("SQLITE_LOCKED")
                || message.contains("database is locked")));
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while retrying SQLite busy operation", interrupted);
        }
    }

    @FunctionalInterface
    private interface SqlSupplier<T> {
        T get() throws SQLException;
    }

    private static DataSource createDataSource(String jdbcUrl) {
        SQLiteConfig config = new SQLiteConfig();
        config.setOpenMode(SQLiteOpenMode.FULLMUTEX);
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setSynchronous(SQLiteConfig.SynchronousMode.FULL);
        config.setBusyTimeout(SQLITE_BUSY_TIMEOUT_MS);

        SQLiteDataSource sqliteDataSource = new SQLiteDataSource(config);
        sqliteDataSource.setUrl(jdbcUrl);
        return sqliteDataSource;
    }
}
