package examples.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Simulated chat API. Deliveries are kept in a SQLite outbox keyed by idempotency key, so a
 * message re-sent after a crash is reported as a duplicate instead of being posted twice.
 */
public final class NotificationServices {
    public static final String SEND_SLACK_MESSAGE = "send-slack-message";

    private static final Logger logger = LoggerFactory.getLogger(NotificationServices.class);
    private static final int DEFAULT_BUSY_RETRIES = 8;
    private static final long RETRY_BACKOFF_MS = 35L;

    private final String jdbcUrl;
    private final long latencyMs;

    public NotificationServices(Path dbPath) {
        this(dbPath, 1_000L);
    }

    public NotificationServices(Path dbPath, long latencyMs) {
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.latencyMs = latencyMs;
    }

    public void initialize() throws SQLException {
        withBusyRetry(() -> {
            try (Connection connection = openConnection(); Statement statement = connection.createStatement()) {
                statement.execute("""
                        CREATE TABLE IF NOT EXISTS outbox (
                            idempotency_key TEXT PRIMARY KEY,
                            channel TEXT NOT NULL,
                            text TEXT NOT NULL,
                            message_id TEXT NOT NULL,
                            sent_at_ms INTEGER NOT NULL
                        )
                        """);
            }
            return null;
        });
    }

    public MessageReceipt sendSlackMessage(SlackMessage message) throws SQLException {
        logger.info("Sending slack message to {}: {}", message.channel(), message.text());
        simulateApiLatency();
        String messageId = "MSG-" + shortHash(message.idempotencyKey());
        long now = System.currentTimeMillis();

        return withBusyRetry(() -> {
            try (Connection connection = openConnection()) {
                int inserted;
                try (PreparedStatement insert = connection.prepareStatement("""
                        INSERT INTO outbox (idempotency_key, channel, text, message_id, sent_at_ms)
                        VALUES (?, ?, ?, ?, ?)
                        ON CONFLICT(idempotency_key) DO NOTHING
                        """)) {
                    insert.setString(1, message.idempotencyKey());
                    insert.setString(2, message.channel());
                    insert.setString(3, message.text());
                    insert.setString(4, messageId);
                    insert.setLong(5, now);
                    inserted = insert.executeUpdate();
                }
                if (inserted == 0) {
                    logger.info("Message {} was already delivered", message.idempotencyKey());
                }
                return new MessageReceipt(messageId, message.channel(), inserted == 0);
            }
        });
    }

    public int deliveredCount(String channel) throws SQLException {
        return withBusyRetry(() -> {
            try (Connection connection = openConnection();
                 PreparedStatement select = connection.prepareStatement("""
                         SELECT COUNT(*) AS delivered
                         FROM outbox
                         WHERE channel = ?
                         """)) {
                select.setString(1, channel);
                try (ResultSet rs = select.executeQuery()) {
                    return rs.next() ? rs.getInt("delivered") : 0;
                }
            }
        });
    }

    private static String shortHash(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder builder = new StringBuilder();
            for (int i = 0; i < 6; i++) {
                builder.append(String.format("%02x", bytes[i]));
            }
            return builder.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private void simulateApiLatency() {
        if (latencyMs <= 0) {
            return;
        }
        try {
            Thread.sleep(latencyMs);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during simulated API call", interrupted);
        }
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL");
            statement.execute("PRAGMA busy_timeout=5000");
        }
        return connection;
    }

    private <T> T withBusyRetry(SqlSupplier<T> supplier) throws SQLException {
        for (int attempt = 0; ; attempt++) {
            try {
                return supplier.run();
            } catch (SQLException e) {
                if (!isBusy(e) || attempt == DEFAULT_BUSY_RETRIES) {
                    throw e;
                }
                sleep(RETRY_BACKOFF_MS * (attempt + 1));
            }
        }
    }

    private static boolean isBusy(SQLException e) {
        String message = e.getMessage();
        return e.getErrorCode() == 5
                || (message != null
                && (message.contains("SQLITE_BUSY") || message.contains("database is locked")));
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while retrying SQLite operation", interrupted);
        }
    }

    @FunctionalInterface
    private interface SqlSupplier<T> {
        T run() throws SQLException;
    }
}
