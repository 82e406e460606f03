package engine;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

public record EngineConfig(StoreKind storeKind,
                           Path storePath,
                           int saveAttempts,
                           long saveBackoffMs,
                           int schedulerThreads) {

    public static final String RESOURCE = "replay-engine.properties";
    public static final String STORE_KIND = "replay.store.kind";
    public static final String STORE_PATH = "replay.store.path";
    public static final String SAVE_ATTEMPTS = "replay.save.attempts";
    public static final String SAVE_BACKOFF_MS = "replay.save.backoff-ms";
    public static final String SCHEDULER_THREADS = "replay.scheduler.threads";

    public enum StoreKind {
        JSON,
        SQLITE;

        public static StoreKind fromValue(String value) {
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "json" -> JSON;
                case "sqlite" -> SQLITE;
                default -> throw new IllegalArgumentException("Unsupported store kind: " + value);
            };
        }
    }

    public EngineConfig {
        Objects.requireNonNull(storeKind, "storeKind");
        Objects.requireNonNull(storePath, "storePath");
        if (saveAttempts < 1) {
            throw new IllegalArgumentException("saveAttempts must be at least 1");
        }
        if (saveBackoffMs < 0) {
            throw new IllegalArgumentException("saveBackoffMs must not be negative");
        }
        if (schedulerThreads < 1) {
            throw new IllegalArgumentException("schedulerThreads must be at least 1");
        }
    }

    public static EngineConfig defaults() {
        return new EngineConfig(StoreKind.JSON, Path.of("history.json"), 3, 100L, 1);
    }

    public static EngineConfig load() {
        Properties properties = new Properties();
        try (InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        for (String key : new String[] {STORE_KIND, STORE_PATH, SAVE_ATTEMPTS, SAVE_BACKOFF_MS, SCHEDULER_THREADS}) {
            String override = System.getProperty(key);
            if (override != null) {
                properties.setProperty(key, override);
            }
        }
        return fromProperties(properties);
    }

    public static EngineConfig fromProperties(Properties properties) {
        EngineConfig defaults = defaults();
        String kind = properties.getProperty(STORE_KIND);
        String path = properties.getProperty(STORE_PATH);
        return new EngineConfig(
                kind == null ? defaults.storeKind() : StoreKind.fromValue(kind),
                path == null || path.isBlank() ? defaults.storePath() : Path.of(path.trim()),
                intProperty(properties, SAVE_ATTEMPTS, defaults.saveAttempts()),
                longProperty(properties, SAVE_BACKOFF_MS, defaults.saveBackoffMs()),
                intProperty(properties, SCHEDULER_THREADS, defaults.schedulerThreads()));
    }

    public EngineConfig withStore(StoreKind kind, Path path) {
        return new EngineConfig(kind, path, saveAttempts, saveBackoffMs, schedulerThreads);
    }

    public HistoryStore createStore() throws HistoryStoreException {
        HistoryStore store = switch (storeKind) {
            case JSON -> new JsonFileHistoryStore(storePath);
            case SQLITE -> new SqliteHistoryStore(storePath);
        };
        store.initialize();
        return store;
    }

    private static int intProperty(Properties properties, String key, int fallback) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    private static long longProperty(Properties properties, String key, long fallback) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid long for " + key + ": " + value, e);
        }
    }
}
