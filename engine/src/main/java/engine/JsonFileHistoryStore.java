package engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public final class JsonFileHistoryStore implements HistoryStore {
    private static final Logger logger = LoggerFactory.getLogger(JsonFileHistoryStore.class);
    private static final TypeReference<LinkedHashMap<String, HistoryLog>> MAPPING =
            new TypeReference<>() {
            };

    private final Path file;
    private final JsonCodec jsonCodec;
    private final Map<String, HistoryLog> stored = new LinkedHashMap<>();
    private boolean loaded;

    public JsonFileHistoryStore(Path file) {
        this.file = Objects.requireNonNull(file, "file").toAbsolutePath();
        this.jsonCodec = new JsonCodec();
    }

    public Path file() {
        return file;
    }

    @Override
    public void initialize() throws HistoryStoreException {
        Path parent = file.getParent();
        try {
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new HistoryStoreException("Cannot create history directory " + parent, e);
        }
    }

    @Override
    public synchronized void save(Map<String, HistoryLog> logs) throws HistoryStoreException {
        ensureLoaded();
        Map<String, HistoryLog> next = new LinkedHashMap<>(stored);
        logs.forEach((workflowId, log) -> next.put(workflowId, log.copy()));
        String json;
        try {
            json = jsonCodec.toPrettyJson(next);
        } catch (JsonProcessingException e) {
            throw new HistoryStoreException("Failed to serialize workflow histories", e);
        }
        writeAtomically(json);
        stored.clear();
        stored.putAll(next);
        logger.debug("Saved {} workflow histories to {}", next.size(), file);
    }

    @Override
    public synchronized Map<String, HistoryLog> load() throws HistoryStoreException {
        loaded = false;
        ensureLoaded();
        Map<String, HistoryLog> copy = new LinkedHashMap<>();
        stored.forEach((workflowId, log) -> copy.put(workflowId, log.copy()));
        return copy;
    }

    private void ensureLoaded() throws HistoryStoreException {
        if (loaded) {
            return;
        }
        stored.clear();
        if (Files.exists(file)) {
            try {
                String json = Files.readString(file, StandardCharsets.UTF_8);
                if (!json.isBlank()) {
                    stored.putAll(jsonCodec.fromJson(json, MAPPING));
                }
            } catch (IOException e) {
                throw new HistoryStoreException("Failed to read workflow histories from " + file, e);
            }
        }
        loaded = true;
        logger.debug("Loaded {} workflow histories from {}", stored.size(), file);
    }

    private void writeAtomically(String json) throws HistoryStoreException {
        Path directory = file.getParent() == null ? Path.of(".") : file.getParent();
        Path temp = null;
        try {
            temp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
            Files.writeString(temp, json, StandardCharsets.UTF_8);
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            HistoryStoreException failure = new HistoryStoreException("Failed to write workflow histories to " + file, e);
            deleteTemp(temp, failure);
            throw failure;
        }
    }

    private static void deleteTemp(Path temp, HistoryStoreException failure) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException cleanupFailure) {
            failure.addSuppressed(cleanupFailure);
        }
    }
}
