package engine;

import java.util.Map;

public interface HistoryStore {
    void initialize() throws HistoryStoreException;

    /** Persists every given log, replacing what was stored for the same workflow ids. */
    void save(Map<String, HistoryLog> logs) throws HistoryStoreException;

    Map<String, HistoryLog> load() throws HistoryStoreException;
}
