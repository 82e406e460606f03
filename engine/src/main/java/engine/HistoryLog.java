package engine;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

@JsonAutoDetect(
        fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class HistoryLog {
    private String workflowId;
    private String workflowType;
    private JsonNode input;
    private WorkflowStatus status;
    private JsonNode result;
    private String failure;
    private List<HistoryEntry> entries;
    private Map<String, List<JsonNode>> pendingSignals;

    private HistoryLog() {
        this.entries = new ArrayList<>();
        this.pendingSignals = new LinkedHashMap<>();
    }

    public static HistoryLog create(String workflowId, String workflowType, JsonNode input) {
        HistoryLog log = new HistoryLog();
        log.workflowId = Objects.requireNonNull(workflowId, "workflowId");
        log.workflowType = Objects.requireNonNull(workflowType, "workflowType");
        log.input = input;
        log.status = WorkflowStatus.RUNNING;
        return log;
    }

    public String workflowId() {
        return workflowId;
    }

    public String workflowType() {
        return workflowType;
    }

    public JsonNode input() {
        return input;
    }

    public WorkflowStatus status() {
        return status;
    }

    public JsonNode result() {
        return result;
    }

    public String failure() {
        return failure;
    }

    public int size() {
        return entries.size();
    }

    public HistoryEntry entry(int position) {
        return entries.get(position);
    }

    public List<HistoryEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public Optional<HistoryEntry> lastEntry() {
        return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(entries.size() - 1));
    }

    void append(HistoryEntry entry) {
        if (!entry.workflowId().equals(workflowId)) {
            throw new IllegalArgumentException("Entry belongs to workflow " + entry.workflowId()
                    + ", not " + workflowId);
        }
        HistoryEntry last = entries.isEmpty() ? null : entries.get(entries.size() - 1);
        if (last != null && last.status() == StepStatus.RUNNING) {
            throw new IllegalStateException("Cannot append to " + workflowId
                    + " while step " + last.describe() + " is still running");
        }
        entries.add(entry);
    }

    void replaceLast(HistoryEntry entry) {
        if (entries.isEmpty()) {
            throw new IllegalStateException("History of " + workflowId + " is empty");
        }
        HistoryEntry last = entries.get(entries.size() - 1);
        if (!last.matches(entry.kind(), entry.stepName())) {
            throw new IllegalStateException("Last entry " + last.describe()
                    + " cannot be replaced by " + entry.describe());
        }
        if (last.status() != StepStatus.RUNNING) {
            throw new IllegalStateException("Last entry " + last.describe() + " is already " + last.status());
        }
        entries.set(entries.size() - 1, entry);
    }

    void status(WorkflowStatus newStatus) {
        this.status = Objects.requireNonNull(newStatus, "status");
    }

    void markCompleted(JsonNode workflowResult) {
        this.status = WorkflowStatus.COMPLETED;
        this.result = workflowResult;
        this.failure = null;
    }

    void markFailed(String failureMessage) {
        this.status = WorkflowStatus.FAILED;
        this.failure = failureMessage;
    }

    void enqueueSignal(String signalName, JsonNode payload) {
        pendingSignals.computeIfAbsent(signalName, ignored -> new ArrayList<>())
                .add(payload == null ? NullNode.getInstance() : payload);
    }

    Optional<JsonNode> pollSignal(String signalName) {
        List<JsonNode> queue = pendingSignals.get(signalName);
        if (queue == null || queue.isEmpty()) {
            return Optional.empty();
        }
        JsonNode payload = queue.remove(0);
        if (queue.isEmpty()) {
            pendingSignals.remove(signalName);
        }
        return Optional.ofNullable(payload);
    }

    Map<String, List<JsonNode>> pendingSignals() {
        Map<String, List<JsonNode>> copy = new LinkedHashMap<>();
        pendingSignals.forEach((name, queue) -> copy.put(name, new ArrayList<>(queue)));
        return copy;
    }

    public int pendingSignalCount(String signalName) {
        List<JsonNode> queue = pendingSignals.get(signalName);
        return queue == null ? 0 : queue.size();
    }

    public HistoryLog copy() {
        HistoryLog copy = new HistoryLog();
        copy.workflowId = workflowId;
        copy.workflowType = workflowType;
        copy.input = input == null ? null : input.deepCopy();
        copy.status = status;
        copy.result = result == null ? null : result.deepCopy();
        copy.failure = failure;
        copy.entries = new ArrayList<>(entries);
        copy.pendingSignals = new LinkedHashMap<>();
        pendingSignals.forEach((name, queue) -> copy.pendingSignals.put(name, new ArrayList<>(queue)));
        return copy;
    }

    static HistoryLog restore(String workflowId,
                              String workflowType,
                              JsonNode input,
                              WorkflowStatus status,
                              JsonNode result,
                              String failure,
                              List<HistoryEntry> entries,
                              Map<String, List<JsonNode>> pendingSignals) {
        HistoryLog log = create(workflowId, workflowType, input);
        log.status = Objects.requireNonNull(status, "status");
        log.result = result;
        log.failure = failure;
        log.entries.addAll(entries);
        pendingSignals.forEach((name, queue) -> log.pendingSignals.put(name, new ArrayList<>(queue)));
        return log;
    }

    @Override
    public String toString() {
        return "HistoryLog{" + workflowId + ", type=" + workflowType + ", status=" + status
                + ", entries=" + entries.size() + "}";
    }
}
