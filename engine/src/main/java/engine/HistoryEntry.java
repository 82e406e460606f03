package engine;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

public record HistoryEntry(
        String workflowId,
        String stepName,
        StepKind kind,
        StepStatus status,
        JsonNode input,
        JsonNode output,
        String error,
        long recordedAtMs) {

    public HistoryEntry {
        Objects.requireNonNull(workflowId, "workflowId");
        Objects.requireNonNull(stepName, "stepName");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(status, "status");
    }

    public static HistoryEntry running(String workflowId, String stepName, StepKind kind, JsonNode input, long nowMs) {
        return new HistoryEntry(workflowId, stepName, kind, StepStatus.RUNNING, input, null, null, nowMs);
    }

    public HistoryEntry completed(JsonNode result, long nowMs) {
        return new HistoryEntry(workflowId, stepName, kind, StepStatus.COMPLETED, input, result, null, nowMs);
    }

    public HistoryEntry failed(String errorMessage, long nowMs) {
        return new HistoryEntry(workflowId, stepName, kind, StepStatus.FAILED, input, null, errorMessage, nowMs);
    }

    public boolean matches(StepKind otherKind, String otherName) {
        return kind == otherKind && stepName.equals(otherName);
    }

    public String describe() {
        return kind + ":" + stepName;
    }
}
