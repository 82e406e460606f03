package engine;

public sealed interface WorkflowOutcome {

    String workflowId();

    record Completed(String workflowId, Object result) implements WorkflowOutcome {
        public <T> T resultAs(Class<T> type) {
            return type.cast(result);
        }
    }

    record Suspended(String workflowId, String reason, Long wakeAtMs) implements WorkflowOutcome {
    }

    record Failed(String workflowId, Throwable error) implements WorkflowOutcome {
        public boolean isDeterminismViolation() {
            return error instanceof DeterminismViolationException;
        }
    }
}
