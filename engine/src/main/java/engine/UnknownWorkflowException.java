package engine;

public final class UnknownWorkflowException extends WorkflowException {
    public UnknownWorkflowException(String workflowId) {
        super(workflowId, "No history exists for workflow " + workflowId);
    }
}
