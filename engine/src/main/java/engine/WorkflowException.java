package engine;

public class WorkflowException extends RuntimeException {
    private final String workflowId;

    public WorkflowException(String workflowId, String message) {
        super(message);
        this.workflowId = workflowId;
    }

    public WorkflowException(String workflowId, String message, Throwable cause) {
        super(message, cause);
        this.workflowId = workflowId;
    }

    public String workflowId() {
        return workflowId;
    }
}
