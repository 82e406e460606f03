package engine;

public final class WorkflowAlreadyExistsException extends WorkflowException {
    public WorkflowAlreadyExistsException(String workflowId) {
        super(workflowId, "Workflow " + workflowId + " has already been started");
    }
}
