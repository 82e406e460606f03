package engine;

public final class StepFailedException extends WorkflowException {
    private final String stepName;
    private final int position;
    private final String recordedError;

    public StepFailedException(String workflowId, String stepName, int position, String recordedError, Throwable cause) {
        super(workflowId, "Step '" + stepName + "' failed at position " + position + " of workflow "
                + workflowId + ": " + recordedError, cause);
        this.stepName = stepName;
        this.position = position;
        this.recordedError = recordedError;
    }

    public String stepName() {
        return stepName;
    }

    public int position() {
        return position;
    }

    public String recordedError() {
        return recordedError;
    }
}
