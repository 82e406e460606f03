package engine;

public final class DeterminismViolationException extends WorkflowException {
    private final int position;
    private final String recorded;
    private final String invoked;

    public DeterminismViolationException(String workflowId, int position, String recorded, String invoked) {
        super(workflowId, "Determinism violation in workflow " + workflowId + " at position " + position
                + ": history has " + recorded + " but code invoked " + invoked);
        this.position = position;
        this.recorded = recorded;
        this.invoked = invoked;
    }

    public int position() {
        return position;
    }

    public String recorded() {
        return recorded;
    }

    public String invoked() {
        return invoked;
    }
}
