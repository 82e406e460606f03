package engine;

public enum WorkflowStatus {
    RUNNING,
    SUSPENDED,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
