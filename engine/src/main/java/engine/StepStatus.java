package engine;

public enum StepStatus {
    RUNNING,
    COMPLETED,
    FAILED
}
