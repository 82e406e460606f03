package engine;

public enum StepKind {
    ACTIVITY,
    TIMER,
    SIGNAL
}
