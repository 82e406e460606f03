package engine;

import java.util.Objects;

final class ExecutionPass {
    private final HistoryLog log;
    private final ExecutionCursor cursor;
    private WakeRequest pendingWake;
    private SuspensionSignal suspension;
    private DeterminismViolationException violation;

    ExecutionPass(HistoryLog log) {
        this.log = Objects.requireNonNull(log, "log");
        this.cursor = new ExecutionCursor();
    }

    String workflowId() {
        return log.workflowId();
    }

    HistoryLog log() {
        return log;
    }

    ExecutionCursor cursor() {
        return cursor;
    }

    WakeRequest pendingWake() {
        return pendingWake;
    }

    SuspensionSignal suspension() {
        return suspension;
    }

    DeterminismViolationException violation() {
        return violation;
    }

    SuspensionSignal suspend(SuspensionSignal signal, WakeRequest wake) {
        this.suspension = signal;
        this.pendingWake = wake;
        return signal;
    }

    DeterminismViolationException violated(DeterminismViolationException e) {
        this.violation = e;
        return e;
    }

    /** A pass that suspended or diverged must not run any further step. */
    void checkActive() {
        if (violation != null) {
            throw violation;
        }
        if (suspension != null) {
            throw suspension;
        }
    }
}
