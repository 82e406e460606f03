package engine;

/**
 * Unwinds a workflow body when it has to wait for something outside the current pass.
 * Workflow code must not catch it. The driver turns it into a
 * {@link WorkflowOutcome.Suspended} outcome.
 */
public final class SuspensionSignal extends Error {
    private final String reason;
    private final Long wakeAtMs;

    SuspensionSignal(String reason, Long wakeAtMs) {
        super(reason, null, false, false);
        this.reason = reason;
        this.wakeAtMs = wakeAtMs;
    }

    public String reason() {
        return reason;
    }

    public Long wakeAtMs() {
        return wakeAtMs;
    }
}
