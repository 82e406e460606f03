package engine;

import com.fasterxml.jackson.databind.node.TextNode;

/**
 * Builds histories the way the interceptor would leave them.
 */
final class HistoryFixtures {
    private static final JsonCodec CODEC = new JsonCodec();

    private HistoryFixtures() {
    }

    /** stepA(1)=2, then a sleep until {@code nowMs + 5000}; suspended with one pending signal. */
    static HistoryLog sleepingLog(String workflowId, long nowMs) {
        HistoryLog log = HistoryLog.create(workflowId, "scenario", CODEC.toTree(1));
        completeActivity(log, "stepA", 1, 2, nowMs);
        HistoryEntry timer = HistoryEntry.running(workflowId, Step.SLEEP, StepKind.TIMER,
                CODEC.timerInput(nowMs, nowMs + 5000), nowMs);
        log.append(timer);
        log.replaceLast(timer.completed(null, nowMs));
        log.enqueueSignal("decision", TextNode.valueOf("approve"));
        log.status(WorkflowStatus.SUSPENDED);
        return log;
    }

    static void completeActivity(HistoryLog log, String name, Object input, Object output, long nowMs) {
        HistoryEntry running = HistoryEntry.running(log.workflowId(), name, StepKind.ACTIVITY, CODEC.toTree(input), nowMs);
        log.append(running);
        log.replaceLast(running.completed(CODEC.toTree(output), nowMs + 1));
    }

    static void failActivity(HistoryLog log, String name, Object input, String error, long nowMs) {
        HistoryEntry running = HistoryEntry.running(log.workflowId(), name, StepKind.ACTIVITY, CODEC.toTree(input), nowMs);
        log.append(running);
        log.replaceLast(running.failed(error, nowMs + 1));
    }

    static void startActivity(HistoryLog log, String name, Object input, long nowMs) {
        log.append(HistoryEntry.running(log.workflowId(), name, StepKind.ACTIVITY, CODEC.toTree(input), nowMs));
    }
}
