package examples.notify;

import engine.HistoryLog;
import engine.StepKind;
import engine.WakeRequest;
import engine.WorkflowDriver;
import engine.WorkflowOutcome;
import engine.WorkflowStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class NotifyWorkflowTest {

    @TempDir
    Path tempDir;

    private ReplayHarness harness;

    @BeforeEach
    void setUp() throws Exception {
        harness = new ReplayHarness(tempDir);
    }

    @Test
    void eachRoundIsSentOnceAcrossRestarts() throws Exception {
        NotifyRequest request = new NotifyRequest("#ops", 3, 1000);
        WorkflowOutcome outcome = harness.driverAt(0).start("notify-1", NotifyWorkflow.TYPE, request);
        assertInstanceOf(WorkflowOutcome.Suspended.class, outcome);

        for (int cycle = 1; cycle <= 3; cycle++) {
            WorkflowDriver restarted = harness.driverAt(cycle * 1000L);
            outcome = restarted.recover().get("notify-1");
        }

        NotifyResult result = assertInstanceOf(WorkflowOutcome.Completed.class, outcome).resultAs(NotifyResult.class);
        assertEquals("#ops", result.channel());
        assertEquals(3, result.messageIds().size());
        assertEquals(3, result.messageIds().stream().distinct().count());
        assertEquals(3, harness.services().deliveredCount("#ops"));

        HistoryLog log = harness.driverAt(3000).describe("notify-1").orElseThrow();
        assertEquals(WorkflowStatus.COMPLETED, log.status());
        assertEquals(List.of(StepKind.ACTIVITY, StepKind.TIMER, StepKind.ACTIVITY, StepKind.TIMER,
                        StepKind.ACTIVITY, StepKind.TIMER),
                log.entries().stream().map(entry -> entry.kind()).collect(Collectors.toList()));
    }

    @Test
    void earlyRestartKeepsSleepingUntilRecordedWakeTime() throws Exception {
        harness.driverAt(0).start("notify-2", NotifyWorkflow.TYPE, new NotifyRequest("#dev", 2, 5000));

        WorkflowOutcome outcome = harness.driverAt(1000).recover().get("notify-2");

        WorkflowOutcome.Suspended suspended = assertInstanceOf(WorkflowOutcome.Suspended.class, outcome);
        assertEquals(ReplayHarness.T0 + 5000, suspended.wakeAtMs());
        assertEquals(new WakeRequest("notify-2", ReplayHarness.T0 + 5000),
                harness.wakes.get(harness.wakes.size() - 1));
        assertEquals(1, harness.services().deliveredCount("#dev"));
    }

    @Test
    void messageAlreadyInOutboxIsReportedAsDuplicate() throws Exception {
        MessageReceipt earlier = harness.services()
                .sendSlackMessage(new SlackMessage("#ops", "message 0", "notify-3:0"));

        harness.driverAt(0).start("notify-3", NotifyWorkflow.TYPE, new NotifyRequest("#ops", 1, 10));
        HistoryLog log = harness.driverAt(0).describe("notify-3").orElseThrow();

        assertFalse(earlier.duplicate());
        assertTrue(log.entry(0).output().get("duplicate").asBoolean());
        assertEquals(earlier.messageId(), log.entry(0).output().get("messageId").asText());
        assertEquals(1, harness.services().deliveredCount("#ops"));
    }

    @Test
    void invalidRequestIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new NotifyRequest("#ops", 0, 10));
        assertThrows(IllegalArgumentException.class, () -> new NotifyRequest("#ops", 1, 0));
    }
}
