package engine;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TimedSignalAndRetryTest {
    private static final long T0 = 1_700_000_000_000L;

    private MutableClock clock;
    private InMemoryHistoryStore store;
    private ManualWakeScheduler scheduler;
    private AtomicInteger attempts;
    private ActivityRegistry activities;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new InMemoryHistoryStore();
        scheduler = new ManualWakeScheduler();
        attempts = new AtomicInteger();
        activities = new ActivityRegistry()
                .register("charge", Integer.class, Integer.class,
                        new RetryPolicy(3, Duration.ofSeconds(1), 2.0),
                        amount -> {
                            if (attempts.incrementAndGet() < 3) {
                                throw new IllegalStateException("gateway timeout");
                            }
                            return amount * 10;
                        })
                .register("refund", Integer.class, Integer.class,
                        new RetryPolicy(2, Duration.ZERO, 2.0),
                        amount -> {
                            attempts.incrementAndGet();
                            throw new IllegalStateException("refunds disabled");
                        });
    }

    @Test
    void signalBeforeDeadlineIsReturned() throws Exception {
        WorkflowDriver driver = driver();

        WorkflowOutcome.Suspended waiting = assertInstanceOf(WorkflowOutcome.Suspended.class,
                driver.start("wf-in-time", "invoice", 0));
        assertEquals(T0 + 5000, waiting.wakeAtMs());
        assertEquals(List.of(new WakeRequest("wf-in-time", T0 + 5000)), scheduler.pending());

        clock.advanceMillis(2000);
        WorkflowOutcome outcome = driver.signal("wf-in-time", "invoice", "INV-7");

        assertEquals("INV-7", assertInstanceOf(WorkflowOutcome.Completed.class, outcome).resultAs(String.class));
        HistoryLog log = store.stored("wf-in-time");
        assertEquals(List.of("TIMER:invoice", "SIGNAL:invoice"),
                log.entries().stream().map(HistoryEntry::describe).collect(Collectors.toList()));
        assertEquals(T0 + 5000, log.entry(0).input().get("wakeAt").asLong());
    }

    @Test
    void deadlineWithoutSignalTimesOutAndReplaysAsTimeout() throws Exception {
        WorkflowDriver driver = driver();
        driver.start("wf-late", "invoice", 0);

        clock.advanceMillis(5000);
        assertEquals(1, scheduler.fireDue(clock.millis()));
        assertEquals(WorkflowStatus.SUSPENDED, store.stored("wf-late").status());
        assertEquals(3, store.stored("wf-late").size());

        assertInstanceOf(WorkflowOutcome.Suspended.class, driver.signal("wf-late", "invoice", "INV-late"));
        assertEquals(1, store.stored("wf-late").pendingSignalCount("invoice"));

        scheduler = new ManualWakeScheduler();
        clock.advanceMillis(1000);
        WorkflowOutcome outcome = driver().recover().get("wf-late");

        assertEquals("timed out", assertInstanceOf(WorkflowOutcome.Completed.class, outcome).resultAs(String.class));
        assertEquals(1, store.stored("wf-late").pendingSignalCount("invoice"));
        assertFalse(store.stored("wf-late").entry(1).output().get("received").asBoolean());
    }

    @Test
    void restartDuringBoundedWaitRearmsDeadline() throws Exception {
        driver().start("wf-restart-wait", "invoice", 0);

        scheduler = new ManualWakeScheduler();
        clock.advanceMillis(1000);
        WorkflowOutcome outcome = driver().recover().get("wf-restart-wait");

        assertEquals(T0 + 5000, assertInstanceOf(WorkflowOutcome.Suspended.class, outcome).wakeAtMs());
        assertEquals(List.of(new WakeRequest("wf-restart-wait", T0 + 5000)), scheduler.pending());
        assertEquals(1, store.stored("wf-restart-wait").size());
    }

    @Test
    void retriesRecordEachAttemptAndBackOffDurably() throws Exception {
        driver().start("wf-charge", "charge", 4);
        assertEquals(List.of(new WakeRequest("wf-charge", T0 + 1000)), scheduler.pending());

        clock.advanceMillis(1000);
        scheduler.fireDue(clock.millis());
        assertEquals(List.of(new WakeRequest("wf-charge", T0 + 3000)), scheduler.pending());

        scheduler = new ManualWakeScheduler();
        clock.advanceMillis(2000);
        WorkflowOutcome outcome = driver().recover().get("wf-charge");

        assertEquals(40, assertInstanceOf(WorkflowOutcome.Completed.class, outcome).resultAs(Integer.class));
        assertEquals(3, attempts.get());
        HistoryLog log = store.stored("wf-charge");
        assertEquals(List.of(StepStatus.FAILED, StepStatus.COMPLETED, StepStatus.FAILED, StepStatus.COMPLETED,
                        StepStatus.COMPLETED),
                log.entries().stream().map(HistoryEntry::status).collect(Collectors.toList()));
        assertEquals(List.of("charge", "sleep", "charge", "sleep", "charge"),
                log.entries().stream().map(HistoryEntry::stepName).collect(Collectors.toList()));
    }

    @Test
    void exhaustedRetriesFailTheWorkflow() throws Exception {
        WorkflowOutcome.Failed failed = assertInstanceOf(WorkflowOutcome.Failed.class,
                driver().start("wf-refund", "refund", 4));

        StepFailedException error = assertInstanceOf(StepFailedException.class, failed.error());
        assertEquals(1, error.position());
        assertEquals(2, attempts.get());
        assertEquals(2, store.stored("wf-refund").size());
        assertEquals(WorkflowStatus.FAILED, store.stored("wf-refund").status());
    }

    @Test
    void retryPolicyValidatesItsSettings() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, Duration.ZERO, 1.0));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(2, Duration.ofSeconds(-1), 1.0));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(2, Duration.ZERO, 0.5));
        assertEquals(4000L, new RetryPolicy(4, Duration.ofSeconds(1), 2.0).delayBeforeRetryMs(3));
    }

    private WorkflowDriver driver() {
        WorkflowRegistry workflows = new WorkflowRegistry()
                .register("invoice", Integer.class, String.class, (ctx, input) -> {
                    Optional<String> invoice = ctx.awaitSignal("invoice", String.class, Duration.ofSeconds(5));
                    if (invoice.isPresent()) {
                        return invoice.get();
                    }
                    ctx.sleep(1000);
                    return "timed out";
                })
                .register("charge", Integer.class, Integer.class, (ctx, input) -> {
                    Integer charged = ctx.activity("charge", input);
                    return charged;
                })
                .register("refund", Integer.class, Integer.class, (ctx, input) -> {
                    Integer refunded = ctx.activity("refund", input);
                    return refunded;
                });
        EngineConfig config = new EngineConfig(EngineConfig.StoreKind.JSON, Path.of("unused.json"), 3, 0L, 1);
        return new WorkflowDriver(store, workflows, activities, scheduler, clock, config, CrashConfig.NONE);
    }
}
