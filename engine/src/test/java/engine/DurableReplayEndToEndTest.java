package engine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Real scheduler and file store: a short sleep is woken by the scheduler thread and the
 * history on disk ends up complete.
 */
class DurableReplayEndToEndTest {

    @TempDir
    Path tempDir;

    @Test
    void sleepingWorkflowIsWokenAndCompletes() throws Exception {
        AtomicInteger firstStepCalls = new AtomicInteger();
        WorkflowRegistry workflows = new WorkflowRegistry().register("greet", String.class, String.class,
                (ctx, name) -> {
                    String greeting = ctx.activity("greet", name);
                    ctx.sleep(Duration.ofMillis(150));
                    return ctx.step("shout", String.class, greeting::toUpperCase);
                });
        ActivityRegistry activities = new ActivityRegistry()
                .register("greet", String.class, String.class, name -> {
                    firstStepCalls.incrementAndGet();
                    return "hello " + name;
                });
        Path file = tempDir.resolve("history.json");
        JsonFileHistoryStore store = new JsonFileHistoryStore(file);
        store.initialize();

        try (WorkflowDriver driver = new WorkflowDriver(store, workflows, activities)) {
            WorkflowOutcome first = driver.start("wf-e2e", "greet", "ada");
            assertInstanceOf(WorkflowOutcome.Suspended.class, first);

            await().atMost(Duration.ofSeconds(5)).until(() ->
                    driver.describe("wf-e2e").orElseThrow().status() == WorkflowStatus.COMPLETED);
        }

        HistoryLog persisted = new JsonFileHistoryStore(file).load().get("wf-e2e");
        assertEquals(WorkflowStatus.COMPLETED, persisted.status());
        assertEquals("HELLO ADA", persisted.result().asText());
        assertEquals(3, persisted.size());
        assertEquals("shout", persisted.entry(2).stepName());
        assertEquals(1, firstStepCalls.get());
    }
}
