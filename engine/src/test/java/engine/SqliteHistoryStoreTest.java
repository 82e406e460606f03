package engine;

import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SqliteHistoryStoreTest {
    private static final long NOW = 1_700_000_000_000L;

    @TempDir
    Path tempDir;

    private Path dbPath;

    @BeforeEach
    void setUp() throws Exception {
        dbPath = tempDir.resolve("history.db");
        new SqliteHistoryStore(dbPath).initialize();
    }

    @Test
    void emptyDatabaseLoadsNothing() throws Exception {
        assertTrue(new SqliteHistoryStore(dbPath).load().isEmpty());
    }

    @Test
    void initializeIsIdempotent() throws Exception {
        SqliteHistoryStore store = new SqliteHistoryStore(dbPath);
        store.initialize();
        store.initialize();

        assertTrue(store.load().isEmpty());
    }

    @Test
    void savedHistoryIsReadBackInOrder() throws Exception {
        HistoryLog log = HistoryFixtures.sleepingLog("wf-1", NOW);
        HistoryFixtures.completeActivity(log, "stepB", 2, 4, NOW + 5000);
        log.markCompleted(new JsonCodec().toTree(4));
        new SqliteHistoryStore(dbPath).save(Map.of("wf-1", log));

        HistoryLog loaded = new SqliteHistoryStore(dbPath).load().get("wf-1");

        assertEquals(WorkflowStatus.COMPLETED, loaded.status());
        assertEquals(4, loaded.result().asInt());
        assertEquals(List.of("stepA", "sleep", "stepB"),
                loaded.entries().stream().map(HistoryEntry::stepName).toList());
        assertEquals(NOW + 5000, loaded.entry(1).input().get("wakeAt").asLong());
        assertNull(loaded.entry(1).output());
        assertEquals(4, loaded.entry(2).output().asInt());
        assertEquals(1, loaded.pendingSignalCount("decision"));
    }

    @Test
    void resavingReplacesRunningEntryAndDrainedSignals() throws Exception {
        SqliteHistoryStore store = new SqliteHistoryStore(dbPath);
        HistoryLog log = HistoryLog.create("wf-2", "scenario", TextNode.valueOf("in"));
        HistoryFixtures.startActivity(log, "stepA", 1, NOW);
        log.enqueueSignal("decision", TextNode.valueOf("yes"));
        store.save(Map.of("wf-2", log));
        assertEquals(StepStatus.RUNNING, store.load().get("wf-2").entry(0).status());

        HistoryEntry running = log.entry(0);
        log.replaceLast(running.completed(new JsonCodec().toTree(2), NOW + 10));
        assertTrue(log.pollSignal("decision").isPresent());
        log.status(WorkflowStatus.SUSPENDED);
        store.save(Map.of("wf-2", log));

        HistoryLog loaded = store.load().get("wf-2");
        assertEquals(1, loaded.size());
        assertEquals(StepStatus.COMPLETED, loaded.entry(0).status());
        assertEquals(2, loaded.entry(0).output().asInt());
        assertEquals(0, loaded.pendingSignalCount("decision"));
        assertEquals(WorkflowStatus.SUSPENDED, loaded.status());
        assertEquals("in", loaded.input().asText());
    }

    @Test
    void reexecutedRunningEntryKeepsItsNewInput() throws Exception {
        SqliteHistoryStore store = new SqliteHistoryStore(dbPath);
        JsonCodec codec = new JsonCodec();
        HistoryLog log = HistoryLog.create("wf-rerun", "scenario", null);
        HistoryFixtures.startActivity(log, "stepA", 1, NOW);
        store.save(Map.of("wf-rerun", log));

        HistoryEntry rerun = HistoryEntry.running("wf-rerun", "stepA", StepKind.ACTIVITY, codec.toTree(7), NOW + 50);
        log.replaceLast(rerun);
        log.replaceLast(rerun.completed(codec.toTree(14), NOW + 60));
        store.save(Map.of("wf-rerun", log));

        HistoryEntry loaded = store.load().get("wf-rerun").entry(0);
        assertEquals(7, loaded.input().asInt());
        assertEquals(14, loaded.output().asInt());
        assertEquals(StepStatus.COMPLETED, loaded.status());
    }

    @Test
    void historiesOfDifferentWorkflowsAreKeptApart() throws Exception {
        SqliteHistoryStore store = new SqliteHistoryStore(dbPath);
        store.save(Map.of("wf-a", HistoryFixtures.sleepingLog("wf-a", NOW)));
        HistoryLog failed = HistoryLog.create("wf-b", "scenario", null);
        HistoryFixtures.failActivity(failed, "stepA", 1, "java.lang.IllegalStateException: boom", NOW);
        failed.markFailed("boom");
        store.save(Map.of("wf-b", failed));

        Map<String, HistoryLog> loaded = store.load();

        assertEquals(2, loaded.get("wf-a").size());
        assertEquals(1, loaded.get("wf-b").size());
        assertEquals("java.lang.IllegalStateException: boom", loaded.get("wf-b").entry(0).error());
        assertEquals("boom", loaded.get("wf-b").failure());
    }

    @Test
    void driverResumesFromSqliteAfterRestart() throws Exception {
        MutableClock clock = new MutableClock(NOW);
        WorkflowRegistry workflows = new WorkflowRegistry().register("scenario", Integer.class, Integer.class,
                (ctx, input) -> {
                    Integer a = ctx.activity("stepA", input);
                    ctx.sleep(5000);
                    Integer b = ctx.activity("stepB", a);
                    return b;
                });
        ActivityRegistry activities = new ActivityRegistry()
                .register("stepA", Integer.class, Integer.class, input -> input * 2)
                .register("stepB", Integer.class, Integer.class, input -> input * 2);
        EngineConfig config = new EngineConfig(EngineConfig.StoreKind.SQLITE, dbPath, 3, 0L, 1);

        WorkflowDriver first = new WorkflowDriver(new SqliteHistoryStore(dbPath), workflows, activities,
                new ManualWakeScheduler(), clock, config, CrashConfig.NONE);
        assertInstanceOf(WorkflowOutcome.Suspended.class, first.start("wf-sql", "scenario", 1));

        clock.advanceMillis(5000);
        WorkflowDriver second = new WorkflowDriver(new SqliteHistoryStore(dbPath), workflows, activities,
                new ManualWakeScheduler(), clock, config, CrashConfig.NONE);
        WorkflowOutcome outcome = second.recover().get("wf-sql");

        assertEquals(4, assertInstanceOf(WorkflowOutcome.Completed.class, outcome).resultAs(Integer.class));
        assertEquals(3, new SqliteHistoryStore(dbPath).load().get("wf-sql").size());
    }
}
