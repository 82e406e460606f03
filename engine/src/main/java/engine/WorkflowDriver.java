package engine;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

public final class WorkflowDriver implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(WorkflowDriver.class);
    private static final long MIN_WAKE_RETRY_MS = 1_000L;

    private final HistoryStore historyStore;
    private final WorkflowRegistry workflows;
    private final ActivityRegistry activities;
    private final WakeScheduler wakeScheduler;
    private final Clock clock;
    private final JsonCodec jsonCodec;
    private final StepInterceptor interceptor;
    private final int saveAttempts;
    private final long saveBackoffMs;

    private final Map<String, HistoryLog> histories = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Set<String> unsaved = ConcurrentHashMap.newKeySet();
    private final Object storeLock = new Object();
    private volatile boolean loaded;

    public WorkflowDriver(HistoryStore historyStore, WorkflowRegistry workflows, ActivityRegistry activities) {
        this(historyStore, workflows, activities, Clock.systemUTC());
    }

    private WorkflowDriver(HistoryStore historyStore,
                           WorkflowRegistry workflows,
                           ActivityRegistry activities,
                           Clock clock) {
        this(historyStore, workflows, activities, new ScheduledWakeScheduler(clock, 1), clock,
                EngineConfig.defaults(), CrashConfig.NONE);
    }

    public WorkflowDriver(HistoryStore historyStore,
                          WorkflowRegistry workflows,
                          ActivityRegistry activities,
                          WakeScheduler wakeScheduler,
                          Clock clock,
                          EngineConfig config,
                          CrashConfig crashConfig) {
        this.historyStore = Objects.requireNonNull(historyStore, "historyStore");
        this.workflows = Objects.requireNonNull(workflows, "workflows");
        this.activities = Objects.requireNonNull(activities, "activities");
        this.wakeScheduler = Objects.requireNonNull(wakeScheduler, "wakeScheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.jsonCodec = new JsonCodec();
        this.interceptor = new StepInterceptor(jsonCodec, clock, crashConfig);
        this.saveAttempts = config.saveAttempts();
        this.saveBackoffMs = config.saveBackoffMs();
    }

    public static WorkflowDriver create(EngineConfig config,
                                        WorkflowRegistry workflows,
                                        ActivityRegistry activities,
                                        CrashConfig crashConfig) throws HistoryStoreException {
        Clock clock = Clock.systemUTC();
        return new WorkflowDriver(config.createStore(), workflows, activities,
                new ScheduledWakeScheduler(clock, config.schedulerThreads()), clock, config, crashConfig);
    }

    public WorkflowOutcome start(String workflowId, String workflowType, Object input) throws HistoryStoreException {
        Objects.requireNonNull(workflowId, "workflowId");
        WorkflowDefinition<?, ?> definition = workflows.get(workflowType);
        if (input != null && !definition.inputType().isInstance(input)) {
            throw new IllegalArgumentException("Workflow " + workflowType + " expects input of type "
                    + definition.inputType().getName() + " but got " + input.getClass().getName());
        }
        ensureLoaded();
        ReentrantLock lock = lockFor(workflowId);
        lock.lock();
        try {
            if (histories.containsKey(workflowId)) {
                throw new WorkflowAlreadyExistsException(workflowId);
            }
            HistoryLog log = HistoryLog.create(workflowId, workflowType, jsonCodec.toTree(input));
            histories.put(workflowId, log);
            logger.info("Starting workflow {} of type {}", workflowId, workflowType);
            return runPass(log);
        } finally {
            lock.unlock();
        }
    }

    public WorkflowOutcome resume(String workflowId) throws HistoryStoreException {
        ensureLoaded();
        ReentrantLock lock = lockFor(workflowId);
        lock.lock();
        try {
            return resumeLocked(requireLog(workflowId));
        } finally {
            lock.unlock();
        }
    }

    public WorkflowOutcome signal(String workflowId, String signalName, Object payload) throws HistoryStoreException {
        String name = ActivityRegistry.normalizeName(signalName);
        ensureLoaded();
        ReentrantLock lock = lockFor(workflowId);
        lock.lock();
        try {
            HistoryLog log = requireLog(workflowId);
            if (log.status().isTerminal()) {
                throw new IllegalStateException("Workflow " + workflowId + " is already " + log.status()
                        + " and cannot receive signal " + name);
            }
            JsonNode tree = jsonCodec.toTree(payload);
            HistoryLog staged = log.copy();
            staged.enqueueSignal(name, tree);
            flush(staged);
            log.enqueueSignal(name, tree);
            logger.info("Signal '{}' delivered to workflow {}", name, workflowId);
            return resumeLocked(log);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Startup protocol: loads every stored history and resumes each one that has not
     * completed or failed. A workflow sleeping on a timer that is not yet due is re-armed
     * from the timer's recorded wake time instead of being run.
     */
    public Map<String, WorkflowOutcome> recover() throws HistoryStoreException {
        ensureLoaded();
        Map<String, WorkflowOutcome> outcomes = new LinkedHashMap<>();
        for (String workflowId : new ArrayList<>(histories.keySet())) {
            ReentrantLock lock = lockFor(workflowId);
            lock.lock();
            try {
                HistoryLog log = histories.get(workflowId);
                if (log.status().isTerminal()) {
                    continue;
                }
                if (!workflows.contains(log.workflowType())) {
                    logger.warn("Cannot recover workflow {}: type {} is not registered",
                            workflowId, log.workflowType());
                    continue;
                }
                outcomes.put(workflowId, resumeLocked(log));
            } finally {
                lock.unlock();
            }
        }
        logger.info("Recovered {} incomplete workflows", outcomes.size());
        return outcomes;
    }

    public Optional<HistoryLog> describe(String workflowId) throws HistoryStoreException {
        ensureLoaded();
        ReentrantLock lock = lockFor(workflowId);
        lock.lock();
        try {
            HistoryLog log = histories.get(workflowId);
            return log == null ? Optional.empty() : Optional.of(log.copy());
        } finally {
            lock.unlock();
        }
    }

    private WorkflowOutcome resumeLocked(HistoryLog log) {
        String workflowId = log.workflowId();
        if (log.status() == WorkflowStatus.COMPLETED || log.status() == WorkflowStatus.FAILED) {
            return recordedOutcome(log);
        }
        Optional<WakeRequest> timer = trailingTimer(log);
        if (timer.isPresent() && timer.get().fireAtMs() > clock.millis()) {
            try {
                flushIfUnsaved(log);
            } catch (HistoryStoreException e) {
                return new WorkflowOutcome.Failed(workflowId, e);
            }
            logger.info("Workflow {} is sleeping until {}, re-arming its wake", workflowId, timer.get().fireAtMs());
            armWake(timer.get());
            return new WorkflowOutcome.Suspended(workflowId, "sleeping until " + timer.get().fireAtMs(),
                    timer.get().fireAtMs());
        }
        logger.info("Resuming workflow {} with {} recorded steps", workflowId, log.size());
        return runPass(log);
    }

    private WorkflowOutcome recordedOutcome(HistoryLog log) {
        try {
            flushIfUnsaved(log);
        } catch (HistoryStoreException e) {
            return new WorkflowOutcome.Failed(log.workflowId(), e);
        }
        if (log.status() == WorkflowStatus.COMPLETED) {
            Class<?> outputType = workflows.get(log.workflowType()).outputType();
            return new WorkflowOutcome.Completed(log.workflowId(), jsonCodec.fromTree(log.result(), outputType));
        }
        return new WorkflowOutcome.Failed(log.workflowId(),
                new WorkflowException(log.workflowId(), "Workflow failed: " + log.failure()));
    }

    private WorkflowOutcome runPass(HistoryLog log) {
        WorkflowDefinition<?, ?> definition = workflows.get(log.workflowType());
        WorkflowStatus previousStatus = log.status();
        ExecutionPass pass = new ExecutionPass(log);
        WorkflowContext context = new WorkflowContext(pass, interceptor, activities);
        log.status(WorkflowStatus.RUNNING);

        Object result = null;
        Exception error = null;
        try {
            result = definition.run(context, jsonCodec, log);
        } catch (SuspensionSignal signal) {
            logger.debug("Pass over {} unwound: {}", log.workflowId(), signal.reason());
        } catch (Exception e) {
            error = e;
        }

        if (pass.violation() != null) {
            // history is left untouched so a corrected deployment can resume it
            log.status(previousStatus);
            logger.error("Workflow {} diverged from its history", log.workflowId(), pass.violation());
            return new WorkflowOutcome.Failed(log.workflowId(), pass.violation());
        }
        if (pass.suspension() != null) {
            return suspend(log, pass);
        }
        if (error != null) {
            return fail(log, error);
        }
        return complete(log, result);
    }

    private WorkflowOutcome suspend(HistoryLog log, ExecutionPass pass) {
        log.status(WorkflowStatus.SUSPENDED);
        try {
            flush(log);
        } catch (HistoryStoreException e) {
            return new WorkflowOutcome.Failed(log.workflowId(), e);
        }
        WakeRequest wake = pass.pendingWake();
        if (wake != null) {
            armWake(wake);
        }
        logger.info("Workflow {} suspended after {} steps: {}", log.workflowId(), log.size(), pass.suspension().reason());
        return new WorkflowOutcome.Suspended(log.workflowId(), pass.suspension().reason(),
                wake == null ? null : wake.fireAtMs());
    }

    private WorkflowOutcome complete(HistoryLog log, Object result) {
        log.markCompleted(jsonCodec.toTree(result));
        try {
            flush(log);
        } catch (HistoryStoreException e) {
            return new WorkflowOutcome.Failed(log.workflowId(), e);
        }
        logger.info("Workflow {} completed after {} steps", log.workflowId(), log.size());
        return new WorkflowOutcome.Completed(log.workflowId(), result);
    }

    private WorkflowOutcome fail(HistoryLog log, Exception error) {
        log.markFailed(error instanceof WorkflowException ? error.getMessage() : error.toString());
        logger.warn("Workflow {} failed: {}", log.workflowId(), log.failure());
        try {
            flush(log);
        } catch (HistoryStoreException e) {
            e.addSuppressed(error);
            return new WorkflowOutcome.Failed(log.workflowId(), e);
        }
        return new WorkflowOutcome.Failed(log.workflowId(), error);
    }

    private void flushIfUnsaved(HistoryLog log) throws HistoryStoreException {
        if (unsaved.contains(log.workflowId())) {
            flush(log);
        }
    }

    private void flush(HistoryLog log) throws HistoryStoreException {
        String workflowId = log.workflowId();
        HistoryLog snapshot = log.copy();
        synchronized (storeLock) {
            HistoryStoreException last = null;
            for (int attempt = 1; attempt <= saveAttempts; attempt++) {
                try {
                    historyStore.save(Map.of(workflowId, snapshot));
                    unsaved.remove(workflowId);
                    return;
                } catch (HistoryStoreException e) {
                    last = e;
                    logger.warn("Saving history of {} failed (attempt {}/{}): {}",
                            workflowId, attempt, saveAttempts, e.getMessage());
                    if (attempt < saveAttempts) {
                        sleep(saveBackoffMs * attempt);
                    }
                }
            }
            unsaved.add(workflowId);
            logger.error("History of workflow {} could not be saved; it is not durably {}",
                    workflowId, log.status(), last);
            throw last;
        }
    }

    private void armWake(WakeRequest request) {
        wakeScheduler.scheduleWake(request, this::onWake);
    }

    private void onWake(WakeRequest request) {
        WorkflowOutcome outcome;
        try {
            outcome = resume(request.workflowId());
        } catch (HistoryStoreException e) {
            logger.error("Could not resume workflow {} after its timer fired", request.workflowId(), e);
            armWake(retryWake(request.workflowId()));
            return;
        }
        logger.debug("Wake of {} ended with {}", request.workflowId(), outcome);
        if (outcome instanceof WorkflowOutcome.Failed failed && failed.error() instanceof HistoryStoreException) {
            WakeRequest retry = retryWake(request.workflowId());
            logger.warn("History of {} is still unsaved, retrying at {}", request.workflowId(), retry.fireAtMs());
            armWake(retry);
        }
    }

    private WakeRequest retryWake(String workflowId) {
        return new WakeRequest(workflowId, clock.millis() + Math.max(saveBackoffMs, MIN_WAKE_RETRY_MS));
    }

    private Optional<WakeRequest> trailingTimer(HistoryLog log) {
        return log.lastEntry()
                .filter(entry -> entry.kind() == StepKind.TIMER
                        && Step.SLEEP.equals(entry.stepName())
                        && entry.status() == StepStatus.COMPLETED)
                .map(entry -> {
                    JsonNode wakeAt = entry.input() == null ? null : entry.input().get("wakeAt");
                    long fireAt = wakeAt == null ? 0L : wakeAt.asLong();
                    return new WakeRequest(log.workflowId(), fireAt);
                });
    }

    private HistoryLog requireLog(String workflowId) {
        HistoryLog log = histories.get(workflowId);
        if (log == null) {
            throw new UnknownWorkflowException(workflowId);
        }
        return log;
    }

    private ReentrantLock lockFor(String workflowId) {
        return locks.computeIfAbsent(Objects.requireNonNull(workflowId, "workflowId"), ignored -> new ReentrantLock());
    }

    private void ensureLoaded() throws HistoryStoreException {
        if (loaded) {
            return;
        }
        synchronized (storeLock) {
            if (loaded) {
                return;
            }
            Map<String, HistoryLog> stored = historyStore.load();
            stored.forEach(histories::putIfAbsent);
            loaded = true;
            logger.info("Loaded {} workflow histories", stored.size());
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while retrying history save", interrupted);
        }
    }

    @Override
    public void close() {
        wakeScheduler.close();
    }
}
