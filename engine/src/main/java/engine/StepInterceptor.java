package engine;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

final class StepInterceptor {
    private static final Logger logger = LoggerFactory.getLogger(StepInterceptor.class);

    private final JsonCodec jsonCodec;
    private final Clock clock;
    private final CrashConfig crashConfig;

    StepInterceptor(JsonCodec jsonCodec, Clock clock, CrashConfig crashConfig) {
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.crashConfig = Objects.requireNonNull(crashConfig, "crashConfig");
    }

    <T> T intercept(ExecutionPass pass, Step<T> step) {
        pass.checkActive();
        HistoryLog log = pass.log();
        int position = pass.cursor().sequence();

        if (position < log.size()) {
            HistoryEntry recorded = log.entry(position);
            if (!recorded.matches(step.kind(), step.name())) {
                throw pass.violated(new DeterminismViolationException(
                        pass.workflowId(), position, recorded.describe(), step.describe()));
            }
            if (recorded.status() == StepStatus.COMPLETED) {
                pass.cursor().advance();
                logger.debug("Replayed {} at position {} of {}", step.describe(), position, pass.workflowId());
                return jsonCodec.fromTree(recorded.output(), step.resultType());
            }
            if (recorded.status() == StepStatus.FAILED) {
                pass.cursor().advance();
                logger.debug("Replayed failure of {} at position {} of {}",
                        step.describe(), position, pass.workflowId());
                throw new StepFailedException(pass.workflowId(), step.name(), position, recorded.error(), null);
            }
            if (position != log.size() - 1) {
                throw new WorkflowException(pass.workflowId(), "History entry " + recorded.describe()
                        + " at position " + position + " is still running but is not the last entry");
            }
        }

        if (step instanceof Step.Invoke<T> invoke) {
            return invoke(pass, invoke, position);
        }
        if (step instanceof Step.Timer timer) {
            throw startTimer(pass, timer, position);
        }
        if (step instanceof Step.AwaitSignal<T> awaitSignal) {
            return receiveSignal(pass, awaitSignal, position);
        }
        if (step instanceof Step.Deadline deadline) {
            return step.resultType().cast(startDeadline(pass, deadline, position));
        }
        if (step instanceof Step.AwaitSignalUntil awaitUntil) {
            return step.resultType().cast(receiveSignalUntil(pass, awaitUntil, position));
        }
        throw new IllegalArgumentException("Unsupported step: " + step);
    }

    private <T> T invoke(ExecutionPass pass, Step.Invoke<T> step, int position) {
        HistoryLog log = pass.log();
        pass.cursor().advance();
        HistoryEntry running = HistoryEntry.running(
                pass.workflowId(), step.name(), StepKind.ACTIVITY, jsonCodec.toTree(step.input()), clock.millis());
        record(log, position, running);

        maybeCrash(step.name(), CrashPhase.BEFORE_EXECUTE);
        logger.info("Executing {} at position {} of {}", step.describe(), position, pass.workflowId());

        T output;
        try {
            output = step.operation().call();
        } catch (Exception e) {
            String error = e.toString();
            log.replaceLast(running.failed(error, clock.millis()));
            logger.warn("Step {} failed at position {} of {}: {}", step.describe(), position, pass.workflowId(), error);
            throw new StepFailedException(pass.workflowId(), step.name(), position, error, e);
        }

        maybeCrash(step.name(), CrashPhase.AFTER_EXECUTE_BEFORE_RECORD);
        log.replaceLast(running.completed(jsonCodec.toTree(output), clock.millis()));
        return output;
    }

    private SuspensionSignal startTimer(ExecutionPass pass, Step.Timer timer, int position) {
        HistoryLog log = pass.log();
        pass.cursor().advance();
        long now = clock.millis();
        long wakeAt = now + timer.durationMs();
        HistoryEntry running = HistoryEntry.running(
                pass.workflowId(), Step.SLEEP, StepKind.TIMER, jsonCodec.timerInput(now, wakeAt), now);
        record(log, position, running);
        WakeRequest wake = new WakeRequest(pass.workflowId(), wakeAt);
        log.replaceLast(running.completed(null, now));

        logger.info("Workflow {} sleeps {} ms at position {}, wake at {}",
                pass.workflowId(), timer.durationMs(), position, wakeAt);
        return pass.suspend(new SuspensionSignal("sleeping until " + wakeAt, wakeAt), wake);
    }

    private <T> T receiveSignal(ExecutionPass pass, Step.AwaitSignal<T> step, int position) {
        HistoryLog log = pass.log();
        pass.cursor().advance();
        Optional<JsonNode> payload = log.pollSignal(step.name());
        if (payload.isEmpty()) {
            logger.info("Workflow {} waits for signal '{}' at position {}", pass.workflowId(), step.name(), position);
            throw pass.suspend(new SuspensionSignal("awaiting signal " + step.name(), null), null);
        }
        long now = clock.millis();
        HistoryEntry running = HistoryEntry.running(pass.workflowId(), step.name(), StepKind.SIGNAL, null, now);
        record(log, position, running);
        log.replaceLast(running.completed(payload.get(), now));
        logger.info("Workflow {} received signal '{}' at position {}", pass.workflowId(), step.name(), position);
        return jsonCodec.fromTree(payload.get(), step.resultType());
    }

    <T> Optional<T> awaitSignalUntil(ExecutionPass pass, String name, Class<T> type, long deadlineMs) {
        JsonNode outcome = intercept(pass, new Step.AwaitSignalUntil(name, deadlineMs));
        if (outcome == null || !outcome.path("received").asBoolean()) {
            return Optional.empty();
        }
        return Optional.ofNullable(jsonCodec.fromTree(outcome.get("payload"), type));
    }

    private long startDeadline(ExecutionPass pass, Step.Deadline step, int position) {
        HistoryLog log = pass.log();
        pass.cursor().advance();
        long now = clock.millis();
        long deadline = now + step.durationMs();
        HistoryEntry running = HistoryEntry.running(
                pass.workflowId(), step.name(), StepKind.TIMER, jsonCodec.timerInput(now, deadline), now);
        record(log, position, running);
        log.replaceLast(running.completed(jsonCodec.toTree(deadline), now));
        return deadline;
    }

    private JsonNode receiveSignalUntil(ExecutionPass pass, Step.AwaitSignalUntil step, int position) {
        HistoryLog log = pass.log();
        pass.cursor().advance();
        long now = clock.millis();
        Optional<JsonNode> payload = log.pollSignal(step.name());
        if (payload.isEmpty() && now < step.deadlineMs()) {
            logger.info("Workflow {} waits for signal '{}' until {} at position {}",
                    pass.workflowId(), step.name(), step.deadlineMs(), position);
            throw pass.suspend(
                    new SuspensionSignal("awaiting signal " + step.name() + " until " + step.deadlineMs(),
                            step.deadlineMs()),
                    new WakeRequest(pass.workflowId(), step.deadlineMs()));
        }
        JsonNode outcome = jsonCodec.signalOutcome(payload.orElse(null));
        HistoryEntry running = HistoryEntry.running(pass.workflowId(), step.name(), StepKind.SIGNAL, null, now);
        record(log, position, running);
        log.replaceLast(running.completed(outcome, now));
        if (payload.isPresent()) {
            logger.info("Workflow {} received signal '{}' at position {}", pass.workflowId(), step.name(), position);
        } else {
            logger.info("Wait of {} for signal '{}' timed out at position {}", pass.workflowId(), step.name(), position);
        }
        return outcome;
    }

    private static void record(HistoryLog log, int position, HistoryEntry running) {
        if (position < log.size()) {
            // the step was in flight when the log was last saved; run it again in place
            log.replaceLast(running);
        } else {
            log.append(running);
        }
    }

    private void maybeCrash(String stepName, CrashPhase phase) {
        if (crashConfig.shouldCrash(stepName, phase)) {
            logger.error("Simulated crash at phase={} for step={}", phase, stepName);
            Runtime.getRuntime().halt(137);
        }
    }
}
