package engine;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;

public final class WorkflowContext {
    private final ExecutionPass pass;
    private final StepInterceptor interceptor;
    private final ActivityRegistry activities;

    WorkflowContext(ExecutionPass pass, StepInterceptor interceptor, ActivityRegistry activities) {
        this.pass = pass;
        this.interceptor = interceptor;
        this.activities = activities;
    }

    public String workflowId() {
        return pass.workflowId();
    }

    public int sequence() {
        return pass.cursor().sequence();
    }

    public boolean isReplaying() {
        return pass.cursor().sequence() < pass.log().size();
    }

    @SuppressWarnings("unchecked")
    public <O> O activity(String name, Object input) {
        ActivityRegistry.Registration<?, O> registration =
                (ActivityRegistry.Registration<?, O>) activities.get(ActivityRegistry.normalizeName(name));
        RetryPolicy retryPolicy = registration.retryPolicy();
        for (int attempt = 1; ; attempt++) {
            try {
                return interceptor.intercept(pass, new Step.Invoke<>(
                        registration.name(), input, registration.outputType(), () -> registration.invoke(input)));
            } catch (StepFailedException e) {
                if (attempt >= retryPolicy.maximumAttempts()) {
                    throw e;
                }
                long delayMs = retryPolicy.delayBeforeRetryMs(attempt);
                if (delayMs > 0) {
                    sleep(delayMs);
                }
            }
        }
    }

    public <T> T step(String name, Class<T> type, Callable<T> fn) {
        Objects.requireNonNull(fn, "fn");
        String stepName = ActivityRegistry.normalizeName(name);
        if (Step.SLEEP.equals(stepName)) {
            throw new IllegalArgumentException("'" + Step.SLEEP + "' is reserved for timers");
        }
        return interceptor.intercept(pass, new Step.Invoke<>(stepName, null, type, fn));
    }

    public void sleep(Duration duration) {
        sleep(duration.toMillis());
    }

    /**
     * Durable timer. The first time it is reached the current pass is suspended and the
     * workflow is resumed once the time has passed; on replay it returns immediately.
     */
    public void sleep(long durationMs) {
        interceptor.intercept(pass, new Step.Timer(durationMs));
    }

    public <T> T awaitSignal(String signalName, Class<T> type) {
        return interceptor.intercept(pass, new Step.AwaitSignal<>(ActivityRegistry.normalizeName(signalName), type));
    }

    /**
     * Waits at most {@code timeout} for a signal. Empty when the deadline passed first; a
     * signal that arrives later stays queued for the next wait.
     */
    public <T> Optional<T> awaitSignal(String signalName, Class<T> type, Duration timeout) {
        String name = ActivityRegistry.normalizeName(signalName);
        if (Step.SLEEP.equals(name)) {
            throw new IllegalArgumentException("'" + Step.SLEEP + "' is reserved for timers");
        }
        Objects.requireNonNull(type, "type");
        long deadline = interceptor.intercept(pass, new Step.Deadline(name, timeout.toMillis()));
        return interceptor.awaitSignalUntil(pass, name, type, deadline);
    }
}
