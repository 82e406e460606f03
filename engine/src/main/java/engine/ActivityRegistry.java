package engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public final class ActivityRegistry {
    private final Map<String, Registration<?, ?>> activities = new LinkedHashMap<>();

    public <I, O> ActivityRegistry register(String name,
                                            Class<I> inputType,
                                            Class<O> outputType,
                                            Activity<I, O> activity) {
        return register(name, inputType, outputType, RetryPolicy.NONE, activity);
    }

    public <I, O> ActivityRegistry register(String name,
                                            Class<I> inputType,
                                            Class<O> outputType,
                                            RetryPolicy retryPolicy,
                                            Activity<I, O> activity) {
        String stepName = normalizeName(name);
        if (Step.SLEEP.equals(stepName)) {
            throw new IllegalArgumentException("'" + Step.SLEEP + "' is reserved for timers");
        }
        Registration<I, O> registration = new Registration<>(
                stepName,
                Objects.requireNonNull(inputType, "inputType"),
                Objects.requireNonNull(outputType, "outputType"),
                Objects.requireNonNull(retryPolicy, "retryPolicy"),
                Objects.requireNonNull(activity, "activity"));
        if (activities.putIfAbsent(stepName, registration) != null) {
            throw new IllegalArgumentException("Activity already registered: " + stepName);
        }
        return this;
    }

    Registration<?, ?> get(String name) {
        Registration<?, ?> registration = activities.get(name);
        if (registration == null) {
            throw new IllegalArgumentException("No activity registered under name: " + name);
        }
        return registration;
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(activities.keySet());
    }

    static String normalizeName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Step name must not be blank");
        }
        return name.trim();
    }

    record Registration<I, O>(String name,
                              Class<I> inputType,
                              Class<O> outputType,
                              RetryPolicy retryPolicy,
                              Activity<I, O> activity) {
        O invoke(Object input) throws Exception {
            return activity.execute(inputType.cast(input));
        }
    }
}
