package engine;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;
import java.util.concurrent.Callable;

sealed interface Step<T> {

    /** Reserved name of timer entries. */
    String SLEEP = "sleep";

    StepKind kind();

    String name();

    Class<T> resultType();

    default String describe() {
        return kind() + ":" + name();
    }

    record Invoke<T>(String name, Object input, Class<T> resultType, Callable<T> operation) implements Step<T> {
        public Invoke {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(resultType, "resultType");
            Objects.requireNonNull(operation, "operation");
        }

        @Override
        public StepKind kind() {
            return StepKind.ACTIVITY;
        }
    }

    record Timer(long durationMs) implements Step<Void> {
        public Timer {
            if (durationMs <= 0) {
                throw new IllegalArgumentException("Sleep duration must be positive: " + durationMs);
            }
        }

        @Override
        public StepKind kind() {
            return StepKind.TIMER;
        }

        @Override
        public String name() {
            return SLEEP;
        }

        @Override
        public Class<Void> resultType() {
            return Void.class;
        }
    }

    record AwaitSignal<T>(String name, Class<T> resultType) implements Step<T> {
        public AwaitSignal {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(resultType, "resultType");
        }

        @Override
        public StepKind kind() {
            return StepKind.SIGNAL;
        }
    }

    record Deadline(String name, long durationMs) implements Step<Long> {
        public Deadline {
            Objects.requireNonNull(name, "name");
            if (durationMs <= 0) {
                throw new IllegalArgumentException("Timeout must be positive: " + durationMs);
            }
        }

        @Override
        public StepKind kind() {
            return StepKind.TIMER;
        }

        @Override
        public Class<Long> resultType() {
            return Long.class;
        }
    }

    record AwaitSignalUntil(String name, long deadlineMs) implements Step<JsonNode> {
        public AwaitSignalUntil {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public StepKind kind() {
            return StepKind.SIGNAL;
        }

        @Override
        public Class<JsonNode> resultType() {
            return JsonNode.class;
        }
    }
}
