package engine;

import java.util.Objects;

public record CrashConfig(String stepName, CrashPhase phase) {
    public static final CrashConfig NONE = new CrashConfig(null, CrashPhase.NONE);

    public CrashConfig {
        Objects.requireNonNull(phase, "phase");
    }

    public boolean shouldCrash(String currentStepName, CrashPhase currentPhase) {
        if (phase == CrashPhase.NONE || currentPhase != phase) {
            return false;
        }
        if (stepName == null || stepName.isBlank()) {
            return true;
        }
        return stepName.equals(currentStepName);
    }
}
