package engine;

import java.util.Locale;

public enum CrashPhase {
    NONE,
    BEFORE_EXECUTE,
    AFTER_EXECUTE_BEFORE_RECORD;

    public static CrashPhase fromValue(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "before-execute" -> BEFORE_EXECUTE;
            case "after-execute-before-record" -> AFTER_EXECUTE_BEFORE_RECORD;
            case "none" -> NONE;
            default -> throw new IllegalArgumentException("Unsupported crash phase: " + value);
        };
    }
}
