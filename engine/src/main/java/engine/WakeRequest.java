package engine;

import java.util.Objects;

public record WakeRequest(String workflowId, long fireAtMs) {
    public WakeRequest {
        Objects.requireNonNull(workflowId, "workflowId");
    }
}
