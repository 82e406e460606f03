package examples.notify;

public record NotifyRequest(String channel, int rounds, long intervalMs) {
    public NotifyRequest {
        if (rounds < 1) {
            throw new IllegalArgumentException("rounds must be at least 1");
        }
        if (intervalMs < 1) {
            throw new IllegalArgumentException("intervalMs must be positive");
        }
    }
}
