package examples.notify;

/**
 * {@code reminderAfterMs} of zero waits for the decision without ever reminding.
 */
public record ApprovalRequest(String channel, String subject, String approver, long reminderAfterMs) {
    public ApprovalRequest {
        if (reminderAfterMs < 0) {
            throw new IllegalArgumentException("reminderAfterMs must not be negative");
        }
    }

    public ApprovalRequest(String channel, String subject, String approver) {
        this(channel, subject, approver, 0L);
    }
}
