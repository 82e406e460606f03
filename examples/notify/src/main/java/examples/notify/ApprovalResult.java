package examples.notify;

public record ApprovalResult(String subject, boolean approved, String decidedBy, String confirmationMessageId) {
}
