package examples.notify;

public record ApprovalDecision(boolean approved, String decidedBy, String comment) {
}
