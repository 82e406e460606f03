package examples.notify;

import engine.WorkflowContext;

import java.time.Duration;
import java.util.Optional;

/**
 * Asks an approver for a decision, waits for it to arrive as a signal, then posts the
 * outcome. With a reminder delay set, the approver is nudged once if no decision has
 * arrived by then.
 */
public final class ApprovalWorkflow {
    public static final String TYPE = "approval";
    public static final String DECISION_SIGNAL = "decision";

    public ApprovalResult run(WorkflowContext context, ApprovalRequest request) {
        context.activity(NotificationServices.SEND_SLACK_MESSAGE, new SlackMessage(
                request.channel(),
                "@" + request.approver() + " please review: " + request.subject(),
                context.workflowId() + ":request"));

        ApprovalDecision decision = awaitDecision(context, request);

        String verdict = decision.approved() ? "approved" : "rejected";
        MessageReceipt confirmation = context.activity(NotificationServices.SEND_SLACK_MESSAGE, new SlackMessage(
                request.channel(),
                request.subject() + " was " + verdict + " by " + decision.decidedBy(),
                context.workflowId() + ":confirmation"));

        return new ApprovalResult(request.subject(), decision.approved(), decision.decidedBy(),
                confirmation.messageId());
    }

    private ApprovalDecision awaitDecision(WorkflowContext context, ApprovalRequest request) {
        if (request.reminderAfterMs() > 0) {
            Optional<ApprovalDecision> early = context.awaitSignal(
                    DECISION_SIGNAL, ApprovalDecision.class, Duration.ofMillis(request.reminderAfterMs()));
            if (early.isPresent()) {
                return early.get();
            }
            context.activity(NotificationServices.SEND_SLACK_MESSAGE, new SlackMessage(
                    request.channel(),
                    "@" + request.approver() + " reminder: " + request.subject() + " is still waiting for you",
                    context.workflowId() + ":reminder"));
        }
        return context.awaitSignal(DECISION_SIGNAL, ApprovalDecision.class);
    }
}
