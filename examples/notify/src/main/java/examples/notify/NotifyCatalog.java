package examples.notify;

import engine.ActivityRegistry;
import engine.RetryPolicy;
import engine.WorkflowRegistry;

import java.time.Duration;

/**
 * Registers the notification workflows and the activities they call.
 */
public final class NotifyCatalog {
    static final RetryPolicy SEND_RETRY = new RetryPolicy(2, Duration.ofSeconds(1), 2.0);

    private NotifyCatalog() {
    }

    public static WorkflowRegistry workflows() {
        NotifyWorkflow notify = new NotifyWorkflow();
        ApprovalWorkflow approval = new ApprovalWorkflow();
        return new WorkflowRegistry()
                .register(NotifyWorkflow.TYPE, NotifyRequest.class, NotifyResult.class, notify::run)
                .register(ApprovalWorkflow.TYPE, ApprovalRequest.class, ApprovalResult.class, approval::run);
    }

    public static ActivityRegistry activities(NotificationServices services) {
        return new ActivityRegistry()
                .register(NotificationServices.SEND_SLACK_MESSAGE, SlackMessage.class, MessageReceipt.class,
                        SEND_RETRY, services::sendSlackMessage);
    }
}
