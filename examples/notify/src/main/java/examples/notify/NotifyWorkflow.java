package examples.notify;

import engine.WorkflowContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Posts a message to a channel, waits, and repeats. Each wait suspends the workflow; the
 * next pass replays the earlier messages from history instead of sending them again.
 */
public final class NotifyWorkflow {
    public static final String TYPE = "notify";

    private static final Logger logger = LoggerFactory.getLogger(NotifyWorkflow.class);

    public NotifyResult run(WorkflowContext context, NotifyRequest request) {
        List<String> messageIds = new ArrayList<>();
        for (int round = 0; round < request.rounds(); round++) {
            if (!context.isReplaying()) {
                logger.info("Workflow {} sending round {}", context.workflowId(), round);
            }
            SlackMessage message = new SlackMessage(
                    request.channel(),
                    "message " + round,
                    context.workflowId() + ":" + round);
            MessageReceipt receipt = context.activity(NotificationServices.SEND_SLACK_MESSAGE, message);
            messageIds.add(receipt.messageId());
            context.sleep(request.intervalMs());
        }
        return new NotifyResult(request.channel(), List.copyOf(messageIds));
    }
}
