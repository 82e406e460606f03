package examples.notify;

/**
 * A chat message to deliver. The idempotency key makes redelivery after a crash harmless.
 */
public record SlackMessage(String channel, String text, String idempotencyKey) {
}
