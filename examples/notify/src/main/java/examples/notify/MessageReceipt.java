package examples.notify;

public record MessageReceipt(String messageId, String channel, boolean duplicate) {
}
