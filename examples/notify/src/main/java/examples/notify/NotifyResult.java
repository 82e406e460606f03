package examples.notify;

import java.util.List;

public record NotifyResult(String channel, List<String> messageIds) {
}
