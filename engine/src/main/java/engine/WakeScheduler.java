package engine;

import java.util.function.Consumer;

public interface WakeScheduler extends AutoCloseable {

    /**
     * Invokes {@code onWake} no earlier than {@code request.fireAtMs()}. A later request for
     * the same workflow replaces an earlier one.
     */
    void scheduleWake(WakeRequest request, Consumer<WakeRequest> onWake);

    @Override
    void close();
}
