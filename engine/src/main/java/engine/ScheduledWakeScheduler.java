package engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

public final class ScheduledWakeScheduler implements WakeScheduler {
    private static final Logger logger = LoggerFactory.getLogger(ScheduledWakeScheduler.class);

    private final Clock clock;
    private final ScheduledExecutorService executor;
    private final Map<String, ScheduledFuture<?>> pending = new ConcurrentHashMap<>();

    public ScheduledWakeScheduler(Clock clock, int threads) {
        this.clock = Objects.requireNonNull(clock, "clock");
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1");
        }
        this.executor = Executors.newScheduledThreadPool(threads, new WakeThreadFactory());
    }

    @Override
    public synchronized void scheduleWake(WakeRequest request, Consumer<WakeRequest> onWake) {
        Objects.requireNonNull(onWake, "onWake");
        long delayMs = Math.max(0L, request.fireAtMs() - clock.millis());
        ScheduledFuture<?>[] holder = new ScheduledFuture<?>[1];
        holder[0] = executor.schedule(() -> fire(request, onWake, holder), delayMs, TimeUnit.MILLISECONDS);
        ScheduledFuture<?> previous = pending.put(request.workflowId(), holder[0]);
        if (previous != null) {
            previous.cancel(false);
        }
        logger.debug("Wake for {} scheduled in {} ms", request.workflowId(), delayMs);
    }

    private void fire(WakeRequest request, Consumer<WakeRequest> onWake, ScheduledFuture<?>[] self) {
        synchronized (this) {
            pending.remove(request.workflowId(), self[0]);
        }
        logger.info("Timer fired for workflow {}", request.workflowId());
        try {
            onWake.accept(request);
        } catch (RuntimeException e) {
            logger.error("Wake handler failed for workflow {}", request.workflowId(), e);
        }
    }

    public int pendingCount() {
        return pending.size();
    }

    @Override
    public synchronized void close() {
        pending.values().forEach(future -> future.cancel(false));
        pending.clear();
        executor.shutdownNow();
    }

    private static final class WakeThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "wake-scheduler-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
