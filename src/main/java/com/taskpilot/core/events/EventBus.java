package com.taskpilot.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fans dispatch events out to listeners such as the console view of a running job.
 * <p>
 * Events are delivered on the publishing thread, which is the dispatch loop. A listener
 * that throws is logged and skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final List<Consumer<DispatchEvent>> listeners = new CopyOnWriteArrayList<>();

    public void publish(DispatchEvent event) {
        log.debug("{} job={} task={}", event.eventType(), event.jobId(), event.taskId());
        for (Consumer<DispatchEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("Listener failed on {}: {}", event.eventType(), e.getMessage(), e);
            }
        }
    }

    /**
     * @return handle that removes the listener again
     */
    public Subscription subscribe(Consumer<DispatchEvent> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }
}
