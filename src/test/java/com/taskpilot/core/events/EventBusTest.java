package com.taskpilot.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static DispatchEvent event(String type, String taskId) {
        return new DispatchEvent(type, "job-1", taskId, Map.of(), Instant.now());
    }

    @Test
    @DisplayName("every listener receives events in publish order")
    void fanOut() {
        List<String> first = new ArrayList<>();
        List<String> second = new ArrayList<>();
        eventBus.subscribe(e -> first.add(e.eventType()));
        eventBus.subscribe(e -> second.add(e.eventType()));

        eventBus.publish(event(DispatchEvent.TASK_DISPATCHED, "t1"));
        eventBus.publish(event(DispatchEvent.TASK_SUCCEEDED, "t1"));

        assertEquals(List.of(DispatchEvent.TASK_DISPATCHED, DispatchEvent.TASK_SUCCEEDED), first);
        assertEquals(first, second);
    }

    @Test
    @DisplayName("publishing with no listeners is a no-op")
    void noListeners() {
        assertDoesNotThrow(() -> eventBus.publish(event(DispatchEvent.JOB_HEARTBEAT, null)));
    }

    @Test
    @DisplayName("unsubscribe stops delivery")
    void unsubscribe() {
        List<DispatchEvent> received = new ArrayList<>();
        EventBus.Subscription subscription = eventBus.subscribe(received::add);

        subscription.unsubscribe();
        eventBus.publish(event(DispatchEvent.TASK_BLOCKED, "t1"));

        assertTrue(received.isEmpty());
    }

    @Test
    @DisplayName("a throwing listener does not stop the others")
    void isolatesFailures() {
        List<DispatchEvent> received = new ArrayList<>();
        eventBus.subscribe(e -> {
            throw new IllegalStateException("boom");
        });
        eventBus.subscribe(received::add);

        eventBus.publish(event(DispatchEvent.WORKER_KILLED, "t1"));

        assertEquals(1, received.size());
    }
}
