package com.taskpilot.core.rollup;

import com.taskpilot.core.model.Priority;
import com.taskpilot.core.model.Task;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RollupAggregatorTest {

    private Task t1;
    private Task t2;
    private Task t3;
    private Task other;
    private RollupAggregator aggregator;

    private static Task task(String id, String status, String ws, String ms) {
        return new Task(id, "Task " + id, status, Priority.MEDIUM, null, null, ws, null, ms, null, null, List.of());
    }

    @BeforeEach
    void setUp() {
        t1 = task("t1", "done", "ws1", "m1");
        t2 = task("t2", "in_progress", "ws1", "m1");
        t3 = task("t3", "todo", "ws1", "m1");
        other = task("t9", "todo", "ws2", "m2");
        aggregator = new RollupAggregator(List.of(t1, t2, t3, other), List.of(t2, t3),
                Map.of("m1", "Beta"), Map.of("ws1", "Platform"));
    }

    @Test
    @DisplayName("seeds rollups for containers of queued tasks only")
    void seeds() {
        Rollup m1 = aggregator.milestoneRollups().get("m1");
        assertEquals("in_progress", m1.status());
        assertEquals(33, m1.progressPct());
        assertEquals("active", aggregator.workstreamRollups().get("ws1").status());
        assertFalse(aggregator.milestoneRollups().containsKey("m2"));
        assertFalse(aggregator.workstreamRollups().containsKey("ws2"));
    }

    @Test
    @DisplayName("completing the remaining tasks propagates 100 percent exactly once")
    void propagatesCompletionOnce() {
        List<RollupChange> received = new ArrayList<>();
        RollupSink sink = received::add;

        aggregator.setStatus("t2", "done");
        aggregator.sync(t2, 1, sink);
        aggregator.setStatus("t3", "done");
        aggregator.sync(t3, 1, sink);
        // same state again: nothing new to say
        aggregator.sync(t3, 1, sink);

        List<RollupChange> milestones = received.stream()
                .filter(c -> c.level() == RollupLevel.MILESTONE).toList();
        assertEquals(2, milestones.size());
        assertEquals(67, milestones.get(0).current().progressPct());
        assertFalse(milestones.get(0).statusChanged());

        RollupChange last = milestones.get(1);
        assertEquals("completed", last.current().status());
        assertEquals(100, last.current().progressPct());
        assertTrue(last.statusChanged());
        assertEquals("in_progress", last.previous().status());
        assertEquals("t3", last.triggerTaskId());
        assertEquals("Beta", last.entityName());

        assertEquals(1, received.stream()
                .filter(c -> c.level() == RollupLevel.MILESTONE && c.current().isComplete()).count());
    }

    @Test
    @DisplayName("unchanged rollup is not propagated")
    void unchanged() {
        List<RollupChange> received = new ArrayList<>();
        aggregator.setStatus("t2", "running");
        assertTrue(aggregator.sync(t2, 1, received::add).isEmpty());
        assertTrue(received.isEmpty());
    }

    @Test
    @DisplayName("a failing sink leaves the change pending for the next transition")
    void failingSinkRetried() {
        aggregator.setStatus("t2", "done");
        List<RollupChange> accepted = aggregator.sync(t2, 1, change -> {
            throw new IllegalStateException("service down");
        });
        assertTrue(accepted.isEmpty());
        assertEquals(33, aggregator.milestoneRollups().get("m1").progressPct());

        List<RollupChange> received = new ArrayList<>();
        aggregator.sync(t2, 2, received::add);
        assertEquals(2, received.size());
        assertEquals(67, aggregator.milestoneRollups().get("m1").progressPct());
    }

    @Test
    @DisplayName("changes carry display names")
    void displayNames() {
        List<RollupChange> received = new ArrayList<>();
        aggregator.setStatus("t3", "blocked");
        aggregator.sync(t3, 1, received::add);
        RollupChange workstream = received.stream()
                .filter(c -> c.level() == RollupLevel.WORKSTREAM).findFirst().orElseThrow();
        assertEquals("Platform", workstream.entityName());
        assertEquals("in_progress", aggregator.statusOf("t2"));
    }
}
