package com.taskpilot.core.scheduler;

import com.taskpilot.core.model.Priority;
import com.taskpilot.core.model.Task;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TaskQueueBuilderTest {

    private TaskQueueBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new TaskQueueBuilder();
    }

    private Task task(String id, String status, Priority priority) {
        return task(id, status, priority, null, null, "ws1");
    }

    private Task task(String id, String status, Priority priority, Instant due, Integer sequence, String ws) {
        return new Task(id, "Task " + id, status, priority, due, sequence, ws, null, null, null, null, List.of());
    }

    private List<String> ids(List<Task> tasks) {
        return tasks.stream().map(Task::id).toList();
    }

    @Test
    @DisplayName("orders todo tasks by priority")
    void priorityOrder() {
        var queue = builder.build(List.of(
                task("low", "todo", Priority.LOW),
                task("high", "todo", Priority.HIGH),
                task("medium", "todo", Priority.MEDIUM)), QueueFilter.all());
        assertEquals(List.of("high", "medium", "low"), ids(queue));
    }

    @Test
    @DisplayName("in progress before todo before blocked, regardless of priority")
    void lifecycleFirst() {
        var queue = builder.build(List.of(
                task("b", "blocked", Priority.URGENT),
                task("t", "todo", Priority.URGENT),
                task("p", "in_progress", Priority.LOW),
                task("q", "queued", Priority.URGENT)), QueueFilter.all());
        assertEquals(List.of("p", "t", "b", "q"), ids(queue));
    }

    @Test
    @DisplayName("earlier due date wins, missing due date last")
    void dueDateOrder() {
        Instant jan = Instant.parse("2026-01-01T00:00:00Z");
        Instant feb = Instant.parse("2026-02-01T00:00:00Z");
        var queue = builder.build(List.of(
                task("none", "todo", Priority.URGENT, null, null, "ws1"),
                task("feb", "todo", Priority.LOW, feb, null, "ws1"),
                task("jan", "todo", Priority.LOW, jan, null, "ws1")), QueueFilter.all());
        assertEquals(List.of("jan", "feb", "none"), ids(queue));
    }

    @Test
    @DisplayName("sequence breaks priority ties, missing sequence last")
    void sequenceOrder() {
        var queue = builder.build(List.of(
                task("s-none", "todo", Priority.HIGH, null, null, "ws1"),
                task("s2", "todo", Priority.HIGH, null, 2, "ws1"),
                task("s1", "todo", Priority.HIGH, null, 1, "ws1")), QueueFilter.all());
        assertEquals(List.of("s1", "s2", "s-none"), ids(queue));
    }

    @Test
    @DisplayName("order is total: shuffled input always yields the same queue")
    void totalOrder() {
        List<Task> tasks = new ArrayList<>();
        tasks.add(new Task("a", "Same", "todo", Priority.HIGH, null, null, "ws1", null, null, null, null, List.of()));
        tasks.add(new Task("b", "Same", "todo", Priority.HIGH, null, null, "ws1", null, null, null, null, List.of()));
        tasks.add(task("c", "in_progress", Priority.LOW));
        tasks.add(task("d", "blocked", Priority.MEDIUM));
        tasks.add(task("e", "todo", Priority.UNKNOWN));
        List<String> expected = ids(builder.build(tasks, QueueFilter.all()));

        Random random = new Random(7);
        for (int i = 0; i < 20; i++) {
            List<Task> shuffled = new ArrayList<>(tasks);
            Collections.shuffle(shuffled, random);
            assertEquals(expected, ids(builder.build(shuffled, QueueFilter.all())));
        }
    }

    @Test
    @DisplayName("done tasks are excluded unless included or selected by id")
    void doneFiltering() {
        var tasks = List.of(task("open", "todo", Priority.LOW), task("closed", "done", Priority.HIGH));

        assertEquals(List.of("open"), ids(builder.build(tasks, QueueFilter.all())));
        assertEquals(List.of("open", "closed"),
                ids(builder.build(tasks, new QueueFilter(Set.of(), Set.of(), true, 0))));
        assertEquals(List.of("closed"),
                ids(builder.build(tasks, new QueueFilter(Set.of(), Set.of("closed"), false, 0))));
    }

    @Test
    @DisplayName("workstream filter and max tasks cap")
    void workstreamAndCap() {
        var tasks = List.of(
                task("a", "todo", Priority.HIGH, null, null, "ws1"),
                task("b", "todo", Priority.MEDIUM, null, null, "ws2"),
                task("c", "todo", Priority.LOW, null, null, "ws1"));

        assertEquals(List.of("a", "c"), ids(builder.build(tasks, new QueueFilter(Set.of("ws1"), Set.of(), false, 0))));
        assertEquals(List.of("a", "b"), ids(builder.build(tasks, new QueueFilter(Set.of(), Set.of(), false, 2))));
    }

    @Test
    @DisplayName("tasks without id are dropped")
    void dropsMissingIds() {
        var queue = builder.build(List.of(task(null, "todo", Priority.HIGH), task("x", "todo", Priority.LOW)),
                QueueFilter.all());
        assertEquals(List.of("x"), ids(queue));
    }
}
