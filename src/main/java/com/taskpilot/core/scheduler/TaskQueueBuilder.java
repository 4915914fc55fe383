package com.taskpilot.core.scheduler;

import com.taskpilot.core.model.Task;
import com.taskpilot.core.model.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Turns the raw task list of a scope into the ordered dispatch queue.
 * <p>
 * Ordering keys, ascending: lifecycle weight of the raw status, due date (missing last),
 * priority rank, sequence (missing last), title, id. The final id key makes the order
 * total, so the same task set always yields the same queue regardless of input order.
 */
@Service
public class TaskQueueBuilder {

    private static final Logger log = LoggerFactory.getLogger(TaskQueueBuilder.class);

    public static final Comparator<Task> DISPATCH_ORDER = Comparator
            .comparingInt((Task t) -> lifecycleWeight(t.status()))
            .thenComparing(Task::dueDate, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
            .thenComparingInt(t -> t.priority().rank())
            .thenComparing(Task::sequence, Comparator.nullsLast(Comparator.<Integer>naturalOrder()))
            .thenComparing(t -> t.title() == null ? "" : t.title())
            .thenComparing(t -> t.id() == null ? "" : t.id());

    public List<Task> build(Collection<Task> tasks, QueueFilter filter) {
        List<Task> queue = tasks.stream()
                .filter(t -> t.id() != null)
                .filter(t -> filter.workstreamIds().isEmpty() || filter.workstreamIds().contains(t.workstreamId()))
                .filter(t -> filter.taskIds().isEmpty() || filter.taskIds().contains(t.id()))
                .filter(t -> filter.includeDone()
                        || t.state() != TaskState.DONE
                        || filter.taskIds().contains(t.id()))
                .sorted(DISPATCH_ORDER)
                .toList();

        if (filter.maxTasks() > 0 && queue.size() > filter.maxTasks()) {
            log.info("Queue capped at {} of {} matching tasks", filter.maxTasks(), queue.size());
            queue = queue.subList(0, filter.maxTasks());
        }
        log.debug("Built dispatch queue of {} tasks from {} candidates", queue.size(), tasks.size());
        return queue;
    }

    /**
     * Weight of the raw status string: in_progress first, then todo, then blocked.
     * Anything else (including other active-classified statuses) sorts last.
     */
    static int lifecycleWeight(String rawStatus) {
        return switch (TaskState.normalize(rawStatus)) {
            case "in_progress" -> 0;
            case "todo" -> 1;
            case "blocked" -> 2;
            default -> 9;
        };
    }
}
