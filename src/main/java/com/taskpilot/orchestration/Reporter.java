package com.taskpilot.orchestration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskpilot.core.persistence.JsonSupport;
import com.taskpilot.core.rollup.Rollup;
import com.taskpilot.core.rollup.RollupChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The only path through which a dispatch job mutates the orchestration service.
 *
 * <p>Until the service hands out a run id, payloads carry the job's correlation id and
 * source client; the first response that includes {@code run_id} switches all later
 * payloads to that id. In dry-run mode nothing is sent and each call returns a synthetic
 * acknowledgement holding the payload that would have been sent.
 *
 * <p>Methods throw {@link OrchestrationException} on failure; callers decide whether a
 * failure matters.
 */
public class Reporter {

    private static final Logger log = LoggerFactory.getLogger(Reporter.class);

    /** Identity and flags of the job being reported on. */
    public record Settings(
        String scopeId,
        String jobId,
        String correlationId,
        String sourceClient,
        String planPath,
        String planHash,
        boolean dryRun
    ) {}

    private final OrchestrationClient client;
    private final Settings settings;
    private final ObjectMapper mapper = JsonSupport.newMapper();
    private String runId;

    public Reporter(OrchestrationClient client, Settings settings) {
        this.client = client;
        this.settings = settings;
    }

    public String runId() {
        return runId;
    }

    public JsonNode emit(ProgressEvent event) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("initiative_id", settings.scopeId());
        payload.put("message", event.message());
        payload.put("phase", event.phase().wireName());
        payload.put("level", event.level().wireName());
        if (event.progressPct() != null) {
            payload.put("progress_pct", event.progressPct());
        }
        if (event.nextStep() != null) {
            payload.put("next_step", event.nextStep());
        }
        ObjectNode metadata = mapper.valueToTree(event.metadata());
        metadata.put("job_id", settings.jobId());
        metadata.put("plan_file", settings.planPath());
        metadata.put("plan_sha256", settings.planHash());
        payload.set("metadata", metadata);
        withRunContext(payload);

        if (settings.dryRun()) {
            return dryRunAck(payload);
        }
        return captureRunId(client.emitActivity(payload));
    }

    public JsonNode applyChangeset(List<String> idempotencyParts, ArrayNode operations) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("initiative_id", settings.scopeId());
        payload.put("idempotency_key", IdempotencyKeys.of(idempotencyParts));
        payload.set("operations", operations);
        withRunContext(payload);

        if (settings.dryRun()) {
            return dryRunAck(payload);
        }
        return captureRunId(client.applyChangeset(payload));
    }

    /**
     * Pushes a task status through a {@code task.update} changeset. When metadata is given,
     * an activity entry describing the transition follows; its failure is only logged.
     */
    public JsonNode taskStatus(String taskId, String status, int attempt, String reason,
                               Map<String, Object> metadata) {
        ArrayNode operations = mapper.createArrayNode();
        operations.addObject()
                .put("op", "task.update")
                .put("task_id", taskId)
                .put("status", status)
                .put("description", reason);
        JsonNode response = applyChangeset(
                List.of("dispatch", settings.jobId(), taskId, status, String.valueOf(attempt)), operations);

        if (metadata != null && !metadata.isEmpty()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("task_id", taskId);
            details.put("status", status);
            details.put("attempt", attempt);
            details.putAll(metadata);
            emitQuietly(ProgressEvent.of("Task " + taskId + " -> " + status,
                    "done".equals(status) ? ProgressEvent.Phase.COMPLETED : ProgressEvent.Phase.EXECUTION,
                    "blocked".equals(status) ? ProgressEvent.Level.WARN : ProgressEvent.Level.INFO,
                    null, details));
        }
        return response;
    }

    /**
     * Reports a milestone rollup. The status itself is only written when it changed; the
     * activity entry is emitted for every propagated change.
     */
    public JsonNode milestoneStatus(RollupChange change) {
        Rollup next = change.current();
        JsonNode response = mapper.createObjectNode().put("ok", true).put("skipped", "no_status_change");
        if (change.statusChanged()) {
            ArrayNode operations = mapper.createArrayNode();
            operations.addObject()
                    .put("op", "milestone.update")
                    .put("milestone_id", change.entityId())
                    .put("status", next.status());
            response = applyChangeset(List.of("dispatch", settings.jobId(), "milestone", change.entityId(),
                    next.status(), String.valueOf(next.progressPct()), String.valueOf(next.done()),
                    String.valueOf(next.total())), operations);
        }
        emitQuietly(rollupEvent("Milestone", "milestone", change));
        return response;
    }

    /**
     * Reports a workstream rollup. The status is written with a direct entity update.
     */
    public JsonNode workstreamStatus(RollupChange change) {
        Rollup next = change.current();
        JsonNode response = mapper.createObjectNode().put("ok", true).put("skipped", "no_status_change");
        if (change.statusChanged()) {
            ObjectNode patch = mapper.createObjectNode().put("status", next.status());
            if (settings.dryRun()) {
                ObjectNode payload = mapper.createObjectNode()
                        .put("type", "workstream")
                        .put("id", change.entityId())
                        .put("status", next.status());
                response = dryRunAck(payload);
            } else {
                response = client.updateEntity("workstream", change.entityId(), patch);
            }
        }
        emitQuietly(rollupEvent("Workstream", "workstream", change));
        return response;
    }

    /**
     * Asks a human to decide on a blocked task, through a {@code decision.create} changeset.
     */
    public JsonNode requestDecision(String taskId, String title, String summary, List<String> options,
                                    boolean blocking) {
        ArrayNode operations = mapper.createArrayNode();
        ObjectNode op = operations.addObject()
                .put("op", "decision.create")
                .put("title", title)
                .put("summary", summary)
                .put("urgency", blocking ? "high" : "medium")
                .put("blocking", blocking);
        ArrayNode optionNodes = op.putArray("options");
        options.forEach(optionNodes::add);
        return applyChangeset(List.of("dispatch", settings.jobId(), "decision", taskId), operations);
    }

    private ProgressEvent rollupEvent(String label, String prefix, RollupChange change) {
        Rollup next = change.current();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("event", prefix + "_rollup");
        metadata.put(prefix + "_id", change.entityId());
        metadata.put(prefix + "_name", change.entityName());
        metadata.put("status", next.status());
        metadata.put("status_changed", change.statusChanged());
        metadata.put("done", next.done());
        metadata.put("total", next.total());
        metadata.put("blocked", next.blocked());
        metadata.put("active", next.active());
        metadata.put("todo", next.todo());
        if (change.previous() != null) {
            metadata.put("previous_status", change.previous().status());
            metadata.put("previous_done", change.previous().done());
        }
        metadata.put("trigger_task_id", change.triggerTaskId());
        metadata.put("attempt", change.attempt());

        ProgressEvent.Phase phase;
        if (next.isComplete()) {
            phase = ProgressEvent.Phase.COMPLETED;
        } else if (next.isAtRisk()) {
            phase = ProgressEvent.Phase.BLOCKED;
        } else {
            phase = ProgressEvent.Phase.EXECUTION;
        }
        String message = "%s %s: %d/%d done (%d%%), status %s.".formatted(label, change.entityName(),
                next.done(), next.total(), next.progressPct(), next.status());
        return ProgressEvent.of(message, phase,
                next.isAtRisk() ? ProgressEvent.Level.WARN : ProgressEvent.Level.INFO,
                next.progressPct(), metadata);
    }

    private void emitQuietly(ProgressEvent event) {
        try {
            emit(event);
        } catch (RuntimeException e) {
            log.warn("Activity emit failed ({}): {}", event.message(), e.getMessage());
        }
    }

    private void withRunContext(ObjectNode payload) {
        if (runId != null) {
            payload.put("run_id", runId);
        } else {
            payload.put("correlation_id", settings.correlationId());
            payload.put("source_client", settings.sourceClient());
        }
    }

    private JsonNode captureRunId(JsonNode response) {
        if (response != null && response.hasNonNull("run_id") && runId == null) {
            runId = response.get("run_id").asText();
            log.info("Orchestration run id {}", runId);
        }
        return response;
    }

    private JsonNode dryRunAck(ObjectNode payload) {
        log.debug("[dry-run] {}", payload);
        ObjectNode ack = mapper.createObjectNode();
        ack.put("ok", true);
        ack.put("dry_run", true);
        ack.set("payload", payload);
        return ack;
    }
}
