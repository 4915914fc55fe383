package com.taskpilot.orchestration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;

/**
 * Narrow client into the orchestration service. All methods throw
 * {@link OrchestrationException} on failure.
 */
public interface OrchestrationClient {

    /** Lists entities of {@code type} ("task", "milestone", "workstream") matching {@code filters}. */
    List<JsonNode> listEntities(String type, Map<String, String> filters);

    JsonNode updateEntity(String type, String id, ObjectNode patch);

    JsonNode applyChangeset(ObjectNode payload);

    JsonNode emitActivity(ObjectNode payload);

    /**
     * @throws SpawnGuardUnsupportedException when the service has no admission endpoint
     */
    SpawnGuardResult checkSpawnGuard(String domain, String taskId);
}
