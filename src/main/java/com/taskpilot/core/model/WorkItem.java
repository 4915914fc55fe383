package com.taskpilot.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A milestone or workstream container; only its identity and display name matter here.
 */
public record WorkItem(String id, String name) {

    public static WorkItem fromEntity(JsonNode node) {
        String id = text(node, "id");
        String name = text(node, "title");
        if (name == null) {
            name = text(node, "name");
        }
        return new WorkItem(id, name == null ? id : name);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            return null;
        }
        return value.asText().trim();
    }
}
