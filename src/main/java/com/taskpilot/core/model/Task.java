package com.taskpilot.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * A unit of backlog work as fetched from the orchestration service.
 *
 * @param id              stable identifier
 * @param title           human readable title
 * @param status          raw lifecycle status string, classified through {@link TaskState}
 * @param priority        priority bucket
 * @param dueDate         due date, null when missing or unparseable
 * @param sequence        ordering hint within a milestone, null when missing
 * @param workstreamId    parent workstream id (nullable)
 * @param workstreamName  parent workstream name (nullable)
 * @param milestoneId     parent milestone id (nullable)
 * @param milestoneTitle  parent milestone title (nullable)
 * @param domain          routing domain consulted by the spawn guard
 * @param requiredSkills  skill tags
 */
public record Task(
    String id,
    String title,
    String status,
    Priority priority,
    Instant dueDate,
    Integer sequence,
    String workstreamId,
    String workstreamName,
    String milestoneId,
    String milestoneTitle,
    String domain,
    List<String> requiredSkills
) {

    public Task {
        title = title == null ? "" : title;
        priority = priority == null ? Priority.UNKNOWN : priority;
        requiredSkills = requiredSkills == null ? List.of() : List.copyOf(requiredSkills);
        domain = (domain == null || domain.isBlank())
                ? DomainClassifier.infer(null, requiredSkills, title)
                : domain;
    }

    public TaskState state() {
        return TaskState.classify(status);
    }

    public Task withStatus(String newStatus) {
        return new Task(id, title, newStatus, priority, dueDate, sequence, workstreamId,
                workstreamName, milestoneId, milestoneTitle, domain, requiredSkills);
    }

    /** "title (id)" form used in log lines and activity messages. */
    public String summary() {
        return title + " (" + id + ")";
    }

    /**
     * Maps an entity record from the orchestration service. Missing fields become null;
     * the due date accepts ISO instants, offset date-times and plain dates.
     */
    public static Task fromEntity(JsonNode node) {
        List<String> skills = new ArrayList<>();
        JsonNode skillsNode = node.has("required_skills") ? node.get("required_skills") : node.get("skills");
        if (skillsNode != null && skillsNode.isArray()) {
            skillsNode.forEach(s -> {
                if (s.isTextual() && !s.asText().isBlank()) {
                    skills.add(s.asText().trim());
                }
            });
        }
        String title = firstText(node, "title", "name");
        return new Task(
                firstText(node, "id"),
                title == null ? "" : title,
                firstText(node, "status"),
                Priority.fromString(firstText(node, "priority")),
                parseDueDate(firstText(node, "due_date")),
                parseSequence(node.get("sequence")),
                firstText(node, "workstream_id"),
                firstText(node, "workstream_name"),
                firstText(node, "milestone_id"),
                firstText(node, "milestone_title"),
                DomainClassifier.infer(firstText(node, "domain"), skills, title),
                skills
        );
    }

    static Instant parseDueDate(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException ignored) {
            // fall through to the next accepted format
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException ignored) {
            // fall through to the next accepted format
        }
        try {
            return LocalDate.parse(value).atStartOfDay().toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Integer parseSequence(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.asInt();
        }
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull()) {
                String text = value.asText().trim();
                if (!text.isEmpty()) {
                    return text;
                }
            }
        }
        return null;
    }
}
