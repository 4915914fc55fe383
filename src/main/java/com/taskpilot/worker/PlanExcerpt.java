package com.taskpilot.worker;

import com.taskpilot.core.model.Task;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cuts the part of a plan document most relevant to a task.
 */
public final class PlanExcerpt {

    public static final int MAX_CHARS = 2_800;
    private static final int CHARS_BEFORE = 1_200;
    private static final int CHARS_AFTER = 1_600;

    private PlanExcerpt() {}

    /**
     * Returns the text around the first occurrence of the task title, workstream name or
     * milestone title (tried in that order, case-insensitive), or the head of the plan
     * when none occurs. Never longer than {@code maxChars}.
     */
    public static String extract(String planText, Task task, int maxChars) {
        if (planText == null || planText.isEmpty()) {
            return "";
        }
        List<String> anchors = new ArrayList<>(3);
        addIfPresent(anchors, task.title());
        addIfPresent(anchors, task.workstreamName());
        addIfPresent(anchors, task.milestoneTitle());

        for (String anchor : anchors) {
            Matcher matcher = Pattern.compile(Pattern.quote(anchor), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)
                    .matcher(planText);
            if (matcher.find()) {
                int start = Math.max(0, matcher.start() - CHARS_BEFORE);
                int end = Math.min(planText.length(), matcher.end() + CHARS_AFTER);
                return truncate(planText.substring(start, end), maxChars).trim();
            }
        }
        return truncate(planText, maxChars).trim();
    }

    public static String extract(String planText, Task task) {
        return extract(planText, task, MAX_CHARS);
    }

    private static void addIfPresent(List<String> anchors, String value) {
        if (value != null && !value.isBlank()) {
            anchors.add(value.trim());
        }
    }

    private static String truncate(String text, int maxChars) {
        return text.length() <= maxChars ? text : text.substring(0, maxChars);
    }
}
