package com.taskpilot.worker;

import com.taskpilot.core.model.Task;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * Converts a task and its job context into the prompt handed to the execution agent.
 * Pure function, no Spring dependencies.
 */
public final class InstructionBuilder {

    /** Upper bound for each embedded skill reference document. */
    public static final int MAX_SKILL_DOC_CHARS = 4_000;

    private InstructionBuilder() {}

    /**
     * @param task           the task being dispatched
     * @param job            per-job context
     * @param attempt        1-based attempt number
     * @param completedTasks tasks completed so far in this job
     * @param skillDocs      reference documents by skill tag, already loaded
     */
    public static String build(Task task, JobContext job, int attempt, int completedTasks,
                               Map<String, String> skillDocs) {
        var sb = new StringBuilder();

        sb.append("You are an implementation worker for scope ").append(job.scopeId()).append(".\n\n");

        sb.append("## Execution Requirements\n\n");
        sb.append("- Complete this task end-to-end in the current workspace without asking for input.\n");
        sb.append("- Keep scope constrained to this one task and its direct dependencies.\n");
        sb.append("- Run relevant validation/tests before finishing.\n");
        sb.append("- If blocked, produce concrete blocker details and a proposed next action.\n");
        sb.append("- Do not perform unrelated refactors.\n\n");

        sb.append("## Task\n\n");
        sb.append("- **Scope ID:** ").append(job.scopeId()).append("\n");
        sb.append("- **Task ID:** ").append(task.id()).append("\n");
        sb.append("- **Title:** ").append(task.title()).append("\n");
        sb.append("- **Workstream:** ").append(orElse(task.workstreamName(), orElse(task.workstreamId(), "unassigned"))).append("\n");
        sb.append("- **Milestone:** ").append(orElse(task.milestoneTitle(), orElse(task.milestoneId(), "unassigned"))).append("\n");
        sb.append("- **Due Date:** ").append(task.dueDate() == null ? "none"
                : DateTimeFormatter.ISO_LOCAL_DATE.format(task.dueDate().atOffset(ZoneOffset.UTC))).append("\n");
        sb.append("- **Priority:** ").append(task.priority().wireName()).append("\n");
        sb.append("- **Domain:** ").append(task.domain()).append("\n");
        if (!task.requiredSkills().isEmpty()) {
            sb.append("- **Required Skills:** ").append(String.join(", ", task.requiredSkills())).append("\n");
        }
        sb.append("- **Dispatcher Job ID:** ").append(job.jobId()).append("\n");
        sb.append("- **Attempt:** ").append(attempt).append("\n");
        sb.append("- **Progress Snapshot:** ").append(completedTasks).append("/").append(job.totalTasks())
                .append(" tasks complete\n\n");

        sb.append("## Plan\n\n");
        sb.append("Original Plan Reference: ").append(orElse(job.planPath(), "none")).append("\n\n");
        String excerpt = PlanExcerpt.extract(job.planText(), task);
        sb.append("```md\n").append(excerpt.isEmpty() ? "No plan excerpt found." : excerpt).append("\n```\n\n");

        String workstreamPrompt = task.workstreamId() == null ? null
                : job.jobConfig().workstreamPrompt().get(task.workstreamId());
        String taskPrompt = job.jobConfig().taskPrompt().get(task.id());
        if (isPresent(workstreamPrompt) || isPresent(taskPrompt)) {
            sb.append("## Additional Instructions\n\n");
            if (isPresent(workstreamPrompt)) {
                sb.append(workstreamPrompt.trim()).append("\n\n");
            }
            if (isPresent(taskPrompt)) {
                sb.append(taskPrompt.trim()).append("\n\n");
            }
        }

        if (skillDocs != null && !skillDocs.isEmpty()) {
            sb.append("## Skill References\n\n");
            for (var entry : skillDocs.entrySet()) {
                String doc = entry.getValue();
                if (doc.length() > MAX_SKILL_DOC_CHARS) {
                    doc = doc.substring(0, MAX_SKILL_DOC_CHARS) + "\n... (truncated)";
                }
                sb.append("### ").append(entry.getKey()).append("\n\n");
                sb.append(doc.trim()).append("\n\n");
            }
        }

        sb.append("## Definition of Done\n\n");
        sb.append("1. Code/config/docs changes are implemented.\n");
        sb.append("2. Relevant checks/tests are run and reported.\n");
        sb.append("3. Output includes: changed files, checks run, and final result.\n");

        return sb.toString();
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }

    private static String orElse(String value, String fallback) {
        return isPresent(value) ? value : fallback;
    }
}
