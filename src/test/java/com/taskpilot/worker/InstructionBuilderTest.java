package com.taskpilot.worker;

import com.taskpilot.core.model.Priority;
import com.taskpilot.core.model.Task;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InstructionBuilderTest {

    private static Task task() {
        return new Task("t-42", "Add login rate limiting", "todo", Priority.HIGH,
                Instant.parse("2026-03-01T00:00:00Z"), 3, "ws-1", "Auth Hardening", "m-1", "Beta",
                null, List.of("java", "security"));
    }

    private static JobContext job(String planText, JobConfig config) {
        return new JobContext("job-7", "scope-9", "corr-1", "docs/plan.md", planText, config,
                Path.of("/tmp/jobs/job-7"), 12);
    }

    @Nested
    @DisplayName("InstructionBuilder")
    class BuildTests {

        @Test
        @DisplayName("includes task fields and the progress snapshot")
        void taskFields() {
            String prompt = InstructionBuilder.build(task(), job("", JobConfig.empty()), 2, 5, Map.of());

            assertTrue(prompt.contains("- **Task ID:** t-42"));
            assertTrue(prompt.contains("- **Title:** Add login rate limiting"));
            assertTrue(prompt.contains("- **Workstream:** Auth Hardening"));
            assertTrue(prompt.contains("- **Milestone:** Beta"));
            assertTrue(prompt.contains("- **Due Date:** 2026-03-01"));
            assertTrue(prompt.contains("- **Priority:** high"));
            assertTrue(prompt.contains("- **Required Skills:** java, security"));
            assertTrue(prompt.contains("- **Dispatcher Job ID:** job-7"));
            assertTrue(prompt.contains("- **Attempt:** 2"));
            assertTrue(prompt.contains("5/12 tasks complete"));
            assertTrue(prompt.contains("No plan excerpt found."));
            assertTrue(prompt.contains("## Definition of Done"));
        }

        @Test
        @DisplayName("missing parents and due date fall back to placeholders")
        void placeholders() {
            Task bare = new Task("t-1", "Loose task", "todo", null, null, null, null, null, null, null, null, null);
            String prompt = InstructionBuilder.build(bare, job(null, null), 1, 0, null);

            assertTrue(prompt.contains("- **Workstream:** unassigned"));
            assertTrue(prompt.contains("- **Due Date:** none"));
            assertFalse(prompt.contains("Required Skills"));
            assertFalse(prompt.contains("## Additional Instructions"));
            assertFalse(prompt.contains("## Skill References"));
        }

        @Test
        @DisplayName("appends workstream then task prompts")
        void additionalInstructions() {
            JobConfig config = new JobConfig(null, null, Map.of("ws-1", "Use the auth module."),
                    Map.of("t-42", "Keep the limit configurable."), null);
            String prompt = InstructionBuilder.build(task(), job("", config), 1, 0, Map.of());

            int ws = prompt.indexOf("Use the auth module.");
            int tp = prompt.indexOf("Keep the limit configurable.");
            assertTrue(ws > 0);
            assertTrue(tp > ws);
        }

        @Test
        @DisplayName("truncates long skill documents")
        void skillDocs() {
            String longDoc = "a".repeat(InstructionBuilder.MAX_SKILL_DOC_CHARS + 500);
            String prompt = InstructionBuilder.build(task(), job("", null), 1, 0, Map.of("security", longDoc));

            assertTrue(prompt.contains("### security"));
            assertTrue(prompt.contains("... (truncated)"));
            assertFalse(prompt.contains("a".repeat(InstructionBuilder.MAX_SKILL_DOC_CHARS + 1)));
        }
    }

    @Nested
    @DisplayName("PlanExcerpt")
    class PlanExcerptTests {

        @Test
        @DisplayName("centres on the task title")
        void titleAnchor() {
            String plan = "x".repeat(5000) + "\n## ADD LOGIN RATE LIMITING\nthrottle attempts\n" + "y".repeat(5000);
            String excerpt = PlanExcerpt.extract(plan, task());

            assertTrue(excerpt.contains("ADD LOGIN RATE LIMITING"));
            assertTrue(excerpt.contains("throttle attempts"));
            assertTrue(excerpt.length() <= PlanExcerpt.MAX_CHARS);
        }

        @Test
        @DisplayName("falls back to the workstream name")
        void workstreamAnchor() {
            String plan = "z".repeat(4000) + "\nAuth Hardening section\n";
            assertTrue(PlanExcerpt.extract(plan, task()).contains("Auth Hardening section"));
        }

        @Test
        @DisplayName("uses the head of the plan when nothing matches")
        void headFallback() {
            String plan = "Intro\n" + "q".repeat(4000);
            String excerpt = PlanExcerpt.extract(plan, task(), 100);

            assertTrue(excerpt.startsWith("Intro"));
            assertEquals(100, excerpt.length());
        }

        @Test
        @DisplayName("empty plan gives empty excerpt")
        void emptyPlan() {
            assertEquals("", PlanExcerpt.extract("", task()));
            assertEquals("", PlanExcerpt.extract(null, task()));
        }
    }
}
