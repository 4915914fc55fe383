package com.taskpilot.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskpilot.core.events.EventBus;
import com.taskpilot.core.metrics.DispatchMetrics;
import com.taskpilot.core.model.FailureKind;
import com.taskpilot.core.model.Task;
import com.taskpilot.core.persistence.JobResult;
import com.taskpilot.core.persistence.JobState;
import com.taskpilot.core.persistence.JobStateStore;
import com.taskpilot.core.resource.HostMetricsSampler;
import com.taskpilot.core.scheduler.DispatchLoop;
import com.taskpilot.core.scheduler.DispatchOptions;
import com.taskpilot.core.scheduler.DispatchPlan;
import com.taskpilot.core.scheduler.JobOutcome;
import com.taskpilot.core.scheduler.MutableClock;
import com.taskpilot.core.scheduler.TaskQueueBuilder;
import com.taskpilot.orchestration.OrchestrationClient;
import com.taskpilot.orchestration.OrchestrationException;
import com.taskpilot.orchestration.OrchestrationProperties;
import com.taskpilot.worker.FakeWorkerHandle;
import com.taskpilot.worker.WorkerManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.intThat;
import static org.mockito.Mockito.*;

class DispatchEngineTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private OrchestrationClient client;
    private OrchestrationProperties properties;
    private WorkerManager workerManager;
    private JobStateStore store;
    private DispatchLoop.Sleeper sleeper;

    @BeforeEach
    void setUp() throws Exception {
        clock = new MutableClock(Instant.parse("2026-05-01T12:00:00Z"));
        client = mock(OrchestrationClient.class);
        properties = new OrchestrationProperties();
        properties.setApiKey("secret");
        workerManager = mock(WorkerManager.class);
        when(workerManager.launch(any(), any(), anyInt(), anyInt()))
                .thenAnswer(inv -> FakeWorkerHandle.exited(1, tempDir.resolve("w.log"), 0));
        store = new JobStateStore(clock);
        sleeper = clock::advance;
    }

    private DispatchEngine engine() {
        return new DispatchEngine(client, properties, new TaskQueueBuilder(), workerManager, store, new EventBus(),
                new DispatchMetrics(new SimpleMeterRegistry()), mock(HostMetricsSampler.class), clock, sleeper);
    }

    private DispatchOptions.Builder options() {
        return DispatchOptions.builder()
                .scopeId("scope-1")
                .jobId("job-1")
                .concurrency(2)
                .resourceGuardEnabled(false)
                .logsDir(tempDir.resolve("jobs"));
    }

    private void givenTasks(String... json) throws Exception {
        List<JsonNode> nodes = new ArrayList<>();
        for (String row : json) {
            nodes.add(mapper.readTree(row));
        }
        when(client.listEntities(eq("task"), anyMap())).thenReturn(nodes);
    }

    private void givenThreeTasks() throws Exception {
        givenTasks(
                "{\"id\":\"t1\",\"title\":\"One\",\"status\":\"todo\",\"priority\":\"high\",\"workstream_id\":\"ws1\",\"milestone_id\":\"m1\"}",
                "{\"id\":\"t2\",\"title\":\"Two\",\"status\":\"todo\",\"priority\":\"medium\",\"workstream_id\":\"ws1\",\"milestone_id\":\"m1\"}",
                "{\"id\":\"t3\",\"title\":\"Three\",\"status\":\"todo\",\"priority\":\"low\",\"workstream_id\":\"ws1\",\"milestone_id\":\"m1\"}");
    }

    private Path stateFile() {
        return tempDir.resolve("jobs").resolve("job-1").resolve(DispatchEngine.STATE_FILE_NAME);
    }

    @Nested
    @DisplayName("validation")
    class ValidationTests {

        @Test
        @DisplayName("scope id is required")
        void scopeRequired() {
            DispatchException e = assertThrows(DispatchException.class,
                    () -> engine().run(options().scopeId(null).build()));
            assertTrue(e.getMessage().contains("Scope id is required"));
        }

        @Test
        @DisplayName("api key is required unless dry run")
        void apiKeyRequired() throws Exception {
            properties.setApiKey("");
            assertThrows(DispatchException.class, () -> engine().run(options().build()));

            givenTasks();
            assertDoesNotThrow(() -> engine().run(options().dryRun(true).build()));
        }

        @Test
        @DisplayName("retry-blocked needs resume, resume needs a state file or job id")
        void resumeFlags() {
            DispatchException retry = assertThrows(DispatchException.class,
                    () -> engine().run(options().retryBlocked(true).build()));
            assertEquals("--retry-blocked requires --resume", retry.getMessage());

            DispatchException resume = assertThrows(DispatchException.class,
                    () -> engine().run(options().jobId(null).resume(true).build()));
            assertEquals("--resume requires --state-file or --job-id", resume.getMessage());
            verifyNoInteractions(client);
        }

        @Test
        @DisplayName("unreadable plan file fails before any fetch")
        void missingPlan() {
            assertThrows(DispatchException.class,
                    () -> engine().run(options().planFile(tempDir.resolve("absent.md")).build()));
            verifyNoInteractions(client);
        }
    }

    @Nested
    @DisplayName("run")
    class RunTests {

        @Test
        @DisplayName("empty queue completes without spawning")
        void emptyQueue() {
            JobOutcome outcome = engine().run(options().build());

            assertEquals(JobResult.COMPLETED, outcome.result());
            assertEquals(0, outcome.totalTasks());
            assertEquals(JobResult.COMPLETED, store.load(stateFile()).orElseThrow().getResult());
            verifyNoInteractions(workerManager);
            verify(client).emitActivity(argThat(p -> "No matching tasks to dispatch.".equals(p.get("message").asText())));
        }

        @Test
        @DisplayName("fetches with scope filter and dispatches in priority order")
        void dispatchesAll() throws Exception {
            givenThreeTasks();

            JobOutcome outcome = engine().run(options().concurrency(1).build());

            assertEquals(JobResult.COMPLETED, outcome.result());
            assertEquals(3, outcome.completed());
            assertEquals(stateFile(), outcome.stateFile());
            verify(client).listEntities(eq("task"), argThat(f -> "scope-1".equals(f.get("initiative_id"))
                    && "1500".equals(f.get("limit"))));
            var order = inOrder(workerManager);
            order.verify(workerManager).launch(any(), argThat(t -> t.id().equals("t1")), eq(1), eq(0));
            order.verify(workerManager).launch(any(), argThat(t -> t.id().equals("t2")), eq(1), eq(1));
            order.verify(workerManager).launch(any(), argThat(t -> t.id().equals("t3")), eq(1), eq(2));

            JobState state = store.load(stateFile()).orElseThrow();
            assertEquals("completed", state.getRollups().getMilestones().get("m1").status());
        }

        @Test
        @DisplayName("dry run reads but never spawns or writes")
        void dryRun() throws Exception {
            givenThreeTasks();

            JobOutcome outcome = engine().run(options().dryRun(true).build());

            assertEquals(3, outcome.completed());
            verifyNoInteractions(workerManager);
            verify(client, never()).applyChangeset(any());
            verify(client, never()).emitActivity(any());
            verify(client, never()).updateEntity(any(), any(), any());
        }

        @Test
        @DisplayName("fetch failure becomes a DispatchException")
        void fetchFailure() {
            when(client.listEntities(eq("workstream"), anyMap())).thenThrow(new OrchestrationException("down", 502));

            DispatchException e = assertThrows(DispatchException.class, () -> engine().run(options().build()));
            assertTrue(e.getMessage().startsWith("Failed to list workstream entities"));
        }

        @Test
        @DisplayName("interrupt surfaces as DispatchException with the flag restored")
        void interrupted() throws Exception {
            givenThreeTasks();
            when(workerManager.launch(any(), any(), anyInt(), anyInt()))
                    .thenAnswer(inv -> new FakeWorkerHandle(7, tempDir.resolve("w.log")));
            sleeper = d -> {
                throw new InterruptedException();
            };

            assertThrows(DispatchException.class, () -> engine().run(options().build()));
            assertTrue(Thread.interrupted());
        }
    }

    @Nested
    @DisplayName("resume")
    class ResumeTests {

        private void givenPriorRun() {
            JobState prior = JobState.start("job-1", "scope-1", null, null, List.of(), 3, clock.instant());
            prior.recordTask("t1", new JobState.TaskRecord("done", 1, 0, null, clock.instant(), null, null));
            prior.recordTask("t2", new JobState.TaskRecord("blocked", 2, 1, null, clock.instant(), null, "failed"));
            prior.recordTask("t3", new JobState.TaskRecord("retry_pending", 1, 1, null, clock.instant(), null, null));
            prior.getActiveWorkers().put("t3", new JobState.ActiveWorker(55, 1, clock.instant(), null));
            store.persist(stateFile(), prior);
        }

        @Test
        @DisplayName("skips settled tasks and continues attempt numbering")
        void resumes() throws Exception {
            givenThreeTasks();
            givenPriorRun();

            JobOutcome outcome = engine().run(options().resume(true).build());

            assertEquals(JobResult.COMPLETED_WITH_BLOCKERS, outcome.result());
            assertEquals(3, outcome.totalTasks());
            assertEquals(2, outcome.completed());
            assertEquals(1, outcome.blocked());
            verify(workerManager, times(1)).launch(any(), any(), anyInt(), anyInt());
            verify(workerManager).launch(any(), argThat(t -> t.id().equals("t3")), eq(2), anyInt());

            JobState state = store.load(stateFile()).orElseThrow();
            assertTrue(state.getActiveWorkers().isEmpty());
            assertEquals("blocked", state.taskRecord("t2").status());
        }

        @Test
        @DisplayName("a second resume of a finished job dispatches nothing")
        void idempotent() throws Exception {
            givenThreeTasks();
            givenPriorRun();
            engine().run(options().resume(true).build());
            clearInvocations(workerManager);

            JobOutcome again = engine().run(options().resume(true).build());

            assertEquals(2, again.completed());
            assertEquals(1, again.blocked());
            verifyNoInteractions(workerManager);
        }

        @Test
        @DisplayName("a task that crashed on its last attempt is blocked, not launched again")
        void exhaustedAcrossRestarts() throws Exception {
            givenThreeTasks();
            JobState prior = JobState.start("job-1", "scope-1", null, null, List.of(), 3, clock.instant());
            prior.recordTask("t1", new JobState.TaskRecord("running", 2, null, null, clock.instant(), null, null));
            store.persist(stateFile(), prior);

            JobOutcome outcome = engine().run(options().maxAttempts(2).resume(true).build());

            assertEquals(JobResult.COMPLETED_WITH_BLOCKERS, outcome.result());
            assertEquals(2, outcome.completed());
            assertEquals(1, outcome.blocked());
            verify(workerManager, never()).launch(any(), argThat(t -> t.id().equals("t1")), anyInt(), anyInt());
            verify(workerManager, never()).launch(any(), any(), intThat(a -> a > 2), anyInt());
            verify(client).applyChangeset(argThat(p -> p.toString()
                    .contains("\"op\":\"task.update\",\"task_id\":\"t1\",\"status\":\"blocked\"")));

            JobState.TaskRecord record = store.load(stateFile()).orElseThrow().taskRecord("t1");
            assertEquals("blocked", record.status());
            assertEquals(2, record.attempts());
            assertEquals(FailureKind.EXHAUSTED, record.failureKind());
        }

        @Test
        @DisplayName("retry-blocked re-dispatches blocked tasks from attempt one")
        void retryBlocked() throws Exception {
            givenThreeTasks();
            givenPriorRun();

            JobOutcome outcome = engine().run(options().resume(true).retryBlocked(true).build());

            assertEquals(JobResult.COMPLETED, outcome.result());
            assertEquals(3, outcome.completed());
            verify(workerManager).launch(any(), argThat(t -> t.id().equals("t2")), eq(1), anyInt());
        }
    }

    @Nested
    @DisplayName("resumePlan")
    class ResumePlanTests {

        private Task task(String id) {
            return new Task(id, id, "todo", null, null, null, null, null, null, null, null, null);
        }

        @Test
        @DisplayName("explicitly selected done tasks run again")
        void reselectedDone() {
            JobState prior = new JobState();
            prior.recordTask("t1", new JobState.TaskRecord("done", 2, 0, null, null, null, null));

            DispatchPlan plan = DispatchEngine.resumePlan(List.of(task("t1"), task("t2")), prior,
                    options().taskIds(Set.of("t1")).resume(true).build());

            assertEquals(List.of("t1", "t2"), plan.queue().stream().map(Task::id).toList());
            assertTrue(plan.priorAttempts().isEmpty());
            assertTrue(plan.skippedDone().isEmpty());
        }

        @Test
        @DisplayName("no prior state means a fresh plan")
        void fresh() {
            DispatchPlan plan = DispatchEngine.resumePlan(List.of(task("t1")), null, options().build());
            assertEquals(1, plan.totalTasks());
            assertEquals(1, plan.queue().size());
        }
    }
}
