package com.taskpilot.worker;

import com.taskpilot.core.model.Task;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class WorkerWatchdogTest {

    private static final Instant NOW = Instant.parse("2026-05-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private WorkerWatchdog watchdog;

    @BeforeEach
    void setUp() {
        watchdog = new WorkerWatchdog(Duration.ofSeconds(3600), Duration.ofSeconds(720), Duration.ofSeconds(20));
    }

    private static Task task(String id) {
        return new Task(id, "Task " + id, "todo", null, null, null, null, null, null, null, null, null);
    }

    private Path logWrittenAt(String name, Instant modified) throws Exception {
        Path log = Files.writeString(tempDir.resolve(name), "output\n");
        Files.setLastModifiedTime(log, FileTime.from(modified));
        return log;
    }

    @Nested
    @DisplayName("evaluate")
    class EvaluateTests {

        @Test
        @DisplayName("timeout wins when both limits are exceeded")
        void timeoutPrecedence() {
            assertEquals(Optional.of(KillReason.TIMEOUT),
                    watchdog.evaluate(Duration.ofSeconds(4000), Duration.ofSeconds(4000)));
        }

        @Test
        @DisplayName("log stall alone")
        void logStall() {
            assertEquals(Optional.of(KillReason.LOG_STALL),
                    watchdog.evaluate(Duration.ofSeconds(800), Duration.ofSeconds(721)));
        }

        @Test
        @DisplayName("limits are exclusive")
        void atLimits() {
            assertTrue(watchdog.evaluate(Duration.ofSeconds(3600), Duration.ofSeconds(720)).isEmpty());
        }

        @Test
        @DisplayName("zero or negative limits are disabled")
        void disabledLimits() {
            WorkerWatchdog noTimeout = new WorkerWatchdog(Duration.ZERO, Duration.ofSeconds(720), Duration.ofSeconds(20));
            assertTrue(noTimeout.evaluate(Duration.ofDays(2), Duration.ofSeconds(1)).isEmpty());
            assertEquals(Optional.of(KillReason.LOG_STALL),
                    noTimeout.evaluate(Duration.ofDays(2), Duration.ofSeconds(721)));

            WorkerWatchdog noLimits = new WorkerWatchdog(Duration.ofSeconds(-1), Duration.ZERO, Duration.ofSeconds(20));
            assertTrue(noLimits.evaluate(Duration.ofDays(2), Duration.ofDays(2)).isEmpty());
        }
    }

    @Nested
    @DisplayName("sweep")
    class SweepTests {

        @Test
        @DisplayName("healthy worker with fresh log is left alone")
        void healthy() throws Exception {
            Instant started = NOW.minusSeconds(1000);
            FakeWorkerHandle handle = new FakeWorkerHandle(10, logWrittenAt("t1.log", NOW.minusSeconds(30)));
            RunningWorker worker = new RunningWorker(task("t1"), 1, handle, started);

            assertTrue(watchdog.sweep(List.of(worker), NOW).isEmpty());
            assertEquals(0, handle.terminateCalls());
            assertEquals(RunningWorker.KillState.NONE, worker.killState());
        }

        @Test
        @DisplayName("stalled log sends SIGTERM and records the reason")
        void stalled() throws Exception {
            Instant started = NOW.minusSeconds(1000);
            FakeWorkerHandle handle = new FakeWorkerHandle(11, logWrittenAt("t2.log", NOW.minusSeconds(800)));
            RunningWorker worker = new RunningWorker(task("t2"), 1, handle, started);

            List<WorkerWatchdog.Action> actions = watchdog.sweep(List.of(worker), NOW);

            assertEquals(1, actions.size());
            assertEquals(KillReason.LOG_STALL, actions.get(0).reason());
            assertFalse(actions.get(0).forceful());
            assertEquals(1, handle.terminateCalls());
            assertEquals(RunningWorker.KillState.SIGTERM_SENT, worker.killState());
            assertEquals("Worker log stalled (720s)", worker.forcedFailureDetail());
            assertEquals(NOW.plusSeconds(20), worker.graceDeadline());
        }

        @Test
        @DisplayName("missing log counts as idle since start")
        void missingLog() {
            FakeWorkerHandle handle = new FakeWorkerHandle(12, tempDir.resolve("absent.log"));
            RunningWorker worker = new RunningWorker(task("t3"), 1, handle, NOW.minusSeconds(721));

            List<WorkerWatchdog.Action> actions = watchdog.sweep(List.of(worker), NOW);

            assertEquals(KillReason.LOG_STALL, actions.get(0).reason());
        }

        @Test
        @DisplayName("escalates to SIGKILL after the grace period")
        void escalates() throws Exception {
            FakeWorkerHandle handle = new FakeWorkerHandle(13, logWrittenAt("t4.log", NOW.minusSeconds(10)))
                    .ignoringTerminate();
            RunningWorker worker = new RunningWorker(task("t4"), 1, handle, NOW.minusSeconds(4000));

            watchdog.sweep(List.of(worker), NOW);
            assertTrue(watchdog.sweep(List.of(worker), NOW.plusSeconds(10)).isEmpty());

            List<WorkerWatchdog.Action> actions = watchdog.sweep(List.of(worker), NOW.plusSeconds(20));
            assertEquals(1, actions.size());
            assertTrue(actions.get(0).forceful());
            assertEquals(KillReason.TIMEOUT, actions.get(0).reason());
            assertEquals(1, handle.killCalls());
            assertEquals(RunningWorker.KillState.SIGKILL_SENT, worker.killState());

            assertTrue(watchdog.sweep(List.of(worker), NOW.plusSeconds(60)).isEmpty());
        }

        @Test
        @DisplayName("no SIGKILL when the worker exited during the grace period")
        void exitedDuringGrace() throws Exception {
            FakeWorkerHandle handle = new FakeWorkerHandle(14, logWrittenAt("t5.log", NOW.minusSeconds(10)));
            RunningWorker worker = new RunningWorker(task("t5"), 1, handle, NOW.minusSeconds(4000));

            watchdog.sweep(List.of(worker), NOW);
            assertTrue(watchdog.sweep(List.of(worker), NOW.plusSeconds(30)).isEmpty());
            assertEquals(0, handle.killCalls());
            assertEquals(KillReason.TIMEOUT, worker.forcedFailure());
        }
    }
}
