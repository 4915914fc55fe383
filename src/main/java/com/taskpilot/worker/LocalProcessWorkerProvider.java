package com.taskpilot.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.concurrent.CompletableFuture;

/**
 * Runs workers as child processes of the dispatcher.
 * <p>
 * stdout and stderr are appended to the log file by the OS, so the log keeps growing
 * even while the dispatcher is busy. The log is bracketed by a start marker and an exit
 * marker carrying the exit code. Launching truncates any log left at the same path by an
 * earlier job, so failure detection only ever sees this attempt's output.
 */
public class LocalProcessWorkerProvider implements WorkerProvider {

    private static final Logger log = LoggerFactory.getLogger(LocalProcessWorkerProvider.class);

    private final Clock clock;

    public LocalProcessWorkerProvider(Clock clock) {
        this.clock = clock;
    }

    @Override
    public WorkerHandle launch(WorkerRequest request) throws IOException {
        Path logFile = request.logFile();
        Files.createDirectories(logFile.toAbsolutePath().getParent());
        Files.writeString(logFile, "==== " + clock.instant() + " :: " + request.summary() + " ====\n",
                StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE);

        ProcessBuilder builder = new ProcessBuilder(request.command())
                .directory(request.workingDir().toFile())
                .redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()));
        builder.environment().putAll(request.environment());

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            appendMarker(logFile, "\nworker error: " + e.getMessage() + "\n");
            throw e;
        }
        // Workers never read stdin
        process.getOutputStream().close();
        log.info("Started worker pid {} for {} attempt {} in {}", process.pid(), request.taskId(),
                request.attempt(), request.workingDir());
        return new ProcessWorkerHandle(process, logFile);
    }

    private void appendMarker(Path logFile, String marker) throws IOException {
        Files.writeString(logFile, marker, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    private final class ProcessWorkerHandle implements WorkerHandle {

        private final Process process;
        private final Path logPath;
        private final CompletableFuture<Integer> exit;

        ProcessWorkerHandle(Process process, Path logPath) {
            this.process = process;
            this.logPath = logPath;
            this.exit = process.onExit().thenApply(p -> {
                int code = p.exitValue();
                try {
                    appendMarker(logPath, "\n==== " + clock.instant() + " :: exit code=" + code + " ====\n");
                } catch (IOException e) {
                    log.warn("Could not write exit marker to {}: {}", logPath, e.getMessage());
                }
                return code;
            });
        }

        @Override
        public long pid() {
            return process.pid();
        }

        @Override
        public Path logPath() {
            return logPath;
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public void terminate() {
            process.destroy();
        }

        @Override
        public void kill() {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
        }

        @Override
        public CompletableFuture<Integer> onExit() {
            return exit;
        }
    }
}
