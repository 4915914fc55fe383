package com.taskpilot.worker;

import com.taskpilot.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Prepares and starts the execution agent for one task attempt.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Resolves the working directory from job config overrides and defaults</li>
 *   <li>Builds the prompt via {@link InstructionBuilder}</li>
 *   <li>Assembles the {@code TASKPILOT_*} environment</li>
 *   <li>Delegates process start to {@link WorkerProvider}</li>
 * </ul>
 */
@Service
public class WorkerManager {

    private static final Logger log = LoggerFactory.getLogger(WorkerManager.class);

    private final WorkerProvider provider;
    private final WorkerProperties properties;

    public WorkerManager(WorkerProvider provider, WorkerProperties properties) {
        this.provider = provider;
        this.properties = properties;
    }

    /**
     * Starts a worker for {@code task}.
     *
     * @throws IOException when the process cannot be started
     */
    public WorkerHandle launch(JobContext job, Task task, int attempt, int completedTasks) throws IOException {
        Path cwd = resolveWorkingDir(job.jobConfig(), task);
        String prompt = InstructionBuilder.build(task, job, attempt, completedTasks,
                loadSkillDocs(job.jobConfig(), task));

        List<String> command = new ArrayList<>();
        command.add(properties.getAgentBin());
        command.addAll(properties.getAgentArgs());
        command.add(prompt);

        WorkerRequest request = new WorkerRequest(task.id(), attempt, task.summary(), command, cwd,
                environment(job, task, attempt), job.logPath(task.id(), attempt));
        log.debug("Launching {} for {} (prompt {} chars)", properties.getAgentBin(), task.id(), prompt.length());
        return provider.launch(request);
    }

    /**
     * Workstream override from the job config, then the job config default, then the
     * configured default, then the dispatcher's own working directory.
     */
    public Path resolveWorkingDir(JobConfig jobConfig, Task task) {
        String dir = task.workstreamId() == null ? null : jobConfig.workstreamCwds().get(task.workstreamId());
        if (isBlank(dir)) {
            dir = jobConfig.defaultCwd();
        }
        if (isBlank(dir)) {
            dir = properties.getDefaultCwd();
        }
        if (isBlank(dir)) {
            dir = "";
        }
        return Path.of(dir).toAbsolutePath().normalize();
    }

    Map<String, String> environment(JobContext job, Task task, int attempt) {
        Map<String, String> env = new LinkedHashMap<>();
        env.put("TASKPILOT_SCOPE_ID", job.scopeId());
        env.put("TASKPILOT_TASK_ID", task.id());
        env.put("TASKPILOT_JOB_ID", job.jobId());
        env.put("TASKPILOT_ATTEMPT", String.valueOf(attempt));
        if (job.correlationId() != null) {
            env.put("TASKPILOT_CORRELATION_ID", job.correlationId());
        }
        if (job.planPath() != null) {
            env.put("TASKPILOT_PLAN_FILE", job.planPath());
        }
        return env;
    }

    Map<String, String> loadSkillDocs(JobConfig jobConfig, Task task) {
        Map<String, String> docs = new LinkedHashMap<>();
        for (String skill : task.requiredSkills()) {
            String location = jobConfig.skillDocs().get(skill);
            if (isBlank(location)) {
                continue;
            }
            try {
                docs.put(skill, Files.readString(Path.of(location), StandardCharsets.UTF_8));
            } catch (IOException e) {
                log.warn("Skipping skill doc for '{}' ({}): {}", skill, location, e.getMessage());
            }
        }
        return docs;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
