package com.taskpilot.worker;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Optional per-job overrides read from a JSON file.
 *
 * @param defaultCwd       working directory for workers without a workstream override
 * @param workstreamCwds   working directory by workstream id
 * @param workstreamPrompt extra prompt text by workstream id
 * @param taskPrompt       extra prompt text by task id
 * @param skillDocs        reference document path by skill tag
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobConfig(
    String defaultCwd,
    Map<String, String> workstreamCwds,
    Map<String, String> workstreamPrompt,
    Map<String, String> taskPrompt,
    Map<String, String> skillDocs
) {

    public JobConfig {
        workstreamCwds = workstreamCwds == null ? Map.of() : Map.copyOf(workstreamCwds);
        workstreamPrompt = workstreamPrompt == null ? Map.of() : Map.copyOf(workstreamPrompt);
        taskPrompt = taskPrompt == null ? Map.of() : Map.copyOf(taskPrompt);
        skillDocs = skillDocs == null ? Map.of() : Map.copyOf(skillDocs);
    }

    public static JobConfig empty() {
        return new JobConfig(null, null, null, null, null);
    }

    public static JobConfig load(Path file, ObjectMapper mapper) throws IOException {
        return mapper.readValue(file.toFile(), JobConfig.class);
    }
}
