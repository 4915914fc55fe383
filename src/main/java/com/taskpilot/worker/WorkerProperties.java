package com.taskpilot.worker;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Execution agent and supervision settings, bound from {@code taskpilot.worker.*}.
 */
@Component
@ConfigurationProperties(prefix = "taskpilot.worker")
public class WorkerProperties {

    private String agentBin = "codex";
    private List<String> agentArgs = new ArrayList<>(List.of("--full-auto"));
    private int timeoutSeconds = 3600;
    private int logStallSeconds = 720;
    private int killGraceSeconds = 20;
    private String defaultCwd = "";
    private String logsDir = ".taskpilot-jobs";

    public String getAgentBin() { return agentBin; }
    public void setAgentBin(String agentBin) { this.agentBin = agentBin; }
    public List<String> getAgentArgs() { return agentArgs; }
    public void setAgentArgs(List<String> agentArgs) { this.agentArgs = agentArgs; }
    public int getTimeoutSeconds() { return timeoutSeconds; }
    public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    public int getLogStallSeconds() { return logStallSeconds; }
    public void setLogStallSeconds(int logStallSeconds) { this.logStallSeconds = logStallSeconds; }
    public int getKillGraceSeconds() { return killGraceSeconds; }
    public void setKillGraceSeconds(int killGraceSeconds) { this.killGraceSeconds = killGraceSeconds; }
    public String getDefaultCwd() { return defaultCwd; }
    public void setDefaultCwd(String defaultCwd) { this.defaultCwd = defaultCwd; }
    public String getLogsDir() { return logsDir; }
    public void setLogsDir(String logsDir) { this.logsDir = logsDir; }
}
