package com.taskpilot.core.scheduler;

import com.taskpilot.orchestration.GuardMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Dispatch loop defaults, bound from {@code taskpilot.dispatch.*}. Flags on
 * {@code taskpilot run} override them per job.
 */
@Component
@ConfigurationProperties(prefix = "taskpilot.dispatch")
public class DispatchProperties {

    private int concurrency = 4;
    private int maxAttempts = 2;
    private int pollIntervalSeconds = 10;
    private int heartbeatSeconds = 45;
    private boolean autoComplete = true;
    private boolean decisionOnBlock = false;
    private GuardMode guardMode = GuardMode.FAIL_OPEN;
    private String sourceClient = "taskpilot";
    private String stateFile = "";
    private Retry retry = new Retry();
    private ResourceGuardSettings resourceGuard = new ResourceGuardSettings();

    public static class Retry {
        private long baseMs = 15_000;
        private long capMs = 180_000;

        public long getBaseMs() { return baseMs; }
        public void setBaseMs(long baseMs) { this.baseMs = baseMs; }
        public long getCapMs() { return capMs; }
        public void setCapMs(long capMs) { this.capMs = capMs; }
    }

    public static class ResourceGuardSettings {
        private boolean enabled = true;
        private double maxLoadRatio = 0.9;
        private long minFreeMemMb = 1024;
        private double minFreeMemRatio = 0.05;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public double getMaxLoadRatio() { return maxLoadRatio; }
        public void setMaxLoadRatio(double maxLoadRatio) { this.maxLoadRatio = maxLoadRatio; }
        public long getMinFreeMemMb() { return minFreeMemMb; }
        public void setMinFreeMemMb(long minFreeMemMb) { this.minFreeMemMb = minFreeMemMb; }
        public double getMinFreeMemRatio() { return minFreeMemRatio; }
        public void setMinFreeMemRatio(double minFreeMemRatio) { this.minFreeMemRatio = minFreeMemRatio; }
    }

    public int getConcurrency() { return concurrency; }
    public void setConcurrency(int concurrency) { this.concurrency = concurrency; }
    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    public int getPollIntervalSeconds() { return pollIntervalSeconds; }
    public void setPollIntervalSeconds(int pollIntervalSeconds) { this.pollIntervalSeconds = pollIntervalSeconds; }
    public int getHeartbeatSeconds() { return heartbeatSeconds; }
    public void setHeartbeatSeconds(int heartbeatSeconds) { this.heartbeatSeconds = heartbeatSeconds; }
    public boolean isAutoComplete() { return autoComplete; }
    public void setAutoComplete(boolean autoComplete) { this.autoComplete = autoComplete; }
    public boolean isDecisionOnBlock() { return decisionOnBlock; }
    public void setDecisionOnBlock(boolean decisionOnBlock) { this.decisionOnBlock = decisionOnBlock; }
    public GuardMode getGuardMode() { return guardMode; }
    public void setGuardMode(GuardMode guardMode) { this.guardMode = guardMode; }
    public String getSourceClient() { return sourceClient; }
    public void setSourceClient(String sourceClient) { this.sourceClient = sourceClient; }
    public String getStateFile() { return stateFile; }
    public void setStateFile(String stateFile) { this.stateFile = stateFile; }
    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }
    public ResourceGuardSettings getResourceGuard() { return resourceGuard; }
    public void setResourceGuard(ResourceGuardSettings resourceGuard) { this.resourceGuard = resourceGuard; }
}
