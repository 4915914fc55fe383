package com.taskpilot.orchestration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Connection settings for the orchestration service, bound from
 * {@code taskpilot.orchestration.*}.
 */
@Component
@ConfigurationProperties(prefix = "taskpilot.orchestration")
public class OrchestrationProperties {

    private String baseUrl = "http://localhost:3000";
    private String apiKey = "";
    private String userId = "";
    private int requestTimeoutSeconds = 30;
    private int entityPageLimit = 1500;

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }
    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }
    public int getRequestTimeoutSeconds() { return requestTimeoutSeconds; }
    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) { this.requestTimeoutSeconds = requestTimeoutSeconds; }
    public int getEntityPageLimit() { return entityPageLimit; }
    public void setEntityPageLimit(int entityPageLimit) { this.entityPageLimit = entityPageLimit; }
}
