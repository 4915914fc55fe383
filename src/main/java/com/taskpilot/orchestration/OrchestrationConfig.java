package com.taskpilot.orchestration;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OrchestrationConfig {

    @Bean
    @ConditionalOnMissingBean(OrchestrationClient.class)
    public OrchestrationClient httpOrchestrationClient(OrchestrationProperties properties) {
        return new HttpOrchestrationClient(properties);
    }
}
