package com.taskpilot.worker;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class WorkerConfig {

    @Bean
    public WorkerProvider localProcessWorkerProvider(Clock clock) {
        return new LocalProcessWorkerProvider(clock);
    }
}
