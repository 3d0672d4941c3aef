package com.beapvault.config;

import java.util.concurrent.Executor;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class EvaluationConfiguration {

    /**
     * Small bounded pool for local policy lookups. A lookup that overruns its timeout
     * keeps its thread, so the queue is bounded and a full pool rejects new lookups.
     */
    @Bean(name = "policyLookupExecutor")
    public Executor policyLookupExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(32);
        executor.setThreadNamePrefix("policy-lookup-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
