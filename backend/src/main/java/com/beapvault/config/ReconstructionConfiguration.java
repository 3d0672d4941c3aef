package com.beapvault.config;

import java.util.concurrent.Executor;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class ReconstructionConfiguration {

    /**
     * Bounded pool for per-attachment reconstruction work. Each task mostly waits on
     * an isolated tool process, so the pool size caps concurrent tool processes.
     */
    @Bean(name = "reconstructionExecutor")
    public Executor reconstructionExecutor(BeapProperties properties) {
        int workers = properties.tools().workerThreads();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("reconstruct-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
