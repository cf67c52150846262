package com.llamaservice.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor behind POST /api/v1/models/setup/async.
 *
 * One worker, so queued setups run in submission order; once the queue is
 * full, submissions fail with TaskRejectedException.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "setupExecutor")
    public TaskExecutor setupExecutor(AppConfig appConfig) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(appConfig.getSetup().getQueueCapacity());
        executor.setThreadNamePrefix("model-setup-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
