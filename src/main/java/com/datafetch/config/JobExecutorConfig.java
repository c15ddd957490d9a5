package com.datafetch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor that runs one fetch job per task. Jobs queue up behind the configured thread
 * count; each job runs its fetch, merge and render steps sequentially on its thread.
 */
@Configuration
public class JobExecutorConfig {

    private final FetchProperties properties;

    public JobExecutorConfig(FetchProperties properties) {
        this.properties = properties;
    }

    @Bean
    public ThreadPoolTaskExecutor fetchJobExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getJobThreads());
        executor.setMaxPoolSize(properties.getJobThreads());
        executor.setQueueCapacity(properties.getJobQueueCapacity());
        executor.setThreadNamePrefix("fetch-job-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
