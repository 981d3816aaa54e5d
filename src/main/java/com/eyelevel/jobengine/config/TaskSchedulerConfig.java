package com.eyelevel.jobengine.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Configures the scheduler that drives the stale job watchdog and the workers' lock extension and
 * stalled-message sweeps.
 */
@Configuration
public class TaskSchedulerConfig {

    @Bean("jobEngineTaskScheduler")
    public TaskScheduler jobEngineTaskScheduler() {
        final ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("job-engine-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }
}
