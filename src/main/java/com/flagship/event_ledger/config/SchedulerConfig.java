package com.flagship.event_ledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Scheduling and background execution.
 *
 * The task scheduler runs the reconciliation and view-refresh triggers (registered
 * explicitly by their schedulers) as well as the periodic outbox, reprocessing and
 * metrics jobs. Targeted view refreshes go to a separate bounded executor so a burst
 * of engagement events cannot starve the scheduled jobs.
 */
@Configuration
@EnableScheduling
public class SchedulerConfig {

    public static final String VIEW_REFRESH_EXECUTOR = "viewRefreshExecutor";

    @Bean(name = "taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        scheduler.initialize();
        return scheduler;
    }

    @Bean(name = VIEW_REFRESH_EXECUTOR)
    public ThreadPoolTaskExecutor viewRefreshExecutor(MaterializedViewProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getRefreshPoolSize());
        executor.setMaxPoolSize(properties.getRefreshPoolSize());
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("view-refresh-");
        // Saturation falls back to the caller rather than dropping a refresh.
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
