package com.fplrefresh.config;

import com.fplrefresh.domain.JobType;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Named thread pools: one long-running worker loop per queue, plus the pool that actually runs job
 * bodies so a loop can heartbeat and enforce the job timeout while the body executes.
 */
@Configuration
public class AsyncConfig {

    public static final String QUEUE_WORKER_EXECUTOR = "queue-worker-executor";
    public static final String JOB_EXECUTOR = "job-executor";

    /** One thread per job type: each queue has exactly one worker loop (concurrency 1). */
    @Bean(name = QUEUE_WORKER_EXECUTOR)
    public ThreadPoolTaskExecutor queueWorkerExecutor() {
        int loops = JobType.values().length;
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(loops);
        e.setMaxPoolSize(loops);
        e.setQueueCapacity(0);
        e.setThreadNamePrefix("queue-worker-");
        e.setWaitForTasksToCompleteOnShutdown(false);
        e.initialize();
        return e;
    }

    @Bean(name = JOB_EXECUTOR)
    public ThreadPoolTaskExecutor jobExecutor() {
        int loops = JobType.values().length;
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(loops);
        e.setMaxPoolSize(loops * 2);
        e.setThreadNamePrefix("job-");
        e.initialize();
        return e;
    }
}
