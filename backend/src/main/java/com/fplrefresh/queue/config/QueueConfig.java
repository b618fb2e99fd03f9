package com.fplrefresh.queue.config;

import com.fplrefresh.common.RetryPolicy;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({ QueueProperties.class, SchedulerProperties.class })
public class QueueConfig {

    public static final String JOB_RETRY_POLICY = "jobRetryPolicy";

    /** Job retry backoff; attempts come from each job, so the policy's own limit is unused. */
    @Bean(name = JOB_RETRY_POLICY)
    public RetryPolicy jobRetryPolicy(QueueProperties properties) {
        return new RetryPolicy(
                properties.getBackoffBase().toMillis(),
                properties.getBackoffJitter(),
                Integer.MAX_VALUE,
                properties.getBackoffMax().toMillis());
    }
}
