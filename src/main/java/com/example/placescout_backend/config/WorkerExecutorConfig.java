package com.example.placescout_backend.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Runtime for background video jobs: the pool that runs claimed jobs and the clock that stamps
 * them, drives retention and measures extraction deadlines.
 */
@Configuration
@EnableConfigurationProperties(WorkerExecutorProperties.class)
public class WorkerExecutorConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(WorkerExecutorConfig.class);

    @Bean
    public Clock jobClock() {
        return Clock.systemUTC();
    }

    @Bean(name = "workerTaskExecutor")
    public ThreadPoolTaskExecutor workerTaskExecutor(WorkerExecutorProperties properties) {
        // threads beyond max-concurrency would only block on the job semaphore
        int threads = Math.max(1, Math.min(properties.getExecutorThreads(), properties.getMaxConcurrency()));

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(Math.max(0, properties.getExecutorQueueCapacity()));
        executor.setThreadNamePrefix("video-job-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        if (properties.getJobTimeoutSeconds() > 0) {
            executor.setAwaitTerminationSeconds((int) Math.min(Integer.MAX_VALUE, properties.getJobTimeoutSeconds()));
        }
        executor.initialize();

        LOGGER.info("Configuring video job executor threads={} queue={} maxConcurrency={} jobTimeout={}s",
                threads, properties.getExecutorQueueCapacity(), properties.getMaxConcurrency(),
                properties.getJobTimeoutSeconds());
        return executor;
    }
}
