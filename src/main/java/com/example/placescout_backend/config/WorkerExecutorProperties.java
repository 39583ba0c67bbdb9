package com.example.placescout_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configures worker polling and concurrency limits for background video jobs.
 */
@ConfigurationProperties(prefix = "worker")
public class WorkerExecutorProperties {

    private boolean enabled = true;
    private int pollBatchSize = 5;
    private long pollDelayMs = 3000;
    private int executorThreads = 2;
    private int executorQueueCapacity = 50;
    private int maxConcurrency = 1;
    private long jobTimeoutSeconds = 0;
    private int finishedJobLimit = 200;
    private Duration finishedJobTtl = Duration.ofHours(24);

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getPollBatchSize() {
        return pollBatchSize;
    }

    public void setPollBatchSize(int pollBatchSize) {
        this.pollBatchSize = pollBatchSize;
    }

    public long getPollDelayMs() {
        return pollDelayMs;
    }

    public void setPollDelayMs(long pollDelayMs) {
        this.pollDelayMs = pollDelayMs;
    }

    public int getExecutorThreads() {
        return executorThreads;
    }

    public void setExecutorThreads(int executorThreads) {
        this.executorThreads = executorThreads;
    }

    public int getExecutorQueueCapacity() {
        return executorQueueCapacity;
    }

    public void setExecutorQueueCapacity(int executorQueueCapacity) {
        this.executorQueueCapacity = executorQueueCapacity;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    /**
     * Wall-clock budget for one job's network stages; 0 disables the deadline.
     */
    public long getJobTimeoutSeconds() {
        return jobTimeoutSeconds;
    }

    public void setJobTimeoutSeconds(long jobTimeoutSeconds) {
        this.jobTimeoutSeconds = jobTimeoutSeconds;
    }

    /**
     * DONE and FAILED jobs kept in memory, oldest evicted first; 0 keeps all.
     */
    public int getFinishedJobLimit() {
        return finishedJobLimit;
    }

    public void setFinishedJobLimit(int finishedJobLimit) {
        this.finishedJobLimit = finishedJobLimit;
    }

    /**
     * How long a finished job stays readable after its last update; {@code null} or zero keeps it.
     */
    public Duration getFinishedJobTtl() {
        return finishedJobTtl;
    }

    public void setFinishedJobTtl(Duration finishedJobTtl) {
        this.finishedJobTtl = finishedJobTtl;
    }
}
