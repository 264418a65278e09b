package com.example.shotforge_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Retry budget per shot, bounds of a shot's duration and sizing of the pool that executes
 * production runs.
 */
@ConfigurationProperties(prefix = "production")
public class ProductionProperties {

    private int maxAttempts = 3;
    private int executorThreads = 4;
    private int executorQueueCapacity = 50;
    private int minShotDurationSeconds = 4;
    private int maxShotDurationSeconds = 8;

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
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

    public int getMinShotDurationSeconds() {
        return minShotDurationSeconds;
    }

    public void setMinShotDurationSeconds(int minShotDurationSeconds) {
        this.minShotDurationSeconds = minShotDurationSeconds;
    }

    public int getMaxShotDurationSeconds() {
        return maxShotDurationSeconds;
    }

    public void setMaxShotDurationSeconds(int maxShotDurationSeconds) {
        this.maxShotDurationSeconds = maxShotDurationSeconds;
    }
}
