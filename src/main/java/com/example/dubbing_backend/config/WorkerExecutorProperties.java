package com.example.dubbing_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configures worker polling and the size of the dubbing worker pool.
 */
@ConfigurationProperties(prefix = "worker")
public class WorkerExecutorProperties {

    private boolean enabled = true;
    private int executorThreads = 2;
    private int executorQueueCapacity = 0;
    private long staleClaimMinutes = 240;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
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

    public long getStaleClaimMinutes() {
        return staleClaimMinutes;
    }

    public void setStaleClaimMinutes(long staleClaimMinutes) {
        this.staleClaimMinutes = staleClaimMinutes;
    }
}
