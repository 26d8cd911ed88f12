package com.example.mediacatalog_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Batch sizing, polling and leasing for the background deletion worker.
 */
@ConfigurationProperties(prefix = "catalog.deletion")
public class DeletionWorkerProperties {

    // segments removed per transaction; bounds how long the flow row lock is held
    private int batchSize = 500;
    private int pollBatchSize = 4;
    private int executorThreads = 2;
    private int executorQueueCapacity = 16;
    private long leaseSeconds = 300;
    private long pollDelayMs = 2000;

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getPollBatchSize() {
        return pollBatchSize;
    }

    public void setPollBatchSize(int pollBatchSize) {
        this.pollBatchSize = pollBatchSize;
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

    public long getLeaseSeconds() {
        return leaseSeconds;
    }

    public void setLeaseSeconds(long leaseSeconds) {
        this.leaseSeconds = leaseSeconds;
    }

    public long getPollDelayMs() {
        return pollDelayMs;
    }

    public void setPollDelayMs(long pollDelayMs) {
        this.pollDelayMs = pollDelayMs;
    }
}
