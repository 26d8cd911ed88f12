package com.example.mediacatalog_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Outbound webhook delivery: retry budget, timeouts and lane concurrency.
 */
@ConfigurationProperties(prefix = "catalog.webhooks")
public class WebhookProperties {
    private int maxAttempts = 5;
    private long initialBackoffMs = 500;
    private long maxBackoffMs = 30_000;
    private long attemptTimeoutSeconds = 10;
    private int connectTimeoutMs = 5_000;
    private int laneThreads = 4;
    private int laneQueueCapacity = 256;
    private long pollDelayMs = 5_000;
    private int dispatchBatchSize = 100;
    private long gapGraceMs = 10_000;
    private String userAgent = "mediacatalog-backend";

    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

    public long getInitialBackoffMs() { return initialBackoffMs; }
    public void setInitialBackoffMs(long initialBackoffMs) { this.initialBackoffMs = initialBackoffMs; }

    public long getMaxBackoffMs() { return maxBackoffMs; }
    public void setMaxBackoffMs(long maxBackoffMs) { this.maxBackoffMs = maxBackoffMs; }

    public long getAttemptTimeoutSeconds() { return attemptTimeoutSeconds; }
    public void setAttemptTimeoutSeconds(long attemptTimeoutSeconds) { this.attemptTimeoutSeconds = attemptTimeoutSeconds; }

    public int getConnectTimeoutMs() { return connectTimeoutMs; }
    public void setConnectTimeoutMs(int connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

    public int getLaneThreads() { return laneThreads; }
    public void setLaneThreads(int laneThreads) { this.laneThreads = laneThreads; }

    public int getLaneQueueCapacity() { return laneQueueCapacity; }
    public void setLaneQueueCapacity(int laneQueueCapacity) { this.laneQueueCapacity = laneQueueCapacity; }

    public long getPollDelayMs() { return pollDelayMs; }
    public void setPollDelayMs(long pollDelayMs) { this.pollDelayMs = pollDelayMs; }

    public int getDispatchBatchSize() { return dispatchBatchSize; }
    public void setDispatchBatchSize(int dispatchBatchSize) { this.dispatchBatchSize = dispatchBatchSize; }

    public long getGapGraceMs() { return gapGraceMs; }
    public void setGapGraceMs(long gapGraceMs) { this.gapGraceMs = gapGraceMs; }

    public String getUserAgent() { return userAgent; }
    public void setUserAgent(String userAgent) { this.userAgent = userAgent; }
}
