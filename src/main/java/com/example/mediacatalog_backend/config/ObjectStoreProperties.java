package com.example.mediacatalog_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "catalog.storage")
public class ObjectStoreProperties {
    private String baseDir = "./data/objects";
    private String publicBaseUrl = "http://localhost:8080";
    private long uploadUrlTtlSeconds = 3600;
    private long orphanRetentionHours = 168;
    private int reaperBatchSize = 100;
    private long reaperDelayMs = 600_000;

    public String getBaseDir() { return baseDir; }
    public void setBaseDir(String baseDir) { this.baseDir = baseDir; }

    public String getPublicBaseUrl() { return publicBaseUrl; }
    public void setPublicBaseUrl(String publicBaseUrl) { this.publicBaseUrl = publicBaseUrl; }

    public long getUploadUrlTtlSeconds() { return uploadUrlTtlSeconds; }
    public void setUploadUrlTtlSeconds(long uploadUrlTtlSeconds) { this.uploadUrlTtlSeconds = uploadUrlTtlSeconds; }

    public long getOrphanRetentionHours() { return orphanRetentionHours; }
    public void setOrphanRetentionHours(long orphanRetentionHours) { this.orphanRetentionHours = orphanRetentionHours; }

    public int getReaperBatchSize() { return reaperBatchSize; }
    public void setReaperBatchSize(int reaperBatchSize) { this.reaperBatchSize = reaperBatchSize; }

    public long getReaperDelayMs() { return reaperDelayMs; }
    public void setReaperDelayMs(long reaperDelayMs) { this.reaperDelayMs = reaperDelayMs; }
}
