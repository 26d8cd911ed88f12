package com.example.mediacatalog_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "catalog.pagination")
public class PaginationProperties {
    private int defaultLimit = 50;
    private int maxLimit = 1000;

    public int getDefaultLimit() { return defaultLimit; }
    public void setDefaultLimit(int defaultLimit) { this.defaultLimit = defaultLimit; }

    public int getMaxLimit() { return maxLimit; }
    public void setMaxLimit(int maxLimit) { this.maxLimit = maxLimit; }

    /** Null means default; anything above the maximum is clamped. */
    public int clamp(Integer requested) {
        if (requested == null) return defaultLimit;
        return Math.min(requested, maxLimit);
    }
}
