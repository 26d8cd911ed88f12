package com.example.mediacatalog_backend.model;

import com.example.mediacatalog_backend.util.EventType;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "webhook")
public class Webhook {
    @Id
    @Column(name = "url", nullable = false, updatable = false, length = 1024)
    private String url;

    @Column(name = "api_key_name", length = 255)
    private String apiKeyName;

    @Column(name = "api_key_value", length = 1024)
    private String apiKeyValue;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "events")
    private List<String> events = new ArrayList<>();

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    protected Webhook() {}

    public Webhook(String url) {
        this.url = url;
    }

    public boolean subscribes(EventType type) {
        return getEvents().contains(EventType.WILDCARD) || getEvents().contains(type.wireName());
    }

    public boolean hasApiKey() {
        return apiKeyName != null && !apiKeyName.isBlank() && apiKeyValue != null;
    }

    public String getUrl() {
        return url;
    }

    public String getApiKeyName() {
        return apiKeyName;
    }

    public void setApiKeyName(String apiKeyName) {
        this.apiKeyName = apiKeyName;
    }

    public String getApiKeyValue() {
        return apiKeyValue;
    }

    public void setApiKeyValue(String apiKeyValue) {
        this.apiKeyValue = apiKeyValue;
    }

    public List<String> getEvents() {
        if (events == null) events = new ArrayList<>();
        return events;
    }

    public void setEvents(List<String> events) {
        this.events = events == null ? new ArrayList<>() : new ArrayList<>(events);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
