package com.example.mediacatalog_backend.model;

import com.example.mediacatalog_backend.util.DeliveryStatus;
import jakarta.persistence.*;

import java.time.Instant;

/**
 * Delivery of one event to one webhook. Rows for the same url are sent strictly in
 * {@code eventId} order.
 */
@Entity
@Table(
        name = "webhook_delivery",
        uniqueConstraints = @UniqueConstraint(name = "uq_delivery_event_url", columnNames = {"event_id", "webhook_url"}),
        indexes = @Index(name = "idx_delivery_url_status_event", columnList = "webhook_url, status, event_id")
)
public class WebhookDelivery {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "event_id", nullable = false, updatable = false)
    private Long eventId;

    @Column(name = "webhook_url", nullable = false, updatable = false, length = 1024)
    private String webhookUrl;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private DeliveryStatus status = DeliveryStatus.PENDING;

    @Column(name = "attempts", nullable = false)
    private int attempts = 0;

    @Column(name = "last_error", length = 1024)
    private String lastError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    protected WebhookDelivery() {}

    public WebhookDelivery(Long eventId, String webhookUrl, Instant createdAt) {
        this.eventId = eventId;
        this.webhookUrl = webhookUrl;
        this.createdAt = createdAt;
    }

    public Long getId() {
        return id;
    }

    public Long getEventId() {
        return eventId;
    }

    public String getWebhookUrl() {
        return webhookUrl;
    }

    public DeliveryStatus getStatus() {
        return status;
    }

    public int getAttempts() {
        return attempts;
    }

    public String getLastError() {
        return lastError;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void complete(DeliveryStatus status, int attempts, String lastError, Instant at) {
        this.status = status;
        this.attempts = attempts;
        this.lastError = lastError == null || lastError.length() <= 1024 ? lastError : lastError.substring(0, 1024);
        this.completedAt = at;
    }
}
