package com.example.mediacatalog_backend.model;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

/**
 * Outbox row written in the same transaction as the mutation it describes. The identity column
 * gives the creation order that per-webhook delivery preserves.
 */
@Entity
@Table(
        name = "catalog_event",
        indexes = @Index(name = "idx_event_fanned_out", columnList = "fanned_out, id")
)
public class CatalogEvent {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "event_type", nullable = false, length = 64)
    private String eventType;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "payload")
    private Map<String, Object> payload;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "fanned_out", nullable = false)
    private boolean fannedOut = false;

    @Column(name = "fanned_out_at")
    private Instant fannedOutAt;

    protected CatalogEvent() {}

    public CatalogEvent(String eventType, Map<String, Object> payload, Instant createdAt) {
        this.eventType = eventType;
        this.payload = payload;
        this.createdAt = createdAt;
    }

    public Long getId() {
        return id;
    }

    public String getEventType() {
        return eventType;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public boolean isFannedOut() {
        return fannedOut;
    }

    public void markFannedOut(Instant at) {
        this.fannedOut = true;
        this.fannedOutAt = at;
    }

    public Instant getFannedOutAt() {
        return fannedOutAt;
    }
}
