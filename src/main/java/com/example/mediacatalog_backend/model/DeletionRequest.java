package com.example.mediacatalog_backend.model;

import com.example.mediacatalog_backend.timerange.TimeRange;
import com.example.mediacatalog_backend.util.DeletionStatus;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

/**
 * Tracked job removing every segment of a flow inside {@code timerange}. {@code remaining} is the
 * part not yet cleared; it is persisted after each batch so a restarted worker resumes from it.
 * A worker holds the request through {@code leaseOwner}/{@code leaseExpiresAt} while processing.
 */
@Entity
@Table(
        name = "deletion_request",
        indexes = {
                @Index(name = "idx_deletion_status_created", columnList = "status, created_at"),
                @Index(name = "idx_deletion_flow", columnList = "flow_id")
        }
)
public class DeletionRequest {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "flow_id", nullable = false, updatable = false)
    private UUID flowId;

    @Convert(converter = TimeRangeConverter.class)
    @Column(name = "timerange", nullable = false, updatable = false, length = 96)
    private TimeRange timerange;

    @Convert(converter = TimeRangeConverter.class)
    @Column(name = "remaining", length = 96)
    private TimeRange remaining;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private DeletionStatus status = DeletionStatus.PENDING;

    @Column(name = "error_reason", length = 1024)
    private String errorReason;

    @Column(name = "cancel_requested", nullable = false)
    private boolean cancelRequested = false;

    @Column(name = "deleted_count", nullable = false)
    private long deletedCount = 0;

    @Column(name = "batches_processed", nullable = false)
    private int batchesProcessed = 0;

    @Column(name = "lease_owner", length = 128)
    private String leaseOwner;

    @Column(name = "lease_expires_at")
    private Instant leaseExpiresAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    protected DeletionRequest() {}

    public DeletionRequest(UUID flowId, TimeRange timerange) {
        this.flowId = flowId;
        this.timerange = timerange;
        this.remaining = timerange;
    }

    public UUID getId() {
        return id;
    }

    public UUID getFlowId() {
        return flowId;
    }

    public TimeRange getTimerange() {
        return timerange;
    }

    public TimeRange getRemaining() {
        return remaining;
    }

    public void setRemaining(TimeRange remaining) {
        this.remaining = remaining;
    }

    public DeletionStatus getStatus() {
        return status;
    }

    public void setStatus(DeletionStatus status) {
        this.status = status;
    }

    public String getErrorReason() {
        return errorReason;
    }

    public void setErrorReason(String errorReason) {
        this.errorReason = errorReason;
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    public void setCancelRequested(boolean cancelRequested) {
        this.cancelRequested = cancelRequested;
    }

    public long getDeletedCount() {
        return deletedCount;
    }

    public void setDeletedCount(long deletedCount) {
        this.deletedCount = deletedCount;
    }

    public int getBatchesProcessed() {
        return batchesProcessed;
    }

    public void setBatchesProcessed(int batchesProcessed) {
        this.batchesProcessed = batchesProcessed;
    }

    public String getLeaseOwner() {
        return leaseOwner;
    }

    public void setLeaseOwner(String leaseOwner) {
        this.leaseOwner = leaseOwner;
    }

    public Instant getLeaseExpiresAt() {
        return leaseExpiresAt;
    }

    public void setLeaseExpiresAt(Instant leaseExpiresAt) {
        this.leaseExpiresAt = leaseExpiresAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public long getVersion() {
        return version;
    }

    @PrePersist
    void prePersist() {
        if (status == null) status = DeletionStatus.PENDING;
        if (remaining == null && status == DeletionStatus.PENDING) remaining = timerange;
    }
}
