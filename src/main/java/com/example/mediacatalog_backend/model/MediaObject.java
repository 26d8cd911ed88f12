package com.example.mediacatalog_backend.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Stored bytes referenced by segments. {@code flowReferences} holds every flow that currently has
 * at least one segment on this object; it is only changed in the transaction that adds or removes
 * such a segment.
 */
@Entity
@Table(
        name = "media_object",
        indexes = @Index(name = "idx_media_object_unreferenced", columnList = "unreferenced_since")
)
public class MediaObject {
    @Id
    @Column(name = "object_id", nullable = false, updatable = false, length = 256)
    private String objectId;

    @Column(name = "size_bytes")
    private Long sizeBytes;

    @Column(name = "mime_type", length = 128)
    private String mimeType;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(
            name = "media_object_flow_refs",
            joinColumns = @JoinColumn(name = "object_id", foreignKey = @ForeignKey(name = "fk_object_ref_object"))
    )
    @Column(name = "flow_id", nullable = false)
    private Set<UUID> flowReferences = new HashSet<>();

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "unreferenced_since")
    private Instant unreferencedSince;

    @Version
    @Column(name = "version")
    private Long version;

    protected MediaObject() {}

    public MediaObject(String objectId, Long sizeBytes, String mimeType) {
        this.objectId = objectId;
        this.sizeBytes = sizeBytes;
        this.mimeType = mimeType;
    }

    public void addReference(UUID flowId) {
        flowReferences.add(flowId);
        unreferencedSince = null;
    }

    /** Returns true when this removal left the object unreferenced. */
    public boolean removeReference(UUID flowId, Instant now) {
        if (flowReferences.remove(flowId) && flowReferences.isEmpty()) {
            unreferencedSince = now;
            return true;
        }
        return false;
    }

    public int getReferenceCount() {
        return flowReferences.size();
    }

    public String getObjectId() {
        return objectId;
    }

    public Long getSizeBytes() {
        return sizeBytes;
    }

    public void setSizeBytes(Long sizeBytes) {
        this.sizeBytes = sizeBytes;
    }

    public String getMimeType() {
        return mimeType;
    }

    public void setMimeType(String mimeType) {
        this.mimeType = mimeType;
    }

    public Set<UUID> getFlowReferences() {
        return flowReferences;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUnreferencedSince() {
        return unreferencedSince;
    }

    public void setUnreferencedSince(Instant unreferencedSince) {
        this.unreferencedSince = unreferencedSince;
    }
}
