package com.example.mediacatalog_backend.model;

import com.example.mediacatalog_backend.util.ContentFormat;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(
        name = "source",
        indexes = {
                @Index(name = "idx_source_format", columnList = "format"),
                @Index(name = "idx_source_created", columnList = "created_at")
        }
)
public class Source {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "format", nullable = false, length = 16)
    private ContentFormat format;

    @Column(name = "label", length = 255)
    private String label;

    @Column(name = "description", length = 2048)
    private String description;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "tags")
    private Map<String, String> tags = new HashMap<>();

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    protected Source() {}

    public Source(ContentFormat format) {
        this.format = format;
    }

    public UUID getId() {
        return id;
    }

    public ContentFormat getFormat() {
        return format;
    }

    public void setFormat(ContentFormat format) {
        this.format = format;
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Map<String, String> getTags() {
        if (tags == null) tags = new HashMap<>();
        return tags;
    }

    public void setTags(Map<String, String> tags) {
        this.tags = tags == null ? new HashMap<>() : new HashMap<>(tags);
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
}
