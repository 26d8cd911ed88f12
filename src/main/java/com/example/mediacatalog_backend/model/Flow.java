package com.example.mediacatalog_backend.model;

import com.example.mediacatalog_backend.timerange.TimeRangeSet;
import com.example.mediacatalog_backend.util.ContentFormat;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One encoded rendition of a source. {@code sourceId} is a lookup reference only and is cleared
 * when the source goes away. {@code availableTimerange} is a cache of the union of the flow's
 * segment ranges and is rewritten by every segment mutation.
 */
@Entity
@Table(
        name = "flow",
        indexes = {
                @Index(name = "idx_flow_source", columnList = "source_id"),
                @Index(name = "idx_flow_format", columnList = "format"),
                @Index(name = "idx_flow_created", columnList = "created_at")
        }
)
public class Flow {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "source_id")
    private UUID sourceId;

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

    @Column(name = "read_only", nullable = false)
    private boolean readOnly = false;

    @Column(name = "max_bit_rate")
    private Long maxBitRate;

    @Column(name = "avg_bit_rate")
    private Long avgBitRate;

    @Column(name = "container", length = 128)
    private String container;

    @Column(name = "codec", length = 128)
    private String codec;

    @Column(name = "frame_width")
    private Integer frameWidth;

    @Column(name = "frame_height")
    private Integer frameHeight;

    @Column(name = "sample_rate")
    private Integer sampleRate;

    @Column(name = "channels")
    private Integer channels;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "flow_collection")
    private List<FlowCollectionItem> flowCollection;

    @Convert(converter = TimeRangeSetConverter.class)
    @Column(name = "available_timerange", columnDefinition = "text")
    private TimeRangeSet availableTimerange = TimeRangeSet.EMPTY;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    protected Flow() {}

    public Flow(ContentFormat format) {
        this.format = format;
    }

    public UUID getId() {
        return id;
    }

    public UUID getSourceId() {
        return sourceId;
    }

    public void setSourceId(UUID sourceId) {
        this.sourceId = sourceId;
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

    public boolean isReadOnly() {
        return readOnly;
    }

    public void setReadOnly(boolean readOnly) {
        this.readOnly = readOnly;
    }

    public Long getMaxBitRate() {
        return maxBitRate;
    }

    public void setMaxBitRate(Long maxBitRate) {
        this.maxBitRate = maxBitRate;
    }

    public Long getAvgBitRate() {
        return avgBitRate;
    }

    public void setAvgBitRate(Long avgBitRate) {
        this.avgBitRate = avgBitRate;
    }

    public String getContainer() {
        return container;
    }

    public void setContainer(String container) {
        this.container = container;
    }

    public String getCodec() {
        return codec;
    }

    public void setCodec(String codec) {
        this.codec = codec;
    }

    public Integer getFrameWidth() {
        return frameWidth;
    }

    public void setFrameWidth(Integer frameWidth) {
        this.frameWidth = frameWidth;
    }

    public Integer getFrameHeight() {
        return frameHeight;
    }

    public void setFrameHeight(Integer frameHeight) {
        this.frameHeight = frameHeight;
    }

    public Integer getSampleRate() {
        return sampleRate;
    }

    public void setSampleRate(Integer sampleRate) {
        this.sampleRate = sampleRate;
    }

    public Integer getChannels() {
        return channels;
    }

    public void setChannels(Integer channels) {
        this.channels = channels;
    }

    public List<FlowCollectionItem> getFlowCollection() {
        return flowCollection == null ? List.of() : Collections.unmodifiableList(flowCollection);
    }

    public void setFlowCollection(List<FlowCollectionItem> flowCollection) {
        this.flowCollection = flowCollection == null || flowCollection.isEmpty() ? null : new ArrayList<>(flowCollection);
    }

    /** Drops every item pointing at {@code flowId}; true when something was removed. */
    public boolean removeFromCollection(UUID flowId) {
        if (flowCollection == null || flowCollection.stream().noneMatch(i -> flowId.equals(i.flowId()))) {
            return false;
        }
        setFlowCollection(flowCollection.stream().filter(i -> !flowId.equals(i.flowId())).toList());
        return true;
    }

    public TimeRangeSet getAvailableTimerange() {
        return availableTimerange == null ? TimeRangeSet.EMPTY : availableTimerange;
    }

    public void setAvailableTimerange(TimeRangeSet availableTimerange) {
        this.availableTimerange = availableTimerange;
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
