package com.example.mediacatalog_backend.model;

import com.example.mediacatalog_backend.timerange.TimePoint;
import com.example.mediacatalog_backend.timerange.TimeRange;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A bounded slice of a flow backed by one media object. Identity on the wire is
 * (flow, object, timerange); the surrogate id only exists so a split can rewrite a row in place.
 * <p>
 * The start/end columns mirror {@link #timerange} so the index can be range-scanned in SQL;
 * {@code start_rank} is 0 for an inclusive start and 1 for an exclusive one.
 */
@Entity
@Table(
        name = "flow_segment",
        uniqueConstraints = @UniqueConstraint(name = "uq_segment_identity", columnNames = {"flow_id", "object_id", "timerange"}),
        indexes = {
                @Index(name = "idx_segment_flow_start", columnList = "flow_id, start_sec, start_nanos, start_rank"),
                @Index(name = "idx_segment_object", columnList = "object_id")
        }
)
public class FlowSegment {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "flow_id", nullable = false, foreignKey = @ForeignKey(name = "fk_segment_flow"))
    private Flow flow;

    @Column(name = "object_id", nullable = false, length = 256)
    private String objectId;

    @Convert(converter = TimeRangeConverter.class)
    @Column(name = "timerange", nullable = false, length = 96)
    private TimeRange timerange;

    @Column(name = "start_sec", nullable = false)
    private long startSec;

    @Column(name = "start_nanos", nullable = false)
    private int startNanos;

    @Column(name = "start_rank", nullable = false)
    private int startRank;

    @Column(name = "end_sec", nullable = false)
    private long endSec;

    @Column(name = "end_nanos", nullable = false)
    private int endNanos;

    @Convert(converter = TimePointConverter.class)
    @Column(name = "ts_offset", length = 48)
    private TimePoint tsOffset;

    @Column(name = "sample_offset")
    private Long sampleOffset;

    @Column(name = "sample_count")
    private Long sampleCount;

    @Column(name = "key_frame_count")
    private Integer keyFrameCount;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "get_urls")
    private Map<String, String> getUrls = new LinkedHashMap<>();

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    protected FlowSegment() {}

    public FlowSegment(Flow flow, String objectId, TimeRange timerange) {
        this.flow = flow;
        this.objectId = objectId;
        setTimerange(timerange);
    }

    /** Copy of the per-object fields, used when a split produces a second piece. */
    public FlowSegment copyWithTimerange(TimeRange range) {
        FlowSegment copy = new FlowSegment(flow, objectId, range);
        copy.tsOffset = tsOffset;
        copy.sampleOffset = sampleOffset;
        copy.sampleCount = sampleCount;
        copy.keyFrameCount = keyFrameCount;
        copy.getUrls = new LinkedHashMap<>(getGetUrls());
        return copy;
    }

    public UUID getId() {
        return id;
    }

    public Flow getFlow() {
        return flow;
    }

    public String getObjectId() {
        return objectId;
    }

    public TimeRange getTimerange() {
        return timerange;
    }

    public void setTimerange(TimeRange timerange) {
        if (!timerange.isBounded()) {
            throw new IllegalArgumentException("segment timerange must be bounded: " + timerange);
        }
        this.timerange = timerange;
        this.startSec = timerange.start().seconds();
        this.startNanos = timerange.start().nanos();
        this.startRank = timerange.startInclusive() ? 0 : 1;
        this.endSec = timerange.end().seconds();
        this.endNanos = timerange.end().nanos();
    }

    public TimePoint getTsOffset() {
        return tsOffset;
    }

    public void setTsOffset(TimePoint tsOffset) {
        this.tsOffset = tsOffset;
    }

    public Long getSampleOffset() {
        return sampleOffset;
    }

    public void setSampleOffset(Long sampleOffset) {
        this.sampleOffset = sampleOffset;
    }

    public Long getSampleCount() {
        return sampleCount;
    }

    public void setSampleCount(Long sampleCount) {
        this.sampleCount = sampleCount;
    }

    public Integer getKeyFrameCount() {
        return keyFrameCount;
    }

    public void setKeyFrameCount(Integer keyFrameCount) {
        this.keyFrameCount = keyFrameCount;
    }

    public Map<String, String> getGetUrls() {
        if (getUrls == null) getUrls = new LinkedHashMap<>();
        return getUrls;
    }

    public void setGetUrls(Map<String, String> getUrls) {
        this.getUrls = getUrls == null ? new LinkedHashMap<>() : new LinkedHashMap<>(getUrls);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
