package com.example.mediacatalog_backend.service;

import com.example.mediacatalog_backend.dto.FlowSegmentDTO;
import com.example.mediacatalog_backend.dto.web.SegmentResponse;
import com.example.mediacatalog_backend.events.EventPayloads;
import com.example.mediacatalog_backend.events.EventRecorder;
import com.example.mediacatalog_backend.exception.CatalogException;
import com.example.mediacatalog_backend.model.Flow;
import com.example.mediacatalog_backend.model.FlowSegment;
import com.example.mediacatalog_backend.repository.FlowRepository;
import com.example.mediacatalog_backend.repository.FlowSegmentRepository;
import com.example.mediacatalog_backend.timerange.TimePoint;
import com.example.mediacatalog_backend.timerange.TimeRange;
import com.example.mediacatalog_backend.timerange.TimeRangeSet;
import com.example.mediacatalog_backend.util.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Per-flow segment index: overlap-checked insert, ordered range queries and range deletion
 * with splitting of partially covered segments.
 * <p>
 * Every mutation first takes the flow's row lock, so mutations on one flow are serialized and
 * always see a non-overlapping segment set. After each mutation the flow's cached
 * {@code available_timerange} equals the exact union of its segments.
 */
@Service
public class SegmentIndexService {
    private static final Logger LOGGER = LoggerFactory.getLogger(SegmentIndexService.class);

    private final FlowRepository flowRepo;
    private final FlowSegmentRepository segmentRepo;
    private final MediaObjectService mediaObjects;
    private final EventRecorder events;

    public SegmentIndexService(FlowRepository flowRepo, FlowSegmentRepository segmentRepo,
                               MediaObjectService mediaObjects, EventRecorder events) {
        this.flowRepo = flowRepo;
        this.segmentRepo = segmentRepo;
        this.mediaObjects = mediaObjects;
        this.events = events;
    }

    public record SegmentPage(List<FlowSegment> segments, String nextCursor) {
    }

    public record DeleteResult(int deleted, int modified) {
        public static final DeleteResult NONE = new DeleteResult(0, 0);

        public boolean changed() {
            return deleted > 0 || modified > 0;
        }
    }

    /**
     * Adds a segment. Overlap with existing coverage is a conflict unless {@code replace} is set,
     * in which case the covered part of the flow is cleared first.
     */
    @Transactional
    public FlowSegment insert(UUID flowId, FlowSegmentDTO dto, boolean replace) {
        TimeRange range = dto.timerange();
        if (range == null || !range.isBounded()) {
            throw CatalogException.parseError("SEGMENT_TIMERANGE_UNBOUNDED");
        }
        if (dto.objectId() == null || dto.objectId().isBlank()) {
            throw CatalogException.parseError("OBJECT_ID_MISSING");
        }
        Flow flow = lockWritableFlow(flowId);

        if (!findOverlapping(flowId, range).isEmpty()) {
            if (!replace) {
                LOGGER.debug("SEGMENT OVERLAP flowId={} timerange={}", flowId, range);
                throw CatalogException.overlap("SEGMENT_OVERLAP");
            }
            DeleteResult cleared = deleteRangeLocked(flow, range);
            // removals must reach the table before the replacement row is inserted
            segmentRepo.flush();
            LOGGER.info("SEGMENT REPLACE flowId={} timerange={} deleted={} modified={}",
                    flowId, range, cleared.deleted(), cleared.modified());
        }

        mediaObjects.attach(dto.objectId(), flowId);

        FlowSegment segment = new FlowSegment(flow, dto.objectId(), range);
        segment.setTsOffset(dto.tsOffset());
        segment.setSampleOffset(dto.sampleOffset());
        segment.setSampleCount(dto.sampleCount());
        segment.setKeyFrameCount(dto.keyFrameCount());
        segment.setGetUrls(dto.getUrls());
        segmentRepo.save(segment);

        flow.setAvailableTimerange(flow.getAvailableTimerange().add(range));
        events.record(EventType.SEGMENTS_ADDED,
                new EventPayloads.SegmentsAdded(flowId, List.of(SegmentResponse.from(segment))));
        LOGGER.info("SEGMENT ADD flowId={} objectId={} timerange={}", flowId, dto.objectId(), range);
        return segment;
    }

    /**
     * Segments overlapping {@code range} in ascending start order, at most {@code limit} of them,
     * starting strictly after the segment whose timerange is {@code cursor}.
     */
    @Transactional(readOnly = true)
    public SegmentPage query(UUID flowId, TimeRange range, String cursor, int limit) {
        if (limit < 1) {
            throw CatalogException.parseError("BAD_PAGINATION");
        }
        if (!flowRepo.existsById(flowId)) {
            throw CatalogException.notFound("FLOW_NOT_FOUND");
        }
        TimeRange window = range == null ? TimeRange.ETERNITY : range;
        ScanPosition pos = ScanPosition.from(cursor);

        List<FlowSegment> out = new ArrayList<>();
        boolean more = true;
        while (more && out.size() < limit) {
            List<FlowSegment> rows = segmentRepo.scanFrom(flowId, fromSec(window), toSec(window),
                    pos.sec, pos.nanos, pos.rank, PageRequest.of(0, limit));
            more = rows.size() == limit;
            for (FlowSegment s : rows) {
                pos = ScanPosition.after(s);
                if (s.getTimerange().startsAfter(window)) {
                    more = false;
                    break;
                }
                if (s.getTimerange().overlaps(window)) {
                    out.add(s);
                    if (out.size() == limit) break;
                }
            }
        }
        String next = out.size() == limit ? out.get(out.size() - 1).getTimerange().format() : null;
        return new SegmentPage(out, next);
    }

    @Transactional
    public DeleteResult deleteRange(UUID flowId, TimeRange range) {
        Flow flow = lockWritableFlow(flowId);
        DeleteResult result = deleteRangeLocked(flow, range);
        LOGGER.info("SEGMENT DELETE flowId={} timerange={} deleted={} modified={}",
                flowId, range, result.deleted(), result.modified());
        return result;
    }

    /**
     * Clears {@code range} from a flow whose row lock the caller already holds. Segments fully
     * inside the range are removed; partially covered ones are cut down to what lies outside it,
     * the first remainder rewriting the row in place and a second remainder becoming a new row.
     */
    DeleteResult deleteRangeLocked(Flow flow, TimeRange range) {
        UUID flowId = flow.getId();
        List<FlowSegment> hits = findOverlapping(flowId, range);
        if (hits.isEmpty()) {
            return DeleteResult.NONE;
        }
        Set<String> removedFrom = new LinkedHashSet<>();
        int deleted = 0;
        int modified = 0;
        for (FlowSegment s : hits) {
            TimeRange original = s.getTimerange();
            List<TimeRange> pieces = original.subtract(range);
            if (pieces.isEmpty()) {
                segmentRepo.delete(s);
                removedFrom.add(s.getObjectId());
                deleted++;
                continue;
            }
            if (pieces.size() == 2) {
                FlowSegment second = s.copyWithTimerange(pieces.get(1));
                trimmed(second, original);
                segmentRepo.save(second);
            }
            s.setTimerange(pieces.get(0));
            trimmed(s, original);
            modified++;
        }
        segmentRepo.flush();

        for (String objectId : removedFrom) {
            if (!segmentRepo.existsByFlowIdAndObjectId(flowId, objectId)) {
                mediaObjects.detach(objectId, flowId);
            }
        }
        flow.setAvailableTimerange(TimeRangeSet.of(segmentRepo.findTimerangesByFlowId(flowId)));
        events.record(EventType.SEGMENTS_DELETED, new EventPayloads.SegmentsDeleted(flowId, range.format()));
        return new DeleteResult(deleted, modified);
    }

    /**
     * Rebuilds the cached coverage from the segment rows.
     */
    @Transactional
    public TimeRangeSet recomputeAvailable(UUID flowId) {
        Flow flow = flowRepo.findByIdForUpdate(flowId).orElseThrow(() -> CatalogException.notFound("FLOW_NOT_FOUND"));
        TimeRangeSet available = TimeRangeSet.of(segmentRepo.findTimerangesByFlowId(flowId));
        flow.setAvailableTimerange(available);
        return available;
    }

    Flow lockWritableFlow(UUID flowId) {
        Flow flow = flowRepo.findByIdForUpdate(flowId).orElseThrow(() -> CatalogException.notFound("FLOW_NOT_FOUND"));
        if (flow.isReadOnly()) {
            throw CatalogException.readOnly("FLOW_READ_ONLY");
        }
        return flow;
    }

    private List<FlowSegment> findOverlapping(UUID flowId, TimeRange range) {
        return segmentRepo.findCandidates(flowId, fromSec(range), toSec(range)).stream()
                .filter(s -> s.getTimerange().overlaps(range))
                .toList();
    }

    // a remainder that no longer starts where the object's content started loses its sample
    // bookkeeping, and its ts_offset advances by the amount trimmed off the front
    private static void trimmed(FlowSegment piece, TimeRange original) {
        TimePoint oldStart = original.start();
        TimePoint newStart = piece.getTimerange().start();
        if (!newStart.equals(oldStart)) {
            TimePoint base = piece.getTsOffset() == null ? TimePoint.ZERO : piece.getTsOffset();
            piece.setTsOffset(base.plus(newStart.minus(oldStart)));
            piece.setSampleOffset(null);
        }
        piece.setSampleCount(null);
        piece.setKeyFrameCount(null);
    }

    private static long fromSec(TimeRange r) {
        return r.start() == null ? Long.MIN_VALUE : r.start().seconds();
    }

    private static long toSec(TimeRange r) {
        return r.end() == null ? Long.MAX_VALUE : r.end().seconds();
    }

    private record ScanPosition(long sec, int nanos, int rank) {
        static final ScanPosition BEGIN = new ScanPosition(Long.MIN_VALUE, -1, -1);

        static ScanPosition after(FlowSegment s) {
            TimeRange r = s.getTimerange();
            return new ScanPosition(r.start().seconds(), r.start().nanos(), r.startInclusive() ? 0 : 1);
        }

        static ScanPosition from(String cursor) {
            if (cursor == null || cursor.isBlank()) {
                return BEGIN;
            }
            TimeRange r = TimeRange.parse(cursor);
            if (r.start() == null) {
                throw CatalogException.parseError("BAD_PAGE_CURSOR");
            }
            return new ScanPosition(r.start().seconds(), r.start().nanos(), r.startInclusive() ? 0 : 1);
        }
    }
}
