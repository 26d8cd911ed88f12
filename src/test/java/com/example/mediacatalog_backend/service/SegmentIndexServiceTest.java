package com.example.mediacatalog_backend.service;

import com.example.mediacatalog_backend.config.TimeConfig;
import com.example.mediacatalog_backend.dto.FlowSegmentDTO;
import com.example.mediacatalog_backend.events.EventRecorder;
import com.example.mediacatalog_backend.exception.CatalogException;
import com.example.mediacatalog_backend.exception.ErrorKind;
import com.example.mediacatalog_backend.model.CatalogEvent;
import com.example.mediacatalog_backend.model.Flow;
import com.example.mediacatalog_backend.model.FlowSegment;
import com.example.mediacatalog_backend.model.MediaObject;
import com.example.mediacatalog_backend.repository.CatalogEventRepository;
import com.example.mediacatalog_backend.repository.FlowRepository;
import com.example.mediacatalog_backend.repository.FlowSegmentRepository;
import com.example.mediacatalog_backend.repository.MediaObjectRepository;
import com.example.mediacatalog_backend.service.Interfaces.ObjectStat;
import com.example.mediacatalog_backend.service.Interfaces.ObjectStore;
import com.example.mediacatalog_backend.timerange.TimePoint;
import com.example.mediacatalog_backend.timerange.TimeRange;
import com.example.mediacatalog_backend.timerange.TimeRangeSet;
import com.example.mediacatalog_backend.util.ContentFormat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.ImportAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@DataJpaTest
@Import({SegmentIndexService.class, MediaObjectService.class, EventRecorder.class, TimeConfig.class})
@ImportAutoConfiguration(JacksonAutoConfiguration.class)
class SegmentIndexServiceTest {

    @Autowired
    private SegmentIndexService index;

    @Autowired
    private FlowRepository flowRepository;

    @Autowired
    private FlowSegmentRepository segmentRepository;

    @Autowired
    private MediaObjectRepository objectRepository;

    @Autowired
    private CatalogEventRepository eventRepository;

    @MockitoBean
    private ObjectStore objectStore;

    private UUID flowId;

    @BeforeEach
    void setUp() {
        when(objectStore.exists(anyString())).thenReturn(true);
        when(objectStore.stat(anyString())).thenReturn(new ObjectStat(1024, "video/mp2t", "sha256:abc"));
        flowId = flowRepository.saveAndFlush(new Flow(ContentFormat.VIDEO)).getId();
    }

    private static TimeRange r(String text) {
        return TimeRange.parse(text);
    }

    private FlowSegment add(String objectId, String range) {
        return index.insert(flowId, new FlowSegmentDTO(objectId, r(range)), false);
    }

    private List<String> storedRanges() {
        return index.query(flowId, null, null, 100).segments().stream()
                .map(s -> s.getTimerange().format())
                .toList();
    }

    private TimeRangeSet available() {
        return flowRepository.findById(flowId).orElseThrow().getAvailableTimerange();
    }

    @Test
    void overlapIsRejectedAndPartialDeleteTrimsBothNeighbours() {
        add("obj-a", "[0:0_10:0)");
        add("obj-b", "[10:0_20:0)");
        assertThat(available().format()).isEqualTo("[0:0_20:0)");

        CatalogException conflict = assertThrows(CatalogException.class, () -> add("obj-c", "[5:0_15:0)"));
        assertThat(conflict.getKind()).isEqualTo(ErrorKind.OVERLAP_CONFLICT);
        assertThat(conflict.getReason()).isEqualTo("SEGMENT_OVERLAP");

        SegmentIndexService.DeleteResult result = index.deleteRange(flowId, r("[5:0_15:0)"));

        assertThat(result.deleted()).isZero();
        assertThat(result.modified()).isEqualTo(2);
        assertThat(storedRanges()).containsExactly("[0:0_5:0)", "[15:0_20:0)");
        assertThat(available().ranges()).containsExactly(r("[0:0_5:0)"), r("[15:0_20:0)"));
    }

    @Test
    void trimmedFrontAdvancesTsOffsetAndDropsSampleCounts() {
        index.insert(flowId, new FlowSegmentDTO("obj-a", r("[10:0_20:0)"), TimePoint.parse("1:0"),
                0L, 250L, 5, Map.of("default", "http://cdn/obj-a")), false);

        index.deleteRange(flowId, r("[10:0_12:500000000)"));

        FlowSegment remainder = index.query(flowId, null, null, 10).segments().get(0);
        assertThat(remainder.getTimerange()).isEqualTo(r("[12:500000000_20:0)"));
        assertThat(remainder.getTsOffset()).isEqualTo(TimePoint.parse("3:500000000"));
        assertThat(remainder.getSampleOffset()).isNull();
        assertThat(remainder.getSampleCount()).isNull();
        assertThat(remainder.getKeyFrameCount()).isNull();
        assertThat(remainder.getGetUrls()).containsEntry("default", "http://cdn/obj-a");
    }

    @Test
    void deletingTheMiddleSplitsOneSegmentInTwo() {
        add("obj-a", "[0:0_10:0)");

        SegmentIndexService.DeleteResult result = index.deleteRange(flowId, r("[4:0_6:0)"));

        assertThat(result.modified()).isEqualTo(1);
        List<FlowSegment> pieces = index.query(flowId, null, null, 10).segments();
        assertThat(pieces).extracting(s -> s.getTimerange().format()).containsExactly("[0:0_4:0)", "[6:0_10:0)");
        assertThat(pieces).extracting(FlowSegment::getObjectId).containsOnly("obj-a");
        assertThat(pieces.get(1).getTsOffset()).isEqualTo(TimePoint.parse("6:0"));
        assertThat(objectRepository.findById("obj-a").orElseThrow().getReferenceCount()).isEqualTo(1);
    }

    @Test
    void secondDeleteOfSameRangeChangesNothing() {
        add("obj-a", "[0:0_10:0)");
        add("obj-b", "[10:0_20:0)");
        index.deleteRange(flowId, r("[5:0_15:0)"));
        TimeRangeSet before = available();

        SegmentIndexService.DeleteResult again = index.deleteRange(flowId, r("[5:0_15:0)"));

        assertThat(again.changed()).isFalse();
        assertThat(available()).isEqualTo(before);
        assertThat(storedRanges()).containsExactly("[0:0_5:0)", "[15:0_20:0)");
    }

    @Test
    void replaceClearsTheCoveredPartBeforeInserting() {
        add("obj-a", "[0:0_10:0)");
        add("obj-b", "[10:0_20:0)");

        index.insert(flowId, new FlowSegmentDTO("obj-c", r("[5:0_15:0)")), true);

        assertThat(storedRanges()).containsExactly("[0:0_5:0)", "[5:0_15:0)", "[15:0_20:0)");
        assertThat(available().format()).isEqualTo("[0:0_20:0)");
        List<String> types = eventRepository.findAll().stream()
                .sorted(Comparator.comparing(CatalogEvent::getId))
                .map(CatalogEvent::getEventType)
                .toList();
        assertThat(types).containsSubsequence("segments.added", "segments.added", "segments.deleted", "segments.added");
    }

    @Test
    void removingTheLastSegmentOfAnObjectReleasesIt() {
        add("obj-a", "[0:0_10:0)");
        add("obj-b", "[10:0_20:0)");

        index.deleteRange(flowId, r("[10:0_"));

        MediaObject released = objectRepository.findById("obj-b").orElseThrow();
        assertThat(released.getReferenceCount()).isZero();
        assertThat(released.getUnreferencedSince()).isNotNull();
        assertThat(objectRepository.findById("obj-a").orElseThrow().getUnreferencedSince()).isNull();
        assertThat(available().format()).isEqualTo("[0:0_10:0)");
    }

    @Test
    void clearingEverythingEmptiesAvailableRange() {
        add("obj-a", "[0:0_10:0)");

        index.deleteRange(flowId, TimeRange.ETERNITY);

        assertThat(available().isEmpty()).isTrue();
        assertThat(segmentRepository.countByFlowId(flowId)).isZero();
    }

    @Test
    void queryPagesInStartOrderWithCursor() {
        for (int i = 4; i >= 0; i--) {
            add("obj-" + i, "[" + i + ":0_" + (i + 1) + ":0)");
        }

        SegmentIndexService.SegmentPage first = index.query(flowId, null, null, 2);
        assertThat(first.segments()).extracting(FlowSegment::getObjectId).containsExactly("obj-0", "obj-1");
        assertThat(first.nextCursor()).isEqualTo("[1:0_2:0)");

        SegmentIndexService.SegmentPage second = index.query(flowId, null, first.nextCursor(), 2);
        assertThat(second.segments()).extracting(FlowSegment::getObjectId).containsExactly("obj-2", "obj-3");

        SegmentIndexService.SegmentPage last = index.query(flowId, null, second.nextCursor(), 2);
        assertThat(last.segments()).extracting(FlowSegment::getObjectId).containsExactly("obj-4");
        assertThat(last.nextCursor()).isNull();
    }

    @Test
    void queryReturnsOnlyOverlappingSegments() {
        for (int i = 0; i < 5; i++) {
            add("obj-" + i, "[" + i + ":0_" + (i + 1) + ":0)");
        }

        List<FlowSegment> hits = index.query(flowId, r("[2:500000000_3:500000000)"), null, 10).segments();

        assertThat(hits).extracting(FlowSegment::getObjectId).containsExactly("obj-2", "obj-3");
        assertThat(index.query(flowId, r("[1:0_1:0]"), null, 10).segments())
                .extracting(FlowSegment::getObjectId).containsExactly("obj-1");
    }

    @Test
    void readOnlyFlowRejectsMutations() {
        add("obj-a", "[0:0_10:0)");
        Flow flow = flowRepository.findById(flowId).orElseThrow();
        flow.setReadOnly(true);
        flowRepository.saveAndFlush(flow);

        CatalogException insert = assertThrows(CatalogException.class, () -> add("obj-b", "[10:0_20:0)"));
        CatalogException delete = assertThrows(CatalogException.class, () -> index.deleteRange(flowId, TimeRange.ETERNITY));

        assertThat(insert.getKind()).isEqualTo(ErrorKind.READ_ONLY_FLOW);
        assertThat(delete.getKind()).isEqualTo(ErrorKind.READ_ONLY_FLOW);
        assertThat(storedRanges()).containsExactly("[0:0_10:0)");
    }

    @Test
    void rejectsUnboundedSegmentsAndUnknownObjects() {
        CatalogException unbounded = assertThrows(CatalogException.class, () -> add("obj-a", "[0:0_"));
        assertThat(unbounded.getKind()).isEqualTo(ErrorKind.PARSE_ERROR);

        when(objectStore.exists("missing")).thenReturn(false);
        CatalogException missing = assertThrows(CatalogException.class, () -> add("missing", "[0:0_1:0)"));
        assertThat(missing.getKind()).isEqualTo(ErrorKind.NOT_FOUND);
        assertThat(missing.getReason()).isEqualTo("OBJECT_NOT_FOUND");

        CatalogException noFlow = assertThrows(CatalogException.class,
                () -> index.insert(UUID.randomUUID(), new FlowSegmentDTO("obj-a", r("[0:0_1:0)")), false));
        assertThat(noFlow.getReason()).isEqualTo("FLOW_NOT_FOUND");
    }

    @Test
    void recomputeMatchesIncrementalValue() {
        add("obj-a", "[0:0_10:0)");
        add("obj-b", "[20:0_30:0)");
        index.deleteRange(flowId, r("[25:0_26:0)"));
        TimeRangeSet incremental = available();

        assertThat(index.recomputeAvailable(flowId)).isEqualTo(incremental);
        assertThat(incremental.format()).isEqualTo("[0:0_10:0),[20:0_25:0),[26:0_30:0)");
    }

    @Test
    void flowWithManyGapsKeepsAcceptingSegments() {
        for (int i = 0; i < 400; i++) {
            long sec = 1_609_459_200L + 2L * i;
            add("obj-" + i, "[" + sec + ":40000000_" + (sec + 1) + ":40000000)");
        }
        index.deleteRange(flowId, r("[1609459300:500000000_1609459300:600000000)"));

        TimeRangeSet available = available();
        assertThat(available.ranges()).hasSize(401);
        assertThat(segmentRepository.countByFlowId(flowId)).isEqualTo(401);
        flowRepository.flush();
        assertThat(index.recomputeAvailable(flowId)).isEqualTo(available);
    }

    @Test
    void randomInsertsAndDeletesKeepIndexConsistent() {
        Random random = new Random(20240917L);
        List<TimeRange> expected = new ArrayList<>();
        for (int step = 0; step < 300; step++) {
            if (random.nextInt(3) > 0) {
                TimeRange range = randomRange(random, true);
                boolean clash = expected.stream().anyMatch(e -> e.overlaps(range));
                if (clash) {
                    CatalogException conflict = assertThrows(CatalogException.class, () -> add("obj-x", range.format()));
                    assertThat(conflict.getKind()).isEqualTo(ErrorKind.OVERLAP_CONFLICT);
                } else {
                    add("obj-" + step, range.format());
                    expected.add(range);
                }
            } else {
                TimeRange range = randomRange(random, false);
                index.deleteRange(flowId, range);
                List<TimeRange> rest = new ArrayList<>();
                for (TimeRange e : expected) {
                    rest.addAll(e.subtract(range));
                }
                expected = rest;
            }

            List<TimeRange> stored = index.query(flowId, null, null, 1000).segments().stream()
                    .map(FlowSegment::getTimerange)
                    .toList();
            assertThat(stored).containsExactlyInAnyOrderElementsOf(expected);
            for (int i = 0; i < stored.size(); i++) {
                for (int j = i + 1; j < stored.size(); j++) {
                    assertThat(stored.get(i).overlaps(stored.get(j))).as("%s vs %s", stored.get(i), stored.get(j)).isFalse();
                }
            }
            assertThat(available()).isEqualTo(TimeRangeSet.of(stored));
        }
    }

    // integer-second bounds on a short timeline so inserts and deletes collide often
    private static TimeRange randomRange(Random random, boolean bounded) {
        int a = random.nextInt(40);
        int b = a + 1 + random.nextInt(6);
        TimePoint start = bounded || random.nextInt(8) > 0 ? TimePoint.of(a, 0) : null;
        TimePoint end = bounded || random.nextInt(8) > 0 ? TimePoint.of(b, 0) : null;
        return TimeRange.of(start, random.nextBoolean(), end, random.nextBoolean());
    }
}
