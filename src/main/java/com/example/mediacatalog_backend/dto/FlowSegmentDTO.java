package com.example.mediacatalog_backend.dto;

import com.example.mediacatalog_backend.timerange.TimePoint;
import com.example.mediacatalog_backend.timerange.TimeRange;

import java.util.Map;

/**
 * Parsed segment to be added to a flow's index.
 */
public record FlowSegmentDTO(
        String objectId,
        TimeRange timerange,
        TimePoint tsOffset,
        Long sampleOffset,
        Long sampleCount,
        Integer keyFrameCount,
        Map<String, String> getUrls
) {
    public FlowSegmentDTO(String objectId, TimeRange timerange) {
        this(objectId, timerange, null, null, null, null, Map.of());
    }
}
