package com.example.mediacatalog_backend.dto.web;

import com.example.mediacatalog_backend.model.FlowSegment;

import java.util.LinkedHashMap;
import java.util.Map;

public record SegmentResponse(String objectId, String timerange, String tsOffset,
                              Long sampleOffset, Long sampleCount, Integer keyFrameCount,
                              Map<String, String> getUrls) {
    public static SegmentResponse from(FlowSegment s) {
        return new SegmentResponse(s.getObjectId(), s.getTimerange().format(),
                s.getTsOffset() == null ? null : s.getTsOffset().toString(),
                s.getSampleOffset(), s.getSampleCount(), s.getKeyFrameCount(),
                new LinkedHashMap<>(s.getGetUrls()));
    }
}
