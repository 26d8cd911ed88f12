package com.example.mediacatalog_backend.dto.web;

import com.example.mediacatalog_backend.dto.FlowSegmentDTO;
import com.example.mediacatalog_backend.timerange.TimePoint;
import com.example.mediacatalog_backend.timerange.TimeRange;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.Map;

public record SegmentRequest(@NotBlank String objectId,
                             @NotBlank String timerange,
                             String tsOffset,
                             @PositiveOrZero Long sampleOffset,
                             @PositiveOrZero Long sampleCount,
                             @PositiveOrZero Integer keyFrameCount,
                             Map<String, String> getUrls) {
    public FlowSegmentDTO toDto() {
        return new FlowSegmentDTO(
                objectId,
                TimeRange.parse(timerange),
                tsOffset == null || tsOffset.isBlank() ? null : TimePoint.parse(tsOffset),
                sampleOffset,
                sampleCount,
                keyFrameCount,
                getUrls == null ? Map.of() : getUrls);
    }
}
