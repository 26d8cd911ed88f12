package com.example.mediacatalog_backend.dto.web;

import com.example.mediacatalog_backend.model.Flow;
import com.example.mediacatalog_backend.model.FlowCollectionItem;
import com.example.mediacatalog_backend.timerange.TimeRange;
import com.example.mediacatalog_backend.util.ContentFormat;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * {@code timerange} is the hull of the flow's content, {@code availableTimerange} the exact
 * covered ranges joined by commas. Both are null for a flow without segments.
 */
public record FlowResponse(UUID id, UUID sourceId, ContentFormat format, String label, String description,
                           Map<String, String> tags, boolean readOnly,
                           Long maxBitRate, Long avgBitRate, String container, String codec,
                           Integer frameWidth, Integer frameHeight, Integer sampleRate, Integer channels,
                           List<FlowCollectionItem> flowCollection,
                           String timerange, String availableTimerange,
                           Instant createdAt, Instant updatedAt) {
    public static FlowResponse from(Flow f) {
        TimeRange hull = f.getAvailableTimerange().hull();
        return new FlowResponse(f.getId(), f.getSourceId(), f.getFormat(), f.getLabel(), f.getDescription(),
                new HashMap<>(f.getTags()), f.isReadOnly(),
                f.getMaxBitRate(), f.getAvgBitRate(), f.getContainer(), f.getCodec(),
                f.getFrameWidth(), f.getFrameHeight(), f.getSampleRate(), f.getChannels(),
                List.copyOf(f.getFlowCollection()),
                hull == null ? null : hull.format(),
                f.getAvailableTimerange().isEmpty() ? null : f.getAvailableTimerange().format(),
                f.getCreatedAt(), f.getUpdatedAt());
    }
}
