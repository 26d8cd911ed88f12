package com.example.mediacatalog_backend.events;

import com.example.mediacatalog_backend.dto.web.FlowResponse;
import com.example.mediacatalog_backend.dto.web.SegmentResponse;
import com.example.mediacatalog_backend.dto.web.SourceResponse;

import java.util.List;
import java.util.UUID;

/**
 * Type-specific bodies carried in the {@code event} field of a webhook notification.
 */
public final class EventPayloads {
    private EventPayloads() {
    }

    public record SourceChanged(SourceResponse source) {
    }

    public record SourceDeleted(UUID sourceId) {
    }

    public record FlowChanged(FlowResponse flow) {
    }

    public record FlowDeleted(UUID flowId) {
    }

    public record SegmentsAdded(UUID flowId, List<SegmentResponse> segments) {
    }

    public record SegmentsDeleted(UUID flowId, String timerange) {
    }
}
