package com.example.mediacatalog_backend.dto.web;

import java.util.UUID;

public record SegmentDeleteResponse(UUID flowId, String timerange, int deleted, int modified) {
}
