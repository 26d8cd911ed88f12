package com.example.mediacatalog_backend.dto.web;

import java.util.List;

/** {@code nextPage} is passed back as the {@code page} query parameter; null on the last page. */
public record SegmentPageResponse(List<SegmentResponse> segments, int limit, String nextPage) {
}
