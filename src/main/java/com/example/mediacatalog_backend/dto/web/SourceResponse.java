package com.example.mediacatalog_backend.dto.web;

import com.example.mediacatalog_backend.model.Source;
import com.example.mediacatalog_backend.util.ContentFormat;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

public record SourceResponse(UUID id, ContentFormat format, String label, String description,
                             Map<String, String> tags, Instant createdAt, Instant updatedAt) {
    public static SourceResponse from(Source s) {
        return new SourceResponse(s.getId(), s.getFormat(), s.getLabel(), s.getDescription(),
                new HashMap<>(s.getTags()), s.getCreatedAt(), s.getUpdatedAt());
    }
}
