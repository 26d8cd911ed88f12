package com.example.mediacatalog_backend.dto.web;

import com.example.mediacatalog_backend.model.MediaObject;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record MediaObjectResponse(String objectId, Long sizeBytes, String mimeType,
                                  List<UUID> referencedBy, Instant createdAt) {
    public static MediaObjectResponse from(MediaObject o) {
        return new MediaObjectResponse(o.getObjectId(), o.getSizeBytes(), o.getMimeType(),
                o.getFlowReferences().stream().sorted().toList(), o.getCreatedAt());
    }
}
