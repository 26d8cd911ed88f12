package com.example.mediacatalog_backend.dto.web;

import com.example.mediacatalog_backend.model.DeletionRequest;
import com.example.mediacatalog_backend.util.DeletionStatus;

import java.time.Instant;
import java.util.UUID;

public record DeletionRequestResponse(UUID id, UUID flowId, String timerange, String remaining,
                                      DeletionStatus status, String errorReason, boolean cancelRequested,
                                      long deletedCount, int batchesProcessed,
                                      Instant createdAt, Instant updatedAt) {
    public static DeletionRequestResponse from(DeletionRequest d) {
        return new DeletionRequestResponse(d.getId(), d.getFlowId(), d.getTimerange().format(),
                d.getRemaining() == null ? null : d.getRemaining().format(),
                d.getStatus(), d.getErrorReason(), d.isCancelRequested(),
                d.getDeletedCount(), d.getBatchesProcessed(),
                d.getCreatedAt(), d.getUpdatedAt());
    }
}
