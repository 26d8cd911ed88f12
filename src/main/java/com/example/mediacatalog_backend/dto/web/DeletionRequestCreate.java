package com.example.mediacatalog_backend.dto.web;

import jakarta.validation.constraints.NotNull;

import java.util.UUID;

/** A missing timerange means the whole flow. */
public record DeletionRequestCreate(@NotNull UUID flowId, String timerange) {
}
