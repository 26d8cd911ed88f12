package com.example.mediacatalog_backend.dto.web;

import jakarta.validation.constraints.NotNull;

public record ReadOnlyRequest(@NotNull Boolean readOnly) {
}
