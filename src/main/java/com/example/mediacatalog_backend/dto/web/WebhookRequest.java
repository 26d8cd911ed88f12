package com.example.mediacatalog_backend.dto.web;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record WebhookRequest(@NotBlank String url,
                             String apiKeyName,
                             String apiKeyValue,
                             @NotEmpty List<String> events) {
}
