package com.example.mediacatalog_backend.dto.web;

import com.example.mediacatalog_backend.util.ContentFormat;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.Map;

public record SourceRequest(@NotNull ContentFormat format,
                            @Size(max = 255) String label,
                            @Size(max = 2048) String description,
                            Map<String, String> tags) {
}
