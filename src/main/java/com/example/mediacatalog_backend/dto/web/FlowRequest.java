package com.example.mediacatalog_backend.dto.web;

import com.example.mediacatalog_backend.model.FlowCollectionItem;
import com.example.mediacatalog_backend.util.ContentFormat;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.Map;
import java.util.UUID;

public record FlowRequest(UUID sourceId,
                          @NotNull ContentFormat format,
                          @Size(max = 255) String label,
                          @Size(max = 2048) String description,
                          Map<String, String> tags,
                          Boolean readOnly,
                          @PositiveOrZero Long maxBitRate,
                          @PositiveOrZero Long avgBitRate,
                          String container,
                          String codec,
                          @PositiveOrZero Integer frameWidth,
                          @PositiveOrZero Integer frameHeight,
                          @PositiveOrZero Integer sampleRate,
                          @PositiveOrZero Integer channels,
                          List<FlowCollectionItem> flowCollection) {
}
