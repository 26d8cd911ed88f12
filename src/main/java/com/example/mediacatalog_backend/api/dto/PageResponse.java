package com.example.mediacatalog_backend.api.dto;

import org.springframework.data.domain.Page;

import java.util.List;
import java.util.function.Function;

/**
 * Stable pagination DTO to avoid exposing Spring Data internals in JSON.
 */
public record PageResponse<T>(List<T> content, int page, int size, long total) {
    public static <E, T> PageResponse<T> from(Page<E> page, Function<E, T> mapper) {
        return new PageResponse<>(page.getContent().stream().map(mapper).toList(), page.getNumber(), page.getSize(), page.getTotalElements());
    }
}
