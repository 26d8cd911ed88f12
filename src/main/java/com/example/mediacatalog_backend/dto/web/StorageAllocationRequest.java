package com.example.mediacatalog_backend.dto.web;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;

import java.util.List;

/** Either explicit object ids, or a count of ids to generate. */
public record StorageAllocationRequest(@Positive @Max(1000) Integer limit, List<String> objectIds) {
}
