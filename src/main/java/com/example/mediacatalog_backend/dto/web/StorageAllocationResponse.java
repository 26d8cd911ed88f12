package com.example.mediacatalog_backend.dto.web;

import com.example.mediacatalog_backend.service.Interfaces.UploadLocator;

import java.time.Instant;
import java.util.List;

public record StorageAllocationResponse(List<Item> mediaObjects) {
    public record Item(String objectId, String putUrl, Instant expiresAt) {
        public static Item from(UploadLocator l) {
            return new Item(l.objectId(), l.putUrl(), l.expiresAt());
        }
    }

    public static StorageAllocationResponse from(List<UploadLocator> locators) {
        return new StorageAllocationResponse(locators.stream().map(Item::from).toList());
    }
}
