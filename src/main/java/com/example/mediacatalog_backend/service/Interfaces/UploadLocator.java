package com.example.mediacatalog_backend.service.Interfaces;

import java.time.Instant;

public record UploadLocator(String objectId, String putUrl, Instant expiresAt) {
}
