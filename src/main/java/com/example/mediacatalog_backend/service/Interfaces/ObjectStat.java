package com.example.mediacatalog_backend.service.Interfaces;

public record ObjectStat(long sizeBytes, String mimeType, String contentHash) {
}
