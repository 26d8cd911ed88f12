package com.example.mediacatalog_backend.dto.web;

public record ErrorResponse(String error, String kind, int status) {
}
