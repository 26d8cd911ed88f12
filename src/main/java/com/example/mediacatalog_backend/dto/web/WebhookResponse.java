package com.example.mediacatalog_backend.dto.web;

import com.example.mediacatalog_backend.model.Webhook;

import java.util.List;

/** The API key value is write-only and never echoed. */
public record WebhookResponse(String url, String apiKeyName, List<String> events) {
    public static WebhookResponse from(Webhook w) {
        return new WebhookResponse(w.getUrl(), w.getApiKeyName(), List.copyOf(w.getEvents()));
    }
}
