package com.example.mediacatalog_backend.events;

/** In-process signal that an outbox row was written; handled after the writing transaction commits. */
public record CatalogEventRecorded(Long eventId, String eventType) {
}
