package com.example.mediacatalog_backend.events;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/** Body POSTed to a subscriber. */
public record EventEnvelope(@JsonProperty("event_timestamp") String eventTimestamp,
                            @JsonProperty("event_type") String eventType,
                            @JsonProperty("event") Map<String, Object> event) {
}
