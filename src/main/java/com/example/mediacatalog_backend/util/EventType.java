package com.example.mediacatalog_backend.util;

import java.util.Arrays;
import java.util.Optional;

/**
 * Catalog event types as they appear on the wire and in webhook subscriptions.
 */
public enum EventType {
    SOURCE_CREATED("source.created"),
    SOURCE_UPDATED("source.updated"),
    SOURCE_DELETED("source.deleted"),
    FLOW_CREATED("flow.created"),
    FLOW_UPDATED("flow.updated"),
    FLOW_DELETED("flow.deleted"),
    SEGMENTS_ADDED("segments.added"),
    SEGMENTS_DELETED("segments.deleted");

    public static final String WILDCARD = "*";

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<EventType> fromWireName(String name) {
        return Arrays.stream(values()).filter(t -> t.wireName.equals(name)).findFirst();
    }
}
