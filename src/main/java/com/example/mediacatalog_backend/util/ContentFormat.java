package com.example.mediacatalog_backend.util;

import com.example.mediacatalog_backend.exception.CatalogException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Essence format of a source or flow. Serialized as its URN.
 */
public enum ContentFormat {
    VIDEO("urn:x-nmos:format:video"),
    IMAGE("urn:x-tam:format:image"),
    AUDIO("urn:x-nmos:format:audio"),
    DATA("urn:x-nmos:format:data"),
    MULTI("urn:x-nmos:format:multi");

    private final String urn;

    ContentFormat(String urn) {
        this.urn = urn;
    }

    /**
     * Accepts the URN or the bare enum name, case-insensitive.
     *
     * @param value incoming value from the request payload or query string.
     * @return matching format, or {@code null} for blank input.
     */
    @JsonCreator
    public static ContentFormat fromJson(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim();
        for (ContentFormat format : values()) {
            if (format.urn.equalsIgnoreCase(normalized) || format.name().equalsIgnoreCase(normalized)) {
                return format;
            }
        }
        throw CatalogException.parseError("UNSUPPORTED_FORMAT");
    }

    @JsonValue
    public String urn() {
        return urn;
    }
}
