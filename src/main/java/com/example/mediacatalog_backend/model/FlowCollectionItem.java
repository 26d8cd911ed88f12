package com.example.mediacatalog_backend.model;

import java.util.UUID;

/**
 * Reference from a multi-essence flow to one of its member flows. No ownership implied.
 */
public record FlowCollectionItem(UUID flowId, String role) {
}
