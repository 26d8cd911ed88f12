package com.example.mediacatalog_backend.exception;

import java.util.UUID;

/**
 * The worker no longer holds the processing lease of a deletion request; another worker owns it
 * or it reached a terminal state.
 */
public class LeaseLostException extends RuntimeException {
    public LeaseLostException(UUID requestId, String owner) {
        super("Lease lost requestId=" + requestId + " owner=" + owner);
    }
}
