package com.example.mediacatalog_backend.exception;

import org.springframework.web.server.ResponseStatusException;

/**
 * Recoverable catalog error. The reason is a stable code such as {@code FLOW_NOT_FOUND}.
 */
public class CatalogException extends ResponseStatusException {
    private final ErrorKind kind;

    public CatalogException(ErrorKind kind, String reason) {
        super(kind.status(), reason);
        this.kind = kind;
    }

    public CatalogException(ErrorKind kind, String reason, Throwable cause) {
        super(kind.status(), reason, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static CatalogException notFound(String reason) {
        return new CatalogException(ErrorKind.NOT_FOUND, reason);
    }

    public static CatalogException parseError(String reason) {
        return new CatalogException(ErrorKind.PARSE_ERROR, reason);
    }

    public static CatalogException overlap(String reason) {
        return new CatalogException(ErrorKind.OVERLAP_CONFLICT, reason);
    }

    public static CatalogException readOnly(String reason) {
        return new CatalogException(ErrorKind.READ_ONLY_FLOW, reason);
    }
}
