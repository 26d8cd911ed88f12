package com.example.mediacatalog_backend.util;

public enum DeletionStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    ERROR;

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR;
    }
}
