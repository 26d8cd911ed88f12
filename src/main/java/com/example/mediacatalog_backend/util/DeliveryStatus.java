package com.example.mediacatalog_backend.util;

public enum DeliveryStatus {
    PENDING,
    DELIVERED,
    FAILED
}
