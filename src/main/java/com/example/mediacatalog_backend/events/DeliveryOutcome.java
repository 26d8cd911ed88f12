package com.example.mediacatalog_backend.events;

public record DeliveryOutcome(boolean delivered, int attempts, String error) {
    public static DeliveryOutcome delivered(int attempts) {
        return new DeliveryOutcome(true, attempts, null);
    }

    public static DeliveryOutcome failed(int attempts, String error) {
        return new DeliveryOutcome(false, attempts, error);
    }
}
