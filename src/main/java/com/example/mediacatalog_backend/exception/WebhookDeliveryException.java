package com.example.mediacatalog_backend.exception;

/**
 * A single webhook delivery attempt failed. {@link #isRetryable()} decides whether the attempt counts
 * against the backoff budget or ends the sequence immediately.
 */
public class WebhookDeliveryException extends RuntimeException {
    private final int statusCode;

    public WebhookDeliveryException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return statusCode >= 500 || statusCode == 429 || statusCode == 408;
    }
}
