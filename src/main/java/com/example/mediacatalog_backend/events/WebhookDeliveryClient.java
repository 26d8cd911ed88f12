package com.example.mediacatalog_backend.events;

import com.example.mediacatalog_backend.config.WebhookProperties;
import com.example.mediacatalog_backend.exception.WebhookDeliveryException;
import com.example.mediacatalog_backend.model.CatalogEvent;
import com.example.mediacatalog_backend.model.Webhook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sends one event to one subscriber, retrying transient failures with exponential backoff.
 * Each attempt is bounded by {@code attempt-timeout-seconds}; a timeout counts as a failed attempt.
 */
@Component
public class WebhookDeliveryClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(WebhookDeliveryClient.class);
    private static final int MAX_ERROR_BODY = 256;

    private final WebClient webClient;
    private final WebhookProperties properties;

    public WebhookDeliveryClient(@Qualifier("webhookWebClient") WebClient webClient, WebhookProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    public DeliveryOutcome deliver(Webhook webhook, CatalogEvent event) {
        EventEnvelope body = new EventEnvelope(event.getCreatedAt().toString(), event.getEventType(), event.getPayload());
        AtomicInteger attempts = new AtomicInteger();
        int maxAttempts = Math.max(1, properties.getMaxAttempts());

        try {
            webClient.post()
                    .uri(URI.create(webhook.getUrl()))
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(h -> {
                        h.set(HttpHeaders.USER_AGENT, properties.getUserAgent());
                        if (webhook.hasApiKey()) {
                            h.set(webhook.getApiKeyName(), webhook.getApiKeyValue());
                        }
                    })
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp ->
                            resp.bodyToMono(String.class).defaultIfEmpty("")
                                    .map(text -> new WebhookDeliveryException(
                                            "HTTP %d: %s".formatted(resp.statusCode().value(), abbreviate(text)),
                                            resp.statusCode().value())))
                    .toBodilessEntity()
                    .timeout(Duration.ofSeconds(properties.getAttemptTimeoutSeconds()))
                    .doFirst(attempts::incrementAndGet)
                    .retryWhen(Retry.backoff(maxAttempts - 1L, Duration.ofMillis(properties.getInitialBackoffMs()))
                            .maxBackoff(Duration.ofMillis(properties.getMaxBackoffMs()))
                            .filter(this::isRetryable)
                            .doBeforeRetry(signal -> LOGGER.warn(
                                    "WEBHOOK RETRY url={} eventId={} attempt={} error={}",
                                    webhook.getUrl(), event.getId(), signal.totalRetries() + 1, describe(signal.failure()))))
                    .block();
            LOGGER.debug("WEBHOOK DELIVERED url={} eventId={} attempts={}", webhook.getUrl(), event.getId(), attempts.get());
            return DeliveryOutcome.delivered(attempts.get());
        } catch (RuntimeException e) {
            Throwable failure = Exceptions.isRetryExhausted(e) && e.getCause() != null ? e.getCause() : Exceptions.unwrap(e);
            String reason = describe(failure);
            LOGGER.warn("WEBHOOK EXHAUSTED url={} eventId={} type={} attempts={} error={}",
                    webhook.getUrl(), event.getId(), event.getEventType(), attempts.get(), reason);
            return DeliveryOutcome.failed(attempts.get(), reason);
        }
    }

    boolean isRetryable(Throwable throwable) {
        if (throwable instanceof WebhookDeliveryException wde) return wde.isRetryable();
        if (throwable instanceof TimeoutException) return true;
        if (throwable instanceof WebClientRequestException) return true;
        return throwable instanceof IOException;
    }

    private static String describe(Throwable t) {
        if (t == null) return "unknown";
        if (t instanceof TimeoutException) return "attempt timed out";
        return t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
    }

    private static String abbreviate(String text) {
        return text.length() <= MAX_ERROR_BODY ? text : text.substring(0, MAX_ERROR_BODY) + "...";
    }
}
