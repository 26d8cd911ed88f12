package com.example.mediacatalog_backend.service;

import com.example.mediacatalog_backend.dto.web.WebhookRequest;
import com.example.mediacatalog_backend.exception.CatalogException;
import com.example.mediacatalog_backend.exception.ErrorKind;
import com.example.mediacatalog_backend.model.Webhook;
import com.example.mediacatalog_backend.repository.WebhookRepository;
import com.example.mediacatalog_backend.util.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Webhook registrations, keyed by url. Registering an existing url replaces its configuration.
 */
@Service
public class WebhookService {
    private static final Logger LOGGER = LoggerFactory.getLogger(WebhookService.class);

    private final WebhookRepository webhookRepo;

    public WebhookService(WebhookRepository webhookRepo) {
        this.webhookRepo = webhookRepo;
    }

    @Transactional
    public Webhook upsert(WebhookRequest req) {
        String url = validateUrl(req.url());
        List<String> events = validateEvents(req.events());
        boolean hasKeyName = req.apiKeyName() != null && !req.apiKeyName().isBlank();
        if (hasKeyName != (req.apiKeyValue() != null)) {
            throw CatalogException.parseError("BAD_API_KEY");
        }

        Webhook webhook = webhookRepo.findById(url).orElseGet(() -> new Webhook(url));
        webhook.setApiKeyName(hasKeyName ? req.apiKeyName().trim() : null);
        webhook.setApiKeyValue(hasKeyName ? req.apiKeyValue() : null);
        webhook.setEvents(events);
        webhook = webhookRepo.save(webhook);
        LOGGER.info("WEBHOOK REGISTERED url={} events={} apiKey={}", url, events, webhook.hasApiKey());
        return webhook;
    }

    @Transactional(readOnly = true)
    public List<Webhook> list() {
        return webhookRepo.findAllByOrderByCreatedAtAsc();
    }

    /** Pending deliveries to a removed webhook are failed by the dispatcher. */
    @Transactional
    public void delete(String url) {
        if (url == null || !webhookRepo.existsById(url.trim())) {
            throw CatalogException.notFound("WEBHOOK_NOT_FOUND");
        }
        webhookRepo.deleteById(url.trim());
        LOGGER.info("WEBHOOK REMOVED url={}", url);
    }

    static String validateUrl(String raw) {
        if (raw == null || raw.isBlank()) {
            throw CatalogException.parseError("WEBHOOK_URL_MISSING");
        }
        String url = raw.trim();
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            if (scheme == null || uri.getHost() == null
                    || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                throw CatalogException.parseError("BAD_WEBHOOK_URL");
            }
        } catch (URISyntaxException e) {
            throw new CatalogException(ErrorKind.PARSE_ERROR, "BAD_WEBHOOK_URL", e);
        }
        return url;
    }

    static List<String> validateEvents(List<String> requested) {
        if (requested == null || requested.isEmpty()) {
            throw CatalogException.parseError("WEBHOOK_EVENTS_MISSING");
        }
        Set<String> events = new LinkedHashSet<>();
        for (String e : requested) {
            String name = e == null ? "" : e.trim();
            if (!EventType.WILDCARD.equals(name) && EventType.fromWireName(name).isEmpty()) {
                throw CatalogException.parseError("UNKNOWN_EVENT_TYPE");
            }
            events.add(name);
        }
        return new ArrayList<>(events);
    }
}
