package com.example.mediacatalog_backend.controller;

import com.example.mediacatalog_backend.config.AuthProperties;
import com.example.mediacatalog_backend.config.ServiceInfoProperties;
import com.example.mediacatalog_backend.dto.web.ServiceInfoResponse;
import com.example.mediacatalog_backend.dto.web.WebhookRequest;
import com.example.mediacatalog_backend.dto.web.WebhookResponse;
import com.example.mediacatalog_backend.service.WebhookService;
import com.example.mediacatalog_backend.util.EventType;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/service")
public class ServiceController {

    private final ServiceInfoProperties info;
    private final AuthProperties auth;
    private final WebhookService webhookService;

    public ServiceController(ServiceInfoProperties info, AuthProperties auth, WebhookService webhookService) {
        this.info = info;
        this.auth = auth;
        this.webhookService = webhookService;
    }

    @GetMapping
    public ServiceInfoResponse info() {
        Map<String, Boolean> capabilities = new LinkedHashMap<>();
        capabilities.put("segment_replace", true);
        capabilities.put("flow_delete_requests", true);
        capabilities.put("webhooks", true);
        capabilities.put("basic_auth", auth.isRequireAuth());
        List<String> eventTypes = Arrays.stream(EventType.values()).map(EventType::wireName).toList();
        return new ServiceInfoResponse(info.getName(), info.getDescription(), info.getVersion(),
                info.getMediaStoreType(), List.of("webhooks"), eventTypes, capabilities);
    }

    /* ================== WEBHOOKS ================== */

    @GetMapping("/webhooks")
    public List<WebhookResponse> listWebhooks() {
        return webhookService.list().stream().map(WebhookResponse::from).toList();
    }

    @PostMapping("/webhooks")
    @ResponseStatus(HttpStatus.CREATED)
    public WebhookResponse registerWebhook(@Valid @RequestBody WebhookRequest request) {
        return WebhookResponse.from(webhookService.upsert(request));
    }

    @DeleteMapping("/webhooks")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteWebhook(@RequestParam String url) {
        webhookService.delete(url);
    }
}
