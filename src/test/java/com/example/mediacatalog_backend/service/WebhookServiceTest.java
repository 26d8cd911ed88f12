package com.example.mediacatalog_backend.service;

import com.example.mediacatalog_backend.dto.web.WebhookRequest;
import com.example.mediacatalog_backend.exception.CatalogException;
import com.example.mediacatalog_backend.exception.ErrorKind;
import com.example.mediacatalog_backend.model.Webhook;
import com.example.mediacatalog_backend.repository.WebhookRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WebhookServiceTest {

    @Mock
    private WebhookRepository webhookRepository;

    private WebhookService service;

    @BeforeEach
    void setUp() {
        service = new WebhookService(webhookRepository);
    }

    private static CatalogException reject(Runnable call) {
        try {
            call.run();
        } catch (CatalogException e) {
            return e;
        }
        throw new AssertionError("expected CatalogException");
    }

    @Test
    void registersNewWebhookWithDeduplicatedEvents() {
        when(webhookRepository.findById("https://hooks.test/x")).thenReturn(Optional.empty());
        when(webhookRepository.save(any(Webhook.class))).thenAnswer(inv -> inv.getArgument(0));

        Webhook saved = service.upsert(new WebhookRequest(" https://hooks.test/x ", "X-Key", "v",
                List.of("flow.created", "segments.added", "flow.created")));

        assertThat(saved.getUrl()).isEqualTo("https://hooks.test/x");
        assertThat(saved.getEvents()).containsExactly("flow.created", "segments.added");
        assertThat(saved.hasApiKey()).isTrue();
    }

    @Test
    void reRegisteringReplacesConfiguration() {
        Webhook existing = new Webhook("http://hooks.test/y");
        existing.setEvents(List.of("flow.created"));
        existing.setApiKeyName("X-Key");
        existing.setApiKeyValue("old");
        when(webhookRepository.findById("http://hooks.test/y")).thenReturn(Optional.of(existing));
        when(webhookRepository.save(any(Webhook.class))).thenAnswer(inv -> inv.getArgument(0));

        Webhook saved = service.upsert(new WebhookRequest("http://hooks.test/y", null, null, List.of("*")));

        assertThat(saved).isSameAs(existing);
        assertThat(saved.getEvents()).containsExactly("*");
        assertThat(saved.hasApiKey()).isFalse();
    }

    @Test
    void rejectsInvalidRegistrations() {
        assertThat(reject(() -> service.upsert(new WebhookRequest("ftp://hooks.test", null, null, List.of("*"))))
                .getReason()).isEqualTo("BAD_WEBHOOK_URL");
        assertThat(reject(() -> service.upsert(new WebhookRequest("not a url", null, null, List.of("*"))))
                .getReason()).isEqualTo("BAD_WEBHOOK_URL");
        assertThat(reject(() -> service.upsert(new WebhookRequest("http://hooks.test", null, null, List.of("flow.exploded"))))
                .getReason()).isEqualTo("UNKNOWN_EVENT_TYPE");
        assertThat(reject(() -> service.upsert(new WebhookRequest("http://hooks.test", null, null, List.of())))
                .getReason()).isEqualTo("WEBHOOK_EVENTS_MISSING");
        assertThat(reject(() -> service.upsert(new WebhookRequest("http://hooks.test", "X-Key", null, List.of("*"))))
                .getReason()).isEqualTo("BAD_API_KEY");
        verify(webhookRepository, never()).save(any());
    }

    @Test
    void deletingUnknownUrlIsNotFound() {
        when(webhookRepository.existsById("http://hooks.test/gone")).thenReturn(false);

        assertThatThrownBy(() -> service.delete("http://hooks.test/gone"))
                .isInstanceOf(CatalogException.class)
                .satisfies(e -> assertThat(((CatalogException) e).getKind()).isEqualTo(ErrorKind.NOT_FOUND));
    }
}
