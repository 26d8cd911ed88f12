package com.example.mediacatalog_backend.events;

import com.example.mediacatalog_backend.model.CatalogEvent;
import com.example.mediacatalog_backend.repository.CatalogEventRepository;
import com.example.mediacatalog_backend.util.EventType;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Map;

/**
 * Appends an event to the outbox inside the caller's transaction. The mutation and its event
 * commit or roll back together; delivery happens later from {@link EventDispatcher}.
 */
@Component
public class EventRecorder {
    private static final Logger LOGGER = LoggerFactory.getLogger(EventRecorder.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final CatalogEventRepository eventRepo;
    private final ObjectMapper objectMapper;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public EventRecorder(CatalogEventRepository eventRepo, ObjectMapper objectMapper, ApplicationEventPublisher publisher, Clock clock) {
        this.eventRepo = eventRepo;
        this.objectMapper = objectMapper;
        this.publisher = publisher;
        this.clock = clock;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public CatalogEvent record(EventType type, Object payload) {
        Map<String, Object> body = objectMapper.convertValue(payload, MAP_TYPE);
        CatalogEvent event = eventRepo.save(new CatalogEvent(type.wireName(), body, clock.instant()));
        LOGGER.debug("EVENT RECORDED id={} type={}", event.getId(), type.wireName());
        publisher.publishEvent(new CatalogEventRecorded(event.getId(), type.wireName()));
        return event;
    }
}
