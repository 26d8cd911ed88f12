package com.example.mediacatalog_backend.events;

import com.example.mediacatalog_backend.config.WebhookProperties;
import com.example.mediacatalog_backend.model.CatalogEvent;
import com.example.mediacatalog_backend.model.Webhook;
import com.example.mediacatalog_backend.model.WebhookDelivery;
import com.example.mediacatalog_backend.repository.CatalogEventRepository;
import com.example.mediacatalog_backend.repository.WebhookDeliveryRepository;
import com.example.mediacatalog_backend.repository.WebhookRepository;
import com.example.mediacatalog_backend.util.DeliveryStatus;
import com.example.mediacatalog_backend.util.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drains the event outbox to webhook subscribers.
 * <p>
 * Dispatch runs in two steps. Fan-out turns each new event into one {@link WebhookDelivery} row per
 * matching webhook. Delivery then runs one lane per webhook url: a lane sends that url's pending
 * rows strictly in event order, one at a time, so a slow or failing subscriber delays only itself.
 * Lanes for different urls run concurrently on the lane executor.
 * <p>
 * Triggered after every committing mutation and, as a backstop for anything missed (crash,
 * rejected task), by a fixed-delay poll.
 * <p>
 * Event ids are handed out at insert time, not at commit, so a transaction can commit a lower id
 * after a higher one is already visible. Fan-out therefore stops at the first gap in the id
 * sequence and waits for the missing id to commit. A gap older than {@code gap-grace-ms} is taken
 * to be a rollback and skipped; an event committing later than that is still delivered, but after
 * its successors.
 */
@Component
public class EventDispatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(EventDispatcher.class);

    private final CatalogEventRepository eventRepo;
    private final WebhookRepository webhookRepo;
    private final WebhookDeliveryRepository deliveryRepo;
    private final WebhookDeliveryClient client;
    private final WebhookProperties properties;
    private final Executor laneExecutor;
    private final TransactionTemplate tx;
    private final Clock clock;

    private final ConcurrentHashMap<String, AtomicBoolean> lanes = new ConcurrentHashMap<>();
    private final AtomicBoolean fanOutRunning = new AtomicBoolean(false);
    private final AtomicBoolean fanOutRequested = new AtomicBoolean(false);

    public EventDispatcher(CatalogEventRepository eventRepo,
                           WebhookRepository webhookRepo,
                           WebhookDeliveryRepository deliveryRepo,
                           WebhookDeliveryClient client,
                           WebhookProperties properties,
                           @Qualifier("webhookLaneExecutor") Executor laneExecutor,
                           PlatformTransactionManager transactionManager,
                           Clock clock) {
        this.eventRepo = eventRepo;
        this.webhookRepo = webhookRepo;
        this.deliveryRepo = deliveryRepo;
        this.client = client;
        this.properties = properties;
        this.laneExecutor = laneExecutor;
        this.tx = new TransactionTemplate(transactionManager);
        this.tx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onEventRecorded(CatalogEventRecorded recorded) {
        LOGGER.debug("Dispatch signalled eventId={} type={}", recorded.eventId(), recorded.eventType());
        try {
            laneExecutor.execute(this::dispatch);
        } catch (TaskRejectedException e) {
            LOGGER.warn("Dispatch task rejected eventId={}; poll will pick it up", recorded.eventId());
        }
    }

    @Scheduled(fixedDelayString = "${catalog.webhooks.poll-delay-ms:5000}")
    public void poll() {
        dispatch();
    }

    public void dispatch() {
        try {
            fanOut();
            startLanes();
        } catch (RuntimeException e) {
            LOGGER.error("Dispatch failed: {}", e.toString(), e);
        }
    }

    /**
     * Creates delivery rows for every event not yet fanned out. Single-flight: a call made while
     * another thread is fanning out only leaves a request, which that thread picks up, including
     * one that lands just before it steps down.
     */
    void fanOut() {
        fanOutRequested.set(true);
        while (fanOutRequested.get() && fanOutRunning.compareAndSet(false, true)) {
            try {
                while (fanOutRequested.getAndSet(false)) {
                    int batch;
                    do {
                        Integer n = tx.execute(status -> fanOutBatch());
                        batch = n == null ? 0 : n;
                    } while (batch >= properties.getDispatchBatchSize());
                }
            } finally {
                fanOutRunning.set(false);
            }
        }
    }

    private int fanOutBatch() {
        List<CatalogEvent> events = eventRepo.findNotFannedOut(PageRequest.of(0, properties.getDispatchBatchSize()));
        if (events.isEmpty()) {
            return 0;
        }
        List<Webhook> webhooks = webhookRepo.findAll();
        Instant now = clock.instant();
        Instant settled = now.minusMillis(properties.getGapGraceMs());
        Long last = eventRepo.findMaxFannedOutId();
        int processed = 0;
        for (CatalogEvent event : events) {
            if (last != null && event.getId() > last + 1 && event.getCreatedAt().isAfter(settled)) {
                LOGGER.debug("FANOUT HOLD eventId={} lastFannedOut={}", event.getId(), last);
                break;
            }
            Optional<EventType> type = EventType.fromWireName(event.getEventType());
            int targets = 0;
            for (Webhook webhook : webhooks) {
                if (type.isPresent() && webhook.subscribes(type.get())) {
                    deliveryRepo.save(new WebhookDelivery(event.getId(), webhook.getUrl(), now));
                    targets++;
                }
            }
            event.markFannedOut(now);
            eventRepo.save(event);
            last = last == null ? event.getId() : Math.max(last, event.getId());
            processed++;
            LOGGER.debug("FANOUT eventId={} type={} targets={}", event.getId(), event.getEventType(), targets);
        }
        return processed;
    }

    void startLanes() {
        for (String url : deliveryRepo.findUrlsWithPending()) {
            startLane(url);
        }
    }

    private void startLane(String url) {
        AtomicBoolean running = lanes.computeIfAbsent(url, u -> new AtomicBoolean(false));
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            laneExecutor.execute(() -> drainLane(url, running));
        } catch (TaskRejectedException e) {
            running.set(false);
            LOGGER.warn("Lane task rejected url={}; poll will retry", url);
        }
    }

    private void drainLane(String url, AtomicBoolean running) {
        try {
            Optional<WebhookDelivery> head;
            while ((head = deliveryRepo.findFirstByWebhookUrlAndStatusOrderByEventIdAsc(url, DeliveryStatus.PENDING)).isPresent()) {
                deliverOne(head.get());
            }
        } catch (RuntimeException e) {
            LOGGER.error("Lane failed url={}: {}", url, e.toString(), e);
            running.set(false);
            return;
        }
        running.set(false);
        // a row may have arrived between the last empty read and the flag reset
        if (deliveryRepo.findFirstByWebhookUrlAndStatusOrderByEventIdAsc(url, DeliveryStatus.PENDING).isPresent()) {
            startLane(url);
        }
    }

    private void deliverOne(WebhookDelivery delivery) {
        String url = delivery.getWebhookUrl();
        Optional<Webhook> webhook = webhookRepo.findById(url);
        if (webhook.isEmpty()) {
            Integer failed = tx.execute(status -> deliveryRepo.failPending(url, "webhook removed", clock.instant()));
            LOGGER.info("Webhook removed, dropped pending deliveries url={} count={}", url, failed);
            return;
        }
        Optional<CatalogEvent> event = eventRepo.findById(delivery.getEventId());
        DeliveryOutcome outcome = event
                .map(e -> client.deliver(webhook.get(), e))
                .orElseGet(() -> DeliveryOutcome.failed(0, "event missing"));

        tx.executeWithoutResult(status -> {
            WebhookDelivery row = deliveryRepo.findById(delivery.getId()).orElseThrow();
            row.complete(outcome.delivered() ? DeliveryStatus.DELIVERED : DeliveryStatus.FAILED,
                    outcome.attempts(), outcome.error(), clock.instant());
            deliveryRepo.save(row);
        });
        if (!outcome.delivered()) {
            LOGGER.warn("DELIVERY FAILED url={} eventId={} attempts={} error={}",
                    url, delivery.getEventId(), outcome.attempts(), outcome.error());
        }
    }
}
