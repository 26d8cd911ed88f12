package com.example.mediacatalog_backend.repository;

import com.example.mediacatalog_backend.model.WebhookDelivery;
import com.example.mediacatalog_backend.util.DeliveryStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface WebhookDeliveryRepository extends JpaRepository<WebhookDelivery, Long> {
    /** Head of the per-url lane: the oldest event still waiting for this subscriber. */
    Optional<WebhookDelivery> findFirstByWebhookUrlAndStatusOrderByEventIdAsc(String webhookUrl, DeliveryStatus status);

    @Query("select distinct d.webhookUrl from WebhookDelivery d where d.status = com.example.mediacatalog_backend.util.DeliveryStatus.PENDING")
    List<String> findUrlsWithPending();

    List<WebhookDelivery> findByWebhookUrlOrderByEventIdAsc(String webhookUrl);

    List<WebhookDelivery> findByEventIdOrderByWebhookUrlAsc(Long eventId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update WebhookDelivery d
          set d.status = com.example.mediacatalog_backend.util.DeliveryStatus.FAILED,
              d.lastError = :reason,
              d.completedAt = :now
        where d.webhookUrl = :url
          and d.status = com.example.mediacatalog_backend.util.DeliveryStatus.PENDING
    """)
    int failPending(@Param("url") String url, @Param("reason") String reason, @Param("now") Instant now);
}
