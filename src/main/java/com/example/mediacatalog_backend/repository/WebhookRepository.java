package com.example.mediacatalog_backend.repository;

import com.example.mediacatalog_backend.model.Webhook;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface WebhookRepository extends JpaRepository<Webhook, String> {
    List<Webhook> findAllByOrderByCreatedAtAsc();
}
