package com.example.mediacatalog_backend.service;

import com.example.mediacatalog_backend.config.ObjectStoreProperties;
import com.example.mediacatalog_backend.model.MediaObject;
import com.example.mediacatalog_backend.repository.MediaObjectRepository;
import com.example.mediacatalog_backend.service.Interfaces.ObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Reclaims media objects nobody has referenced for longer than the retention period.
 * The row stays locked from the reference check to the commit, so a concurrent attach waits and
 * then finds the object gone. Bytes go first, then the row, so a failed store delete is retried
 * on the next sweep.
 */
@Component
public class MediaObjectReaper {
    private static final Logger LOGGER = LoggerFactory.getLogger(MediaObjectReaper.class);

    private final MediaObjectRepository objectRepo;
    private final ObjectStore objectStore;
    private final ObjectStoreProperties properties;
    private final Clock clock;
    private final TransactionTemplate tx;

    public MediaObjectReaper(MediaObjectRepository objectRepo, ObjectStore objectStore, ObjectStoreProperties properties,
                             Clock clock, PlatformTransactionManager transactionManager) {
        this.objectRepo = objectRepo;
        this.objectStore = objectStore;
        this.properties = properties;
        this.clock = clock;
        this.tx = new TransactionTemplate(transactionManager);
    }

    @Scheduled(fixedDelayString = "${catalog.storage.reaper-delay-ms:600000}", initialDelayString = "${catalog.storage.reaper-delay-ms:600000}")
    public void sweep() {
        Instant cutoff = clock.instant().minus(Duration.ofHours(properties.getOrphanRetentionHours()));
        List<String> candidates = objectRepo.findUnreferencedBefore(cutoff, PageRequest.of(0, Math.max(1, properties.getReaperBatchSize())));
        if (candidates.isEmpty()) {
            LOGGER.debug("Reaper tick - no orphaned objects before {}", cutoff);
            return;
        }
        int reclaimed = 0;
        for (String objectId : candidates) {
            try {
                if (reclaim(objectId, cutoff)) {
                    reclaimed++;
                }
            } catch (RuntimeException e) {
                LOGGER.warn("Reclaim failed objectId={}: {}", objectId, e.toString());
            }
        }
        LOGGER.info("REAPER swept candidates={} reclaimed={}", candidates.size(), reclaimed);
    }

    // re-checked under the transaction: a segment may have attached the object since the query
    boolean reclaim(String objectId, Instant cutoff) {
        Boolean done = tx.execute(status -> {
            MediaObject object = objectRepo.findByIdForUpdate(objectId).orElse(null);
            if (object == null || object.getReferenceCount() > 0
                    || object.getUnreferencedSince() == null || !object.getUnreferencedSince().isBefore(cutoff)) {
                return false;
            }
            objectStore.delete(objectId);
            objectRepo.delete(object);
            LOGGER.info("OBJECT RECLAIMED objectId={} unreferencedSince={}", objectId, object.getUnreferencedSince());
            return true;
        });
        return Boolean.TRUE.equals(done);
    }
}
