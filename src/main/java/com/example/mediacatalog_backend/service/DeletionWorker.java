package com.example.mediacatalog_backend.service;

import com.example.mediacatalog_backend.config.DeletionWorkerProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Background loop picking up deletion requests. Each claimed request runs on the deletion executor;
 * a request is never run twice at once thanks to its lease.
 */
@Component
public class DeletionWorker {
    private static final Logger LOGGER = LoggerFactory.getLogger(DeletionWorker.class);

    private final DeletionRequestService requests;
    private final DeletionWorkflow workflow;
    private final Executor executor;
    private final DeletionWorkerProperties properties;
    private final String instanceId = "deletion-worker-" + UUID.randomUUID();
    private final Set<UUID> inFlight = ConcurrentHashMap.newKeySet();

    public DeletionWorker(DeletionRequestService requests, DeletionWorkflow workflow,
                          @Qualifier("deletionTaskExecutor") Executor executor, DeletionWorkerProperties properties) {
        this.requests = requests;
        this.workflow = workflow;
        this.executor = executor;
        this.properties = properties;
    }

    /** Single catalog instance: any lease still held at startup belongs to a process that died. */
    @EventListener(ApplicationReadyEvent.class)
    public void resumeInterrupted() {
        int released = requests.releaseAllLeases();
        if (released > 0) {
            LOGGER.info("Released {} stale deletion leases; requests will resume", released);
        }
    }

    @Scheduled(fixedDelayString = "${catalog.deletion.poll-delay-ms:2000}")
    public void poll() {
        int free = Math.max(1, properties.getExecutorThreads()) - inFlight.size();
        if (free <= 0) {
            return;
        }
        List<UUID> ids = requests.findClaimable(Math.min(free, properties.getPollBatchSize()));
        if (ids.isEmpty()) {
            LOGGER.debug("Deletion poll tick - nothing claimable");
            return;
        }
        for (UUID id : ids) {
            if (inFlight.contains(id) || !requests.claim(id, instanceId)) {
                continue;
            }
            inFlight.add(id);
            try {
                executor.execute(() -> runClaimed(id));
            } catch (TaskRejectedException e) {
                inFlight.remove(id);
                LOGGER.warn("Deletion task rejected id={}; lease will expire and it will be retried", id);
            }
        }
    }

    private void runClaimed(UUID id) {
        try {
            workflow.run(id, instanceId);
        } finally {
            inFlight.remove(id);
        }
    }

    @PreDestroy
    public void releaseOnShutdown() {
        int released = requests.releaseLeases(instanceId);
        LOGGER.info("Deletion worker stopping owner={} leasesReleased={}", instanceId, released);
    }
}
