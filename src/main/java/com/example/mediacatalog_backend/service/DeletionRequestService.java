package com.example.mediacatalog_backend.service;

import com.example.mediacatalog_backend.config.DeletionWorkerProperties;
import com.example.mediacatalog_backend.config.PaginationProperties;
import com.example.mediacatalog_backend.dto.web.FlowResponse;
import com.example.mediacatalog_backend.events.EventPayloads;
import com.example.mediacatalog_backend.events.EventRecorder;
import com.example.mediacatalog_backend.exception.CatalogException;
import com.example.mediacatalog_backend.exception.LeaseLostException;
import com.example.mediacatalog_backend.model.DeletionRequest;
import com.example.mediacatalog_backend.model.Flow;
import com.example.mediacatalog_backend.repository.DeletionRequestRepository;
import com.example.mediacatalog_backend.repository.FlowRepository;
import com.example.mediacatalog_backend.timerange.TimeRange;
import com.example.mediacatalog_backend.util.DeletionStatus;
import com.example.mediacatalog_backend.util.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Lifecycle of deletion requests: {@code PENDING -> PROCESSING -> COMPLETED | ERROR}.
 * Terminal states are never left again.
 */
@Service
public class DeletionRequestService {
    private static final Logger LOGGER = LoggerFactory.getLogger(DeletionRequestService.class);
    public static final String CANCELLED = "cancelled";

    private final DeletionRequestRepository requestRepo;
    private final FlowRepository flowRepo;
    private final EventRecorder events;
    private final DeletionWorkerProperties properties;
    private final PaginationProperties pagination;
    private final Clock clock;

    public DeletionRequestService(DeletionRequestRepository requestRepo, FlowRepository flowRepo, EventRecorder events,
                                  DeletionWorkerProperties properties, PaginationProperties pagination, Clock clock) {
        this.requestRepo = requestRepo;
        this.flowRepo = flowRepo;
        this.events = events;
        this.properties = properties;
        this.pagination = pagination;
        this.clock = clock;
    }

    /** Records a request to clear {@code range} (the whole timeline when null) from a flow. */
    @Transactional
    public DeletionRequest create(UUID flowId, TimeRange range) {
        Flow flow = flowRepo.findById(flowId).orElseThrow(() -> CatalogException.notFound("FLOW_NOT_FOUND"));
        if (flow.isReadOnly()) {
            throw CatalogException.readOnly("FLOW_READ_ONLY");
        }
        DeletionRequest request = requestRepo.saveAndFlush(new DeletionRequest(flowId, range == null ? TimeRange.ETERNITY : range));
        LOGGER.info("DELETION REQUESTED id={} flowId={} timerange={}", request.getId(), flowId, request.getTimerange());
        return request;
    }

    @Transactional(readOnly = true)
    public DeletionRequest get(UUID id) {
        return requestRepo.findById(id).orElseThrow(() -> CatalogException.notFound("DELETION_REQUEST_NOT_FOUND"));
    }

    @Transactional(readOnly = true)
    public Page<DeletionRequest> list(UUID flowId, DeletionStatus status, int page, Integer limit) {
        if (page < 0 || (limit != null && limit < 1)) {
            throw CatalogException.parseError("BAD_PAGINATION");
        }
        return requestRepo.search(flowId, status, PageRequest.of(page, pagination.clamp(limit)));
    }

    /**
     * A pending request is cancelled immediately; a processing one stops at its next batch boundary.
     * Cancelling a finished request has no effect. Both transitions are conditional updates on the
     * row, never a read-modify-write of the versioned entity.
     */
    @Transactional
    public DeletionRequest cancel(UUID id) {
        if (!requestRepo.existsById(id)) {
            throw CatalogException.notFound("DELETION_REQUEST_NOT_FOUND");
        }
        Instant now = clock.instant();
        if (requestRepo.cancelPending(id, CANCELLED, now) == 1) {
            LOGGER.info("DELETION CANCEL id={} status={}", id, DeletionStatus.ERROR);
        } else if (requestRepo.flagCancel(id, now) == 1) {
            LOGGER.info("DELETION CANCEL id={} status={}", id, DeletionStatus.PROCESSING);
        }
        return get(id);
    }

    @Transactional(readOnly = true)
    public List<UUID> findClaimable(int limit) {
        return requestRepo.findClaimable(clock.instant(), PageRequest.of(0, Math.max(1, limit)));
    }

    /** Takes the processing lease; false when another worker holds it or the request is finished. */
    @Transactional
    public boolean claim(UUID id, String owner) {
        Instant now = clock.instant();
        boolean claimed = requestRepo.tryAcquireLease(id, owner, now, now.plus(leaseDuration())) == 1;
        if (claimed) {
            LOGGER.info("DELETION CLAIMED id={} owner={}", id, owner);
        }
        return claimed;
    }

    /**
     * Persists the remaining range after a batch, in the batch's transaction, and renews the lease.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void recordProgress(UUID id, String owner, TimeRange remaining, long removed) {
        DeletionRequest request = requireLease(id, owner);
        request.setRemaining(remaining);
        request.setDeletedCount(request.getDeletedCount() + removed);
        request.setBatchesProcessed(request.getBatchesProcessed() + 1);
        request.setLeaseExpiresAt(clock.instant().plus(leaseDuration()));
        requestRepo.save(request);
    }

    @Transactional(readOnly = true)
    public DeletionRequest requireLease(UUID id, String owner) {
        DeletionRequest request = get(id);
        if (request.getStatus() != DeletionStatus.PROCESSING || !owner.equals(request.getLeaseOwner())) {
            throw new LeaseLostException(id, owner);
        }
        return request;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markCompleted(UUID id, String owner) {
        DeletionRequest request = requireLease(id, owner);
        request.setStatus(DeletionStatus.COMPLETED);
        request.setRemaining(null);
        clearLease(request);
        requestRepo.save(request);
        flowRepo.findById(request.getFlowId()).ifPresent(flow ->
                events.record(EventType.FLOW_UPDATED, new EventPayloads.FlowChanged(FlowResponse.from(flow))));
        LOGGER.info("DELETION COMPLETED id={} flowId={} deleted={} batches={}",
                id, request.getFlowId(), request.getDeletedCount(), request.getBatchesProcessed());
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markError(UUID id, String owner, String reason) {
        DeletionRequest request = requireLease(id, owner);
        request.setStatus(DeletionStatus.ERROR);
        request.setErrorReason(reason);
        clearLease(request);
        requestRepo.save(request);
        LOGGER.info("DELETION ERROR id={} reason={}", id, reason);
    }

    @Transactional
    public int releaseLeases(String owner) {
        return requestRepo.releaseLeases(owner);
    }

    @Transactional
    public int releaseAllLeases() {
        return requestRepo.releaseAllLeases();
    }

    private Duration leaseDuration() {
        return Duration.ofSeconds(properties.getLeaseSeconds());
    }

    private static void clearLease(DeletionRequest request) {
        request.setLeaseOwner(null);
        request.setLeaseExpiresAt(null);
    }
}
