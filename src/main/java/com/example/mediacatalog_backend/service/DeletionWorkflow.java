package com.example.mediacatalog_backend.service;

import com.example.mediacatalog_backend.config.DeletionWorkerProperties;
import com.example.mediacatalog_backend.exception.CatalogException;
import com.example.mediacatalog_backend.exception.LeaseLostException;
import com.example.mediacatalog_backend.model.DeletionRequest;
import com.example.mediacatalog_backend.model.FlowSegment;
import com.example.mediacatalog_backend.timerange.TimeRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.UUID;

/**
 * Drives one claimed deletion request through bounded batches.
 * <p>
 * Each batch takes the next {@code batch-size} segments of the remaining range, clears the range
 * up to the end of the last of them, and persists the new remaining range, all in one transaction.
 * A crash therefore loses at most the batch in flight, and the next run picks up from the stored
 * remaining range. Cancellation is checked between batches.
 */
@Service
public class DeletionWorkflow {
    private static final Logger LOGGER = LoggerFactory.getLogger(DeletionWorkflow.class);
    static final int MAX_CONFLICT_RETRIES = 5;

    private final DeletionRequestService requests;
    private final SegmentIndexService index;
    private final DeletionWorkerProperties properties;
    private final TransactionTemplate tx;

    public DeletionWorkflow(DeletionRequestService requests, SegmentIndexService index,
                            DeletionWorkerProperties properties, PlatformTransactionManager transactionManager) {
        this.requests = requests;
        this.index = index;
        this.properties = properties;
        this.tx = new TransactionTemplate(transactionManager);
    }

    /**
     * Runs batches until the request completes, fails, is cancelled or the lease is lost.
     * A batch that loses an optimistic-lock race (a cancel, or a segment write on the same
     * objects) was rolled back as a whole and is simply run again.
     */
    public void run(UUID requestId, String owner) {
        long t0 = System.nanoTime();
        LOGGER.info("DELETION START requestId={} owner={}", requestId, owner);
        try {
            int batches = 0;
            int conflicts = 0;
            while (true) {
                boolean more;
                try {
                    more = processNextBatch(requestId, owner);
                } catch (OptimisticLockingFailureException e) {
                    if (++conflicts > MAX_CONFLICT_RETRIES) {
                        throw e;
                    }
                    LOGGER.warn("DELETION BATCH CONFLICT requestId={} attempt={}: {}", requestId, conflicts, e.getMessage());
                    continue;
                }
                if (!more) {
                    break;
                }
                batches++;
                conflicts = 0;
            }
            LOGGER.info("DELETION STOP requestId={} batches={} in={}ms", requestId, batches, (System.nanoTime() - t0) / 1_000_000);
        } catch (LeaseLostException e) {
            LOGGER.warn("DELETION LEASE LOST requestId={} owner={}: {}", requestId, owner, e.getMessage());
        } catch (CatalogException e) {
            failQuietly(requestId, owner, e.getReason());
        } catch (RuntimeException e) {
            LOGGER.error("Deletion {} failed: {}", requestId, e.toString(), e);
            failQuietly(requestId, owner, "storage failure: " + e.getMessage());
        }
    }

    /**
     * Performs one unit of work. Returns false once the request reached a terminal state.
     */
    public boolean processNextBatch(UUID requestId, String owner) {
        DeletionRequest request = requests.requireLease(requestId, owner);
        if (request.isCancelRequested()) {
            requests.markError(requestId, owner, DeletionRequestService.CANCELLED);
            return false;
        }
        TimeRange remaining = request.getRemaining();
        if (remaining == null) {
            requests.markCompleted(requestId, owner);
            return false;
        }
        List<FlowSegment> batch = index.query(request.getFlowId(), remaining, null, Math.max(1, properties.getBatchSize())).segments();
        if (batch.isEmpty()) {
            requests.markCompleted(requestId, owner);
            return false;
        }

        TimeRange lastRange = batch.get(batch.size() - 1).getTimerange();
        TimeRange batchRange = remaining.intersect(TimeRange.upTo(lastRange.end(), lastRange.endInclusive()));
        List<TimeRange> rest = remaining.subtract(batchRange);
        TimeRange nextRemaining = rest.isEmpty() ? null : rest.get(0);

        SegmentIndexService.DeleteResult result = tx.execute(status -> {
            SegmentIndexService.DeleteResult r = index.deleteRange(request.getFlowId(), batchRange);
            requests.recordProgress(requestId, owner, nextRemaining, r.deleted());
            return r;
        });
        LOGGER.info("DELETE BATCH requestId={} flowId={} range={} deleted={} modified={} remaining={}",
                requestId, request.getFlowId(), batchRange,
                result == null ? 0 : result.deleted(), result == null ? 0 : result.modified(), nextRemaining);
        return true;
    }

    private void failQuietly(UUID requestId, String owner, String reason) {
        try {
            requests.markError(requestId, owner, reason);
        } catch (LeaseLostException | OptimisticLockingFailureException e) {
            LOGGER.warn("Could not record failure requestId={} reason={}: {}", requestId, reason, e.getMessage());
        }
    }
}
