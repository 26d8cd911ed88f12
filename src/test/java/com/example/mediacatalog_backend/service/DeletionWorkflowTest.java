package com.example.mediacatalog_backend.service;

import com.example.mediacatalog_backend.config.DeletionWorkerProperties;
import com.example.mediacatalog_backend.config.PaginationProperties;
import com.example.mediacatalog_backend.config.TimeConfig;
import com.example.mediacatalog_backend.dto.FlowSegmentDTO;
import com.example.mediacatalog_backend.events.EventRecorder;
import com.example.mediacatalog_backend.exception.CatalogException;
import com.example.mediacatalog_backend.exception.ErrorKind;
import com.example.mediacatalog_backend.model.CatalogEvent;
import com.example.mediacatalog_backend.model.DeletionRequest;
import com.example.mediacatalog_backend.model.Flow;
import com.example.mediacatalog_backend.repository.CatalogEventRepository;
import com.example.mediacatalog_backend.repository.DeletionRequestRepository;
import com.example.mediacatalog_backend.repository.FlowRepository;
import com.example.mediacatalog_backend.repository.FlowSegmentRepository;
import com.example.mediacatalog_backend.repository.MediaObjectRepository;
import com.example.mediacatalog_backend.service.Interfaces.ObjectStat;
import com.example.mediacatalog_backend.service.Interfaces.ObjectStore;
import com.example.mediacatalog_backend.timerange.TimeRange;
import com.example.mediacatalog_backend.util.ContentFormat;
import com.example.mediacatalog_backend.util.DeletionStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.ImportAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

/**
 * Runs deletion requests against a real database, committing each step, so batch boundaries,
 * leases and resumption behave as they do in production.
 */
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({DeletionWorkflow.class, DeletionRequestService.class, SegmentIndexService.class, MediaObjectService.class,
        EventRecorder.class, TimeConfig.class, DeletionWorkflowTest.Config.class})
@ImportAutoConfiguration(JacksonAutoConfiguration.class)
class DeletionWorkflowTest {

    @TestConfiguration
    static class Config {
        @Bean
        DeletionWorkerProperties deletionWorkerProperties() {
            DeletionWorkerProperties properties = new DeletionWorkerProperties();
            properties.setBatchSize(2);
            return properties;
        }

        @Bean
        PaginationProperties paginationProperties() {
            return new PaginationProperties();
        }
    }

    @Autowired private DeletionWorkflow workflow;
    @Autowired private DeletionRequestService requests;
    @Autowired private SegmentIndexService index;
    @Autowired private FlowRepository flowRepository;
    @Autowired private FlowSegmentRepository segmentRepository;
    @Autowired private MediaObjectRepository objectRepository;
    @Autowired private DeletionRequestRepository requestRepository;
    @Autowired private CatalogEventRepository eventRepository;
    @Autowired private PlatformTransactionManager transactionManager;

    @MockitoBean
    private ObjectStore objectStore;

    private UUID flowId;

    @BeforeEach
    void setUp() {
        when(objectStore.exists(anyString())).thenReturn(true);
        when(objectStore.stat(anyString())).thenReturn(new ObjectStat(10, "video/mp2t", "sha256:x"));
        flowId = newFlowWithSegments(7);
    }

    @AfterEach
    void cleanUp() {
        segmentRepository.deleteAll();
        objectRepository.deleteAll();
        requestRepository.deleteAll();
        eventRepository.deleteAll();
        flowRepository.deleteAll();
    }

    private UUID newFlowWithSegments(int count) {
        UUID id = flowRepository.saveAndFlush(new Flow(ContentFormat.VIDEO)).getId();
        for (int i = 0; i < count; i++) {
            index.insert(id, new FlowSegmentDTO("obj-" + i, TimeRange.parse("[" + i + ":0_" + (i + 1) + ":0)")), false);
        }
        return id;
    }

    private List<String> ranges(UUID flow) {
        return index.query(flow, null, null, 100).segments().stream().map(s -> s.getTimerange().format()).toList();
    }

    private static final TimeRange TARGET = TimeRange.parse("[0:500000000_5:500000000)");

    @Test
    void batchedRunMatchesSingleDelete() {
        DeletionRequest request = requests.create(flowId, TARGET);
        assertThat(request.getStatus()).isEqualTo(DeletionStatus.PENDING);
        assertThat(requests.claim(request.getId(), "worker-1")).isTrue();

        workflow.run(request.getId(), "worker-1");

        DeletionRequest done = requests.get(request.getId());
        assertThat(done.getStatus()).isEqualTo(DeletionStatus.COMPLETED);
        assertThat(done.getRemaining()).isNull();
        assertThat(done.getBatchesProcessed()).isEqualTo(3);
        assertThat(done.getDeletedCount()).isEqualTo(4);
        assertThat(done.getLeaseOwner()).isNull();

        UUID reference = newFlowWithSegments(7);
        index.deleteRange(reference, TARGET);
        assertThat(ranges(flowId)).isEqualTo(ranges(reference))
                .containsExactly("[0:0_0:500000000)", "[5:500000000_6:0)", "[6:0_7:0)");
        assertThat(flowRepository.findById(flowId).orElseThrow().getAvailableTimerange())
                .isEqualTo(flowRepository.findById(reference).orElseThrow().getAvailableTimerange());

        List<String> types = eventRepository.findAll().stream().map(CatalogEvent::getEventType).toList();
        assertThat(types).contains("flow.updated");
        assertThat(types.stream().filter("segments.deleted"::equals).count()).isEqualTo(4);
    }

    @Test
    void interruptedRequestResumesFromStoredProgress() {
        DeletionRequest request = requests.create(flowId, TARGET);
        requests.claim(request.getId(), "worker-1");

        assertThat(workflow.processNextBatch(request.getId(), "worker-1")).isTrue();
        DeletionRequest midway = requests.get(request.getId());
        assertThat(midway.getStatus()).isEqualTo(DeletionStatus.PROCESSING);
        assertThat(midway.getRemaining()).isEqualTo(TimeRange.parse("[2:0_5:500000000)"));

        // worker-1 dies; the restarted process frees its lease and another worker continues
        assertThat(requests.releaseAllLeases()).isEqualTo(1);
        assertThat(requests.findClaimable(10)).containsExactly(request.getId());
        assertThat(requests.claim(request.getId(), "worker-2")).isTrue();
        workflow.run(request.getId(), "worker-2");

        assertThat(requests.get(request.getId()).getStatus()).isEqualTo(DeletionStatus.COMPLETED);
        assertThat(ranges(flowId)).containsExactly("[0:0_0:500000000)", "[5:500000000_6:0)", "[6:0_7:0)");
    }

    @Test
    void wholeFlowRequestClearsEverything() {
        DeletionRequest request = requests.create(flowId, null);
        assertThat(request.getTimerange()).isEqualTo(TimeRange.ETERNITY);
        requests.claim(request.getId(), "worker-1");

        workflow.run(request.getId(), "worker-1");

        assertThat(requests.get(request.getId()).getDeletedCount()).isEqualTo(7);
        assertThat(segmentRepository.countByFlowId(flowId)).isZero();
        assertThat(flowRepository.findById(flowId).orElseThrow().getAvailableTimerange().isEmpty()).isTrue();
    }

    @Test
    void cancellingPendingRequestEndsItImmediately() {
        DeletionRequest request = requests.create(flowId, TARGET);

        DeletionRequest cancelled = requests.cancel(request.getId());

        assertThat(cancelled.getStatus()).isEqualTo(DeletionStatus.ERROR);
        assertThat(cancelled.getErrorReason()).isEqualTo(DeletionRequestService.CANCELLED);
        assertThat(requests.claim(request.getId(), "worker-1")).isFalse();
        assertThat(ranges(flowId)).hasSize(7);
    }

    @Test
    void cancellingProcessingRequestStopsAtNextBatch() {
        DeletionRequest request = requests.create(flowId, TARGET);
        requests.claim(request.getId(), "worker-1");
        workflow.processNextBatch(request.getId(), "worker-1");

        assertThat(requests.cancel(request.getId()).isCancelRequested()).isTrue();
        workflow.run(request.getId(), "worker-1");

        DeletionRequest stopped = requests.get(request.getId());
        assertThat(stopped.getStatus()).isEqualTo(DeletionStatus.ERROR);
        assertThat(stopped.getErrorReason()).isEqualTo(DeletionRequestService.CANCELLED);
        assertThat(stopped.getBatchesProcessed()).isEqualTo(1);
        assertThat(ranges(flowId)).startsWith("[0:0_0:500000000)", "[2:0_3:0)");

        DeletionRequest again = requests.cancel(request.getId());
        assertThat(again.getStatus()).isEqualTo(DeletionStatus.ERROR);
    }

    @Test
    void cancelCommittedDuringBatchWinsOverTheBatch() throws Exception {
        DeletionRequest request = requests.create(flowId, TARGET);
        requests.claim(request.getId(), "worker-1");
        ExecutorService other = Executors.newSingleThreadExecutor();
        try {
            TransactionTemplate tx = new TransactionTemplate(transactionManager);
            assertThrows(OptimisticLockingFailureException.class, () -> tx.executeWithoutResult(status -> {
                requests.recordProgress(request.getId(), "worker-1", TimeRange.parse("[2:0_5:500000000)"), 2);
                try {
                    DeletionRequest flagged = other.submit(() -> requests.cancel(request.getId())).get();
                    assertThat(flagged.isCancelRequested()).isTrue();
                } catch (Exception e) {
                    throw new IllegalStateException(e);
                }
            }));
        } finally {
            other.shutdownNow();
        }

        DeletionRequest afterConflict = requests.get(request.getId());
        assertThat(afterConflict.isCancelRequested()).isTrue();
        assertThat(afterConflict.getBatchesProcessed()).isZero();

        workflow.run(request.getId(), "worker-1");

        DeletionRequest stopped = requests.get(request.getId());
        assertThat(stopped.getStatus()).isEqualTo(DeletionStatus.ERROR);
        assertThat(stopped.getErrorReason()).isEqualTo(DeletionRequestService.CANCELLED);
        assertThat(ranges(flowId)).hasSize(7);
    }

    @Test
    void workerWithoutLeaseDoesNothing() {
        DeletionRequest request = requests.create(flowId, TARGET);
        requests.claim(request.getId(), "worker-1");

        assertThat(requests.claim(request.getId(), "worker-2")).isFalse();
        workflow.run(request.getId(), "worker-2");

        DeletionRequest untouched = requests.get(request.getId());
        assertThat(untouched.getStatus()).isEqualTo(DeletionStatus.PROCESSING);
        assertThat(untouched.getLeaseOwner()).isEqualTo("worker-1");
        assertThat(untouched.getBatchesProcessed()).isZero();
        assertThat(ranges(flowId)).hasSize(7);
    }

    @Test
    void flowTurningReadOnlyMarksRequestAsError() {
        DeletionRequest request = requests.create(flowId, TARGET);
        requests.claim(request.getId(), "worker-1");
        Flow flow = flowRepository.findById(flowId).orElseThrow();
        flow.setReadOnly(true);
        flowRepository.saveAndFlush(flow);

        workflow.run(request.getId(), "worker-1");

        DeletionRequest failed = requests.get(request.getId());
        assertThat(failed.getStatus()).isEqualTo(DeletionStatus.ERROR);
        assertThat(failed.getErrorReason()).isEqualTo("FLOW_READ_ONLY");
        assertThat(ranges(flowId)).hasSize(7);
    }

    @Test
    void createValidatesTheFlow() {
        CatalogException missing = assertThrows(CatalogException.class, () -> requests.create(UUID.randomUUID(), TARGET));
        assertThat(missing.getKind()).isEqualTo(ErrorKind.NOT_FOUND);

        Flow flow = flowRepository.findById(flowId).orElseThrow();
        flow.setReadOnly(true);
        flowRepository.saveAndFlush(flow);
        CatalogException readOnly = assertThrows(CatalogException.class, () -> requests.create(flowId, TARGET));
        assertThat(readOnly.getKind()).isEqualTo(ErrorKind.READ_ONLY_FLOW);
    }
}
