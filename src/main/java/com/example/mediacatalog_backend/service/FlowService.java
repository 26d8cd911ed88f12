package com.example.mediacatalog_backend.service;

import com.example.mediacatalog_backend.config.PaginationProperties;
import com.example.mediacatalog_backend.dto.web.FlowRequest;
import com.example.mediacatalog_backend.dto.web.FlowResponse;
import com.example.mediacatalog_backend.events.EventPayloads;
import com.example.mediacatalog_backend.events.EventRecorder;
import com.example.mediacatalog_backend.exception.CatalogException;
import com.example.mediacatalog_backend.model.Flow;
import com.example.mediacatalog_backend.model.FlowCollectionItem;
import com.example.mediacatalog_backend.repository.FlowRepository;
import com.example.mediacatalog_backend.repository.FlowSegmentRepository;
import com.example.mediacatalog_backend.repository.SourceRepository;
import com.example.mediacatalog_backend.util.ContentFormat;
import com.example.mediacatalog_backend.util.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Service
public class FlowService {
    private static final Logger LOGGER = LoggerFactory.getLogger(FlowService.class);

    private final FlowRepository flowRepo;
    private final SourceRepository sourceRepo;
    private final FlowSegmentRepository segmentRepo;
    private final MediaObjectService mediaObjects;
    private final EventRecorder events;
    private final PaginationProperties pagination;

    public FlowService(FlowRepository flowRepo, SourceRepository sourceRepo, FlowSegmentRepository segmentRepo,
                       MediaObjectService mediaObjects, EventRecorder events, PaginationProperties pagination) {
        this.flowRepo = flowRepo;
        this.sourceRepo = sourceRepo;
        this.segmentRepo = segmentRepo;
        this.mediaObjects = mediaObjects;
        this.events = events;
        this.pagination = pagination;
    }

    @Transactional
    public Flow create(FlowRequest req) {
        Flow flow = new Flow(req.format());
        apply(flow, req, null);
        flow.setReadOnly(Boolean.TRUE.equals(req.readOnly()));
        flow = flowRepo.saveAndFlush(flow);
        events.record(EventType.FLOW_CREATED, new EventPayloads.FlowChanged(FlowResponse.from(flow)));
        LOGGER.info("FLOW CREATED id={} source={} format={}", flow.getId(), flow.getSourceId(), flow.getFormat());
        return flow;
    }

    @Transactional(readOnly = true)
    public Flow get(UUID id) {
        return flowRepo.findById(id).orElseThrow(() -> CatalogException.notFound("FLOW_NOT_FOUND"));
    }

    @Transactional(readOnly = true)
    public Page<Flow> list(UUID sourceId, ContentFormat format, String codec, String label, int page, Integer limit) {
        if (page < 0 || (limit != null && limit < 1)) {
            throw CatalogException.parseError("BAD_PAGINATION");
        }
        return flowRepo.search(sourceId, format, codec, label, PageRequest.of(page, pagination.clamp(limit)));
    }

    /**
     * Replaces the flow's metadata. A read-only flow only accepts {@link #setReadOnly}.
     */
    @Transactional
    public Flow update(UUID id, FlowRequest req) {
        Flow flow = lockWritable(id);
        if (req.format() != null) {
            flow.setFormat(req.format());
        }
        apply(flow, req, id);
        if (req.readOnly() != null) {
            flow.setReadOnly(req.readOnly());
        }
        flow = flowRepo.saveAndFlush(flow);
        events.record(EventType.FLOW_UPDATED, new EventPayloads.FlowChanged(FlowResponse.from(flow)));
        LOGGER.info("FLOW UPDATED id={}", id);
        return flow;
    }

    @Transactional
    public Flow setReadOnly(UUID id, boolean readOnly) {
        Flow flow = flowRepo.findByIdForUpdate(id).orElseThrow(() -> CatalogException.notFound("FLOW_NOT_FOUND"));
        if (flow.isReadOnly() == readOnly) {
            return flow;
        }
        flow.setReadOnly(readOnly);
        flow = flowRepo.saveAndFlush(flow);
        events.record(EventType.FLOW_UPDATED, new EventPayloads.FlowChanged(FlowResponse.from(flow)));
        LOGGER.info("FLOW READ_ONLY id={} readOnly={}", id, readOnly);
        return flow;
    }

    /**
     * Deletes the flow together with all of its segments, releasing its media object references.
     * Other flows listing it in their collection lose that item and are announced as updated.
     */
    @Transactional
    public void delete(UUID id) {
        lockWritable(id);
        List<String> objectIds = segmentRepo.findObjectIdsByFlowId(id);
        for (String objectId : objectIds) {
            mediaObjects.detach(objectId, id);
        }
        int segments = segmentRepo.deleteAllByFlowId(id);
        flowRepo.deleteById(id);
        for (Flow parent : flowRepo.findCollectionsExcept(id)) {
            if (parent.removeFromCollection(id)) {
                Flow saved = flowRepo.save(parent);
                events.record(EventType.FLOW_UPDATED, new EventPayloads.FlowChanged(FlowResponse.from(saved)));
                LOGGER.info("FLOW COLLECTION PRUNED id={} removed={}", parent.getId(), id);
            }
        }
        events.record(EventType.FLOW_DELETED, new EventPayloads.FlowDeleted(id));
        LOGGER.info("FLOW DELETED id={} segments={} objectsReleased={}", id, segments, objectIds.size());
    }

    private Flow lockWritable(UUID id) {
        Flow flow = flowRepo.findByIdForUpdate(id).orElseThrow(() -> CatalogException.notFound("FLOW_NOT_FOUND"));
        if (flow.isReadOnly()) {
            throw CatalogException.readOnly("FLOW_READ_ONLY");
        }
        return flow;
    }

    private void apply(Flow flow, FlowRequest req, UUID selfId) {
        if (req.sourceId() != null && !sourceRepo.existsById(req.sourceId())) {
            throw CatalogException.notFound("SOURCE_NOT_FOUND");
        }
        List<FlowCollectionItem> collection = req.flowCollection() == null ? List.of() : req.flowCollection();
        for (FlowCollectionItem item : collection) {
            if (item == null || item.flowId() == null) {
                throw CatalogException.parseError("BAD_FLOW_COLLECTION");
            }
            if (item.flowId().equals(selfId)) {
                throw CatalogException.parseError("FLOW_COLLECTION_SELF_REFERENCE");
            }
            if (!flowRepo.existsById(item.flowId())) {
                throw CatalogException.notFound("COLLECTED_FLOW_NOT_FOUND");
            }
        }
        flow.setSourceId(req.sourceId());
        flow.setLabel(req.label());
        flow.setDescription(req.description());
        flow.setTags(req.tags());
        flow.setMaxBitRate(req.maxBitRate());
        flow.setAvgBitRate(req.avgBitRate());
        flow.setContainer(req.container());
        flow.setCodec(req.codec());
        flow.setFrameWidth(req.frameWidth());
        flow.setFrameHeight(req.frameHeight());
        flow.setSampleRate(req.sampleRate());
        flow.setChannels(req.channels());
        flow.setFlowCollection(collection);
    }
}
