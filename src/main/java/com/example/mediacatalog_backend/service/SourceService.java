package com.example.mediacatalog_backend.service;

import com.example.mediacatalog_backend.config.PaginationProperties;
import com.example.mediacatalog_backend.dto.web.FlowResponse;
import com.example.mediacatalog_backend.dto.web.SourceRequest;
import com.example.mediacatalog_backend.dto.web.SourceResponse;
import com.example.mediacatalog_backend.events.EventPayloads;
import com.example.mediacatalog_backend.events.EventRecorder;
import com.example.mediacatalog_backend.exception.CatalogException;
import com.example.mediacatalog_backend.model.Flow;
import com.example.mediacatalog_backend.model.Source;
import com.example.mediacatalog_backend.repository.FlowRepository;
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
public class SourceService {
    private static final Logger LOGGER = LoggerFactory.getLogger(SourceService.class);

    private final SourceRepository sourceRepo;
    private final FlowRepository flowRepo;
    private final EventRecorder events;
    private final PaginationProperties pagination;

    public SourceService(SourceRepository sourceRepo, FlowRepository flowRepo, EventRecorder events, PaginationProperties pagination) {
        this.sourceRepo = sourceRepo;
        this.flowRepo = flowRepo;
        this.events = events;
        this.pagination = pagination;
    }

    @Transactional
    public Source create(SourceRequest req) {
        Source source = new Source(req.format());
        apply(source, req);
        source = sourceRepo.saveAndFlush(source);
        events.record(EventType.SOURCE_CREATED, new EventPayloads.SourceChanged(SourceResponse.from(source)));
        LOGGER.info("SOURCE CREATED id={} format={}", source.getId(), source.getFormat());
        return source;
    }

    @Transactional(readOnly = true)
    public Source get(UUID id) {
        return sourceRepo.findById(id).orElseThrow(() -> CatalogException.notFound("SOURCE_NOT_FOUND"));
    }

    @Transactional(readOnly = true)
    public Page<Source> list(ContentFormat format, String label, int page, Integer limit) {
        if (page < 0 || (limit != null && limit < 1)) {
            throw CatalogException.parseError("BAD_PAGINATION");
        }
        return sourceRepo.search(format, label, PageRequest.of(page, pagination.clamp(limit)));
    }

    @Transactional
    public Source update(UUID id, SourceRequest req) {
        Source source = get(id);
        if (req.format() != null) {
            source.setFormat(req.format());
        }
        apply(source, req);
        source = sourceRepo.saveAndFlush(source);
        events.record(EventType.SOURCE_UPDATED, new EventPayloads.SourceChanged(SourceResponse.from(source)));
        LOGGER.info("SOURCE UPDATED id={}", id);
        return source;
    }

    /**
     * Deletes the source. Flows are not cascaded; their source reference is cleared and each of
     * them is announced as updated.
     */
    @Transactional
    public void delete(UUID id) {
        if (!sourceRepo.existsById(id)) {
            throw CatalogException.notFound("SOURCE_NOT_FOUND");
        }
        List<Flow> flows = flowRepo.findBySourceId(id);
        for (Flow flow : flows) {
            flow.setSourceId(null);
            flow = flowRepo.save(flow);
            events.record(EventType.FLOW_UPDATED, new EventPayloads.FlowChanged(FlowResponse.from(flow)));
        }
        int detached = flows.size();
        sourceRepo.deleteById(id);
        events.record(EventType.SOURCE_DELETED, new EventPayloads.SourceDeleted(id));
        LOGGER.info("SOURCE DELETED id={} flowsDetached={}", id, detached);
    }

    private static void apply(Source source, SourceRequest req) {
        source.setLabel(req.label());
        source.setDescription(req.description());
        source.setTags(req.tags());
    }
}
