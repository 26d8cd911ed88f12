package com.example.mediacatalog_backend.controller;

import com.example.mediacatalog_backend.api.dto.PageResponse;
import com.example.mediacatalog_backend.config.PaginationProperties;
import com.example.mediacatalog_backend.dto.web.*;
import com.example.mediacatalog_backend.exception.CatalogException;
import com.example.mediacatalog_backend.model.Flow;
import com.example.mediacatalog_backend.service.FlowService;
import com.example.mediacatalog_backend.service.MediaObjectService;
import com.example.mediacatalog_backend.service.SegmentIndexService;
import com.example.mediacatalog_backend.timerange.TimeRange;
import com.example.mediacatalog_backend.util.ContentFormat;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/flows")
public class FlowController {

    private final FlowService flowService;
    private final SegmentIndexService segmentIndex;
    private final MediaObjectService mediaObjects;
    private final PaginationProperties pagination;

    public FlowController(FlowService flowService, SegmentIndexService segmentIndex,
                          MediaObjectService mediaObjects, PaginationProperties pagination) {
        this.flowService = flowService;
        this.segmentIndex = segmentIndex;
        this.mediaObjects = mediaObjects;
        this.pagination = pagination;
    }

    /* ================== FLOWS ================== */

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public FlowResponse create(@Valid @RequestBody FlowRequest request) {
        return FlowResponse.from(flowService.create(request));
    }

    @GetMapping
    public PageResponse<FlowResponse> list(@RequestParam(name = "source_id", required = false) UUID sourceId,
                                           @RequestParam(required = false) String format,
                                           @RequestParam(required = false) String codec,
                                           @RequestParam(required = false) String label,
                                           @RequestParam(defaultValue = "0") int page,
                                           @RequestParam(required = false) Integer limit) {
        return PageResponse.from(flowService.list(sourceId, ContentFormat.fromJson(format), codec, label, page, limit),
                FlowResponse::from);
    }

    @GetMapping("/{flowId}")
    public FlowResponse get(@PathVariable UUID flowId) {
        return FlowResponse.from(flowService.get(flowId));
    }

    @PutMapping("/{flowId}")
    public FlowResponse update(@PathVariable UUID flowId, @RequestBody FlowRequest request) {
        return FlowResponse.from(flowService.update(flowId, request));
    }

    @PutMapping("/{flowId}/read_only")
    public FlowResponse setReadOnly(@PathVariable UUID flowId, @Valid @RequestBody ReadOnlyRequest request) {
        return FlowResponse.from(flowService.setReadOnly(flowId, request.readOnly()));
    }

    @DeleteMapping("/{flowId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable UUID flowId) {
        flowService.delete(flowId);
    }

    /* ================== SEGMENTS ================== */

    // page is the cursor returned as next_page by the previous call
    @GetMapping("/{flowId}/segments")
    public SegmentPageResponse segments(@PathVariable UUID flowId,
                                        @RequestParam(required = false) String timerange,
                                        @RequestParam(required = false) Integer limit,
                                        @RequestParam(required = false) String page) {
        if (limit != null && limit < 1) {
            throw CatalogException.parseError("BAD_PAGINATION");
        }
        int effective = pagination.clamp(limit);
        TimeRange range = timerange == null || timerange.isBlank() ? null : TimeRange.parse(timerange);
        SegmentIndexService.SegmentPage result = segmentIndex.query(flowId, range, page, effective);
        return new SegmentPageResponse(result.segments().stream().map(SegmentResponse::from).toList(),
                effective, result.nextCursor());
    }

    @Operation(summary = "Add a segment to the flow's index")
    @ApiResponse(responseCode = "201", description = "Segment stored")
    @ApiResponse(responseCode = "400", description = "Malformed or unbounded timerange")
    @ApiResponse(responseCode = "403", description = "Flow is read-only")
    @ApiResponse(responseCode = "409", description = "Overlaps existing segments and replace was not requested")
    @PostMapping("/{flowId}/segments")
    @ResponseStatus(HttpStatus.CREATED)
    public SegmentResponse addSegment(@PathVariable UUID flowId,
                                      @RequestParam(defaultValue = "false") boolean replace,
                                      @Valid @RequestBody SegmentRequest request) {
        return SegmentResponse.from(segmentIndex.insert(flowId, request.toDto(), replace));
    }

    /** Clears the given range, or the whole flow when no range is given. */
    @Operation(summary = "Delete segments overlapping a range, trimming partial overlaps")
    @DeleteMapping("/{flowId}/segments")
    public SegmentDeleteResponse deleteSegments(@PathVariable UUID flowId,
                                                @RequestParam(required = false) String timerange) {
        TimeRange range = timerange == null || timerange.isBlank() ? TimeRange.ETERNITY : TimeRange.parse(timerange);
        SegmentIndexService.DeleteResult result = segmentIndex.deleteRange(flowId, range);
        return new SegmentDeleteResponse(flowId, range.format(), result.deleted(), result.modified());
    }

    /* ================== STORAGE ================== */

    @PostMapping("/{flowId}/storage")
    @ResponseStatus(HttpStatus.CREATED)
    public StorageAllocationResponse allocateStorage(@PathVariable UUID flowId,
                                                     @Valid @RequestBody(required = false) StorageAllocationRequest request) {
        Flow flow = flowService.get(flowId);
        if (flow.isReadOnly()) {
            throw CatalogException.readOnly("FLOW_READ_ONLY");
        }
        int count = request == null || request.limit() == null ? 1 : request.limit();
        return StorageAllocationResponse.from(mediaObjects.allocate(request == null ? null : request.objectIds(), count));
    }
}
