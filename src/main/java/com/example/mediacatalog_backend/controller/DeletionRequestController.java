package com.example.mediacatalog_backend.controller;

import com.example.mediacatalog_backend.api.dto.PageResponse;
import com.example.mediacatalog_backend.dto.web.DeletionRequestCreate;
import com.example.mediacatalog_backend.dto.web.DeletionRequestResponse;
import com.example.mediacatalog_backend.exception.CatalogException;
import com.example.mediacatalog_backend.service.DeletionRequestService;
import com.example.mediacatalog_backend.timerange.TimeRange;
import com.example.mediacatalog_backend.util.DeletionStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.Locale;
import java.util.UUID;

@RestController
@RequestMapping("/flow-delete-requests")
public class DeletionRequestController {

    private final DeletionRequestService requests;

    public DeletionRequestController(DeletionRequestService requests) {
        this.requests = requests;
    }

    @Operation(summary = "Queue a background deletion of a flow's segments over a time range")
    @ApiResponse(responseCode = "202", description = "Request accepted; poll it for progress")
    @ApiResponse(responseCode = "400", description = "Malformed timerange")
    @ApiResponse(responseCode = "403", description = "Flow is read-only")
    @ApiResponse(responseCode = "404", description = "Flow not found")
    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public DeletionRequestResponse create(@Valid @RequestBody DeletionRequestCreate request) {
        TimeRange range = request.timerange() == null || request.timerange().isBlank()
                ? null : TimeRange.parse(request.timerange());
        return DeletionRequestResponse.from(requests.create(request.flowId(), range));
    }

    @GetMapping
    public PageResponse<DeletionRequestResponse> list(@RequestParam(name = "flow_id", required = false) UUID flowId,
                                                      @RequestParam(required = false) String status,
                                                      @RequestParam(defaultValue = "0") int page,
                                                      @RequestParam(required = false) Integer limit) {
        return PageResponse.from(requests.list(flowId, parseStatus(status), page, limit), DeletionRequestResponse::from);
    }

    @GetMapping("/{requestId}")
    public DeletionRequestResponse get(@PathVariable UUID requestId) {
        return DeletionRequestResponse.from(requests.get(requestId));
    }

    @Operation(summary = "Cancel a deletion request; takes effect at the next batch boundary")
    @PostMapping("/{requestId}/cancel")
    public DeletionRequestResponse cancel(@PathVariable UUID requestId) {
        return DeletionRequestResponse.from(requests.cancel(requestId));
    }

    private static DeletionStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return DeletionStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw CatalogException.parseError("BAD_STATUS");
        }
    }
}
