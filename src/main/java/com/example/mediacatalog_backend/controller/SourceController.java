package com.example.mediacatalog_backend.controller;

import com.example.mediacatalog_backend.api.dto.PageResponse;
import com.example.mediacatalog_backend.dto.web.SourceRequest;
import com.example.mediacatalog_backend.dto.web.SourceResponse;
import com.example.mediacatalog_backend.service.SourceService;
import com.example.mediacatalog_backend.util.ContentFormat;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/sources")
public class SourceController {

    private final SourceService sourceService;

    public SourceController(SourceService sourceService) {
        this.sourceService = sourceService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public SourceResponse create(@Valid @RequestBody SourceRequest request) {
        return SourceResponse.from(sourceService.create(request));
    }

    @GetMapping
    public PageResponse<SourceResponse> list(@RequestParam(required = false) String format,
                                             @RequestParam(required = false) String label,
                                             @RequestParam(defaultValue = "0") int page,
                                             @RequestParam(required = false) Integer limit) {
        return PageResponse.from(sourceService.list(ContentFormat.fromJson(format), label, page, limit), SourceResponse::from);
    }

    @GetMapping("/{sourceId}")
    public SourceResponse get(@PathVariable UUID sourceId) {
        return SourceResponse.from(sourceService.get(sourceId));
    }

    @PutMapping("/{sourceId}")
    public SourceResponse update(@PathVariable UUID sourceId, @RequestBody SourceRequest request) {
        return SourceResponse.from(sourceService.update(sourceId, request));
    }

    @DeleteMapping("/{sourceId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable UUID sourceId) {
        sourceService.delete(sourceId);
    }
}
