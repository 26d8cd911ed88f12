package com.example.mediacatalog_backend.controller;

import com.example.mediacatalog_backend.dto.web.MediaObjectResponse;
import com.example.mediacatalog_backend.service.MediaObjectService;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.io.InputStream;

/**
 * Media object metadata, plus the upload target handed out by storage allocation when the
 * local object store is in use. GET also answers HEAD.
 */
@RestController
@RequestMapping("/objects")
public class ObjectController {

    private final MediaObjectService mediaObjects;

    public ObjectController(MediaObjectService mediaObjects) {
        this.mediaObjects = mediaObjects;
    }

    @GetMapping("/{objectId}")
    public MediaObjectResponse get(@PathVariable String objectId) {
        return MediaObjectResponse.from(mediaObjects.get(objectId));
    }

    @PutMapping("/{objectId}")
    public MediaObjectResponse upload(@PathVariable String objectId, HttpServletRequest request) throws IOException {
        try (InputStream in = request.getInputStream()) {
            return MediaObjectResponse.from(mediaObjects.upload(objectId, in));
        }
    }
}
