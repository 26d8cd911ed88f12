package com.example.mediacatalog_backend.service;

import com.example.mediacatalog_backend.exception.CatalogException;
import com.example.mediacatalog_backend.model.MediaObject;
import com.example.mediacatalog_backend.repository.MediaObjectRepository;
import com.example.mediacatalog_backend.service.Interfaces.ObjectStat;
import com.example.mediacatalog_backend.service.Interfaces.ObjectStore;
import com.example.mediacatalog_backend.service.Interfaces.UploadLocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.io.InputStream;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Media object registry and reference counting. Attach/detach always run inside the transaction
 * that adds or removes the referencing segment.
 */
@Service
public class MediaObjectService {
    private static final Logger LOGGER = LoggerFactory.getLogger(MediaObjectService.class);

    private final MediaObjectRepository objectRepo;
    private final ObjectStore objectStore;
    private final Clock clock;

    public MediaObjectService(MediaObjectRepository objectRepo, ObjectStore objectStore, Clock clock) {
        this.objectRepo = objectRepo;
        this.objectStore = objectStore;
        this.clock = clock;
    }

    /**
     * Records that {@code flowId} references the object, registering the object on first use.
     * An object never seen before must already exist in the object store.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public MediaObject attach(String objectId, UUID flowId) {
        MediaObject object = objectRepo.findByIdForUpdate(objectId).orElseGet(() -> register(objectId));
        object.addReference(flowId);
        return objectRepo.save(object);
    }

    private MediaObject register(String objectId) {
        if (!objectStore.exists(objectId)) {
            throw CatalogException.notFound("OBJECT_NOT_FOUND");
        }
        ObjectStat stat = objectStore.stat(objectId);
        LOGGER.info("OBJECT REGISTERED objectId={} size={} mime={}", objectId, stat.sizeBytes(), stat.mimeType());
        return new MediaObject(objectId, stat.sizeBytes(), stat.mimeType());
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void detach(String objectId, UUID flowId) {
        objectRepo.findByIdForUpdate(objectId).ifPresent(object -> {
            if (object.removeReference(flowId, clock.instant())) {
                LOGGER.info("OBJECT UNREFERENCED objectId={}", objectId);
            }
            objectRepo.save(object);
        });
    }

    @Transactional(readOnly = true)
    public MediaObject get(String objectId) {
        return objectRepo.findById(objectId).orElseThrow(() -> CatalogException.notFound("OBJECT_NOT_FOUND"));
    }

    /**
     * Upload locations for explicit ids, or for {@code count} freshly generated ids.
     */
    public List<UploadLocator> allocate(List<String> objectIds, int count) {
        List<String> ids = new ArrayList<>();
        if (objectIds != null && !objectIds.isEmpty()) {
            for (String id : objectIds) {
                if (id == null || id.isBlank()) throw CatalogException.parseError("BAD_OBJECT_ID");
                ids.add(id.trim());
            }
        } else {
            for (int i = 0; i < count; i++) {
                ids.add(UUID.randomUUID().toString());
            }
        }
        List<UploadLocator> locators = ids.stream().map(objectStore::issueUploadLocator).toList();
        LOGGER.debug("STORAGE ALLOCATED count={}", locators.size());
        return locators;
    }

    /**
     * Stores uploaded bytes and registers the object. A freshly uploaded object counts as
     * unreferenced until a segment points at it, so abandoned uploads are reclaimed too.
     */
    @Transactional
    public MediaObject upload(String objectId, InputStream data) {
        objectStore.write(objectId, data);
        ObjectStat stat = objectStore.stat(objectId);
        MediaObject object = objectRepo.findById(objectId).orElseGet(() -> {
            MediaObject fresh = new MediaObject(objectId, stat.sizeBytes(), stat.mimeType());
            fresh.setUnreferencedSince(clock.instant());
            return fresh;
        });
        object.setSizeBytes(stat.sizeBytes());
        object.setMimeType(stat.mimeType());
        LOGGER.info("OBJECT UPLOADED objectId={} size={}", objectId, stat.sizeBytes());
        return objectRepo.save(object);
    }
}
