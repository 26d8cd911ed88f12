package com.example.mediacatalog_backend.service.Interfaces;

import java.io.InputStream;

/**
 * Byte storage behind media objects. The catalog only asks whether an object exists, what it
 * looks like, where a client may upload it, and to reclaim it; it never reads media bytes.
 */
public interface ObjectStore {
    boolean exists(String objectId);

    /** Size, mime type and content hash of a stored object. */
    ObjectStat stat(String objectId);

    /** Pre-authorised location a client can PUT the object's bytes to. */
    UploadLocator issueUploadLocator(String objectId);

    /** Stores bytes under {@code objectId}, replacing any previous content. */
    void write(String objectId, InputStream data);

    /** Removes the object's bytes. Missing objects are not an error. */
    void delete(String objectId);

    boolean isAvailable();
}
