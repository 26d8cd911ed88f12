package com.example.mediacatalog_backend.exception;

/**
 * Failure in the object store collaborator (filesystem or remote bucket).
 */
public class StorageException extends CatalogException {
    public StorageException(String reason) {
        super(ErrorKind.STORAGE_FAILURE, reason);
    }

    public StorageException(String reason, Throwable cause) {
        super(ErrorKind.STORAGE_FAILURE, reason, cause);
    }
}
