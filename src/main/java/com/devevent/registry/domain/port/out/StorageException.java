package com.devevent.registry.domain.port.out;

/**
 * Base type for failures reported by the storage collaborator that the write path knows how to classify.
 */
public abstract class StorageException extends RuntimeException {

    protected StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
