package com.mediagen.orchestrator.storage;

/**
 * Thrown when the artifact store cannot complete a read, write or delete.
 *
 * Always transient from the orchestrator's point of view: the same key can be
 * written again on the next attempt.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
