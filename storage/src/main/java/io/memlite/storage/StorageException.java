package io.memlite.storage;

/**
 * IO failure or on-disk corruption in the local store.
 * Retryable: the operation that raised it left no partial state in memory.
 */
public class StorageException extends RuntimeException {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
