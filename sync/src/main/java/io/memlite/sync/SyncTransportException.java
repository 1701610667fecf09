package io.memlite.sync;

/** Push or pull did not complete. The sync loop retries on its next cycle. */
public class SyncTransportException extends RuntimeException {
    public SyncTransportException(String message) {
        super(message);
    }

    public SyncTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
