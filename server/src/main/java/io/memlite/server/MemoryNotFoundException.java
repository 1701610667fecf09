package io.memlite.server;

/** Thrown when a memory id is unknown on this replica. Mapped to HTTP 404. */
public class MemoryNotFoundException extends RuntimeException {
    public MemoryNotFoundException(String id) {
        super("memory not found: " + id);
    }
}
