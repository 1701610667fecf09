package io.memlite.storage;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Snapshot policy that asks for a full snapshot after every N durable writes.
 * Bounds recovery time by limiting how much WAL a restart has to replay.
 */
public final class SnapshotPolicy {
    private final int everyOps;
    private final AtomicInteger sinceLast = new AtomicInteger();

    public SnapshotPolicy(int everyOps) {
        if (everyOps <= 0) throw new IllegalArgumentException("everyOps must be > 0");
        this.everyOps = everyOps;
    }

    /** Call after each durable write; true when the threshold was hit (the counter then restarts). */
    public boolean recordWrite() {
        if (sinceLast.incrementAndGet() >= everyOps) {
            sinceLast.set(0);
            return true;
        }
        return false;
    }

    public int everyOps() { return everyOps; }
}
