package io.memlite.sync;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** Running counters of a {@link SyncManager}. Thread-safe; values are read individually. */
public final class SyncStats {
    private final AtomicLong totalSynced = new AtomicLong();
    private final AtomicLong totalFailed = new AtomicLong();
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicLong lastSyncTime = new AtomicLong();
    private final AtomicLong lastDurationMillis = new AtomicLong();
    private final AtomicInteger lastPendingCount = new AtomicInteger();

    void record(SyncResult result, int pendingAfter) {
        if (result.success()) {
            totalSynced.addAndGet(result.syncedCount());
            consecutiveFailures.set(0);
        } else {
            totalFailed.addAndGet(result.failedCount());
            consecutiveFailures.incrementAndGet();
        }
        lastSyncTime.set(System.currentTimeMillis());
        lastDurationMillis.set(result.durationMillis());
        lastPendingCount.set(pendingAfter);
    }

    public long totalSynced() { return totalSynced.get(); }

    public long totalFailed() { return totalFailed.get(); }

    public int consecutiveFailures() { return consecutiveFailures.get(); }

    /** Epoch millis of the last finished cycle, 0 before the first one. */
    public long lastSyncTime() { return lastSyncTime.get(); }

    public long lastDurationMillis() { return lastDurationMillis.get(); }

    /** Pending documents left after the last cycle. */
    public int lastPendingCount() { return lastPendingCount.get(); }

    @Override
    public String toString() {
        return "SyncStats(synced=" + totalSynced() + ", failed=" + totalFailed()
                + ", consecutiveFailures=" + consecutiveFailures() + ", pending=" + lastPendingCount() + ")";
    }
}
