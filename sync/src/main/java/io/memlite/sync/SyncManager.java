package io.memlite.sync;

import io.memlite.core.EmbeddingDocument;
import io.memlite.core.MemoryDocument;
import io.memlite.core.ValidationException;
import io.memlite.storage.MemoryStorage;
import io.memlite.storage.StorageException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Pushes pending local documents to the hub and pulls remote ones into storage.
 * <p>
 * Loop:
 *  - one daemon thread ("memory-sync") runs a cycle, then schedules the next one;
 *  - after a successful cycle the next runs one interval later;
 *  - after a failed cycle it runs after an exponential backoff (1 s doubling, 5 min cap),
 *    and the cycle still never throws out of the loop.
 * <p>
 * Embeddings referenced by pushed documents go to the hub ahead of the documents, and a
 * pull fetches the embeddings of merged documents that this replica lacks.
 * <p>
 * Delivery is at-least-once: documents are marked synced only after the hub confirmed the
 * push. A crash between confirmation and {@code markSynced} re-sends the batch next time,
 * which the hub absorbs because merges are idempotent.
 */
public final class SyncManager implements AutoCloseable {
    private static final Logger log = Logger.getLogger(SyncManager.class.getName());

    public static final int DEFAULT_BATCH_SIZE = 100;
    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(60);
    private static final long STOP_GRACE_MILLIS = 5_000;

    private final MemoryStorage storage;
    private final SyncTransport transport;
    private final int batchSize;
    private final BackoffCalculator backoff;
    private final SyncStats stats = new SyncStats();
    // Serializes cycles triggered by the loop and by callers of sync().
    private final ReentrantLock cycleLock = new ReentrantLock();

    private volatile SyncListener listener;
    private volatile boolean running;
    private ScheduledExecutorService scheduler;
    private Duration interval = DEFAULT_INTERVAL;

    public SyncManager(MemoryStorage storage, SyncTransport transport, int batchSize) {
        this(storage, transport, batchSize, new BackoffCalculator());
    }

    public SyncManager(MemoryStorage storage, SyncTransport transport, int batchSize, BackoffCalculator backoff) {
        if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be > 0");
        this.storage = Objects.requireNonNull(storage, "storage");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.batchSize = batchSize;
    }

    public void setListener(SyncListener listener) { this.listener = listener; }

    public SyncStats stats() { return stats; }

    public boolean isRunning() { return running; }

    /** Start the background loop; the first cycle runs immediately. No-op when already running. */
    public synchronized void start(Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        if (running) return;
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "memory-sync");
            t.setDaemon(true);
            return t;
        });
        running = true;
        scheduleNext(0);
        log.info(() -> "Sync loop started (interval " + interval.toSeconds() + "s, batch " + batchSize + ")");
    }

    /** Stop the loop, waiting briefly for an in-flight cycle. Idempotent. */
    public void stop() {
        ScheduledExecutorService s;
        synchronized (this) {
            if (!running) return;
            running = false;
            s = scheduler;
            scheduler = null;
        }
        s.shutdown();
        try {
            if (!s.awaitTermination(STOP_GRACE_MILLIS, TimeUnit.MILLISECONDS)) {
                log.warning("Sync cycle did not finish in time; interrupting it");
                s.shutdownNow();
            }
        } catch (InterruptedException e) {
            s.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Sync loop stopped");
    }

    @Override
    public void close() { stop(); }

    /**
     * Run one push cycle: take up to batchSize pending documents, push them, and mark
     * them synced only after the hub confirmed. Never throws for transport or storage
     * failures; those come back as an unsuccessful result.
     */
    public SyncResult sync() {
        cycleLock.lock();
        try {
            long started = System.nanoTime();
            List<MemoryDocument> batch;
            try {
                batch = storage.getPendingSync(batchSize);
            } catch (StorageException e) {
                return finish(SyncResult.failed(0, "reading pending documents: " + e.getMessage(), elapsed(started)));
            }
            if (batch.isEmpty()) {
                return finish(SyncResult.succeeded(0, 0, elapsed(started)));
            }

            boolean confirmed;
            try {
                var embeddings = referencedEmbeddings(batch);
                if (!embeddings.isEmpty()) transport.pushEmbeddings(embeddings);
                confirmed = transport.push(batch);
            } catch (RuntimeException e) {
                // Every push failure counts toward the backoff.
                log.log(e instanceof SyncTransportException ? Level.FINE : Level.WARNING, "push failed", e);
                return finish(SyncResult.failed(batch.size(), "push failed: " + e.getMessage(), elapsed(started)));
            }
            if (!confirmed) {
                return finish(SyncResult.failed(batch.size(), "hub refused batch", elapsed(started)));
            }

            var ids = new ArrayList<String>(batch.size());
            for (var doc : batch) ids.add(doc.id());
            int marked;
            try {
                marked = storage.markSynced(ids);
            } catch (StorageException e) {
                // Pushed but not recorded: the batch goes out again next cycle.
                return finish(SyncResult.failed(batch.size(), "marking synced: " + e.getMessage(), elapsed(started)));
            }
            return finish(SyncResult.succeeded(batch.size(), marked, elapsed(started)));
        } finally {
            cycleLock.unlock();
        }
    }

    /**
     * Fetch documents relevant to {@code query} from the hub and merge each into storage.
     * Unknown documents are inserted. Missing embeddings of merged documents are fetched
     * afterwards; a failure there is logged and retried by the next pull.
     *
     * @return the merged local copies
     * @throws SyncTransportException when the hub cannot be reached
     */
    public List<MemoryDocument> pull(String query, int k) {
        if (k <= 0) throw new ValidationException("k must be > 0");
        var remote = transport.pull(query, k);
        var merged = new ArrayList<MemoryDocument>(remote.size());
        for (var doc : remote) merged.add(storage.mergeRemote(doc));
        fetchMissingEmbeddings(merged);
        log.fine(() -> "Pulled " + merged.size() + " documents for query '" + query + "'");
        return merged;
    }

    // ---------- internals ----------

    private List<EmbeddingDocument> referencedEmbeddings(List<MemoryDocument> batch) {
        var byId = new LinkedHashMap<String, EmbeddingDocument>();
        for (var doc : batch) {
            String ref = doc.embeddingRef();
            if (ref == null) continue;
            var embedding = storage.getEmbeddingByHash(ref);
            if (embedding != null) byId.putIfAbsent(embedding.id(), embedding);
        }
        return new ArrayList<>(byId.values());
    }

    private void fetchMissingEmbeddings(List<MemoryDocument> docs) {
        var missing = new LinkedHashSet<String>();
        for (var doc : docs) {
            String ref = doc.embeddingRef();
            if (ref != null && storage.getEmbeddingByHash(ref) == null) missing.add(ref);
        }
        if (missing.isEmpty()) return;
        try {
            int stored = 0;
            for (var embedding : transport.pullEmbeddings(missing)) {
                storage.putEmbedding(embedding);
                stored++;
            }
            int fetched = stored;
            log.fine(() -> "Fetched " + fetched + " of " + missing.size() + " missing embeddings");
        } catch (SyncTransportException e) {
            log.log(Level.WARNING, "Fetching " + missing.size() + " embeddings from the hub failed", e);
        }
    }

    private SyncResult finish(SyncResult result) {
        stats.record(result, storage.pendingCount());
        if (result.success()) {
            if (result.pushedCount() > 0) {
                log.info(() -> "Synced " + result.syncedCount() + "/" + result.pushedCount()
                        + " documents in " + result.durationMillis() + "ms");
            }
        } else {
            log.warning("Sync failed (" + stats.consecutiveFailures() + " in a row): " + result.errors());
        }
        var l = listener;
        if (l != null) {
            try {
                l.onSyncComplete(result);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "Sync listener failed", e);
            }
        }
        return result;
    }

    private void tickSafe() {
        if (!running) return;
        long delay;
        try {
            var result = sync();
            delay = result.success() ? interval.toMillis() : backoff.calculate(stats.consecutiveFailures());
        } catch (RuntimeException e) {
            log.log(Level.SEVERE, "Sync cycle crashed", e);
            delay = backoff.calculate(Math.max(1, stats.consecutiveFailures()));
        }
        scheduleNext(delay);
    }

    private synchronized void scheduleNext(long delayMillis) {
        if (!running || scheduler == null) return;
        try {
            scheduler.schedule(this::tickSafe, delayMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.fine("Sync scheduler already shut down");
        }
    }

    private static long elapsed(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
