package io.memlite.storage;

import io.memlite.core.EmbeddingDocument;
import io.memlite.core.MemoryDocument;
import io.memlite.core.MemoryType;
import io.memlite.core.SyncStatus;
import io.memlite.core.ValidationException;
import io.memlite.storage.json.DocumentJson;
import io.memlite.storage.json.WalRecordDto;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Durable memory store: in-memory documents and indices backed by a WAL and snapshots.
 * <p>
 * Write path (put / mergeRemote), under the document's lock:
 *  1) Merge the incoming document into the stored one.
 *  2) If nothing changed, stop.
 *  3) Append + fsync the merged entry to the WAL. If the process crashes after this,
 *     recovery will see the record.
 *  4) Apply the entry to memory and update the indices.
 *  5) Rotate the WAL segment and maybe snapshot, outside the lock.
 * <p>
 * On startup:
 *  1) Load the latest snapshot (if any).
 *  2) Replay every WAL record. Records carry merged state, so replaying one that the
 *     snapshot already contains changes nothing.
 * <p>
 * Sync bookkeeping: every entry has a local revision, bumped on each state change.
 * {@link #getPendingSync(int)} remembers the revision it handed out, and
 * {@link #markSynced(Collection)} only confirms that revision, so a document updated while
 * its push was in flight stays pending.
 */
public class DurableMemoryStore implements MemoryStorage {
    private static final Logger log = Logger.getLogger(DurableMemoryStore.class.getName());

    public static final long DEFAULT_SEGMENT_BYTES = 64L * 1024 * 1024;
    private static final int STRIPES = 64;
    private static final Pattern WORD_SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");

    private static final Comparator<MemoryDocument> NEWEST_FIRST =
            Comparator.comparingLong(MemoryDocument::updatedAt).reversed().thenComparing(MemoryDocument::id);

    private final Map<String, StoredMemory> entries = new ConcurrentHashMap<>();
    // pendingSeq -> id, oldest first
    private final NavigableMap<Long, String> pendingQueue = new ConcurrentSkipListMap<>();
    private final Map<String, Long> handedOut = new ConcurrentHashMap<>();
    private final Map<String, EmbeddingDocument> embeddingsById = new ConcurrentHashMap<>();
    private final Map<String, EmbeddingDocument> embeddingsByHash = new ConcurrentHashMap<>();
    private final MemoryIndex index = new MemoryIndex();
    private final AtomicLong pendingSeq = new AtomicLong();

    private final ReentrantLock[] stripes = new ReentrantLock[STRIPES];
    // Writers share it; snapshots and sync confirmations take it exclusively.
    private final ReentrantReadWriteLock maintenance = new ReentrantReadWriteLock();

    private final Wal wal;
    private final Snapshotter snaps;
    private final SnapshotPolicy snapPolicy;
    private final DocumentJson json;

    public DurableMemoryStore(Wal wal, Snapshotter snaps, SnapshotPolicy snapPolicy) {
        this(wal, snaps, snapPolicy, new DocumentJson());
    }

    public DurableMemoryStore(Wal wal, Snapshotter snaps, SnapshotPolicy snapPolicy, DocumentJson json) {
        this.wal = Objects.requireNonNull(wal, "wal");
        this.snaps = Objects.requireNonNull(snaps, "snaps");
        this.snapPolicy = Objects.requireNonNull(snapPolicy, "snapPolicy");
        this.json = Objects.requireNonNull(json, "json");
        for (int i = 0; i < STRIPES; i++) stripes[i] = new ReentrantLock();
        recover();
    }

    /** Store rooted at {@code dataDir}: WAL under "wal/", snapshots under "snapshots/". */
    public static DurableMemoryStore open(Path dataDir, int snapshotEvery) {
        var json = new DocumentJson();
        return new DurableMemoryStore(
                new FileWal(dataDir.resolve("wal"), DEFAULT_SEGMENT_BYTES),
                new FileSnapshotter(dataDir.resolve("snapshots"), json),
                new SnapshotPolicy(snapshotEvery),
                json);
    }

    // ---------------------------------------------------------------------
    // Writes
    // ---------------------------------------------------------------------

    @Override
    public String put(MemoryDocument doc) {
        if (doc == null) throw new ValidationException("document is null");
        var incoming = doc.copy();
        String id = incoming.id();

        boolean wrote = withIdLock(id, () -> mergeLocal(entries.get(id), incoming) != null);
        afterWrite(wrote);
        return id;
    }

    @Override
    public MemoryDocument update(String id, Consumer<MemoryDocument> mutator) {
        Objects.requireNonNull(mutator, "mutator");
        if (id == null) return null;

        var outcome = withIdLock(id, () -> {
            var existing = entries.get(id);
            if (existing == null) return null;
            var working = existing.doc().copy();
            mutator.accept(working);
            var next = mergeLocal(existing, working);
            return next == null ? new Outcome(existing, false) : new Outcome(next, true);
        });
        if (outcome == null) return null;
        afterWrite(outcome.wrote());
        return outcome.entry().view();
    }

    // Caller holds the id lock. Returns the new entry, or null when nothing changed.
    private StoredMemory mergeLocal(StoredMemory existing, MemoryDocument incoming) {
        var merged = existing == null ? incoming : existing.doc().merge(incoming);
        if (existing != null && merged.equals(existing.doc())) return null;

        long rev = existing == null ? 1 : existing.revision() + 1;
        var next = new StoredMemory(merged, rev, seqFor(existing), SyncStatus.PENDING);
        persist(WalRecordDto.memory(next.toDto()));
        apply(existing, next);
        return next;
    }

    @Override
    public MemoryDocument mergeRemote(MemoryDocument doc) {
        if (doc == null) throw new ValidationException("document is null");
        var incoming = doc.copy();
        String id = incoming.id();

        var outcome = withIdLock(id, () -> {
            var existing = entries.get(id);
            var merged = existing == null ? incoming : existing.doc().merge(incoming);
            boolean hubHasIt = merged.equals(incoming);
            boolean changed = existing == null || !merged.equals(existing.doc());

            SyncStatus status;
            if (hubHasIt) status = SyncStatus.SYNCED;
            else if (changed) status = SyncStatus.PENDING;
            else status = existing.status();

            if (!changed && existing.status() == status) return new Outcome(existing, false);

            long rev = existing == null ? 1 : changed ? existing.revision() + 1 : existing.revision();
            long seq = status == SyncStatus.PENDING ? seqFor(existing) : 0L;
            var next = new StoredMemory(merged, rev, seq, status);
            persist(WalRecordDto.memory(next.toDto()));
            apply(existing, next);
            return new Outcome(next, true);
        });
        afterWrite(outcome.wrote());
        return outcome.entry().view();
    }

    @Override
    public String putEmbedding(EmbeddingDocument embedding) {
        if (embedding == null) throw new ValidationException("embedding is null");
        String id = embedding.id();
        if (embeddingsById.containsKey(id)) return id;

        boolean wrote = withIdLock(id, () -> {
            if (embeddingsById.containsKey(id)) return false;
            persist(WalRecordDto.embedding(DocumentJson.toDto(embedding)));
            applyEmbedding(embedding);
            return true;
        });
        afterWrite(wrote);
        return id;
    }

    // ---------------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------------

    @Override
    public MemoryDocument get(String id) {
        if (id == null) return null;
        var entry = entries.get(id);
        return entry == null ? null : entry.view();
    }

    @Override
    public List<MemoryDocument> all() {
        return views(entries.keySet(), NEWEST_FIRST);
    }

    @Override
    public int count() { return entries.size(); }

    @Override
    public List<MemoryDocument> recent(int limit) {
        if (limit <= 0) return List.of();
        return all().stream().limit(limit).collect(Collectors.toList());
    }

    @Override
    public List<MemoryDocument> mostImportant(int limit) {
        if (limit <= 0) return List.of();
        return views(index.topByImportance(limit), null);
    }

    @Override
    public List<MemoryDocument> queryByType(MemoryType type) {
        return views(index.idsOfType(type), NEWEST_FIRST);
    }

    @Override
    public List<MemoryDocument> queryByTag(String tag) {
        return views(index.idsWithTag(tag), NEWEST_FIRST);
    }

    @Override
    public List<MemoryDocument> queryByImportance(double minImportance) {
        return views(index.idsByImportance(minImportance), null);
    }

    @Override
    public List<MemoryDocument> queryByContentHash(String contentHash) {
        return views(index.idsWithHash(contentHash), NEWEST_FIRST);
    }

    @Override
    public List<MemoryDocument> search(String query, int k) {
        if (k <= 0) return List.of();
        if (query == null || query.isBlank()) return recent(k);
        Set<String> terms = words(query);

        record Hit(MemoryDocument doc, int score) {}
        var hits = new ArrayList<Hit>();
        for (var entry : entries.values()) {
            var doc = entry.doc();
            var vocabulary = words(doc.content());
            for (String tag : doc.tags()) vocabulary.addAll(words(tag));
            int score = 0;
            for (String t : terms) if (vocabulary.contains(t)) score++;
            if (score > 0) hits.add(new Hit(entry.view(), score));
        }
        hits.sort(Comparator.comparingInt(Hit::score).reversed()
                .thenComparing(h -> h.doc().importance(), Comparator.reverseOrder())
                .thenComparing(Hit::doc, NEWEST_FIRST));
        return hits.stream().limit(k).map(Hit::doc).collect(Collectors.toList());
    }

    @Override
    public EmbeddingDocument getEmbeddingByHash(String contentHash) {
        return contentHash == null ? null : embeddingsByHash.get(contentHash);
    }

    @Override
    public EmbeddingDocument getEmbedding(String contentHash, String model) {
        if (contentHash == null || model == null) return null;
        return embeddingsById.get(EmbeddingDocument.idFor(contentHash, model));
    }

    @Override
    public List<EmbeddingDocument> embeddings() {
        return List.copyOf(embeddingsById.values());
    }

    // ---------------------------------------------------------------------
    // Sync bookkeeping
    // ---------------------------------------------------------------------

    @Override
    public List<MemoryDocument> getPendingSync(int batchSize) {
        if (batchSize <= 0) return List.of();
        var out = new ArrayList<MemoryDocument>(Math.min(batchSize, pendingQueue.size()));
        for (var e : pendingQueue.entrySet()) {
            if (out.size() >= batchSize) break;
            var entry = entries.get(e.getValue());
            // Skip queue slots a concurrent write has already moved.
            if (entry == null || entry.status() != SyncStatus.PENDING || entry.pendingSeq() != e.getKey()) continue;
            handedOut.put(entry.doc().id(), entry.revision());
            out.add(entry.view());
        }
        return out;
    }

    @Override
    public int markSynced(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) return 0;
        maintenance.writeLock().lock();
        try {
            var confirmed = new TreeMap<String, Long>();
            for (String id : new LinkedHashSet<>(ids)) {
                var entry = id == null ? null : entries.get(id);
                if (entry == null || entry.status() == SyncStatus.SYNCED) continue;
                Long handed = handedOut.get(id);
                if (handed != null && handed != entry.revision()) continue;
                confirmed.put(id, entry.revision());
            }
            if (confirmed.isEmpty()) return 0;

            // One record for the whole batch: either all flips survive a crash or none do.
            persist(WalRecordDto.synced(confirmed));
            confirmed.forEach(this::applySynced);
            return confirmed.size();
        } finally {
            maintenance.writeLock().unlock();
        }
    }

    @Override
    public SyncStatus syncStatus(String id) {
        var entry = id == null ? null : entries.get(id);
        return entry == null ? null : entry.status();
    }

    @Override
    public int pendingCount() {
        int n = 0;
        for (var e : entries.values()) if (e.status() == SyncStatus.PENDING) n++;
        return n;
    }

    // ---------------------------------------------------------------------
    // Snapshots and lifecycle
    // ---------------------------------------------------------------------

    /**
     * Write a snapshot of the whole store and drop the WAL records it covers.
     * Blocks writers for the duration.
     */
    public void checkpoint() {
        maintenance.writeLock().lock();
        try {
            var image = new Snapshotter.StoreImage(List.copyOf(entries.values()), List.copyOf(embeddingsById.values()));
            snaps.writeSnapshot(image);
            wal.truncate();
        } finally {
            maintenance.writeLock().unlock();
        }
    }

    @Override
    public void close() {
        wal.close();
    }

    private void recover() {
        var image = snaps.loadLatest();
        if (image != null) {
            for (var m : image.memories()) apply(entries.get(m.doc().id()), m);
            for (var e : image.embeddings()) applyEmbedding(e);
        }

        int replayed = 0;
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                replay(json.readRecord(payload));
                replayed++;
            }
        } catch (IOException | IllegalArgumentException e) {
            throw new StorageException("Recovery failed", e);
        }
        int records = replayed;
        log.info(() -> "Recovered " + entries.size() + " memories, " + embeddingsById.size()
                + " embeddings (" + records + " WAL records replayed, " + pendingCount() + " pending)");
    }

    private void replay(WalRecordDto rec) {
        if (rec == null || rec.type() == null) throw new StorageException("WAL record without type");
        switch (rec.type()) {
            case WalRecordDto.MEMORY -> {
                var stored = StoredMemory.fromDto(rec.memory());
                var existing = entries.get(stored.doc().id());
                if (existing != null && stored.revision() < existing.revision()) return;
                var doc = existing == null ? stored.doc() : existing.doc().merge(stored.doc());
                apply(existing, new StoredMemory(doc, stored.revision(), stored.pendingSeq(), stored.status()));
            }
            case WalRecordDto.EMBEDDING -> applyEmbedding(DocumentJson.fromDto(rec.embedding()));
            case WalRecordDto.SYNCED -> {
                if (rec.synced() == null) return;
                rec.synced().forEach((id, rev) -> {
                    var entry = entries.get(id);
                    if (entry != null && entry.revision() == rev && entry.status() == SyncStatus.PENDING) {
                        applySynced(id, rev);
                    }
                });
            }
            default -> throw new StorageException("Unknown WAL record type: " + rec.type());
        }
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private record Outcome(StoredMemory entry, boolean wrote) {}

    private <T> T withIdLock(String id, Supplier<T> body) {
        var stripe = stripes[(id.hashCode() & 0x7fffffff) % STRIPES];
        maintenance.readLock().lock();
        stripe.lock();
        try {
            return body.get();
        } finally {
            stripe.unlock();
            maintenance.readLock().unlock();
        }
    }

    /** A pending entry keeps its queue position; anything else joins at the back. */
    private long seqFor(StoredMemory existing) {
        if (existing != null && existing.status() == SyncStatus.PENDING) return existing.pendingSeq();
        return pendingSeq.incrementAndGet();
    }

    private void persist(WalRecordDto record) {
        byte[] payload;
        try {
            payload = json.writeRecord(record);
        } catch (IOException e) {
            throw new StorageException("Cannot encode WAL record", e);
        }
        wal.append(RecordCodec.frame(payload));
    }

    private void apply(StoredMemory existing, StoredMemory next) {
        String id = next.doc().id();
        entries.put(id, next);
        if (existing != null && existing.status() == SyncStatus.PENDING) {
            pendingQueue.remove(existing.pendingSeq(), id);
        }
        if (next.status() == SyncStatus.PENDING) {
            pendingQueue.put(next.pendingSeq(), id);
            pendingSeq.accumulateAndGet(next.pendingSeq(), Math::max);
        } else {
            handedOut.remove(id);
        }
        index.update(existing == null ? null : existing.doc(), next.doc());
    }

    private void applySynced(String id, long revision) {
        var entry = entries.get(id);
        apply(entry, new StoredMemory(entry.doc(), revision, 0L, SyncStatus.SYNCED));
    }

    private void applyEmbedding(EmbeddingDocument e) {
        if (embeddingsById.putIfAbsent(e.id(), e) == null) {
            embeddingsByHash.putIfAbsent(e.contentHash(), e);
        }
    }

    private void afterWrite(boolean wrote) {
        if (!wrote) return;
        wal.rotateIfNeeded();
        if (snapPolicy.recordWrite()) {
            try {
                checkpoint();
            } catch (StorageException e) {
                // The write itself is durable in the WAL; the next threshold retries the snapshot.
                log.log(Level.WARNING, "Snapshot failed", e);
            }
        }
    }

    private List<MemoryDocument> views(Collection<String> ids, Comparator<MemoryDocument> order) {
        var out = new ArrayList<MemoryDocument>(ids.size());
        for (String id : ids) {
            var entry = entries.get(id);
            if (entry != null) out.add(entry.view());
        }
        if (order != null) out.sort(order);
        return out;
    }

    private static Set<String> words(String text) {
        var out = new HashSet<String>();
        if (text == null) return out;
        for (String w : WORD_SPLIT.split(text.toLowerCase(Locale.ROOT))) {
            if (!w.isEmpty()) out.add(w);
        }
        return out;
    }
}
