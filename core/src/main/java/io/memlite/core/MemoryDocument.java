package io.memlite.core;

import io.memlite.core.crdt.GCounter;
import io.memlite.core.crdt.GSet;
import io.memlite.core.crdt.LWWNumericRegister;
import io.memlite.core.crdt.LWWRegister;
import io.memlite.core.crdt.Mergeable;
import io.memlite.core.crdt.ORSet;
import io.memlite.core.crdt.OrTag;
import io.memlite.core.crdt.VectorClock;

import java.util.Comparator;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A single memory entry, composed of CRDT fields so that any two replicas holding
 * copies of it converge after exchanging state.
 * <p>
 * Field kinds:
 *  - identity (id, type, createdAt, sourceInstance): fixed at creation,
 *  - content, lastAccessed, embeddingRef: LWW registers,
 *  - importance, confidence: numeric LWW registers,
 *  - tags: observed-remove set; related, parents, evidence: grow-only sets,
 *  - accessCount: grow-only counter,
 *  - vectorClock: ticked by the writer of every local mutation.
 * <p>
 * Local mutators are synchronized on the instance. {@link #merge(MemoryDocument)} is pure
 * and returns a new document. {@code version} and {@code syncStatus} are local bookkeeping
 * and take no part in equality.
 */
public final class MemoryDocument implements Mergeable<MemoryDocument> {

    public static final double DEFAULT_SCORE = 0.5;

    private static final Comparator<MemoryDocument> ORIGIN_ORDER =
            Comparator.<MemoryDocument>comparingLong(d -> d.createdAt)
                    .thenComparing(d -> d.sourceInstance)
                    .thenComparing(d -> d.memoryType);

    private static final AtomicLong TAG_COUNTER = new AtomicLong();

    private final String id;
    private final MemoryType memoryType;
    private final long createdAt;
    private final String sourceInstance;

    private LWWRegister<String> content;
    private ORSet<String> tags;
    private GSet<String> related;
    private GSet<String> parents;
    private GSet<String> evidence;
    private LWWNumericRegister importance;
    private LWWNumericRegister confidence;
    private GCounter accessCount;
    private LWWRegister<Long> lastAccessed;
    private LWWRegister<String> embeddingRef;
    private VectorClock vectorClock;
    private long version;
    private volatile SyncStatus syncStatus = SyncStatus.PENDING;

    private MemoryDocument(Builder b) {
        this.id = b.id;
        this.memoryType = b.memoryType;
        this.createdAt = b.createdAt;
        this.sourceInstance = b.sourceInstance;
        this.content = b.content;
        this.tags = b.tags;
        this.related = b.related;
        this.parents = b.parents;
        this.evidence = b.evidence;
        this.importance = b.importance;
        this.confidence = b.confidence;
        this.accessCount = b.accessCount;
        this.lastAccessed = b.lastAccessed;
        this.embeddingRef = b.embeddingRef;
        this.vectorClock = b.vectorClock;
        this.version = b.version;
        this.syncStatus = b.syncStatus;
    }

    public static MemoryDocument create(String id, String content, MemoryType type, String sourceInstance) {
        return create(id, content, type, sourceInstance, System.currentTimeMillis());
    }

    /**
     * New document authored by {@code sourceInstance} at {@code timestampMillis}.
     * The initial content write counts as the first mutation of the creator.
     */
    public static MemoryDocument create(String id, String content, MemoryType type,
                                        String sourceInstance, long timestampMillis) {
        requireId(id, "id");
        requireId(sourceInstance, "sourceInstance");
        return builder(id, type == null ? MemoryType.EPISODIC : type, timestampMillis, sourceInstance)
                .content(new LWWRegister<>(content == null ? "" : content, timestampMillis, sourceInstance))
                .vectorClock(VectorClock.empty().tick(sourceInstance))
                .version(1)
                .build();
    }

    public static Builder builder(String id, MemoryType type, long createdAt, String sourceInstance) {
        return new Builder(id, type, createdAt, sourceInstance);
    }

    // ---- identity ----

    public String id() { return id; }

    public MemoryType memoryType() { return memoryType; }

    public long createdAt() { return createdAt; }

    public String sourceInstance() { return sourceInstance; }

    // ---- CRDT state ----

    public synchronized LWWRegister<String> contentRegister() { return content; }

    public synchronized String content() { return content.value() == null ? "" : content.value(); }

    /** SHA-256 hex of the current content. */
    public String contentHash() { return ContentHash.sha256(content()); }

    public synchronized ORSet<String> tagSet() { return tags; }

    public synchronized Set<String> tags() { return tags.elements(); }

    public synchronized GSet<String> related() { return related; }

    public synchronized GSet<String> parents() { return parents; }

    public synchronized GSet<String> evidence() { return evidence; }

    public synchronized LWWNumericRegister importanceRegister() { return importance; }

    public synchronized double importance() { return importance.value(); }

    public synchronized LWWNumericRegister confidenceRegister() { return confidence; }

    public synchronized double confidence() { return confidence.value(); }

    public synchronized GCounter accessCounter() { return accessCount; }

    public synchronized long accessCount() { return accessCount.value(); }

    public synchronized LWWRegister<Long> lastAccessedRegister() { return lastAccessed; }

    /** Epoch millis of the last recorded access, 0 when never accessed. */
    public synchronized long lastAccessed() {
        return lastAccessed.value() == null ? 0L : lastAccessed.value();
    }

    public synchronized LWWRegister<String> embeddingRefRegister() { return embeddingRef; }

    /** Content hash of the attached embedding, or null. */
    public synchronized String embeddingRef() { return embeddingRef.value(); }

    public synchronized VectorClock vectorClock() { return vectorClock; }

    public synchronized long version() { return version; }

    /** Latest timestamp carried by any register, never earlier than {@code createdAt}. */
    public synchronized long updatedAt() {
        long t = createdAt;
        t = Math.max(t, content.timestamp());
        t = Math.max(t, importance.timestamp());
        t = Math.max(t, confidence.timestamp());
        t = Math.max(t, lastAccessed.timestamp());
        t = Math.max(t, embeddingRef.timestamp());
        return t;
    }

    public SyncStatus syncStatus() { return syncStatus; }

    /** Local-only flag, set by storage. */
    public void setSyncStatus(SyncStatus status) {
        this.syncStatus = Objects.requireNonNull(status, "status");
    }

    // ---- local mutators ----

    public synchronized void setContent(String value, String writer) {
        setContent(value, stamp(content.timestamp()), writer);
    }

    public synchronized void setContent(String value, long timestamp, String writer) {
        requireId(writer, "writer");
        var next = content.set(value == null ? "" : value, timestamp, writer);
        if (next.equals(content)) return;
        content = next;
        touched(writer);
    }

    public synchronized void setImportance(double value, String writer) {
        setImportance(value, stamp(importance.timestamp()), writer);
    }

    public synchronized void setImportance(double value, long timestamp, String writer) {
        requireId(writer, "writer");
        var next = importance.set(requireScore(value, "importance"), timestamp, writer);
        if (next.equals(importance)) return;
        importance = next;
        touched(writer);
    }

    public synchronized void setConfidence(double value, String writer) {
        setConfidence(value, stamp(confidence.timestamp()), writer);
    }

    public synchronized void setConfidence(double value, long timestamp, String writer) {
        requireId(writer, "writer");
        var next = confidence.set(requireScore(value, "confidence"), timestamp, writer);
        if (next.equals(confidence)) return;
        confidence = next;
        touched(writer);
    }

    public synchronized void setEmbeddingRef(String contentHash, String writer) {
        setEmbeddingRef(contentHash, stamp(embeddingRef.timestamp()), writer);
    }

    public synchronized void setEmbeddingRef(String contentHash, long timestamp, String writer) {
        requireId(writer, "writer");
        var next = embeddingRef.set(contentHash, timestamp, writer);
        if (next.equals(embeddingRef)) return;
        embeddingRef = next;
        touched(writer);
    }

    /**
     * Add a tag under a fresh tag id minted for {@code writer}; returns that id.
     * Ids are unique across all copies of this document held by the process.
     */
    public synchronized OrTag addTag(String tag, String writer) {
        requireId(writer, "writer");
        requireId(tag, "tag");
        var minted = new OrTag(writer, nextTagCounter(tags.nextTag(writer).counter()));
        tags = tags.add(tag, minted);
        touched(writer);
        return minted;
    }

    /**
     * Remove every occurrence of {@code tag} this replica has observed.
     * Returns false when the tag was not present.
     */
    public synchronized boolean removeTag(String tag, String writer) {
        requireId(writer, "writer");
        if (!tags.contains(tag)) return false;
        tags = tags.removeAll(tag);
        touched(writer);
        return true;
    }

    public synchronized void addRelated(String memoryId, String writer) {
        requireId(writer, "writer");
        related = related.add(requireId(memoryId, "related id"));
        touched(writer);
    }

    public synchronized void addParent(String memoryId, String writer) {
        requireId(writer, "writer");
        parents = parents.add(requireId(memoryId, "parent id"));
        touched(writer);
    }

    public synchronized void addEvidence(String evidenceRef, String writer) {
        requireId(writer, "writer");
        evidence = evidence.add(requireId(evidenceRef, "evidence"));
        touched(writer);
    }

    public synchronized void recordAccess(String writer) {
        recordAccess(stamp(lastAccessed.timestamp()), writer);
    }

    public synchronized void recordAccess(long timestamp, String writer) {
        requireId(writer, "writer");
        accessCount = accessCount.increment(writer);
        lastAccessed = lastAccessed.set(timestamp, timestamp, writer);
        touched(writer);
    }

    private void touched(String writer) {
        vectorClock = vectorClock.tick(writer);
        version++;
    }

    // Strictly increasing per process and seeded from wall-clock micros, so counters
    // also keep growing across restarts.
    private static long nextTagCounter(long floor) {
        long micros = System.currentTimeMillis() * 1000L;
        return TAG_COUNTER.updateAndGet(prev -> Math.max(Math.max(prev + 1, micros), floor));
    }

    // Local writes must supersede anything this replica has already observed.
    private static long stamp(long registerTimestamp) {
        return Math.max(System.currentTimeMillis(), registerTimestamp + 1);
    }

    // ---- merge ----

    /**
     * Field-wise CRDT merge. Pure: neither input is modified.
     *
     * @throws ValidationException when the ids differ
     */
    @Override
    public MemoryDocument merge(MemoryDocument other) {
        if (!id.equals(other.id)) {
            throw new ValidationException("cannot merge " + id + " with " + other.id);
        }
        var a = this.copy();
        var b = other.copy();
        // Identity of the earliest creation wins.
        var origin = ORIGIN_ORDER.compare(a, b) <= 0 ? a : b;

        return builder(id, origin.memoryType, origin.createdAt, origin.sourceInstance)
                .content(a.content.merge(b.content))
                .tags(a.tags.merge(b.tags))
                .related(a.related.merge(b.related))
                .parents(a.parents.merge(b.parents))
                .evidence(a.evidence.merge(b.evidence))
                .importance(a.importance.merge(b.importance))
                .confidence(a.confidence.merge(b.confidence))
                .accessCount(a.accessCount.merge(b.accessCount))
                .lastAccessed(a.lastAccessed.merge(b.lastAccessed))
                .embeddingRef(a.embeddingRef.merge(b.embeddingRef))
                .vectorClock(a.vectorClock.merge(b.vectorClock))
                .version(Math.max(a.version, b.version))
                .build();
    }

    /** Independent instance with identical state, version and sync status. */
    public synchronized MemoryDocument copy() {
        return builder(id, memoryType, createdAt, sourceInstance)
                .content(content)
                .tags(tags)
                .related(related)
                .parents(parents)
                .evidence(evidence)
                .importance(importance)
                .confidence(confidence)
                .accessCount(accessCount)
                .lastAccessed(lastAccessed)
                .embeddingRef(embeddingRef)
                .vectorClock(vectorClock)
                .version(version)
                .syncStatus(syncStatus)
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MemoryDocument)) return false;
        // Compare detached copies so two monitors are never held at once.
        var a = this.copy();
        var b = ((MemoryDocument) o).copy();
        return a.id.equals(b.id)
                && a.memoryType == b.memoryType
                && a.createdAt == b.createdAt
                && a.sourceInstance.equals(b.sourceInstance)
                && a.content.equals(b.content)
                && a.tags.equals(b.tags)
                && a.related.equals(b.related)
                && a.parents.equals(b.parents)
                && a.evidence.equals(b.evidence)
                && a.importance.equals(b.importance)
                && a.confidence.equals(b.confidence)
                && a.accessCount.equals(b.accessCount)
                && a.lastAccessed.equals(b.lastAccessed)
                && a.embeddingRef.equals(b.embeddingRef)
                && a.vectorClock.equals(b.vectorClock);
    }

    @Override
    public synchronized int hashCode() {
        return Objects.hash(id, memoryType, createdAt, sourceInstance, content, tags, related, parents,
                evidence, importance, confidence, accessCount, lastAccessed, embeddingRef, vectorClock);
    }

    @Override
    public synchronized String toString() {
        return "MemoryDocument(id=" + id + ", type=" + memoryType.wireName() + ", tags=" + tags.elements()
                + ", importance=" + importance.value() + ", clock=" + vectorClock + ")";
    }

    private static String requireId(String value, String what) {
        if (value == null || value.isBlank()) throw new ValidationException(what + " must not be blank");
        return value;
    }

    private static double requireScore(double value, String what) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new ValidationException(what + " must be within [0, 1]: " + value);
        }
        return value;
    }

    /**
     * Assembles a document from raw CRDT state. Used by codecs and by merge.
     * Unset fields start empty; importance and confidence start at {@link #DEFAULT_SCORE}.
     */
    public static final class Builder {
        private final String id;
        private final MemoryType memoryType;
        private final long createdAt;
        private final String sourceInstance;

        private LWWRegister<String> content = LWWRegister.empty();
        private ORSet<String> tags = ORSet.empty();
        private GSet<String> related = GSet.empty();
        private GSet<String> parents = GSet.empty();
        private GSet<String> evidence = GSet.empty();
        private LWWNumericRegister importance = LWWNumericRegister.initial(DEFAULT_SCORE);
        private LWWNumericRegister confidence = LWWNumericRegister.initial(DEFAULT_SCORE);
        private GCounter accessCount = GCounter.empty();
        private LWWRegister<Long> lastAccessed = LWWRegister.empty();
        private LWWRegister<String> embeddingRef = LWWRegister.empty();
        private VectorClock vectorClock = VectorClock.empty();
        private long version;
        private SyncStatus syncStatus = SyncStatus.PENDING;

        private Builder(String id, MemoryType memoryType, long createdAt, String sourceInstance) {
            this.id = requireId(id, "id");
            this.memoryType = memoryType == null ? MemoryType.EPISODIC : memoryType;
            this.createdAt = createdAt;
            this.sourceInstance = requireId(sourceInstance, "sourceInstance");
        }

        public Builder content(LWWRegister<String> v) { this.content = Objects.requireNonNull(v); return this; }
        public Builder tags(ORSet<String> v) { this.tags = Objects.requireNonNull(v); return this; }
        public Builder related(GSet<String> v) { this.related = Objects.requireNonNull(v); return this; }
        public Builder parents(GSet<String> v) { this.parents = Objects.requireNonNull(v); return this; }
        public Builder evidence(GSet<String> v) { this.evidence = Objects.requireNonNull(v); return this; }
        public Builder importance(LWWNumericRegister v) { this.importance = Objects.requireNonNull(v); return this; }
        public Builder confidence(LWWNumericRegister v) { this.confidence = Objects.requireNonNull(v); return this; }
        public Builder accessCount(GCounter v) { this.accessCount = Objects.requireNonNull(v); return this; }
        public Builder lastAccessed(LWWRegister<Long> v) { this.lastAccessed = Objects.requireNonNull(v); return this; }
        public Builder embeddingRef(LWWRegister<String> v) { this.embeddingRef = Objects.requireNonNull(v); return this; }
        public Builder vectorClock(VectorClock v) { this.vectorClock = Objects.requireNonNull(v); return this; }
        public Builder version(long v) { this.version = v; return this; }
        public Builder syncStatus(SyncStatus v) { this.syncStatus = Objects.requireNonNull(v); return this; }

        public MemoryDocument build() { return new MemoryDocument(this); }
    }
}
