package io.memlite.server;

import io.memlite.core.ContentHash;
import io.memlite.core.EmbeddingDocument;
import io.memlite.core.MemoryDocument;
import io.memlite.core.MemoryType;
import io.memlite.core.ValidationException;
import io.memlite.storage.MemoryStorage;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-replica memory engine used by the HTTP layer.
 * <p>
 * Responsibilities:
 *  - Mint new documents for this instance and keep their embeddings in storage.
 *  - Apply partial updates as local CRDT mutations under the store's per-id lock.
 *  - Recall by embedding similarity, falling back to text search.
 *  - Serve the hub side of the sync contract: merge pushed batches, answer pulls, keep
 *    and hand out embeddings.
 * <p>
 * All writes stamp this replica's instance id as the writer.
 */
public final class MemoryService {
    private static final Logger log = Logger.getLogger(MemoryService.class.getName());

    static final int MAX_EMBEDDING_HASHES = 1_000;

    private final MemoryStorage storage;
    private final String instanceId;
    private final EmbeddingProvider embeddings; // null when no model is configured
    private final String embeddingModel;
    private final double promotionThreshold;

    public MemoryService(MemoryStorage storage, String instanceId) {
        this(storage, instanceId, null, ReplicaConfig.DEFAULT_EMBEDDING_MODEL, ReplicaConfig.DEFAULT_PROMOTION_THRESHOLD);
    }

    public MemoryService(MemoryStorage storage,
                         String instanceId,
                         EmbeddingProvider embeddings,
                         String embeddingModel,
                         double promotionThreshold) {
        if (instanceId == null || instanceId.isBlank()) throw new ValidationException("instanceId must not be blank");
        if (promotionThreshold < 0.0 || promotionThreshold > 1.0) {
            throw new ValidationException("promotionThreshold must be in [0, 1]");
        }
        this.storage = Objects.requireNonNull(storage, "storage");
        this.instanceId = instanceId;
        this.embeddings = embeddings;
        this.embeddingModel = Objects.requireNonNull(embeddingModel, "embeddingModel");
        this.promotionThreshold = promotionThreshold;
    }

    public String instanceId() { return instanceId; }

    /**
     * Store a new memory authored by this instance.
     *
     * @param type       null means episodic
     * @param importance null keeps the default score
     * @param confidence null keeps the default score
     * @return the stored document
     * @throws ValidationException on blank content or scores outside [0, 1]
     */
    public MemoryDocument learn(String content,
                                MemoryType type,
                                Double importance,
                                Double confidence,
                                Collection<String> tags,
                                Collection<String> related,
                                Collection<String> evidence) {
        if (content == null || content.isBlank()) throw new ValidationException("content must not be blank");

        var doc = MemoryDocument.create(UUID.randomUUID().toString(), content, type, instanceId);
        if (importance != null) doc.setImportance(importance, instanceId);
        if (confidence != null) doc.setConfidence(confidence, instanceId);
        if (tags != null) for (String t : tags) doc.addTag(t, instanceId);
        if (related != null) for (String r : related) doc.addRelated(r, instanceId);
        if (evidence != null) for (String e : evidence) doc.addEvidence(e, instanceId);
        String embeddingRef = ensureEmbedding(doc.id(), doc.content());
        if (embeddingRef != null) doc.setEmbeddingRef(embeddingRef, instanceId);

        storage.put(doc);
        log.fine(() -> "Learned " + doc.id() + " (" + doc.memoryType().wireName() + ")");
        return storage.get(doc.id());
    }

    /**
     * Apply a partial update to an existing memory. The mutation runs against the stored
     * state under the store's per-id lock, so concurrent updates of one memory compose.
     *
     * @throws MemoryNotFoundException when the id is unknown
     */
    public MemoryDocument update(String id, MemoryUpdate update) {
        Objects.requireNonNull(update, "update");
        var current = get(id);
        if (update.isEmpty()) return current;

        String content = update.content();
        if (content != null && content.isBlank()) throw new ValidationException("content must not be blank");
        // Embedding calls may be slow; make them before taking the lock.
        String embeddingRef = content != null && !content.equals(current.content())
                ? ensureEmbedding(id, content) : null;

        var updated = storage.update(id, doc -> {
            if (content != null && !content.equals(doc.content())) {
                doc.setContent(content, instanceId);
                if (embeddingRef != null) doc.setEmbeddingRef(embeddingRef, instanceId);
            }
            if (update.importance() != null) doc.setImportance(update.importance(), instanceId);
            if (update.confidence() != null) doc.setConfidence(update.confidence(), instanceId);
            for (String t : update.addTags()) doc.addTag(t, instanceId);
            for (String t : update.removeTags()) doc.removeTag(t, instanceId);
            for (String r : update.addRelated()) doc.addRelated(r, instanceId);
            for (String e : update.addEvidence()) doc.addEvidence(e, instanceId);
        });
        if (updated == null) throw new MemoryNotFoundException(id);
        return updated;
    }

    /** Count one access of {@code id} by this instance. */
    public MemoryDocument recordAccess(String id) {
        if (id == null || id.isBlank()) throw new ValidationException("id must not be empty");
        var updated = storage.update(id, doc -> doc.recordAccess(instanceId));
        if (updated == null) throw new MemoryNotFoundException(id);
        return updated;
    }

    /** @throws MemoryNotFoundException when the id is unknown */
    public MemoryDocument get(String id) {
        if (id == null || id.isBlank()) throw new ValidationException("id must not be empty");
        var doc = storage.get(id);
        if (doc == null) throw new MemoryNotFoundException(id);
        return doc;
    }

    /**
     * Up to {@code k} memories most similar to {@code query}.
     * Uses cosine similarity over stored embeddings when a provider is configured and at
     * least one memory has a usable embedding; otherwise plain text search.
     */
    public List<MemoryDocument> recall(String query, int k) {
        if (k <= 0) throw new ValidationException("k must be > 0");
        if (embeddings == null || query == null || query.isBlank()) return storage.search(query, k);

        float[] probe;
        try {
            probe = embeddings.embed(query, embeddingModel);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Embedding provider failed; falling back to text search", e);
            return storage.search(query, k);
        }

        record Scored(MemoryDocument doc, double score) {}
        var scored = new ArrayList<Scored>();
        for (var doc : storage.all()) {
            String ref = doc.embeddingRef();
            if (ref == null) continue;
            var emb = storage.getEmbedding(ref, embeddingModel);
            if (emb == null || emb.dimensions() != probe.length) continue;
            scored.add(new Scored(doc, emb.cosineSimilarity(probe)));
        }
        if (scored.isEmpty()) return storage.search(query, k);

        scored.sort(Comparator.comparingDouble(Scored::score).reversed()
                .thenComparing(s -> s.doc().id()));
        var out = new ArrayList<MemoryDocument>(Math.min(k, scored.size()));
        for (int i = 0; i < scored.size() && i < k; i++) out.add(scored.get(i).doc());
        return out;
    }

    /**
     * Filtered listing. Filters combine with AND; with no filter the newest memories come back.
     *
     * @param limit maximum number of results, must be positive
     */
    public List<MemoryDocument> list(MemoryType type, String tag, Double minImportance, int limit) {
        if (limit <= 0) throw new ValidationException("k must be > 0");
        if (minImportance != null && (minImportance < 0.0 || minImportance > 1.0)) {
            throw new ValidationException("minImportance must be in [0, 1]");
        }
        List<MemoryDocument> base;
        if (type != null) base = storage.queryByType(type);
        else if (tag != null) base = storage.queryByTag(tag);
        else if (minImportance != null) base = storage.queryByImportance(minImportance);
        else return storage.recent(limit);

        var out = new ArrayList<MemoryDocument>();
        for (var doc : base) {
            if (out.size() >= limit) break;
            if (tag != null && !doc.tags().contains(tag)) continue;
            if (minImportance != null && doc.importance() < minImportance) continue;
            out.add(doc);
        }
        return out;
    }

    /** Memories important enough to be considered for long-term promotion. */
    public List<MemoryDocument> promotionCandidates() {
        return storage.queryByImportance(promotionThreshold);
    }

    // ---------- hub side of sync ----------

    /** Merge a pushed batch; returns how many documents were merged. */
    public int acceptPush(List<MemoryDocument> batch) {
        for (var doc : batch) storage.mergeRemote(doc);
        log.fine(() -> "Accepted push of " + batch.size() + " documents");
        return batch.size();
    }

    public List<MemoryDocument> servePull(String query, int k) {
        if (k <= 0) throw new ValidationException("k must be > 0");
        return storage.search(query, k);
    }

    /** Hub side: keep pushed embeddings. Ones already stored are left as they are. */
    public int acceptEmbeddings(List<EmbeddingDocument> pushed) {
        for (var e : pushed) storage.putEmbedding(e);
        log.fine(() -> "Accepted " + pushed.size() + " embeddings");
        return pushed.size();
    }

    /** Hub side: stored embeddings of the given content hashes; unknown hashes are skipped. */
    public List<EmbeddingDocument> serveEmbeddings(Collection<String> contentHashes) {
        if (contentHashes.size() > MAX_EMBEDDING_HASHES) {
            throw new ValidationException("at most " + MAX_EMBEDDING_HASHES + " hashes per request");
        }
        var out = new ArrayList<EmbeddingDocument>();
        for (String hash : new LinkedHashSet<>(contentHashes)) {
            var e = storage.getEmbeddingByHash(hash);
            if (e != null) out.add(e);
        }
        return out;
    }

    public int count() { return storage.count(); }

    public int pendingCount() { return storage.pendingCount(); }

    // ---------- internals ----------

    // Content hash of a stored embedding for content, or null when none could be made.
    private String ensureEmbedding(String memoryId, String content) {
        if (embeddings == null) return null;
        String hash = ContentHash.sha256(content);
        try {
            if (storage.getEmbedding(hash, embeddingModel) == null) {
                float[] vector = embeddings.embed(content, embeddingModel);
                storage.putEmbedding(new EmbeddingDocument(hash, vector, embeddingModel, System.currentTimeMillis()));
            }
            return hash;
        } catch (RuntimeException e) {
            // Stored without an embedding; recall falls back to text search for it.
            log.log(Level.WARNING, "Embedding failed for " + memoryId, e);
            return null;
        }
    }
}
