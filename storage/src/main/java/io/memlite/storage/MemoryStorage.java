package io.memlite.storage;

import io.memlite.core.EmbeddingDocument;
import io.memlite.core.MemoryDocument;
import io.memlite.core.MemoryType;
import io.memlite.core.SyncStatus;

import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;

/**
 * Local persistent store of memory documents.
 * <p>
 * Every write is read-merge-write: the incoming document is CRDT-merged into the stored
 * one with the same id, so writes commute and repeating one is harmless. Documents handed
 * out are copies; mutating them has no effect until they are put back.
 * <p>
 * Implementations must be safe for concurrent use.
 */
public interface MemoryStorage extends AutoCloseable {

    /**
     * Merge {@code doc} into the stored document with the same id and mark the result pending.
     * A put that does not change the stored state is a no-op.
     *
     * @return the document id
     * @throws StorageException when the change cannot be made durable
     */
    String put(MemoryDocument doc);

    /**
     * Apply {@code mutator} to a copy of the stored document and merge the result back,
     * atomically with respect to other writes of the same id.
     *
     * @return copy of the updated document, or null when the id is unknown
     * @throws StorageException when the change cannot be made durable
     */
    MemoryDocument update(String id, Consumer<MemoryDocument> mutator);

    /**
     * Merge a document received from the hub. The result is synced when it equals what
     * the hub sent, pending when local state added something the hub has not seen.
     *
     * @return copy of the merged document
     */
    MemoryDocument mergeRemote(MemoryDocument doc);

    /** Copy of the stored document, or null. */
    MemoryDocument get(String id);

    List<MemoryDocument> all();

    int count();

    /** Most recently updated first. */
    List<MemoryDocument> recent(int limit);

    /** Highest importance first. */
    List<MemoryDocument> mostImportant(int limit);

    /** Newest first. */
    List<MemoryDocument> queryByType(MemoryType type);

    /** Newest first. */
    List<MemoryDocument> queryByTag(String tag);

    /** Documents with importance >= {@code minImportance}, highest first. */
    List<MemoryDocument> queryByImportance(double minImportance);

    List<MemoryDocument> queryByContentHash(String contentHash);

    /**
     * Word-overlap search over content and tags; ties by importance, then recency.
     * A blank query returns the {@code k} most recent documents.
     */
    List<MemoryDocument> search(String query, int k);

    /** Store an embedding. Content addressed: the first write for an id wins. */
    String putEmbedding(EmbeddingDocument embedding);

    /** Any embedding of the given content, or null. */
    EmbeddingDocument getEmbeddingByHash(String contentHash);

    EmbeddingDocument getEmbedding(String contentHash, String model);

    List<EmbeddingDocument> embeddings();

    /**
     * Up to {@code batchSize} pending documents, in the order they became pending.
     * The store remembers which revision of each it handed out.
     */
    List<MemoryDocument> getPendingSync(int batchSize);

    /**
     * Mark documents synced, but only those still at the revision last handed out by
     * {@link #getPendingSync(int)}. Idempotent.
     *
     * @return number of documents that flipped to synced
     */
    int markSynced(Collection<String> ids);

    /** Local sync status, or null for an unknown id. */
    SyncStatus syncStatus(String id);

    int pendingCount();

    @Override
    void close();
}
