package io.memlite.storage;

import io.memlite.core.EmbeddingDocument;

import java.util.List;

/**
 * Snapshot abstraction to bound recovery time.
 * <p>
 * A snapshot is a full copy of the store at some point in time.
 * On restart:
 *  - we load the latest snapshot, then
 *  - replay whatever the WAL still holds on top of it.
 */
public interface Snapshotter {

    /**
     * Persist a full copy of the store.
     *
     * @return snapshot identifier (file name)
     * @throws StorageException when the snapshot cannot be written
     */
    String writeSnapshot(StoreImage image);

    /** Load the latest snapshot, or null when none exists. */
    StoreImage loadLatest();

    /** Everything a store needs to restart. */
    record StoreImage(List<StoredMemory> memories, List<EmbeddingDocument> embeddings) {}
}
