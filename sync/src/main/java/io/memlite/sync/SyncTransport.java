package io.memlite.sync;

import io.memlite.core.EmbeddingDocument;
import io.memlite.core.MemoryDocument;

import java.util.Collection;
import java.util.List;

/**
 * Connection to the hub that replicas synchronize through.
 * <p>
 * Documents always travel as full CRDT state, so delivering one twice or out of
 * order is harmless on either side. Embeddings are content addressed and never merged;
 * a transport that does not carry them keeps the default no-op embedding methods.
 */
public interface SyncTransport {

    /**
     * Send a batch to the hub.
     *
     * @return true when the hub confirmed it has merged the whole batch
     * @throws SyncTransportException on network or protocol failure
     */
    boolean push(List<MemoryDocument> batch);

    /**
     * Fetch up to {@code k} documents relevant to {@code query} (blank: most recent).
     *
     * @throws SyncTransportException on network or protocol failure
     */
    List<MemoryDocument> pull(String query, int k);

    /**
     * Send embeddings referenced by documents about to be pushed. The hub keeps the first
     * copy of each, so resending is harmless.
     *
     * @throws SyncTransportException on network or protocol failure
     */
    default void pushEmbeddings(List<EmbeddingDocument> embeddings) {
    }

    /**
     * Fetch the hub's embeddings of the given content hashes. Hashes the hub does not
     * know are skipped.
     *
     * @throws SyncTransportException on network or protocol failure
     */
    default List<EmbeddingDocument> pullEmbeddings(Collection<String> contentHashes) {
        return List.of();
    }
}
