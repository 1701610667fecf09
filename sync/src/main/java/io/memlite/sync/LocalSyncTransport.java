package io.memlite.sync;

import io.memlite.core.EmbeddingDocument;
import io.memlite.core.MemoryDocument;
import io.memlite.storage.MemoryStorage;
import io.memlite.storage.StorageException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * In-process hub: pushes merge straight into another {@link MemoryStorage},
 * pulls search it. Used when replicas share a JVM, and in tests.
 */
public final class LocalSyncTransport implements SyncTransport {

    private final MemoryStorage hub;

    public LocalSyncTransport(MemoryStorage hub) {
        this.hub = Objects.requireNonNull(hub, "hub");
    }

    @Override
    public boolean push(List<MemoryDocument> batch) {
        try {
            for (var doc : batch) hub.mergeRemote(doc);
            return true;
        } catch (StorageException e) {
            throw new SyncTransportException("Hub storage rejected push", e);
        }
    }

    @Override
    public List<MemoryDocument> pull(String query, int k) {
        try {
            return new ArrayList<>(hub.search(query, k));
        } catch (StorageException e) {
            throw new SyncTransportException("Hub storage failed on pull", e);
        }
    }

    @Override
    public void pushEmbeddings(List<EmbeddingDocument> embeddings) {
        try {
            for (var e : embeddings) hub.putEmbedding(e);
        } catch (StorageException e) {
            throw new SyncTransportException("Hub storage rejected embeddings", e);
        }
    }

    @Override
    public List<EmbeddingDocument> pullEmbeddings(Collection<String> contentHashes) {
        var out = new ArrayList<EmbeddingDocument>();
        for (String hash : contentHashes) {
            var e = hub.getEmbeddingByHash(hash);
            if (e != null) out.add(e);
        }
        return out;
    }
}
