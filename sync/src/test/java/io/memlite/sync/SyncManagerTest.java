package io.memlite.sync;

import io.memlite.core.ContentHash;
import io.memlite.core.EmbeddingDocument;
import io.memlite.core.MemoryDocument;
import io.memlite.core.MemoryType;
import io.memlite.core.SyncStatus;
import io.memlite.storage.DurableMemoryStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SyncManagerTest {

    @TempDir Path dir;
    private DurableMemoryStore local;
    private DurableMemoryStore hub;

    @BeforeEach
    void open() {
        local = DurableMemoryStore.open(dir.resolve("local"), 10_000);
        hub = DurableMemoryStore.open(dir.resolve("hub"), 10_000);
    }

    @AfterEach
    void close() {
        local.close();
        hub.close();
    }

    /** Transport that records pushes and fails while {@code failuresLeft} > 0. */
    static final class ScriptedTransport implements SyncTransport {
        final List<List<MemoryDocument>> pushes = new ArrayList<>();
        final AtomicInteger failuresLeft = new AtomicInteger();
        boolean refuse;

        @Override
        public synchronized boolean push(List<MemoryDocument> batch) {
            if (failuresLeft.getAndDecrement() > 0) throw new SyncTransportException("hub unreachable");
            pushes.add(batch);
            return !refuse;
        }

        @Override
        public List<MemoryDocument> pull(String query, int k) {
            throw new SyncTransportException("hub unreachable");
        }
    }

    private static MemoryDocument doc(String id, long ts) {
        return MemoryDocument.create(id, "content " + id, MemoryType.EPISODIC, "r1", ts);
    }

    /** Document whose embedding is stored in {@code store}. */
    private static MemoryDocument embedded(DurableMemoryStore store, String id) {
        var d = doc(id, 1_000);
        var embedding = EmbeddingDocument.forContent(d.content(), new float[]{0.6f, 0.8f}, "toy");
        store.putEmbedding(embedding);
        d.setEmbeddingRef(embedding.contentHash(), 1_001, "r1");
        store.put(d);
        return d;
    }

    @Test
    void sync_pushes_pending_and_marks_them_synced() {
        local.put(doc("a", 1_000));
        local.put(doc("b", 2_000));
        var manager = new SyncManager(local, new LocalSyncTransport(hub), 100);

        var result = manager.sync();

        assertTrue(result.success());
        assertEquals(2, result.pushedCount());
        assertEquals(2, result.syncedCount());
        assertEquals(SyncStatus.SYNCED, local.syncStatus("a"));
        assertEquals(local.get("a"), hub.get("a"));
        assertEquals(2, manager.stats().totalSynced());
        assertEquals(0, manager.stats().lastPendingCount());
    }

    @Test
    void second_sync_without_new_writes_pushes_nothing() {
        local.put(doc("a", 1_000));
        var transport = new ScriptedTransport();
        var manager = new SyncManager(local, transport, 100);

        manager.sync();
        var second = manager.sync();

        assertTrue(second.success());
        assertEquals(0, second.pushedCount());
        assertEquals(1, transport.pushes.size());
    }

    @Test
    void batches_are_limited_to_batch_size() {
        for (int i = 0; i < 5; i++) local.put(doc("m" + i, 1_000 + i));
        var transport = new ScriptedTransport();
        var manager = new SyncManager(local, transport, 2);

        manager.sync();
        assertEquals(2, transport.pushes.get(0).size());
        assertEquals(3, local.pendingCount());
        manager.sync();
        manager.sync();
        assertEquals(0, local.pendingCount());
    }

    @Test
    void failed_push_leaves_documents_pending() {
        local.put(doc("a", 1_000));
        var transport = new ScriptedTransport();
        transport.failuresLeft.set(2);
        var manager = new SyncManager(local, transport, 100);

        var r1 = manager.sync();
        var r2 = manager.sync();

        assertFalse(r1.success());
        assertEquals(1, r1.failedCount());
        assertFalse(r2.errors().isEmpty());
        assertEquals(SyncStatus.PENDING, local.syncStatus("a"));
        assertEquals(2, manager.stats().consecutiveFailures());
        assertEquals(2, manager.stats().totalFailed());

        assertTrue(manager.sync().success());
        assertEquals(SyncStatus.SYNCED, local.syncStatus("a"));
        assertEquals(0, manager.stats().consecutiveFailures());
    }

    @Test
    void unexpected_transport_error_counts_as_a_failed_cycle() {
        local.put(doc("a", 1_000));
        var transport = new SyncTransport() {
            @Override
            public boolean push(List<MemoryDocument> batch) {
                throw new IllegalStateException("connection pool closed");
            }

            @Override
            public List<MemoryDocument> pull(String query, int k) { return List.of(); }
        };
        var manager = new SyncManager(local, transport, 100);
        var seen = new ArrayList<SyncResult>();
        manager.setListener(seen::add);

        var result = manager.sync();
        manager.sync();

        assertFalse(result.success());
        assertTrue(result.errors().get(0).contains("connection pool closed"));
        assertEquals(2, manager.stats().consecutiveFailures());
        assertEquals(2, seen.size());
        assertEquals(SyncStatus.PENDING, local.syncStatus("a"));
    }

    @Test
    void refused_push_leaves_documents_pending() {
        local.put(doc("a", 1_000));
        var transport = new ScriptedTransport();
        transport.refuse = true;
        var manager = new SyncManager(local, transport, 100);

        assertFalse(manager.sync().success());
        assertEquals(SyncStatus.PENDING, local.syncStatus("a"));
    }

    @Test
    void update_during_push_keeps_document_pending() {
        local.put(doc("a", 1_000));
        var transport = new SyncTransport() {
            @Override
            public boolean push(List<MemoryDocument> batch) {
                // a local write lands while the batch is in flight
                var a = local.get("a");
                a.addTag("late", "r1");
                local.put(a);
                return true;
            }

            @Override
            public List<MemoryDocument> pull(String query, int k) { return List.of(); }
        };
        var manager = new SyncManager(local, transport, 100);

        var result = manager.sync();
        assertTrue(result.success());
        assertEquals(0, result.syncedCount());
        assertEquals(SyncStatus.PENDING, local.syncStatus("a"));
    }

    @Test
    void pull_inserts_unseen_documents_and_merges_known_ones() {
        var remoteOnly = doc("remote", 1_000);
        hub.put(remoteOnly);
        var shared = doc("shared", 1_000);
        hub.put(shared);
        var mine = shared.copy();
        mine.addTag("local", "r1");
        local.put(mine);

        var manager = new SyncManager(local, new LocalSyncTransport(hub), 100);
        var pulled = manager.pull("", 10);

        assertEquals(2, pulled.size());
        assertEquals(remoteOnly, local.get("remote"));
        assertEquals(SyncStatus.SYNCED, local.syncStatus("remote"));
        assertEquals(Set.of("local"), local.get("shared").tags());
        assertEquals(SyncStatus.PENDING, local.syncStatus("shared"));
    }

    @Test
    void push_carries_referenced_embeddings_to_the_hub() {
        var d = embedded(local, "a");
        local.put(doc("plain", 1_000));
        var manager = new SyncManager(local, new LocalSyncTransport(hub), 100);

        assertTrue(manager.sync().success());

        var onHub = hub.getEmbeddingByHash(d.embeddingRef());
        assertNotNull(onHub);
        assertEquals(local.getEmbeddingByHash(d.embeddingRef()), onHub);
        assertEquals(1, hub.embeddings().size());
    }

    @Test
    void failed_embedding_push_keeps_documents_pending() {
        embedded(local, "a");
        var transport = new SyncTransport() {
            int documentPushes;

            @Override
            public boolean push(List<MemoryDocument> batch) {
                documentPushes++;
                return true;
            }

            @Override
            public List<MemoryDocument> pull(String query, int k) { return List.of(); }

            @Override
            public void pushEmbeddings(List<EmbeddingDocument> embeddings) {
                throw new SyncTransportException("hub unreachable");
            }
        };
        var manager = new SyncManager(local, transport, 100);

        assertFalse(manager.sync().success());
        assertEquals(0, transport.documentPushes);
        assertEquals(SyncStatus.PENDING, local.syncStatus("a"));
    }

    @Test
    void pull_fetches_embeddings_of_merged_documents() {
        var d = embedded(hub, "a");
        var manager = new SyncManager(local, new LocalSyncTransport(hub), 100);

        manager.pull("", 10);

        assertEquals(d, local.get("a"));
        var embedding = local.getEmbeddingByHash(ContentHash.sha256(d.content()));
        assertNotNull(embedding);
        assertEquals(hub.getEmbeddingByHash(d.embeddingRef()), embedding);
    }

    @Test
    void embedding_fetch_failure_keeps_the_pulled_documents() {
        var d = embedded(hub, "a");
        var transport = new SyncTransport() {
            @Override
            public boolean push(List<MemoryDocument> batch) { return true; }

            @Override
            public List<MemoryDocument> pull(String query, int k) { return List.of(hub.get("a")); }

            @Override
            public List<EmbeddingDocument> pullEmbeddings(Collection<String> contentHashes) {
                throw new SyncTransportException("hub unreachable");
            }
        };
        var manager = new SyncManager(local, transport, 100);

        assertEquals(1, manager.pull("", 10).size());
        assertEquals(d, local.get("a"));
        assertNull(local.getEmbeddingByHash(d.embeddingRef()));
    }

    @Test
    void pull_failure_surfaces_to_caller() {
        var manager = new SyncManager(local, new ScriptedTransport(), 100);
        assertThrows(SyncTransportException.class, () -> manager.pull("x", 5));
    }

    @Test
    void listener_sees_every_cycle_and_its_failures_are_ignored() {
        local.put(doc("a", 1_000));
        var manager = new SyncManager(local, new LocalSyncTransport(hub), 100);
        var seen = new ArrayList<SyncResult>();
        manager.setListener(r -> {
            seen.add(r);
            throw new IllegalStateException("listener bug");
        });

        assertTrue(manager.sync().success());
        assertTrue(manager.sync().success());
        assertEquals(2, seen.size());
        assertEquals(1, seen.get(0).pushedCount());
    }
}
