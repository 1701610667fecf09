package io.memlite.server;

import io.memlite.core.MemoryType;
import io.memlite.core.ValidationException;
import io.memlite.storage.DurableMemoryStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class MemoryServiceTest {

    @TempDir Path dir;
    private DurableMemoryStore store;

    @BeforeEach
    void open() {
        store = DurableMemoryStore.open(dir, 10_000);
    }

    @AfterEach
    void close() {
        store.close();
    }

    /** Two-dimensional toy embedding: [mentions of "tea", mentions of "code"]. */
    private static float[] toyEmbed(String content, String model) {
        String lower = content.toLowerCase();
        return new float[]{lower.contains("tea") ? 1f : 0f, lower.contains("code") ? 1f : 0f};
    }

    @Test
    void learn_stores_a_pending_document_authored_by_this_instance() {
        var service = new MemoryService(store, "r1");

        var doc = service.learn("user likes tea", MemoryType.SEMANTIC, 0.8, null,
                List.of("preference"), List.of(), List.of("chat-42"));

        assertEquals("r1", doc.sourceInstance());
        assertEquals(MemoryType.SEMANTIC, doc.memoryType());
        assertEquals(0.8, doc.importance());
        assertEquals(0.5, doc.confidence());
        assertEquals(Set.of("preference"), doc.tags());
        assertTrue(doc.evidence().contains("chat-42"));
        assertNull(doc.embeddingRef());
        assertEquals(1, store.pendingCount());
    }

    @Test
    void learn_rejects_blank_content_and_out_of_range_scores() {
        var service = new MemoryService(store, "r1");
        assertThrows(ValidationException.class, () -> service.learn(" ", null, null, null, null, null, null));
        assertThrows(ValidationException.class, () -> service.learn("x", null, 1.5, null, null, null, null));
        assertEquals(0, store.count());
    }

    @Test
    void learn_embeds_content_once_per_hash() {
        var calls = new AtomicInteger();
        EmbeddingProvider provider = (content, model) -> {
            calls.incrementAndGet();
            return toyEmbed(content, model);
        };
        var service = new MemoryService(store, "r1", provider, "toy", 0.7);

        var a = service.learn("green tea", null, null, null, null, null, null);
        var b = service.learn("green tea", null, null, null, null, null, null);

        assertEquals(1, calls.get());
        assertEquals(a.contentHash(), a.embeddingRef());
        assertEquals(a.embeddingRef(), b.embeddingRef());
        assertNotNull(store.getEmbedding(a.contentHash(), "toy"));
    }

    @Test
    void recall_ranks_by_embedding_similarity() {
        var service = new MemoryService(store, "r1", MemoryServiceTest::toyEmbed, "toy", 0.7);
        var tea = service.learn("oolong tea notes", null, null, null, null, null, null);
        var code = service.learn("code review habits", null, null, null, null, null, null);

        var hits = service.recall("which tea?", 1);

        assertEquals(List.of(tea.id()), List.of(hits.get(0).id()));
        assertEquals(code.id(), service.recall("code", 1).get(0).id());
    }

    @Test
    void recall_falls_back_to_text_search_when_embedding_fails() {
        var fail = new AtomicInteger();
        EmbeddingProvider flaky = (content, model) -> {
            if (fail.get() > 0) throw new IllegalStateException("model offline");
            return toyEmbed(content, model);
        };
        var service = new MemoryService(store, "r1", flaky, "toy", 0.7);
        var doc = service.learn("user prefers dark mode", null, null, null, null, null, null);
        fail.set(1);

        var hits = service.recall("dark mode", 5);

        assertEquals(1, hits.size());
        assertEquals(doc.id(), hits.get(0).id());
    }

    @Test
    void update_applies_every_field_and_unknown_id_is_not_found() {
        var service = new MemoryService(store, "r1");
        var doc = service.learn("draft", null, null, null, List.of("old"), null, null);

        var updated = service.update(doc.id(), new MemoryUpdate("final", 0.9, 0.6,
                List.of("new"), List.of("old"), List.of("other-id"), List.of("ev-1")));

        assertEquals("final", updated.content());
        assertEquals(0.9, updated.importance());
        assertEquals(0.6, updated.confidence());
        assertEquals(Set.of("new"), updated.tags());
        assertTrue(updated.related().contains("other-id"));
        assertTrue(updated.evidence().contains("ev-1"));
        assertThrows(MemoryNotFoundException.class, () -> service.update("missing", MemoryUpdate.importance(0.1)));
    }

    @Test
    void record_access_counts_and_stamps_last_access() {
        var service = new MemoryService(store, "r1");
        var doc = service.learn("x", null, null, null, null, null, null);

        service.recordAccess(doc.id());
        var after = service.recordAccess(doc.id());

        assertEquals(2, after.accessCount());
        assertTrue(after.lastAccessed() > 0);
    }

    @Test
    void concurrent_updates_and_accesses_of_one_memory_all_land() throws Exception {
        var service = new MemoryService(store, "r1");
        var doc = service.learn("shared", null, null, null, null, null, null);
        var pool = Executors.newFixedThreadPool(6);
        try {
            var futures = new ArrayList<Future<?>>();
            for (int i = 0; i < 6; i++) {
                int n = i;
                futures.add(pool.submit(() -> {
                    for (int round = 0; round < 5; round++) {
                        service.update(doc.id(), new MemoryUpdate(null, null, null,
                                List.of("t" + n + "-" + round), null, null, null));
                        service.recordAccess(doc.id());
                    }
                }));
            }
            for (var f : futures) f.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        var stored = service.get(doc.id());
        assertEquals(30, stored.tags().size());
        assertEquals(30, stored.accessCount());
        assertThrows(MemoryNotFoundException.class, () -> service.recordAccess("missing"));
    }

    @Test
    void tag_re_added_after_a_remove_stays() {
        var service = new MemoryService(store, "r1");
        var doc = service.learn("notes", null, null, null, null, null, null);
        var addZ = new MemoryUpdate(null, null, null, List.of("z"), null, null, null);

        service.update(doc.id(), addZ);
        service.update(doc.id(), new MemoryUpdate(null, null, null, null, List.of("z"), null, null));
        var after = service.update(doc.id(), addZ);

        assertEquals(Set.of("z"), after.tags());
        var tagged = service.list(null, "z", null, 10);
        assertEquals(1, tagged.size());
        assertEquals(doc.id(), tagged.get(0).id());
    }

    @Test
    void promotion_candidates_respect_threshold() {
        var service = new MemoryService(store, "r1", null, "toy", 0.7);
        var high = service.learn("important", null, 0.9, null, null, null, null);
        service.learn("trivial", null, 0.2, null, null, null, null);
        var edge = service.learn("edge", null, 0.7, null, null, null, null);

        var ids = service.promotionCandidates().stream().map(d -> d.id()).toList();
        assertEquals(Set.of(high.id(), edge.id()), Set.copyOf(ids));
    }

    @Test
    void list_combines_filters() {
        var service = new MemoryService(store, "r1");
        var a = service.learn("a", MemoryType.SEMANTIC, 0.9, null, List.of("work"), null, null);
        service.learn("b", MemoryType.SEMANTIC, 0.1, null, List.of("work"), null, null);
        service.learn("c", MemoryType.EPISODIC, 0.9, null, List.of("work"), null, null);

        var hits = service.list(MemoryType.SEMANTIC, "work", 0.5, 10);

        assertEquals(1, hits.size());
        assertEquals(a.id(), hits.get(0).id());
        assertThrows(ValidationException.class, () -> service.list(null, null, null, 0));
    }
}
