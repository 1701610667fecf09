package io.memlite.storage;

import io.memlite.core.ContentHash;
import io.memlite.core.EmbeddingDocument;
import io.memlite.core.MemoryDocument;
import io.memlite.core.MemoryType;
import io.memlite.core.SyncStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class DurableMemoryStoreTest {

    @TempDir Path dataDir;
    private DurableMemoryStore store;

    @BeforeEach
    void open() {
        store = DurableMemoryStore.open(dataDir, 10_000);
    }

    @AfterEach
    void close() {
        store.close();
    }

    private static MemoryDocument doc(String id, String content, MemoryType type, long ts) {
        return MemoryDocument.create(id, content, type, "r1", ts);
    }

    private static List<String> ids(List<MemoryDocument> docs) {
        return docs.stream().map(MemoryDocument::id).collect(Collectors.toList());
    }

    @Test
    void put_then_get_returns_equal_document() {
        var d = doc("m1", "likes tea", MemoryType.SEMANTIC, 1_000);
        d.addTag("drink", "r1");

        assertEquals("m1", store.put(d));
        var loaded = store.get("m1");
        assertEquals(d, loaded);
        assertEquals(SyncStatus.PENDING, loaded.syncStatus());
        assertNull(store.get("missing"));
        assertEquals(1, store.count());
    }

    @Test
    void returned_documents_are_copies() {
        store.put(doc("m1", "x", MemoryType.WORKING, 1_000));
        var copy = store.get("m1");
        copy.setContent("changed", 9_000, "r1");

        assertEquals("x", store.get("m1").content());
    }

    @Test
    void put_merges_with_stored_document() {
        var a = doc("m1", "first draft", MemoryType.SEMANTIC, 1_000);
        a.addTag("preference", "r1");
        var b = a.copy();
        b.setContent("final text", 2_000, "r2");
        b.addTag("style", "r2");

        store.put(a);
        store.put(b);
        // stale copy does not roll anything back
        store.put(a);

        var stored = store.get("m1");
        assertEquals("final text", stored.content());
        assertEquals(Set.of("preference", "style"), stored.tags());
    }

    @Test
    void indices_follow_updates() {
        var a = doc("a", "alpha", MemoryType.SEMANTIC, 1_000);
        a.addTag("work", "r1");
        a.setImportance(0.9, 1_001, "r1");
        var b = doc("b", "beta", MemoryType.EPISODIC, 2_000);
        b.addTag("work", "r1");
        b.setImportance(0.3, 2_001, "r1");
        var c = doc("c", "alpha", MemoryType.SEMANTIC, 3_000);
        store.put(a);
        store.put(b);
        store.put(c);

        assertEquals(List.of("c", "a"), ids(store.queryByType(MemoryType.SEMANTIC)));
        assertEquals(List.of("b", "a"), ids(store.queryByTag("work")));
        assertEquals(List.of("a", "c"), ids(store.queryByImportance(0.5)));
        assertEquals(Set.of("a", "c"), Set.copyOf(ids(store.queryByContentHash(ContentHash.sha256("alpha")))));
        assertEquals(List.of("a"), ids(store.mostImportant(1)));
        assertEquals(List.of("c", "b"), ids(store.recent(2)));

        var a2 = store.get("a");
        a2.removeTag("work", "r1");
        a2.setImportance(0.1, 5_000, "r1");
        a2.setContent("gamma", 5_000, "r1");
        store.put(a2);

        assertEquals(List.of("b"), ids(store.queryByTag("work")));
        assertEquals(List.of("c"), ids(store.queryByImportance(0.5)));
        assertEquals(List.of("c"), ids(store.queryByContentHash(ContentHash.sha256("alpha"))));
        assertEquals(List.of("a"), ids(store.queryByContentHash(ContentHash.sha256("gamma"))));
    }

    @Test
    void search_ranks_by_word_overlap_then_importance() {
        var a = doc("a", "User prefers dark mode in the editor", MemoryType.SEMANTIC, 1_000);
        var b = doc("b", "Editor theme: dark", MemoryType.SEMANTIC, 2_000);
        b.setImportance(0.9, 2_001, "r1");
        var c = doc("c", "Lunch was pasta", MemoryType.EPISODIC, 3_000);
        c.addTag("editor", "r1");
        store.put(a);
        store.put(b);
        store.put(c);

        assertEquals(List.of("b", "a", "c"), ids(store.search("dark editor", 10)));
        assertEquals(List.of("b"), ids(store.search("dark editor", 1)));
        assertTrue(store.search("nothing-matches", 5).isEmpty());
        assertEquals(List.of("c", "b"), ids(store.search("  ", 2)));
        assertTrue(store.search("dark", 0).isEmpty());
    }

    @Test
    void embeddings_are_content_addressed_and_first_write_wins() {
        var hash = ContentHash.sha256("hello");
        var first = new EmbeddingDocument(hash, new float[]{1f, 0f}, "m", 1);
        var second = new EmbeddingDocument(hash, new float[]{0f, 1f}, "m", 2);

        assertEquals(first.id(), store.putEmbedding(first));
        assertEquals(first.id(), store.putEmbedding(second));

        assertEquals(first, store.getEmbedding(hash, "m"));
        assertEquals(first, store.getEmbeddingByHash(hash));
        assertNull(store.getEmbedding(hash, "other-model"));
        assertEquals(1, store.embeddings().size());
    }

    @Test
    void all_lists_newest_first() {
        store.put(doc("old", "x", MemoryType.WORKING, 1_000));
        store.put(doc("new", "y", MemoryType.WORKING, 2_000));

        assertEquals(List.of("new", "old"), ids(store.all()));
    }
}
