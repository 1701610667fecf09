package io.memlite.sync;

import io.memlite.core.MemoryDocument;
import io.memlite.core.MemoryType;
import io.memlite.storage.DurableMemoryStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/** Two replicas exchanging state through one hub. */
class ReplicaConvergenceTest {

    @TempDir Path dir;
    private DurableMemoryStore hub;
    private DurableMemoryStore r1;
    private DurableMemoryStore r2;
    private SyncManager sync1;
    private SyncManager sync2;

    @BeforeEach
    void open() {
        hub = DurableMemoryStore.open(dir.resolve("hub"), 10_000);
        r1 = DurableMemoryStore.open(dir.resolve("r1"), 10_000);
        r2 = DurableMemoryStore.open(dir.resolve("r2"), 10_000);
        sync1 = new SyncManager(r1, new LocalSyncTransport(hub), 100);
        sync2 = new SyncManager(r2, new LocalSyncTransport(hub), 100);
    }

    @AfterEach
    void close() {
        hub.close();
        r1.close();
        r2.close();
    }

    private void exchange() {
        sync1.sync();
        sync2.sync();
        sync1.pull("", 100);
        sync2.pull("", 100);
    }

    @Test
    void later_importance_write_wins_on_both_replicas() {
        var doc = MemoryDocument.create("m", "user likes tea", MemoryType.SEMANTIC, "r1", 1);
        r1.put(doc);
        exchange();

        var onR1 = r1.get("m");
        onR1.setImportance(0.9, 10, "r1");
        r1.put(onR1);
        var onR2 = r2.get("m");
        onR2.setImportance(0.7, 12, "r2");
        r2.put(onR2);

        exchange();

        assertEquals(0.7, r1.get("m").importance());
        assertEquals(0.7, r2.get("m").importance());
        assertEquals(r1.get("m"), r2.get("m"));
    }

    @Test
    void offline_tag_add_survives_and_concurrent_remove_loses() {
        var doc = MemoryDocument.create("m", "prefers short answers", MemoryType.SEMANTIC, "r1", 1);
        doc.addTag("preference", "r1");
        doc.addTag("style", "r1");
        r1.put(doc);
        exchange();

        // r2 goes offline and adds a tag; r1 removes "style" while r2 re-adds it
        var onR2 = r2.get("m");
        onR2.addTag("urgent", "r2");
        onR2.addTag("style", "r2");
        r2.put(onR2);
        var onR1 = r1.get("m");
        onR1.removeTag("style", "r1");
        r1.put(onR1);

        exchange();

        assertEquals(Set.of("preference", "style", "urgent"), r1.get("m").tags());
        assertEquals(r1.get("m"), r2.get("m"));
        assertEquals(r1.get("m"), hub.get("m"));
    }

    @Test
    void repeated_exchanges_are_stable() {
        var doc = MemoryDocument.create("m", "x", MemoryType.WORKING, "r1", 1);
        r1.put(doc);
        exchange();
        exchange();
        exchange();

        assertEquals(0, r1.pendingCount());
        assertEquals(0, r2.pendingCount());
        assertEquals(r1.get("m"), r2.get("m"));
        assertEquals(1, hub.count());
    }
}
