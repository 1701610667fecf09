package io.memlite.storage;

import io.memlite.storage.json.DocumentJson;
import io.memlite.storage.json.EmbeddingDto;
import io.memlite.storage.json.SnapshotDto;
import io.memlite.storage.json.StoredMemoryDto;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.TRUNCATE_EXISTING;
import static java.nio.file.StandardOpenOption.WRITE;

/**
 * JSON snapshot files, one per snapshot: "snapshot-00000000000000000001.json", ...
 * <p>
 * Atomicity:
 *   - the snapshot is written and fsynced to "&lt;name&gt;.tmp" first,
 *   - then moved to its final name with ATOMIC_MOVE.
 * Only the newest {@link #KEEP} snapshots are kept.
 */
public final class FileSnapshotter implements Snapshotter {
    private static final Logger log = Logger.getLogger(FileSnapshotter.class.getName());
    static final int KEEP = 2;

    private final Path dir;
    private final DocumentJson json;

    public FileSnapshotter(Path dir, DocumentJson json) {
        this.dir = dir;
        this.json = json;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StorageException("Cannot create snapshot directory " + dir, e);
        }
    }

    @Override
    public String writeSnapshot(StoreImage image) {
        var existing = snapshots();
        long seq = existing.isEmpty() ? 1 : sequenceOf(existing.get(existing.size() - 1)) + 1;
        String name = String.format("snapshot-%020d.json", seq);
        Path tmp = dir.resolve(name + ".tmp");
        Path dst = dir.resolve(name);

        var memories = new ArrayList<StoredMemoryDto>(image.memories().size());
        for (var m : image.memories()) memories.add(m.toDto());
        var embeddings = new ArrayList<EmbeddingDto>(image.embeddings().size());
        for (var e : image.embeddings()) embeddings.add(DocumentJson.toDto(e));
        var body = new SnapshotDto(System.currentTimeMillis(), memories, embeddings);

        try (FileChannel ch = FileChannel.open(tmp, CREATE, WRITE, TRUNCATE_EXISTING)) {
            OutputStream out = Channels.newOutputStream(ch);
            json.mapper().writeValue(nonClosing(out), body);
            ch.force(true);
        } catch (IOException e) {
            throw new StorageException("Snapshot write failed: " + tmp, e);
        }

        try {
            Files.move(tmp, dst, ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StorageException("Snapshot publish failed: " + dst, e);
        }

        pruneOlderThan(KEEP);
        log.info(() -> "Wrote " + name + " (" + memories.size() + " memories, " + embeddings.size() + " embeddings)");
        return name;
    }

    @Override
    public StoreImage loadLatest() {
        var all = snapshots();
        if (all.isEmpty()) return null;
        Path snap = all.get(all.size() - 1);
        try {
            SnapshotDto body = json.mapper().readValue(snap.toFile(), SnapshotDto.class);
            var memories = new ArrayList<StoredMemory>(body.memories().size());
            for (var m : body.memories()) memories.add(StoredMemory.fromDto(m));
            var embeddings = body.embeddings().stream().map(DocumentJson::fromDto).collect(Collectors.toList());
            return new StoreImage(memories, embeddings);
        } catch (IOException | IllegalArgumentException e) {
            throw new StorageException("Cannot load snapshot " + snap.getFileName(), e);
        }
    }

    private List<Path> snapshots() {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> {
                        String n = p.getFileName().toString();
                        return n.startsWith("snapshot-") && n.endsWith(".json");
                    })
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new StorageException("Cannot list snapshots in " + dir, e);
        }
    }

    private void pruneOlderThan(int keep) {
        var all = snapshots();
        for (int i = 0; i < all.size() - keep; i++) {
            try {
                Files.deleteIfExists(all.get(i));
            } catch (IOException e) {
                log.warning("Cannot delete old snapshot " + all.get(i).getFileName() + ": " + e.getMessage());
            }
        }
    }

    private static long sequenceOf(Path snapshot) {
        String n = snapshot.getFileName().toString();
        return Long.parseLong(n.substring("snapshot-".length(), n.length() - ".json".length()));
    }

    // Jackson closes the stream it writes to; the channel must stay open for force().
    private static OutputStream nonClosing(OutputStream out) {
        return new FilterOutputStream(out) {
            @Override public void write(byte[] b, int off, int len) throws IOException { out.write(b, off, len); }
            @Override public void close() throws IOException { flush(); }
        };
    }
}
