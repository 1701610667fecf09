package io.memlite.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.READ;
import static java.nio.file.StandardOpenOption.WRITE;

/**
 * File-backed WAL that appends framed records to numbered segment files
 * ("00000001.log", "00000002.log", ...).
 * <p>
 *  - On construction it opens the newest segment for append. A torn record left at
 *    the tail by a crash is cut off first, so new records never land behind garbage.
 *  - append() writes and fsyncs (data and metadata).
 *  - rotateIfNeeded() starts the next segment once the current one reaches rotateBytes.
 *  - truncate() deletes every segment and starts over at "00000001.log".
 *  - The reader walks all segments in order and stops at the first invalid frame.
 * <p>
 * Appends are serialized on the instance.
 */
public class FileWal implements Wal {
    private static final Logger log = Logger.getLogger(FileWal.class.getName());

    private final Path dir;
    private final long rotateBytes;
    private FileChannel ch;
    private Path current;
    private long writtenInSegment = 0;

    public FileWal(Path dir, long rotateBytes) {
        if (rotateBytes <= 0) throw new IllegalArgumentException("rotateBytes must be > 0");
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StorageException("Cannot create WAL directory " + dir, e);
        }
        openNewestOrCreate();
    }

    @Override
    public synchronized void append(byte[] framedRecord) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(framedRecord);
            while (buf.hasRemaining()) ch.write(buf);
            ch.force(true);
            writtenInSegment += framedRecord.length;
        } catch (IOException e) {
            throw new StorageException("WAL append failed on " + current, e);
        }
    }

    @Override
    public synchronized void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) return;
        try {
            ch.close();
            current = dir.resolve(segmentName(segmentIndex(current) + 1));
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = 0;
            log.fine(() -> "WAL rotated to " + current.getFileName());
        } catch (IOException e) {
            throw new StorageException("WAL rotation failed", e);
        }
    }

    @Override
    public synchronized void truncate() {
        try {
            ch.close();
            for (Path seg : segments(dir)) Files.deleteIfExists(seg);
            current = dir.resolve(segmentName(1));
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = 0;
        } catch (IOException e) {
            throw new StorageException("WAL truncation failed", e);
        }
    }

    @Override
    public WalReader openReader() { return new Reader(segments(dir)); }

    @Override
    public synchronized void close() {
        try {
            if (ch != null) ch.close();
        } catch (IOException e) {
            throw new StorageException("WAL close failed", e);
        }
    }

    /**
     * If there are existing segments, open the newest one and position after its last
     * valid record. If none, create "00000001.log".
     */
    private void openNewestOrCreate() {
        var all = segments(dir);
        current = all.isEmpty() ? dir.resolve(segmentName(1)) : all.get(all.size() - 1);
        try {
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            long valid = validLength(ch);
            if (valid < ch.size()) {
                log.warning("Discarding " + (ch.size() - valid) + " torn bytes at the tail of " + current.getFileName());
                ch.truncate(valid);
                ch.force(true);
            }
            writtenInSegment = valid;
            ch.position(valid);
        } catch (IOException e) {
            throw new StorageException("Cannot open WAL segment " + current, e);
        }
    }

    private static long validLength(FileChannel ch) throws IOException {
        long pos = 0;
        for (byte[] payload; (payload = RecordCodec.readFrame(ch, pos)) != null; ) {
            pos += RecordCodec.HEADER_BYTES + payload.length;
        }
        return pos;
    }

    static List<Path> segments(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".log"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new StorageException("Cannot list WAL segments in " + dir, e);
        }
    }

    private static int segmentIndex(Path segment) {
        return Integer.parseInt(segment.getFileName().toString().replace(".log", ""));
    }

    private static String segmentName(int index) {
        return String.format("%08d.log", index);
    }

    /** Sequential reader over every segment, oldest first. */
    private static final class Reader implements WalReader {
        private final List<Path> segments;
        private int segment = -1;
        private FileChannel ch;
        private long pos;
        private boolean done;

        Reader(List<Path> segments) {
            this.segments = segments;
        }

        @Override
        public byte[] next() {
            if (done) return null;
            try {
                while (true) {
                    if (ch == null && !openNext()) return null;
                    byte[] payload = RecordCodec.readFrame(ch, pos);
                    if (payload != null) {
                        pos += RecordCodec.HEADER_BYTES + payload.length;
                        return payload;
                    }
                    if (pos < ch.size()) {
                        // Invalid frame before the end of a segment: nothing after it can be trusted.
                        log.warning("WAL replay stopped at offset " + pos + " of " + segments.get(segment).getFileName());
                        done = true;
                        return null;
                    }
                    ch.close();
                    ch = null;
                }
            } catch (IOException e) {
                throw new StorageException("WAL read failed", e);
            }
        }

        private boolean openNext() throws IOException {
            segment++;
            if (segment >= segments.size()) {
                done = true;
                return false;
            }
            ch = FileChannel.open(segments.get(segment), READ);
            pos = 0;
            return true;
        }

        @Override
        public void close() {
            try {
                if (ch != null) ch.close();
            } catch (IOException e) {
                throw new StorageException("WAL reader close failed", e);
            }
        }
    }
}
