package io.memlite.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.util.zip.CRC32;

/**
 * Binary framing for WAL records.
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0x4D4C
 *     - version (1B)  = 1
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 *   [PAYLOAD (length bytes)]  UTF-8 JSON, see {@code WalRecordDto}
 * <p>
 * A frame whose header or CRC does not check out marks the end of valid data.
 */
final class RecordCodec {
    static final short MAGIC = (short) 0x4D4C;
    static final byte VERSION = 1;
    static final int HEADER_BYTES = 11;

    // Upper bound on a single payload; anything larger is treated as a corrupt header.
    static final int MAX_PAYLOAD = 64 * 1024 * 1024;

    private RecordCodec() {}

    /** Prefix {@code payload} with the header. */
    static byte[] frame(byte[] payload) {
        ByteBuffer out = ByteBuffer.allocate(HEADER_BYTES + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        out.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        out.put(payload);
        return out.array();
    }

    /**
     * Read the frame starting at {@code pos}.
     *
     * @return the payload, or null when the frame is missing, truncated or corrupt
     */
    static byte[] readFrame(FileChannel ch, long pos) throws IOException {
        ByteBuffer hdr = ByteBuffer.allocate(HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        int read = ch.read(hdr, pos);
        if (read < HEADER_BYTES) return null;
        hdr.flip();
        short magic = hdr.getShort();
        byte ver = hdr.get();
        int len = hdr.getInt();
        int crc = hdr.getInt();
        if (magic != MAGIC || ver != VERSION || len < 0 || len > MAX_PAYLOAD) return null;

        ByteBuffer payload = ByteBuffer.allocate(len);
        long at = pos + HEADER_BYTES;
        while (payload.hasRemaining()) {
            int n = ch.read(payload, at + payload.position());
            if (n <= 0) return null; // truncated payload
        }
        byte[] bytes = payload.array();
        if (crc32(bytes) != crc) return null;
        return bytes;
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue();
    }
}
