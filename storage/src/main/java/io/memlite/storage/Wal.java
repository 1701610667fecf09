package io.memlite.storage;

/**
 * Write-Ahead Log abstraction for durability and recovery.
 * <p>
 * Contract:
 *  - append() is atomic at "record" granularity: a partial write is treated
 *    as absent during recovery (reader stops at first corrupt/truncated record).
 *  - append() must fsync the record to disk before returning, so that if
 *    the process crashes after append() returns, recovery will see the record.
 */
public interface Wal extends AutoCloseable {

    /**
     * Append a single framed record and fsync it.
     *
     * @param framedRecord header+payload bytes from {@link RecordCodec#frame(byte[])}
     * @throws StorageException when the write or fsync fails
     */
    void append(byte[] framedRecord);

    /** Start a new segment once the current one reached its size threshold. */
    void rotateIfNeeded();

    /**
     * Drop every record written so far. Called after a snapshot that contains
     * all of them has been made durable.
     */
    void truncate();

    /**
     * Open a sequential reader over all segments, oldest first.
     * The reader stops at the first corrupt header, truncated payload or bad CRC.
     */
    WalReader openReader();

    @Override
    void close();

    /** Reader abstraction used during recovery. */
    interface WalReader extends AutoCloseable {

        /** @return next valid payload (header stripped), or null at the end of valid data */
        byte[] next();

        @Override
        void close();
    }
}
