// file: src/main/java/io/tabver/storage/Wal.java
package io.tabver.storage;

/**
 * Write-Ahead Log abstraction for durability and recovery.
 * <p>
 * Contract:
 *  - append() is atomic at "record" granularity: a partial write is treated
 *    as absent during recovery (reader stops at first corrupt/truncated record).
 *  - append() must fsync the record to disk before returning, so that if
 *    the process crashes after append() returns, recovery will see the record.
 *  - implementations are safe for concurrent callers.
 */
public interface Wal extends AutoCloseable {

    /**
     * Append a single serialized record and fsync it.
     *
     * @param serializedRecord header+payload bytes, typically from RecordCodec
     */
    void append(byte[] serializedRecord);

    /**
     * Rotate log segment if configured thresholds are hit.
     * Called by the store after each write.
     */
    void rotateIfNeeded();

    /**
     * Close the current segment and start a new one unconditionally.
     *
     * @return index of the new (empty) segment; every record appended before this
     *         call lives in a segment with a smaller index
     */
    long rotate();

    /** Delete every segment whose index is below the given one. */
    void pruneBefore(long segmentIndex);

    /**
     * Open a sequential reader over the WAL.
     * Reader starts from the earliest segment and stops at:
     *  - first corrupt header,
     *  - first truncated payload, or
     *  - end of the last segment.
     */
    WalReader openReader();

    /**
     * Reader abstraction used during recovery.
     */
    interface WalReader extends AutoCloseable {

        /**
         * @return next valid payload (NOT including header), or null when:
         *   - at the end of the log, or
         *   - corruption/truncation is detected at the tail.
         */
        byte[] next();

        @Override
        void close();
    }
}
