// file: src/main/java/io/tabver/storage/FileWal.java
package io.tabver.storage;

import io.tabver.core.StorageException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.*;

/**
 * File-backed WAL that appends header+payload records to segment files.
 * <p>
 * Properties:
 *  - On construction, it:
 *      - creates the directory if needed,
 *      - finds the newest segment (e.g. "00000001.log", "00000002.log", ...),
 *      - truncates a torn tail left by a crash, so new records are never
 *        appended behind garbage,
 *      - opens it for append.
 * <p>
 *  - append():
 *      - writes the bytes,
 *      - calls force(true) to fsync data and metadata,
 *      - tracks bytes written this segment,
 *      - on failure truncates the segment back to where the record started; if
 *        that fails too, every later append is refused.
 * <p>
 *  - rotateIfNeeded() / rotate():
 *      - closes the current segment and opens a new one with incremented index.
 * <p>
 *  - Reader:
 *      - walks every segment in index order,
 *      - reads fixed-size header (11 bytes), validates magic/version/length,
 *      - reads payload, validates CRC,
 *      - stops at the first truncated header/payload or bad CRC.
 */
public class FileWal implements Wal {
    private static final Logger LOG = Logger.getLogger(FileWal.class.getName());
    private static final String SUFFIX = ".log";

    private final Path dir;
    private final long rotateBytes;
    private FileChannel ch;
    private long currentIndex;
    private long writtenInSegment = 0;
    private IOException failure; // set when a failed append could not be rolled back

    public FileWal(Path dir, long rotateBytes) {
        if (rotateBytes <= 0) throw new IllegalArgumentException("rotateBytes must be > 0");
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        try { Files.createDirectories(dir); } catch (IOException e) { throw new StorageException("Cannot create WAL dir " + dir, e); }
        openNewestOrCreate();
    }

    @Override
    public synchronized void append(byte[] serializedRecord) {
        if (failure != null) {
            throw new StorageException("WAL is unusable after a failed rollback", failure);
        }
        long before;
        try {
            before = ch.position();
        } catch (IOException e) {
            throw new StorageException("WAL append failed", e);
        }
        try {
            write(ch, ByteBuffer.wrap(serializedRecord));
            writtenInSegment += serializedRecord.length;
        } catch (IOException e) {
            // bytes of a half-written record must not stay in front of later records
            try {
                rollback(ch, before);
            } catch (IOException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
                failure = e;
                LOG.severe(() -> "WAL rollback to offset " + before + " failed; refusing further appends");
            }
            throw new StorageException("WAL append failed", e);
        }
    }

    /** Write the whole buffer and fsync data and metadata. */
    protected void write(FileChannel channel, ByteBuffer buf) throws IOException {
        while (buf.hasRemaining()) channel.write(buf);
        channel.force(true); // metadata too, so a new file appears durable after rotation
    }

    /** Cut the segment back to {@code offset} after a failed write. */
    protected void rollback(FileChannel channel, long offset) throws IOException {
        channel.truncate(offset);
        channel.position(offset);
        channel.force(true);
    }

    @Override
    public synchronized void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) return;
        rotate();
    }

    @Override
    public synchronized long rotate() {
        try {
            ch.close();
            currentIndex++;
            ch = FileChannel.open(segment(dir, currentIndex), CREATE, WRITE, READ);
            writtenInSegment = 0;
            return currentIndex;
        } catch (IOException e) { throw new StorageException("WAL rotation failed", e); }
    }

    @Override
    public synchronized void pruneBefore(long segmentIndex) {
        for (Path p : segments(dir)) {
            if (indexOf(p) >= segmentIndex) continue;
            try {
                Files.deleteIfExists(p);
            } catch (IOException e) {
                throw new StorageException("Cannot prune WAL segment " + p, e);
            }
        }
    }

    @Override
    public WalReader openReader() { return new Reader(segments(dir)); }

    @Override
    public synchronized void close() throws IOException { if (ch != null) ch.close(); }

    /**
     * On startup:
     *  - If there are existing segments, open the newest one, cut off any torn
     *    tail and position at the end.
     *  - If none, create "00000001.log".
     */
    private void openNewestOrCreate() {
        List<Path> all = segments(dir);
        currentIndex = all.isEmpty() ? 1 : indexOf(all.get(all.size() - 1));
        Path current = segment(dir, currentIndex);
        try {
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            long valid = validPrefix(ch);
            if (valid < ch.size()) {
                LOG.warning(() -> "Truncating torn WAL tail in " + current.getFileName());
                ch.truncate(valid);
                ch.force(true);
            }
            writtenInSegment = valid;
            ch.position(valid);
        } catch (IOException e) { throw new StorageException("Cannot open WAL segment " + current, e); }
    }

    // ---------- helpers ----------

    private static Path segment(Path dir, long index) {
        return dir.resolve(String.format("%08d%s", index, SUFFIX));
    }

    private static long indexOf(Path segment) {
        String name = segment.getFileName().toString();
        return Long.parseLong(name.substring(0, name.length() - SUFFIX.length()));
    }

    private static List<Path> segments(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().matches("\\d{8,}\\.log"))
                    .sorted((a, b) -> Long.compare(indexOf(a), indexOf(b)))
                    .collect(Collectors.toCollection(ArrayList::new));
        } catch (IOException e) {
            throw new StorageException("Cannot list WAL dir " + dir, e);
        }
    }

    /** Length of the longest prefix of whole, CRC-valid records. */
    private static long validPrefix(FileChannel ch) throws IOException {
        long pos = 0;
        while (true) {
            byte[] payload = readRecord(ch, pos);
            if (payload == null) return pos;
            pos += RecordCodec.HEADER_BYTES + payload.length;
        }
    }

    /** Reads the record at pos, or null on EOF / truncation / corruption. */
    private static byte[] readRecord(FileChannel ch, long pos) throws IOException {
        ByteBuffer hdr = ByteBuffer.allocate(RecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        int read = ch.read(hdr, pos);
        if (read < RecordCodec.HEADER_BYTES) return null; // EOF or truncated header at tail
        hdr.flip();
        short magic = hdr.getShort();
        byte ver = hdr.get();
        int len = hdr.getInt();
        int crc = hdr.getInt();
        if (magic != RecordCodec.MAGIC || ver != RecordCodec.VERSION || len < 0) return null;
        if (pos + RecordCodec.HEADER_BYTES + len > ch.size()) return null; // truncated payload
        ByteBuffer payload = ByteBuffer.allocate(len);
        long at = pos + RecordCodec.HEADER_BYTES;
        while (payload.hasRemaining()) {
            int r = ch.read(payload, at + payload.position());
            if (r <= 0) return null;
        }
        byte[] bytes = payload.array();
        if (RecordCodec.crc32(bytes) != crc) return null; // bad tail
        return bytes;
    }

    /**
     * Sequential reader over all segments used during recovery.
     */
    private static final class Reader implements WalReader {
        private final List<Path> segments;
        private int segmentIdx = -1;
        private FileChannel ch;
        private long pos = 0;
        private boolean stopped = false;

        Reader(List<Path> segments) {
            this.segments = segments;
        }

        @Override
        public byte[] next() {
            try {
                while (!stopped) {
                    if (ch == null && !openNextSegment()) return null;
                    byte[] bytes = readRecord(ch, pos);
                    if (bytes != null) {
                        pos += RecordCodec.HEADER_BYTES + bytes.length;
                        return bytes;
                    }
                    if (pos < ch.size()) {
                        // corrupt record inside the log: nothing after it can be trusted
                        stopped = true;
                        return null;
                    }
                    ch.close();
                    ch = null;
                }
                return null;
            } catch (IOException e) {
                throw new StorageException("WAL read failed", e);
            }
        }

        private boolean openNextSegment() throws IOException {
            if (++segmentIdx >= segments.size()) return false;
            ch = FileChannel.open(segments.get(segmentIdx), READ);
            pos = 0;
            return true;
        }

        @Override
        public void close() {
            if (ch == null) return;
            try {
                ch.close();
            } catch (IOException e) {
                throw new StorageException("WAL reader close failed", e);
            }
        }
    }
}
