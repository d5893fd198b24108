// file: src/main/java/io/tabver/storage/RecordCodec.java
package io.tabver.storage;

import io.tabver.core.CellCodec;
import io.tabver.core.CellKey;
import io.tabver.core.CellValue;
import io.tabver.core.NormalizedTable;
import io.tabver.core.StorageException;
import io.tabver.core.Version;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInput;
import java.io.DataInputStream;
import java.io.DataOutput;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.time.Instant;
import java.util.Map;
import java.util.NavigableMap;
import java.util.zip.CRC32;

/**
 * Binary framing and payloads for WAL records.
 * <p>
 * Full on-disk layout:
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0x7AB5   (helps detect garbage)
 *     - version (1B)  = 1        (for future upgrades)
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (length bytes, big-endian, java.io.DataOutput)]
 *     - kind: byte, 1 = version, 2 = preference weight
 *     version:
 *       - id, documentId:     string
 *       - versionNumber:      int32
 *       - parentVersionId:    string (len -1 => null)
 *       - contentHash:        string
 *       - createdAt:          int64 epoch seconds + int32 nanos
 *       - createdBy:          string
 *       - tag:                string (len -1 => null)
 *       - table:              int32 sheetCount, per sheet: name, int32 cellCount,
 *                             per cell: int32 row, int32 column, cell (see CellCodec)
 *     preference weight:
 *       - documentId, actor:  string
 *       - accepted, total, revision: int64
 *       - updatedAt:          int64 epoch seconds + int32 nanos
 * <p>
 * One version, with all of its cells, is always exactly one record, so a torn
 * write can never expose half a version.
 */
final class RecordCodec {
    static final short MAGIC = (short) 0x7AB5;
    static final byte VERSION = 1;
    static final int HEADER_BYTES = 2 + 1 + 4 + 4;

    static final byte KIND_VERSION = 1;
    static final byte KIND_PREFERENCE = 2;

    /** Decoded record. */
    sealed interface LogRecord permits VersionRecord, PreferenceRecord {}

    record VersionRecord(Version version, NormalizedTable table) implements LogRecord {}

    record PreferenceRecord(PreferenceWeight weight) implements LogRecord {}

    private RecordCodec() {}

    /** Encode a version with all its cells into header+payload bytes ready for append. */
    static byte[] encodeVersion(Version version, NormalizedTable table) {
        return frame(payload(out -> {
            out.writeByte(KIND_VERSION);
            writeVersion(out, version, table);
        }));
    }

    static byte[] encodePreference(PreferenceWeight w) {
        return frame(payload(out -> {
            out.writeByte(KIND_PREFERENCE);
            CellCodec.writeString(out, w.documentId());
            CellCodec.writeString(out, w.actor());
            out.writeLong(w.accepted());
            out.writeLong(w.total());
            out.writeLong(w.revision());
            writeInstant(out, w.updatedAt());
        }));
    }

    /** Decode a full payload (not including header). */
    static LogRecord decode(byte[] payload) {
        try (var in = new DataInputStream(new ByteArrayInputStream(payload))) {
            byte kind = in.readByte();
            switch (kind) {
                case KIND_VERSION -> {
                    StoredVersion sv = readVersion(in);
                    return new VersionRecord(sv.version(), sv.table());
                }
                case KIND_PREFERENCE -> {
                    String doc = readRequired(in);
                    String actor = readRequired(in);
                    long accepted = in.readLong();
                    long total = in.readLong();
                    long revision = in.readLong();
                    Instant at = readInstant(in);
                    return new PreferenceRecord(new PreferenceWeight(doc, actor, accepted, total, revision, at));
                }
                default -> throw new StorageException("Unknown WAL record kind " + kind, null);
            }
        } catch (IOException | IllegalArgumentException e) {
            throw new StorageException("Corrupt WAL record payload", e);
        }
    }

    // ----------------- shared with snapshots -----------------

    static void writeVersion(DataOutput out, Version v, NormalizedTable table) throws IOException {
        CellCodec.writeString(out, v.id());
        CellCodec.writeString(out, v.documentId());
        out.writeInt(v.versionNumber());
        CellCodec.writeString(out, v.parentVersionId());
        CellCodec.writeString(out, v.contentHash());
        writeInstant(out, v.createdAt());
        CellCodec.writeString(out, v.createdBy());
        CellCodec.writeString(out, v.tag());
        writeTable(out, table);
    }

    static StoredVersion readVersion(DataInput in) throws IOException {
        String id = readRequired(in);
        String doc = readRequired(in);
        int number = in.readInt();
        String parent = CellCodec.readString(in);
        String hash = readRequired(in);
        Instant createdAt = readInstant(in);
        String createdBy = readRequired(in);
        String tag = CellCodec.readString(in);
        NormalizedTable table = readTable(in);
        var version = new Version(id, doc, number, parent, hash, createdAt, createdBy, tag, table.size());
        return new StoredVersion(version, table);
    }

    static void writeTable(DataOutput out, NormalizedTable table) throws IOException {
        out.writeInt(table.sheets().size());
        for (String sheet : table.sheets()) {
            NavigableMap<CellKey, CellValue> cells = table.sheetCells(sheet);
            CellCodec.writeString(out, sheet);
            out.writeInt(cells.size());
            for (Map.Entry<CellKey, CellValue> e : cells.entrySet()) {
                out.writeInt(e.getKey().row());
                out.writeInt(e.getKey().column());
                CellCodec.writeCell(out, e.getValue());
            }
        }
    }

    static NormalizedTable readTable(DataInput in) throws IOException {
        var b = NormalizedTable.builder();
        int sheets = in.readInt();
        for (int s = 0; s < sheets; s++) {
            String sheet = readRequired(in);
            b.sheet(sheet);
            int cells = in.readInt();
            for (int c = 0; c < cells; c++) {
                int row = in.readInt();
                int column = in.readInt();
                b.put(sheet, row, column, CellCodec.readCell(in));
            }
        }
        return b.build();
    }

    // ----------------- helpers -----------------

    static byte[] frame(byte[] payload) {
        ByteBuffer header = ByteBuffer.allocate(HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        header.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        header.flip();

        byte[] out = new byte[header.remaining() + payload.length];
        header.get(out, 0, header.limit());
        System.arraycopy(payload, 0, out, header.limit(), payload.length);
        return out;
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue();
    }

    @FunctionalInterface
    private interface PayloadWriter {
        void write(DataOutputStream out) throws IOException;
    }

    private static byte[] payload(PayloadWriter writer) {
        var bytes = new ByteArrayOutputStream(256);
        try (var out = new DataOutputStream(bytes)) {
            writer.write(out);
        } catch (IOException e) {
            // in-memory stream
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }

    private static void writeInstant(DataOutput out, Instant t) throws IOException {
        out.writeLong(t.getEpochSecond());
        out.writeInt(t.getNano());
    }

    private static Instant readInstant(DataInput in) throws IOException {
        long seconds = in.readLong();
        int nanos = in.readInt();
        return Instant.ofEpochSecond(seconds, nanos);
    }

    private static String readRequired(DataInput in) throws IOException {
        String s = CellCodec.readString(in);
        if (s == null) throw new IOException("unexpected null string");
        return s;
    }
}
