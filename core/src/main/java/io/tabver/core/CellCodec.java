// file: src/main/java/io/tabver/core/CellCodec.java
package io.tabver.core;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Canonical binary form of cells and strings, shared by fingerprinting, the WAL
 * and snapshots.
 * <p>
 * Cell layout:
 *   - type tag: byte (see {@link Value.Type#tag()})
 *   - payload:
 *       TEXT    -> string
 *       NUMBER  -> int64 IEEE-754 bits (NaN canonical, -0.0 already folded)
 *       BOOLEAN -> byte 0/1
 *       EMPTY   -> nothing
 *       FORMULA -> expression string, then the cached value (tag + payload)
 *   - raw text: string
 *   - formula: string, or length -1 when the cell is not a formula
 * <p>
 * Strings are int32 length + UTF-8 bytes (length -1 => null).
 */
public final class CellCodec {
    private CellCodec() {}

    public static void writeCell(DataOutput out, CellValue cell) throws IOException {
        writeValue(out, cell.value());
        writeString(out, cell.rawText());
        writeString(out, cell.formula().orElse(null));
    }

    public static CellValue readCell(DataInput in) throws IOException {
        Value value = readValue(in);
        String raw = readString(in);
        readString(in); // formula, derivable from the value
        if (raw == null) throw new IOException("cell raw text is missing");
        return new CellValue(value, raw);
    }

    public static void writeValue(DataOutput out, Value value) throws IOException {
        out.writeByte(value.type().tag());
        if (value instanceof Value.Text t) {
            writeString(out, t.text());
        } else if (value instanceof Value.Numeric n) {
            out.writeLong(Double.doubleToLongBits(n.number()));
        } else if (value instanceof Value.Bool b) {
            out.writeByte(b.bool() ? 1 : 0);
        } else if (value instanceof Value.Formula f) {
            writeString(out, f.expression());
            writeValue(out, f.cached());
        }
        // Empty has no payload
    }

    public static Value readValue(DataInput in) throws IOException {
        Value.Type type;
        try {
            type = Value.Type.fromTag(in.readByte());
        } catch (IllegalArgumentException e) {
            throw new IOException(e.getMessage(), e);
        }
        switch (type) {
            case TEXT:
                return new Value.Text(requireString(in));
            case NUMBER:
                return new Value.Numeric(Double.longBitsToDouble(in.readLong()));
            case BOOLEAN:
                return new Value.Bool(in.readByte() != 0);
            case EMPTY:
                return Value.Empty.INSTANCE;
            case FORMULA:
                String expr = requireString(in);
                return new Value.Formula(expr, readValue(in));
            default:
                throw new IOException("Unhandled value type " + type);
        }
    }

    public static void writeString(DataOutput out, String s) throws IOException {
        if (s == null) { out.writeInt(-1); return; }
        byte[] b = s.getBytes(StandardCharsets.UTF_8);
        out.writeInt(b.length);
        out.write(b);
    }

    public static String readString(DataInput in) throws IOException {
        int len = in.readInt();
        if (len == -1) return null;
        if (len < 0) throw new IOException("negative string length " + len);
        byte[] b = new byte[len];
        in.readFully(b);
        return new String(b, StandardCharsets.UTF_8);
    }

    private static String requireString(DataInput in) throws IOException {
        String s = readString(in);
        if (s == null) throw new IOException("unexpected null string");
        return s;
    }
}
