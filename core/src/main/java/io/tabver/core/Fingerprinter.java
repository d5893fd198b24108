// file: src/main/java/io/tabver/core/Fingerprinter.java
package io.tabver.core;

import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.security.DigestOutputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.NavigableMap;

/**
 * Content fingerprint of a {@link NormalizedTable}: lower-case hex SHA-256 over a
 * canonical byte sequence.
 * <p>
 * Canonical sequence:
 *   int32 sheetCount
 *   for each sheet in lexicographic order:
 *     - name:      int32 len + UTF-8 bytes
 *     - cellCount: int32
 *     - for each cell in (row, column) order:
 *         - row:    int32
 *         - column: int32
 *         - cell:   see {@link CellCodec}
 * <p>
 * Two tables with the same cells and sheets always hash to the same value, no
 * matter in which order they were built, because the table iterates in sorted
 * order.
 */
public final class Fingerprinter {
    private Fingerprinter() {}

    public static String fingerprint(NormalizedTable table) {
        MessageDigest md = newDigest();
        try (var out = new DataOutputStream(new DigestOutputStream(OutputStream.nullOutputStream(), md))) {
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
        } catch (IOException e) {
            // the sink never fails
            throw new UncheckedIOException(e);
        }
        return HexFormat.of().formatHex(md.digest());
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
