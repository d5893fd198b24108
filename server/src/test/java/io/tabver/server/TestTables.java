// file: src/test/java/io/tabver/server/TestTables.java
package io.tabver.server;

import io.tabver.core.CellKey;
import io.tabver.core.CellValue;
import io.tabver.core.NormalizedTable;
import io.tabver.storage.DurableVersionStore;
import io.tabver.storage.FileSnapshotter;
import io.tabver.storage.FileWal;
import io.tabver.storage.SnapshotPolicy;

import java.nio.file.Path;

/** Shared fixtures for server tests. */
public final class TestTables {
    public static final String SHEET = "Sheet1";

    private TestTables() {
    }

    public static DurableVersionStore openStore(Path dir) {
        return new DurableVersionStore(
                new FileWal(dir.resolve("wal"), 1L << 60),
                new FileSnapshotter(dir.resolve("snap")),
                new SnapshotPolicy(10_000));
    }

    /** "A1" style reference on {@link #SHEET}. */
    public static CellKey at(String ref) {
        int i = 0;
        int col = 0;
        while (i < ref.length() && Character.isLetter(ref.charAt(i))) {
            col = col * 26 + (ref.charAt(i) - 'A' + 1);
            i++;
        }
        int row = Integer.parseInt(ref.substring(i));
        return CellKey.of(SHEET, row - 1, col - 1);
    }

    /**
     * Table from alternating reference / value pairs; numbers become number cells,
     * everything else text cells: {@code cells("A1", 10, "B1", "x")}.
     */
    public static NormalizedTable cells(Object... refsAndValues) {
        NormalizedTable.Builder b = NormalizedTable.builder().sheet(SHEET);
        for (int i = 0; i < refsAndValues.length; i += 2) {
            b.put(at((String) refsAndValues[i]), value(refsAndValues[i + 1]));
        }
        return b.build();
    }

    public static CellValue value(Object v) {
        if (v instanceof CellValue cv) return cv;
        if (v instanceof Number n) return CellValue.number(n.doubleValue());
        if (v instanceof Boolean b) return CellValue.bool(b);
        return CellValue.text(String.valueOf(v));
    }
}
