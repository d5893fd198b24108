// file: src/main/java/io/tabver/core/CellKey.java
package io.tabver.core;

import java.util.Comparator;
import java.util.Objects;

/**
 * Location of a cell inside a table: (sheet, row, column), all zero-based.
 * <p>
 * Natural order is (sheet, row, column), which is also the canonical order used
 * by fingerprinting and by every diff/merge output.
 * <p>
 * Row-level diff entries (inserted / deleted rows) use {@link #ROW} as column.
 */
public record CellKey(String sheet, int row, int column) implements Comparable<CellKey> {

    /** Column marker for entries that describe a whole row. */
    public static final int ROW = -1;

    private static final Comparator<CellKey> ORDER = Comparator
            .comparing(CellKey::sheet)
            .thenComparingInt(CellKey::row)
            .thenComparingInt(CellKey::column);

    public CellKey {
        Objects.requireNonNull(sheet, "sheet");
        if (sheet.isBlank()) throw new IllegalArgumentException("sheet name must not be blank");
        if (row < 0) throw new IllegalArgumentException("row must be >= 0, got " + row);
        if (column < ROW) throw new IllegalArgumentException("column must be >= 0, got " + column);
    }

    public static CellKey of(String sheet, int row, int column) {
        return new CellKey(sheet, row, column);
    }

    public static CellKey rowOf(String sheet, int row) {
        return new CellKey(sheet, row, ROW);
    }

    public boolean isRowLevel() {
        return column == ROW;
    }

    /** Spreadsheet-style reference, e.g. {@code Sheet1!B3}. */
    public String a1() {
        if (isRowLevel()) return sheet + "!" + (row + 1) + ":" + (row + 1);
        return sheet + "!" + columnLetters(column) + (row + 1);
    }

    @Override
    public int compareTo(CellKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return a1();
    }

    static String columnLetters(int column) {
        StringBuilder sb = new StringBuilder();
        int c = column + 1;
        while (c > 0) {
            int rem = (c - 1) % 26;
            sb.append((char) ('A' + rem));
            c = (c - 1) / 26;
        }
        return sb.reverse().toString();
    }
}
