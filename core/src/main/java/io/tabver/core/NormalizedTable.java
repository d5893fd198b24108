// file: src/main/java/io/tabver/core/NormalizedTable.java
package io.tabver.core;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable, normalized tabular content: a sorted mapping {@link CellKey} -> {@link CellValue}
 * plus the set of sheet names (a sheet may exist without cells).
 * <p>
 * Invariants:
 *  - every cell's sheet is in {@link #sheets()},
 *  - locations are unique and never row-level,
 *  - iteration order is (sheet, row, column) regardless of how the table was built.
 */
public final class NormalizedTable {
    private static final NormalizedTable EMPTY = new NormalizedTable(new TreeSet<>(), new TreeMap<>());

    private final NavigableSet<String> sheets;
    private final NavigableMap<CellKey, CellValue> cells;

    private NormalizedTable(TreeSet<String> sheets, TreeMap<CellKey, CellValue> cells) {
        this.sheets = Collections.unmodifiableNavigableSet(sheets);
        this.cells = Collections.unmodifiableNavigableMap(cells);
    }

    public static NormalizedTable empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public NavigableSet<String> sheets() {
        return sheets;
    }

    public NavigableMap<CellKey, CellValue> cells() {
        return cells;
    }

    public CellValue get(CellKey key) {
        return cells.get(key);
    }

    public int size() {
        return cells.size();
    }

    /** Cells of one sheet, in (row, column) order. */
    public NavigableMap<CellKey, CellValue> sheetCells(String sheet) {
        Objects.requireNonNull(sheet, "sheet");
        if (!sheets.contains(sheet)) return Collections.emptyNavigableMap();
        return cells.subMap(CellKey.of(sheet, 0, 0), true, CellKey.of(sheet, Integer.MAX_VALUE, Integer.MAX_VALUE), true);
    }

    /**
     * Row view of one sheet: row index -> (column index -> value).
     * Rows without cells are absent.
     */
    public NavigableMap<Integer, NavigableMap<Integer, CellValue>> rows(String sheet) {
        TreeMap<Integer, NavigableMap<Integer, CellValue>> rows = new TreeMap<>();
        for (Map.Entry<CellKey, CellValue> e : sheetCells(sheet).entrySet()) {
            rows.computeIfAbsent(e.getKey().row(), r -> new TreeMap<>())
                    .put(e.getKey().column(), e.getValue());
        }
        return rows;
    }

    /** Builder pre-filled with this table's sheets and cells. */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.sheets.addAll(sheets);
        b.cells.putAll(cells);
        return b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NormalizedTable other)) return false;
        return sheets.equals(other.sheets) && cells.equals(other.cells);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sheets, cells);
    }

    @Override
    public String toString() {
        return "NormalizedTable{sheets=" + sheets + ", cells=" + cells.size() + "}";
    }

    /**
     * Mutable builder. {@link #put} rejects a second value for the same location,
     * {@link #set} and {@link #remove} are for overlays (merge output).
     */
    public static final class Builder {
        private final TreeSet<String> sheets = new TreeSet<>();
        private final TreeMap<CellKey, CellValue> cells = new TreeMap<>();

        private Builder() {}

        public Builder sheet(String name) {
            Objects.requireNonNull(name, "sheet");
            if (name.isBlank()) throw new IllegalArgumentException("sheet name must not be blank");
            sheets.add(name);
            return this;
        }

        public Builder put(String sheet, int row, int column, CellValue value) {
            return put(CellKey.of(sheet, row, column), value);
        }

        public Builder put(CellKey key, CellValue value) {
            checkCell(key, value);
            if (cells.containsKey(key)) {
                throw new IllegalArgumentException("duplicate cell location " + key);
            }
            sheets.add(key.sheet());
            cells.put(key, value);
            return this;
        }

        public Builder set(CellKey key, CellValue value) {
            checkCell(key, value);
            sheets.add(key.sheet());
            cells.put(key, value);
            return this;
        }

        public Builder remove(CellKey key) {
            cells.remove(Objects.requireNonNull(key, "key"));
            return this;
        }

        public NormalizedTable build() {
            if (sheets.isEmpty() && cells.isEmpty()) return EMPTY;
            return new NormalizedTable(new TreeSet<>(sheets), new TreeMap<>(cells));
        }

        private static void checkCell(CellKey key, CellValue value) {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
            if (key.isRowLevel()) {
                throw new IllegalArgumentException("cell column must be >= 0, got " + key.column());
            }
        }
    }
}
