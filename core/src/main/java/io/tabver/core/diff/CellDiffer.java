// file: src/main/java/io/tabver/core/diff/CellDiffer.java
package io.tabver.core.diff;

import io.tabver.core.Cancellation;
import io.tabver.core.CellKey;
import io.tabver.core.CellValue;
import io.tabver.core.NormalizedTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Pure cell-level differ between two tables.
 * <p>
 * Positional mode walks both sorted cell maps in lockstep (a merge join over the
 * union of locations):
 *  - only in "to"   -> ADDED
 *  - only in "from" -> REMOVED
 *  - both, unequal  -> MODIFIED
 *  - both, equal    -> UNCHANGED (only when includeUnchanged)
 * <p>
 * Structural mode aligns each sheet's rows with {@link RowAligner} first; rows
 * are dense from 0 to the highest used row, rows without cells count as empty
 * rows. Sheets whose row span or LCS table is too large fall back to positional
 * mode before any per-row state is allocated.
 * <p>
 * Output is sorted by {@link DiffEntry#ORDER} and immutable.
 */
public final class CellDiffer {
    private static final Logger LOG = Logger.getLogger(CellDiffer.class.getName());

    private final DiffOptions options;
    private final ValueEquivalence equivalence;
    private final RowAligner aligner;

    public CellDiffer(DiffOptions options) {
        this(options, new RowAligner());
    }

    public CellDiffer(DiffOptions options, RowAligner aligner) {
        this.options = Objects.requireNonNull(options, "options");
        this.equivalence = new ValueEquivalence(options);
        this.aligner = Objects.requireNonNull(aligner, "aligner");
    }

    public List<DiffEntry> diff(String fromId, NormalizedTable from, String toId, NormalizedTable to) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        List<DiffEntry> out = new ArrayList<>();
        if (!options.structuralAware()) {
            positional(fromId, from.cells(), toId, to.cells(), out);
            return Collections.unmodifiableList(out);
        }

        TreeSet<String> sheets = new TreeSet<>(from.sheets());
        sheets.addAll(to.sheets());
        for (String sheet : sheets) {
            structural(sheet, fromId, from, toId, to, out);
        }
        out.sort(DiffEntry.ORDER);
        return Collections.unmodifiableList(out);
    }

    // ---------- positional ----------

    private void positional(String fromId, NavigableMap<CellKey, CellValue> from,
                            String toId, NavigableMap<CellKey, CellValue> to, List<DiffEntry> out) {
        Iterator<Map.Entry<CellKey, CellValue>> fi = from.entrySet().iterator();
        Iterator<Map.Entry<CellKey, CellValue>> ti = to.entrySet().iterator();
        Map.Entry<CellKey, CellValue> f = next(fi);
        Map.Entry<CellKey, CellValue> t = next(ti);
        long steps = 0;
        while (f != null || t != null) {
            Cancellation.checkpoint(++steps);
            int cmp = f == null ? 1 : t == null ? -1 : f.getKey().compareTo(t.getKey());
            if (cmp < 0) {
                out.add(DiffEntry.cell(fromId, toId, f.getKey(), DiffKind.REMOVED, f.getValue(), null));
                f = next(fi);
            } else if (cmp > 0) {
                out.add(DiffEntry.cell(fromId, toId, t.getKey(), DiffKind.ADDED, null, t.getValue()));
                t = next(ti);
            } else {
                compareCell(fromId, toId, t.getKey(), f.getValue(), t.getValue(), null, out);
                f = next(fi);
                t = next(ti);
            }
        }
    }

    private static <K, V> Map.Entry<K, V> next(Iterator<Map.Entry<K, V>> it) {
        return it.hasNext() ? it.next() : null;
    }

    private void compareCell(String fromId, String toId, CellKey at, CellValue oldValue, CellValue newValue,
                             Integer originRow, List<DiffEntry> out) {
        if (equivalence.equivalent(oldValue, newValue)) {
            if (options.includeUnchanged()) {
                out.add(new DiffEntry(fromId, toId, at, DiffKind.UNCHANGED, oldValue, newValue, originRow));
            }
        } else {
            out.add(new DiffEntry(fromId, toId, at, DiffKind.MODIFIED, oldValue, newValue, originRow));
        }
    }

    // ---------- structural ----------

    private void structural(String sheet, String fromId, NormalizedTable from,
                            String toId, NormalizedTable to, List<DiffEntry> out) {
        NavigableMap<Integer, NavigableMap<Integer, CellValue>> fromRows = from.rows(sheet);
        NavigableMap<Integer, NavigableMap<Integer, CellValue>> toRows = to.rows(sheet);
        // row spans in long: the highest row index may be Integer.MAX_VALUE
        long fromSpan = fromRows.isEmpty() ? 0L : fromRows.lastKey() + 1L;
        long toSpan = toRows.isEmpty() ? 0L : toRows.lastKey() + 1L;
        if (!aligner.fits(fromSpan, toSpan)) {
            fallBack(sheet, fromSpan, toSpan, fromId, from, toId, to, out);
            return;
        }
        int fromCount = (int) fromSpan;
        int toCount = (int) toSpan;

        int[] fromHash = hashes(fromRows, fromCount);
        int[] toHash = hashes(toRows, toCount);
        RowAligner.RowEquality eq = (i, j) -> fromHash[i] == toHash[j]
                && equivalence.rowsEquivalent(row(fromRows, i), row(toRows, j));

        List<RowAligner.Step> steps = aligner.align(fromCount, toCount, eq);
        if (steps == null) {
            fallBack(sheet, fromSpan, toSpan, fromId, from, toId, to, out);
            return;
        }

        for (RowAligner.Step step : steps) {
            switch (step.op()) {
                case MATCH:
                    if (options.includeUnchanged()) {
                        compareRows(sheet, fromId, toId, step, row(fromRows, step.fromRow()), row(toRows, step.toRow()), out);
                    }
                    break;
                case PAIR:
                    compareRows(sheet, fromId, toId, step, row(fromRows, step.fromRow()), row(toRows, step.toRow()), out);
                    break;
                case DELETE:
                    out.add(new DiffEntry(fromId, toId, CellKey.rowOf(sheet, step.fromRow()),
                            DiffKind.ROW_DELETED, null, null, null));
                    break;
                case INSERT:
                    out.add(new DiffEntry(fromId, toId, CellKey.rowOf(sheet, step.toRow()),
                            DiffKind.ROW_INSERTED, null, null, null));
                    break;
                default:
                    throw new IllegalStateException("Unknown alignment op " + step.op());
            }
        }
    }

    private void fallBack(String sheet, long fromSpan, long toSpan, String fromId, NormalizedTable from,
                          String toId, NormalizedTable to, List<DiffEntry> out) {
        LOG.info(() -> "Sheet '" + sheet + "' too large for row alignment (" + fromSpan + " x " + toSpan
                + " rows), comparing positionally");
        positional(fromId, from.sheetCells(sheet), toId, to.sheetCells(sheet), out);
    }

    private void compareRows(String sheet, String fromId, String toId, RowAligner.Step step,
                             NavigableMap<Integer, CellValue> fromRow, NavigableMap<Integer, CellValue> toRow,
                             List<DiffEntry> out) {
        Integer origin = step.fromRow() == step.toRow() ? null : step.fromRow();
        TreeSet<Integer> columns = new TreeSet<>(fromRow.keySet());
        columns.addAll(toRow.keySet());
        for (int column : columns) {
            CellKey at = CellKey.of(sheet, step.toRow(), column);
            CellValue oldValue = fromRow.get(column);
            CellValue newValue = toRow.get(column);
            if (oldValue == null) {
                out.add(new DiffEntry(fromId, toId, at, DiffKind.ADDED, null, newValue, origin));
            } else if (newValue == null) {
                out.add(new DiffEntry(fromId, toId, at, DiffKind.REMOVED, oldValue, null, origin));
            } else {
                compareCell(fromId, toId, at, oldValue, newValue, origin, out);
            }
        }
    }

    private int[] hashes(NavigableMap<Integer, NavigableMap<Integer, CellValue>> rows, int count) {
        int[] out = new int[count];
        for (int i = 0; i < count; i++) out[i] = equivalence.rowHash(row(rows, i));
        return out;
    }

    private static NavigableMap<Integer, CellValue> row(NavigableMap<Integer, NavigableMap<Integer, CellValue>> rows, int index) {
        NavigableMap<Integer, CellValue> r = rows.get(index);
        return r == null ? EMPTY_ROW : r;
    }

    private static final NavigableMap<Integer, CellValue> EMPTY_ROW = Collections.unmodifiableNavigableMap(new TreeMap<>());
}
