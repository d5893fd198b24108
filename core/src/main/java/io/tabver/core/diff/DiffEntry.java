// file: src/main/java/io/tabver/core/diff/DiffEntry.java
package io.tabver.core.diff;

import io.tabver.core.CellKey;
import io.tabver.core.CellValue;

import java.util.Comparator;
import java.util.Objects;

/**
 * One difference between two versions.
 * <p>
 * Value presence by kind:
 *  - ADDED:      newValue only
 *  - REMOVED:    oldValue only
 *  - MODIFIED:   both, unequal under the comparison options
 *  - UNCHANGED:  both, equal under the comparison options
 *  - ROW_*:      neither; location is row-level (column {@link CellKey#ROW})
 * <p>
 * originRow is only set in structural mode, when the cell was compared against a
 * row at a different index in the "from" version.
 */
public record DiffEntry(
        String fromVersionId,
        String toVersionId,
        CellKey location,
        DiffKind kind,
        CellValue oldValue,
        CellValue newValue,
        Integer originRow
) {
    /** (sheet, row, column), then kind declaration order. */
    public static final Comparator<DiffEntry> ORDER = Comparator
            .comparing(DiffEntry::location)
            .thenComparing(DiffEntry::kind);

    public DiffEntry {
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(kind, "kind");
        if (kind.isRowLevel() != location.isRowLevel()) {
            throw new IllegalArgumentException(kind + " entry at " + location);
        }
    }

    public static DiffEntry cell(String from, String to, CellKey location, DiffKind kind,
                                 CellValue oldValue, CellValue newValue) {
        return new DiffEntry(from, to, location, kind, oldValue, newValue, null);
    }

    /** The same difference seen from the other side. Only meaningful for positional entries. */
    public DiffEntry inverse() {
        return new DiffEntry(toVersionId, fromVersionId, location, kind.inverse(), newValue, oldValue, originRow);
    }
}
