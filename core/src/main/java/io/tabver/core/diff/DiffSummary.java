// file: src/main/java/io/tabver/core/diff/DiffSummary.java
package io.tabver.core.diff;

import java.util.List;

/** Entry counts per kind. */
public record DiffSummary(
        int added,
        int removed,
        int modified,
        int unchanged,
        int rowsInserted,
        int rowsDeleted
) {
    public static DiffSummary of(List<DiffEntry> entries) {
        int[] counts = new int[DiffKind.values().length];
        for (DiffEntry e : entries) counts[e.kind().ordinal()]++;
        return new DiffSummary(
                counts[DiffKind.ADDED.ordinal()],
                counts[DiffKind.REMOVED.ordinal()],
                counts[DiffKind.MODIFIED.ordinal()],
                counts[DiffKind.UNCHANGED.ordinal()],
                counts[DiffKind.ROW_INSERTED.ordinal()],
                counts[DiffKind.ROW_DELETED.ordinal()]);
    }

    public int total() {
        return added + removed + modified + unchanged + rowsInserted + rowsDeleted;
    }

    /** True when nothing but UNCHANGED entries were produced. */
    public boolean noChanges() {
        return total() == unchanged;
    }
}
