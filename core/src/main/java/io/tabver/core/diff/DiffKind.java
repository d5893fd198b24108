// file: src/main/java/io/tabver/core/diff/DiffKind.java
package io.tabver.core.diff;

/**
 * Kind of a diff entry. Declaration order is the tie-break order for entries at
 * the same location.
 */
public enum DiffKind {
    ROW_DELETED,
    ROW_INSERTED,
    REMOVED,
    ADDED,
    MODIFIED,
    UNCHANGED;

    /** Kind seen when the comparison runs the other way round. */
    public DiffKind inverse() {
        switch (this) {
            case ADDED: return REMOVED;
            case REMOVED: return ADDED;
            case ROW_INSERTED: return ROW_DELETED;
            case ROW_DELETED: return ROW_INSERTED;
            default: return this;
        }
    }

    public boolean isRowLevel() {
        return this == ROW_DELETED || this == ROW_INSERTED;
    }
}
