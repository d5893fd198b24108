// file: src/main/java/io/tabver/core/merge/ConflictKind.java
package io.tabver.core.merge;

public enum ConflictKind {
    /** Both sides changed a plain value differently. */
    VALUE,
    /** At least one side holds a formula and the formulas (or results) differ. */
    FORMULA,
    /** The two new values have different value types. */
    TYPE_MISMATCH,
    /** One side removed the cell, the other changed or added it. Never auto-resolved. */
    REMOVED_VS_MODIFIED
}
