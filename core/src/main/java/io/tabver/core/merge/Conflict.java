// file: src/main/java/io/tabver/core/merge/Conflict.java
package io.tabver.core.merge;

import io.tabver.core.CellKey;
import io.tabver.core.CellValue;

import java.util.Objects;

/**
 * A location both sides changed differently. Absent values (cell missing on
 * that side) are null. An auto-resolved conflict keeps the rejected value here.
 */
public record Conflict(
        CellKey location,
        CellValue baseValue,
        CellValue leftValue,
        CellValue rightValue,
        ConflictKind kind,
        Resolution resolution,
        String reason
) {
    public Conflict {
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(resolution, "resolution");
        Objects.requireNonNull(reason, "reason");
        if (kind == ConflictKind.REMOVED_VS_MODIFIED && resolution instanceof Resolution.AutoResolved) {
            throw new IllegalArgumentException("removed-vs-modified conflicts are never auto-resolved");
        }
    }

    /** Auto-resolved or manually resolved. */
    public boolean isResolved() {
        return !(resolution instanceof Resolution.Unresolved);
    }

    public Conflict withResolution(Resolution next) {
        return new Conflict(location, baseValue, leftValue, rightValue, kind, next, reason);
    }

    public CellValue valueOf(Side side) {
        return side == Side.LEFT ? leftValue : rightValue;
    }
}
