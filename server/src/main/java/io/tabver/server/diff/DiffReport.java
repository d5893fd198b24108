// file: src/main/java/io/tabver/server/diff/DiffReport.java
package io.tabver.server.diff;

import io.tabver.core.diff.DiffEntry;
import io.tabver.core.diff.DiffSummary;

import java.util.List;
import java.util.Objects;

/** Result of one comparison: ordered entries plus per-kind counts. */
public record DiffReport(List<DiffEntry> entries, DiffSummary summary) {
    public DiffReport {
        entries = List.copyOf(Objects.requireNonNull(entries, "entries"));
        Objects.requireNonNull(summary, "summary");
    }

    public static DiffReport of(List<DiffEntry> entries) {
        return new DiffReport(entries, DiffSummary.of(entries));
    }
}
