// file: src/main/java/io/tabver/server/merge/MergeResult.java
package io.tabver.server.merge;

import io.tabver.core.merge.Conflict;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a three-way merge.
 *
 * @param mergedVersionId     null when unresolved conflicts blocked the merge
 * @param autoResolvedCount   locations settled without a human (one-sided, agreeing and auto-resolved)
 * @param conflicts           every contested location in location order, with its final resolution
 * @param confidenceScore     resolved / (resolved + unresolved), 1.0 when nothing was touched
 * @param audited             false when the merge took effect but its audit line could not be written
 */
public record MergeResult(
        String mergedVersionId,
        String baseVersionId,
        String leftVersionId,
        String rightVersionId,
        Outcome outcome,
        int autoResolvedCount,
        int manuallyResolvedCount,
        int unresolvedCount,
        List<Conflict> conflicts,
        double confidenceScore,
        boolean audited
) {
    public enum Outcome {
        /** A new merged version was written. */
        MERGED,
        /** A merged version was written with some conflicts left at left's value. */
        PARTIAL,
        /** Unresolved conflicts, nothing written. */
        BLOCKED,
        /** The merge reproduces left exactly; left is the result. */
        UNCHANGED
    }

    public MergeResult {
        conflicts = List.copyOf(conflicts);
    }

    public MergeResult withAudited(boolean v) {
        return new MergeResult(mergedVersionId, baseVersionId, leftVersionId, rightVersionId, outcome,
                autoResolvedCount, manuallyResolvedCount, unresolvedCount, conflicts, confidenceScore, v);
    }

    public Optional<String> merged() {
        return Optional.ofNullable(mergedVersionId);
    }

    public List<Conflict> unresolved() {
        return conflicts.stream().filter(c -> !c.isResolved()).toList();
    }
}
