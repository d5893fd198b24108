// file: src/main/java/io/tabver/core/merge/ThreeWayMerger.java
package io.tabver.core.merge;

import io.tabver.core.diff.DiffEntry;

import java.util.List;

/**
 * Pure classification of the locations two branches changed relative to a common
 * base.
 * <p>
 * Typical behavior:
 *  - a location changed by one side only is applied from that side,
 *  - a location changed identically by both sides is applied once,
 *  - a location changed differently by both sides is contested; the conflict
 *    may still be auto-resolved when the confidence heuristic clears the threshold.
 * <p>
 * This interface knows nothing about storage, preference persistence or the
 * shape of the merged table.
 */
public interface ThreeWayMerger {

    /**
     * @param baseToLeft  positional diff base -> left, without UNCHANGED entries
     * @param baseToRight positional diff base -> right, without UNCHANGED entries
     * @param leftAuthor  history of the left version's author
     * @param rightAuthor history of the right version's author
     * @return one decision per touched location, ordered by location
     */
    List<Decision> merge(List<DiffEntry> baseToLeft, List<DiffEntry> baseToRight,
                         AuthorHistory leftAuthor, AuthorHistory rightAuthor);
}
