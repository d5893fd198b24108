// file: src/main/java/io/tabver/core/merge/DefaultThreeWayMerger.java
package io.tabver.core.merge;

import io.tabver.core.Cancellation;
import io.tabver.core.CellKey;
import io.tabver.core.CellValue;
import io.tabver.core.Value;
import io.tabver.core.diff.DiffEntry;
import io.tabver.core.diff.DiffKind;
import io.tabver.core.diff.DiffOptions;
import io.tabver.core.diff.ValueEquivalence;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Default three-way classifier.
 * <p>
 * Algorithm, for every location touched by either diff (sorted):
 *  - only left changed            -> Apply(left new value)
 *  - only right changed           -> Apply(right new value)
 *  - both changed to equal values -> Apply(value), both removed included
 *  - one removed, other changed   -> Contested(REMOVED_VS_MODIFIED, Unresolved)
 *  - both changed differently     -> Contested, AutoResolved for the favoured side
 *                                    when confidence >= threshold, else Unresolved
 * <p>
 * Notes:
 *  - Value equality uses the configured numeric epsilon and no text normalization.
 *  - Deterministic: no randomness, output order is location order.
 */
public final class DefaultThreeWayMerger implements ThreeWayMerger {
    private final ResolverSettings settings;
    private final ConfidenceScorer scorer;
    private final ValueEquivalence equivalence;

    public DefaultThreeWayMerger(ResolverSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.scorer = new ConfidenceScorer(settings);
        this.equivalence = new ValueEquivalence(DiffOptions.defaults().withNumericEpsilon(settings.numericEpsilon()));
    }

    @Override
    public List<Decision> merge(List<DiffEntry> baseToLeft, List<DiffEntry> baseToRight,
                                AuthorHistory leftAuthor, AuthorHistory rightAuthor) {
        Objects.requireNonNull(leftAuthor, "leftAuthor");
        Objects.requireNonNull(rightAuthor, "rightAuthor");
        Map<CellKey, DiffEntry> left = index(baseToLeft);
        Map<CellKey, DiffEntry> right = index(baseToRight);

        TreeSet<CellKey> touched = new TreeSet<>(left.keySet());
        touched.addAll(right.keySet());

        List<Decision> out = new ArrayList<>(touched.size());
        long n = 0;
        for (CellKey at : touched) {
            Cancellation.checkpoint(++n);
            DiffEntry l = left.get(at);
            DiffEntry r = right.get(at);
            if (r == null) {
                out.add(new Decision.Apply(at, l.newValue(), Decision.Source.LEFT));
            } else if (l == null) {
                out.add(new Decision.Apply(at, r.newValue(), Decision.Source.RIGHT));
            } else {
                out.add(bothChanged(at, l, r, leftAuthor, rightAuthor));
            }
        }
        return List.copyOf(out);
    }

    private Decision bothChanged(CellKey at, DiffEntry l, DiffEntry r, AuthorHistory leftAuthor, AuthorHistory rightAuthor) {
        CellValue base = l.oldValue() != null ? l.oldValue() : r.oldValue();
        CellValue lv = l.newValue();
        CellValue rv = r.newValue();

        if (equivalence.equivalent(lv, rv)) {
            return new Decision.Apply(at, lv, Decision.Source.BOTH);
        }

        if (lv == null || rv == null) {
            String reason = (lv == null ? "left removed the cell while right " : "right removed the cell while left ")
                    + (base == null ? "added it" : "changed it");
            return new Decision.Contested(new Conflict(at, base, lv, rv, ConflictKind.REMOVED_VS_MODIFIED,
                    new Resolution.Unresolved(0.0), reason));
        }

        ConflictKind kind = classify(lv, rv);
        ConfidenceScorer.Score score = scorer.score(base, lv, rv, leftAuthor, rightAuthor);
        String reason = ConfidenceScorer.describe(kind, lv, rv, score);

        Resolution resolution;
        if (score.confidence() >= settings.autoResolveThreshold()) {
            Side winner = score.favoured();
            resolution = new Resolution.AutoResolved(winner == Side.LEFT ? lv : rv, score.confidence(), winner);
            reason = "auto-resolved for " + (winner == Side.LEFT ? "left" : "right")
                    + String.format(Locale.ROOT, " (confidence %.2f): ", score.confidence()) + reason;
        } else {
            resolution = new Resolution.Unresolved(score.confidence());
        }
        return new Decision.Contested(new Conflict(at, base, lv, rv, kind, resolution, reason));
    }

    private static ConflictKind classify(CellValue lv, CellValue rv) {
        if (lv.type() != rv.type()) return ConflictKind.TYPE_MISMATCH;
        if (lv.value() instanceof Value.Formula) return ConflictKind.FORMULA;
        return ConflictKind.VALUE;
    }

    private static Map<CellKey, DiffEntry> index(List<DiffEntry> diff) {
        Map<CellKey, DiffEntry> out = new TreeMap<>();
        for (DiffEntry e : diff) {
            if (e.kind() == DiffKind.UNCHANGED) continue;
            if (e.kind().isRowLevel()) {
                throw new IllegalArgumentException("three-way merge needs positional diffs, got " + e.kind() + " at " + e.location());
            }
            out.put(e.location(), e);
        }
        return out;
    }
}
