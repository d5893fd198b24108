// file: src/test/java/io/tabver/core/merge/DefaultThreeWayMergerTest.java
package io.tabver.core.merge;

import io.tabver.core.CellKey;
import io.tabver.core.CellValue;
import io.tabver.core.NormalizedTable;
import io.tabver.core.Value;
import io.tabver.core.diff.CellDiffer;
import io.tabver.core.diff.DiffEntry;
import io.tabver.core.diff.DiffOptions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DefaultThreeWayMergerTest {
    private static final CellKey A1 = CellKey.of("Sheet1", 0, 0);
    private static final CellKey B1 = CellKey.of("Sheet1", 0, 1);
    private static final CellKey A2 = CellKey.of("Sheet1", 1, 0);

    private static final AuthorHistory ALICE = AuthorHistory.unknown("alice");
    private static final AuthorHistory BOB = AuthorHistory.unknown("bob");

    private static NormalizedTable a1(double v) {
        return NormalizedTable.builder().put(A1, CellValue.number(v)).build();
    }

    private static List<DiffEntry> diff(NormalizedTable from, NormalizedTable to) {
        return new CellDiffer(DiffOptions.defaults()).diff("base", from, "side", to);
    }

    private static List<Decision> merge(ResolverSettings settings, NormalizedTable base, NormalizedTable left,
                                        NormalizedTable right, AuthorHistory l, AuthorHistory r) {
        return new DefaultThreeWayMerger(settings).merge(diff(base, left), diff(base, right), l, r);
    }

    @Test
    void identical_edits_on_both_sides_apply_once() {
        var decisions = merge(ResolverSettings.defaults(), a1(10), a1(20), a1(20), ALICE, BOB);

        assertEquals(1, decisions.size());
        var apply = assertInstanceOf(Decision.Apply.class, decisions.get(0));
        assertEquals(CellValue.number(20), apply.value());
        assertEquals(Decision.Source.BOTH, apply.source());
    }

    @Test
    void different_edits_without_history_are_unresolved() {
        var decisions = merge(ResolverSettings.defaults(), a1(10), a1(20), a1(99), ALICE, BOB);

        assertEquals(1, decisions.size());
        var conflict = assertInstanceOf(Decision.Contested.class, decisions.get(0)).conflict();
        assertEquals(A1, conflict.location());
        assertEquals(CellValue.number(10), conflict.baseValue());
        assertEquals(CellValue.number(20), conflict.leftValue());
        assertEquals(CellValue.number(99), conflict.rightValue());
        assertEquals(ConflictKind.VALUE, conflict.kind());
        assertFalse(conflict.isResolved());
        assertTrue(conflict.reason().startsWith("both sides changed to different numeric values"), conflict.reason());
    }

    @Test
    void one_sided_edits_apply_from_their_side_in_location_order() {
        var base = NormalizedTable.builder()
                .put(A1, CellValue.number(1))
                .put(B1, CellValue.number(2))
                .build();
        var left = base.toBuilder().set(B1, CellValue.number(3)).build();
        var right = base.toBuilder().remove(A1).set(A2, CellValue.text("note")).build();

        var decisions = merge(ResolverSettings.defaults(), base, left, right, ALICE, BOB);

        assertEquals(List.of(A1, B1, A2), decisions.stream().map(Decision::location).toList());
        var removeA1 = (Decision.Apply) decisions.get(0);
        assertTrue(removeA1.isRemoval());
        assertEquals(Decision.Source.RIGHT, removeA1.source());
        assertEquals(Decision.Source.LEFT, ((Decision.Apply) decisions.get(1)).source());
        assertEquals(CellValue.text("note"), ((Decision.Apply) decisions.get(2)).value());
    }

    @Test
    void both_removed_is_not_a_conflict() {
        var empty = NormalizedTable.builder().sheet("Sheet1").build();
        var decisions = merge(ResolverSettings.defaults(), a1(10), empty, empty, ALICE, BOB);

        var apply = assertInstanceOf(Decision.Apply.class, decisions.get(0));
        assertTrue(apply.isRemoval());
        assertEquals(Decision.Source.BOTH, apply.source());
    }

    @Test
    void removal_against_modification_is_never_auto_resolved() {
        var empty = NormalizedTable.builder().sheet("Sheet1").build();
        var veteran = new AuthorHistory("alice", 1.0, 1000);
        var novice = new AuthorHistory("bob", 0.0, 1000);

        var decisions = merge(ResolverSettings.defaults().withThreshold(0.0), a1(10), empty, a1(11), veteran, novice);

        var conflict = ((Decision.Contested) decisions.get(0)).conflict();
        assertEquals(ConflictKind.REMOVED_VS_MODIFIED, conflict.kind());
        assertFalse(conflict.isResolved());
        assertNull(conflict.leftValue());
        assertEquals("left removed the cell while right changed it", conflict.reason());
    }

    @Test
    void dominant_right_author_wins_and_rejected_value_is_kept() {
        var left = new AuthorHistory("alice", 0.1, 20);
        var right = new AuthorHistory("bob", 0.95, 20);

        var decisions = merge(ResolverSettings.defaults(), a1(100), a1(101), a1(100.5), left, right);

        var conflict = ((Decision.Contested) decisions.get(0)).conflict();
        var auto = assertInstanceOf(Resolution.AutoResolved.class, conflict.resolution());
        assertEquals(Side.RIGHT, auto.winner());
        assertEquals(CellValue.number(100.5), auto.value());
        assertEquals(CellValue.number(101), conflict.leftValue(), "rejected value stays on record");
        assertTrue(auto.confidence() >= 0.85);
        assertTrue(conflict.reason().startsWith("auto-resolved for right"), conflict.reason());
    }

    @Test
    void ties_favour_the_left_lineage() {
        var decisions = merge(ResolverSettings.defaults().withThreshold(0.0), a1(1), a1(2), a1(3), ALICE, BOB);

        var auto = (Resolution.AutoResolved) ((Decision.Contested) decisions.get(0)).conflict().resolution();
        assertEquals(Side.LEFT, auto.winner());
        assertEquals(CellValue.number(2), auto.value());
    }

    @Test
    void formula_and_type_conflicts_are_classified() {
        var base = NormalizedTable.builder()
                .put(A1, CellValue.formula("A2*2", new Value.Numeric(4)))
                .put(B1, CellValue.number(5))
                .build();
        var left = base.toBuilder()
                .set(A1, CellValue.formula("A2*3", new Value.Numeric(6)))
                .set(B1, CellValue.number(6))
                .build();
        var right = base.toBuilder()
                .set(A1, CellValue.formula("A2+2", new Value.Numeric(4)))
                .set(B1, CellValue.text("six"))
                .build();

        var decisions = merge(ResolverSettings.defaults(), base, left, right, ALICE, BOB);

        assertEquals(ConflictKind.FORMULA, ((Decision.Contested) decisions.get(0)).conflict().kind());
        assertEquals(ConflictKind.TYPE_MISMATCH, ((Decision.Contested) decisions.get(1)).conflict().kind());
    }

    @Test
    void identity_merge_touches_nothing() {
        var t = a1(42);
        assertTrue(merge(ResolverSettings.defaults(), t, t, t, ALICE, BOB).isEmpty());
    }

    @Test
    void epsilon_treats_close_edits_as_the_same() {
        var decisions = merge(ResolverSettings.defaults().withNumericEpsilon(0.01), a1(1), a1(2.001), a1(2.002), ALICE, BOB);

        assertInstanceOf(Decision.Apply.class, decisions.get(0));
    }
}
