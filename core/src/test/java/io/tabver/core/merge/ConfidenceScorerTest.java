// file: src/test/java/io/tabver/core/merge/ConfidenceScorerTest.java
package io.tabver.core.merge;

import io.tabver.core.CellValue;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConfidenceScorerTest {
    private static final double EPS = 1e-9;
    private final ConfidenceScorer scorer = new ConfidenceScorer(ResolverSettings.defaults());

    @Test
    void far_apart_numbers_without_history_score_low() {
        var s = scorer.score(CellValue.number(10), CellValue.number(20), CellValue.number(99),
                AuthorHistory.unknown("alice"), AuthorHistory.unknown("bob"));

        assertEquals(1.0, s.typeAgreement(), EPS);
        assertEquals(0.0, s.numericCloseness(), EPS);
        assertEquals(0.0, s.historyDominance(), EPS);
        assertEquals(0.2, s.confidence(), EPS);
        assertEquals(Side.LEFT, s.favoured());
    }

    @Test
    void closeness_is_scaled_by_the_base_value() {
        var s = scorer.score(CellValue.number(10), CellValue.number(12), CellValue.number(17),
                AuthorHistory.unknown("alice"), AuthorHistory.unknown("bob"));

        assertEquals(0.5, s.numericCloseness(), EPS);
        assertEquals(0.35, s.confidence(), EPS);
        assertTrue(s.baseScaled());
        assertEquals("both sides changed to different numeric values (diverge by 50% of base), no dominant history",
                ConfidenceScorer.describe(ConflictKind.VALUE, CellValue.number(12), CellValue.number(17), s));
    }

    @Test
    void closeness_without_numeric_base_uses_the_larger_side() {
        var s = scorer.score(null, CellValue.number(80), CellValue.number(100),
                AuthorHistory.unknown("alice"), AuthorHistory.unknown("bob"));

        assertEquals(0.8, s.numericCloseness(), EPS);
        assertFalse(s.baseScaled());
    }

    @Test
    void dominant_history_can_clear_the_threshold() {
        var s = scorer.score(CellValue.number(100), CellValue.number(101), CellValue.number(102),
                new AuthorHistory("alice", 0.9, 10), new AuthorHistory("bob", 0.1, 10));

        // 0.2 * 1 + 0.3 * 0.99 + 0.5 * 0.8
        assertEquals(0.897, s.confidence(), 1e-6);
        assertEquals(Side.LEFT, s.favoured());
        assertTrue(s.confidence() >= ResolverSettings.DEFAULT_THRESHOLD);
    }

    @Test
    void authors_with_little_history_are_neutral() {
        var s = scorer.score(CellValue.number(100), CellValue.number(101), CellValue.number(102),
                new AuthorHistory("alice", 0.9, 4), new AuthorHistory("bob", 0.1, 10));

        // alice counts as 0.5, not 0.9
        assertEquals(0.4, s.historyDominance(), EPS);
        assertEquals(0.5, s.leftWeight(), EPS);
        assertEquals(Side.LEFT, s.favoured());
    }

    @Test
    void same_author_on_both_sides_gives_no_dominance() {
        var s = scorer.score(CellValue.number(1), CellValue.number(2), CellValue.number(3),
                new AuthorHistory("alice", 0.9, 50), new AuthorHistory("alice", 0.9, 50));

        assertEquals(0.0, s.historyDominance(), EPS);
        assertEquals(Side.LEFT, s.favoured());
    }

    @Test
    void type_mismatch_gets_no_type_or_numeric_signal() {
        var s = scorer.score(CellValue.number(10), CellValue.number(20), CellValue.text("twenty"),
                AuthorHistory.unknown("alice"), AuthorHistory.unknown("bob"));

        assertEquals(0.0, s.typeAgreement(), EPS);
        assertEquals(0.0, s.numericCloseness(), EPS);
        assertEquals(0.0, s.confidence(), EPS);
        assertEquals("sides disagree on value type (number vs text), no dominant history",
                ConfidenceScorer.describe(ConflictKind.TYPE_MISMATCH, CellValue.number(20), CellValue.text("twenty"), s));
    }

    @Test
    void text_values_get_type_agreement_only() {
        var s = scorer.score(CellValue.text("a"), CellValue.text("b"), CellValue.text("c"),
                AuthorHistory.unknown("alice"), AuthorHistory.unknown("bob"));

        assertEquals(0.2, s.confidence(), EPS);
        assertEquals("both sides changed to different text values, no dominant history",
                ConfidenceScorer.describe(ConflictKind.VALUE, CellValue.text("b"), CellValue.text("c"), s));
    }
}
