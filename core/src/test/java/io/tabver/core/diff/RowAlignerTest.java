// file: src/test/java/io/tabver/core/diff/RowAlignerTest.java
package io.tabver.core.diff;

import org.junit.jupiter.api.Test;

import java.util.List;

import static io.tabver.core.diff.RowAligner.Op.*;
import static org.junit.jupiter.api.Assertions.*;

class RowAlignerTest {

    private static List<RowAligner.Step> align(String from, String to) {
        return new RowAligner().align(from.length(), to.length(), (i, j) -> from.charAt(i) == to.charAt(j));
    }

    @Test
    void identical_rows_all_match() {
        var steps = align("abc", "abc");
        assertEquals(List.of(
                new RowAligner.Step(MATCH, 0, 0),
                new RowAligner.Step(MATCH, 1, 1),
                new RowAligner.Step(MATCH, 2, 2)), steps);
    }

    @Test
    void lcs_keeps_the_longest_common_run() {
        // "abcd" -> "acbd": LCS has length 3
        var steps = align("abcd", "acbd");
        long matches = steps.stream().filter(s -> s.op() == MATCH).count();
        assertEquals(3, matches);
        assertEquals(1, steps.stream().filter(s -> s.op() == DELETE).count());
        assertEquals(1, steps.stream().filter(s -> s.op() == INSERT).count());
    }

    @Test
    void deletes_and_inserts_in_one_gap_are_paired_first() {
        var steps = align("aXYz", "aPz");
        assertEquals(List.of(
                new RowAligner.Step(MATCH, 0, 0),
                new RowAligner.Step(PAIR, 1, 1),
                new RowAligner.Step(DELETE, 2, -1),
                new RowAligner.Step(MATCH, 3, 2)), steps);
    }

    @Test
    void empty_sides() {
        assertEquals(List.of(), align("", ""));
        assertEquals(List.of(new RowAligner.Step(INSERT, -1, 0), new RowAligner.Step(INSERT, -1, 1)), align("", "ab"));
        assertEquals(2, align("ab", "").stream().filter(s -> s.op() == DELETE).count());
    }

    @Test
    void returns_null_when_the_table_would_be_too_large() {
        var aligner = new RowAligner(10);
        assertNull(aligner.align(5, 5, (i, j) -> false));
        // trimming prefix and suffix keeps small middles within bounds
        assertNotNull(aligner.align(100, 101, (i, j) -> i == j || i + 1 == j && i >= 50));
    }

    @Test
    void output_is_deterministic() {
        assertEquals(align("abcabba", "cbabac"), align("abcabba", "cbabac"));
    }

    @Test
    void row_span_above_the_limit_does_not_fit() {
        var aligner = new RowAligner(RowAligner.MAX_TABLE_CELLS, 100);

        assertTrue(aligner.fits(0, 100));
        assertFalse(aligner.fits(101, 3));
        assertFalse(aligner.fits(Integer.MAX_VALUE + 1L, 1));
        assertNull(aligner.align(101, 101, (i, j) -> i == j), "checked before any work, even for identical rows");
    }

    @Test
    void default_limits_cover_the_usual_sheet() {
        var aligner = new RowAligner();
        assertTrue(aligner.fits(RowAligner.MAX_ROWS, RowAligner.MAX_ROWS));
        assertFalse(aligner.fits(RowAligner.MAX_ROWS + 1L, 0));
        assertThrows(IllegalArgumentException.class, () -> new RowAligner(10, 0));
    }
}
