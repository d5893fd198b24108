// file: src/main/java/io/tabver/core/diff/RowAligner.java
package io.tabver.core.diff;

import io.tabver.core.Cancellation;

import java.util.ArrayList;
import java.util.List;

/**
 * Aligns the rows of two sheets by content using a longest-common-subsequence.
 * <p>
 * Algorithm:
 *  0) Sheets spanning more than {@link #MAX_ROWS} rows (counting blank rows up to
 *     the highest used one) are not aligned at all; see {@link #fits}.
 *  1) Trim the common prefix and suffix (rows equal at the same offset).
 *  2) Build the suffix-LCS table over the remaining middle section. If it would
 *     exceed {@link #MAX_TABLE_CELLS} cells, give up and return null; the caller
 *     falls back to positional comparison.
 *  3) Walk the table front to back producing MATCH / DELETE / INSERT steps.
 *  4) Inside every gap between two matches, pair deleted and inserted rows
 *     positionally (PAIR); what is left over stays DELETE or INSERT.
 * <p>
 * The walk prefers DELETE over INSERT on ties, so the output is deterministic.
 */
public final class RowAligner {
    public static final long MAX_TABLE_CELLS = 4_000_000L;
    public static final int MAX_ROWS = 1_000_000;

    /** Row equality by index: (from row, to row) -> equal? */
    @FunctionalInterface
    public interface RowEquality {
        boolean equal(int fromRow, int toRow);
    }

    public enum Op { MATCH, PAIR, DELETE, INSERT }

    /**
     * One alignment step. fromRow is -1 for INSERT, toRow is -1 for DELETE.
     */
    public record Step(Op op, int fromRow, int toRow) {}

    private final long maxTableCells;
    private final int maxRows;

    public RowAligner() {
        this(MAX_TABLE_CELLS, MAX_ROWS);
    }

    public RowAligner(long maxTableCells) {
        this(maxTableCells, MAX_ROWS);
    }

    public RowAligner(long maxTableCells, int maxRows) {
        if (maxTableCells <= 0) throw new IllegalArgumentException("maxTableCells must be > 0");
        if (maxRows <= 0) throw new IllegalArgumentException("maxRows must be > 0");
        this.maxTableCells = maxTableCells;
        this.maxRows = maxRows;
    }

    /**
     * Whether sheets with these row spans may be aligned. Callers check this before
     * building per-row state, which is sized by the span and not by the used rows.
     */
    public boolean fits(long fromRows, long toRows) {
        return fromRows >= 0 && toRows >= 0 && fromRows <= maxRows && toRows <= maxRows;
    }

    /**
     * @param fromRows number of rows (dense, 0..fromRows-1) in the "from" sheet
     * @param toRows   number of rows in the "to" sheet
     * @return ordered steps, or null when the sheets or the LCS table would be too large
     */
    public List<Step> align(int fromRows, int toRows, RowEquality eq) {
        if (!fits(fromRows, toRows)) return null;
        List<Step> raw = new ArrayList<>(Math.max(fromRows, toRows));

        // 1) common prefix / suffix
        int prefix = 0;
        while (prefix < fromRows && prefix < toRows && eq.equal(prefix, prefix)) {
            Cancellation.checkpoint(prefix);
            prefix++;
        }
        int fromEnd = fromRows, toEnd = toRows;
        while (fromEnd > prefix && toEnd > prefix && eq.equal(fromEnd - 1, toEnd - 1)) {
            Cancellation.checkpoint(fromEnd);
            fromEnd--;
            toEnd--;
        }

        int a = fromEnd - prefix;
        int b = toEnd - prefix;
        if ((long) (a + 1) * (b + 1) > maxTableCells) return null;

        for (int i = 0; i < prefix; i++) raw.add(new Step(Op.MATCH, i, i));

        // 2) suffix LCS: lcs[i][j] = LCS of from[prefix+i..fromEnd) and to[prefix+j..toEnd)
        int[][] lcs = new int[a + 1][b + 1];
        for (int i = a - 1; i >= 0; i--) {
            Cancellation.checkpoint();
            for (int j = b - 1; j >= 0; j--) {
                if (eq.equal(prefix + i, prefix + j)) {
                    lcs[i][j] = lcs[i + 1][j + 1] + 1;
                } else {
                    lcs[i][j] = Math.max(lcs[i + 1][j], lcs[i][j + 1]);
                }
            }
        }

        // 3) walk
        int i = 0, j = 0;
        while (i < a || j < b) {
            if (i < a && j < b && eq.equal(prefix + i, prefix + j) && lcs[i][j] == lcs[i + 1][j + 1] + 1) {
                raw.add(new Step(Op.MATCH, prefix + i, prefix + j));
                i++;
                j++;
            } else if (j >= b || (i < a && lcs[i + 1][j] >= lcs[i][j + 1])) {
                raw.add(new Step(Op.DELETE, prefix + i, -1));
                i++;
            } else {
                raw.add(new Step(Op.INSERT, -1, prefix + j));
                j++;
            }
        }

        for (int k = 0; k < fromRows - fromEnd; k++) {
            raw.add(new Step(Op.MATCH, fromEnd + k, toEnd + k));
        }

        // 4) pair within gaps
        return pairGaps(raw);
    }

    private static List<Step> pairGaps(List<Step> raw) {
        List<Step> out = new ArrayList<>(raw.size());
        List<Integer> deleted = new ArrayList<>();
        List<Integer> inserted = new ArrayList<>();
        for (Step s : raw) {
            if (s.op() == Op.DELETE) {
                deleted.add(s.fromRow());
            } else if (s.op() == Op.INSERT) {
                inserted.add(s.toRow());
            } else {
                flushGap(deleted, inserted, out);
                out.add(s);
            }
        }
        flushGap(deleted, inserted, out);
        return out;
    }

    private static void flushGap(List<Integer> deleted, List<Integer> inserted, List<Step> out) {
        int paired = Math.min(deleted.size(), inserted.size());
        for (int k = 0; k < paired; k++) out.add(new Step(Op.PAIR, deleted.get(k), inserted.get(k)));
        for (int k = paired; k < deleted.size(); k++) out.add(new Step(Op.DELETE, deleted.get(k), -1));
        for (int k = paired; k < inserted.size(); k++) out.add(new Step(Op.INSERT, -1, inserted.get(k)));
        deleted.clear();
        inserted.clear();
    }
}
