// file: src/main/java/io/tabver/core/diff/ValueEquivalence.java
package io.tabver.core.diff;

import io.tabver.core.CellValue;
import io.tabver.core.Value;

import java.util.Locale;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Typed equality of cell values under a set of {@link DiffOptions}.
 * <p>
 * Rules:
 *  - different value types are never equal (Numeric 10 vs Text "10"),
 *  - text and formula expressions are normalized (whitespace, case) when asked,
 *  - numbers are equal within numericEpsilon,
 *  - formulas are equal when expression and cached value are equal,
 *  - Empty equals Empty.
 * <p>
 * Raw text does not take part in equality; it is presentation only.
 */
public final class ValueEquivalence {
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private final boolean ignoreWhitespace;
    private final boolean ignoreCase;
    private final double epsilon;

    public ValueEquivalence(DiffOptions options) {
        Objects.requireNonNull(options, "options");
        this.ignoreWhitespace = options.ignoreWhitespace();
        this.ignoreCase = options.ignoreCase();
        this.epsilon = options.numericEpsilon();
    }

    public boolean equivalent(CellValue a, CellValue b) {
        if (a == null || b == null) return a == b;
        return equivalent(a.value(), b.value());
    }

    public boolean equivalent(Value a, Value b) {
        if (a.type() != b.type()) return false;
        if (a instanceof Value.Text ta && b instanceof Value.Text tb) {
            return normalize(ta.text()).equals(normalize(tb.text()));
        }
        if (a instanceof Value.Numeric na && b instanceof Value.Numeric nb) {
            return numbersEqual(na.number(), nb.number());
        }
        if (a instanceof Value.Formula fa && b instanceof Value.Formula fb) {
            return normalize(fa.expression()).equals(normalize(fb.expression()))
                    && equivalent(fa.cached(), fb.cached());
        }
        // Bool and Empty: record equality
        return a.equals(b);
    }

    /** Two rows (column -> value) are equal when they have the same columns with equivalent values. */
    public boolean rowsEquivalent(NavigableMap<Integer, CellValue> a, NavigableMap<Integer, CellValue> b) {
        if (a.size() != b.size()) return false;
        var ia = a.entrySet().iterator();
        var ib = b.entrySet().iterator();
        while (ia.hasNext()) {
            var ea = ia.next();
            var eb = ib.next();
            if (!ea.getKey().equals(eb.getKey())) return false;
            if (!equivalent(ea.getValue(), eb.getValue())) return false;
        }
        return true;
    }

    /**
     * Hash consistent with {@link #rowsEquivalent}: equivalent rows always hash the
     * same. With a non-zero epsilon, numbers contribute only their type.
     */
    public int rowHash(NavigableMap<Integer, CellValue> row) {
        int h = 1;
        for (var e : row.entrySet()) {
            h = 31 * h + e.getKey();
            h = 31 * h + valueHash(e.getValue().value());
        }
        return h;
    }

    String normalize(String s) {
        String out = s;
        if (ignoreWhitespace) out = WHITESPACE_RUN.matcher(out.strip()).replaceAll(" ");
        if (ignoreCase) out = out.toLowerCase(Locale.ROOT);
        return out;
    }

    private boolean numbersEqual(double x, double y) {
        if (Double.compare(x, y) == 0) return true;
        return epsilon > 0 && Math.abs(x - y) <= epsilon;
    }

    private int valueHash(Value v) {
        int h = v.type().tag();
        if (v instanceof Value.Text t) {
            h = 31 * h + normalize(t.text()).hashCode();
        } else if (v instanceof Value.Numeric n) {
            if (epsilon == 0) h = 31 * h + Double.hashCode(n.number());
        } else if (v instanceof Value.Bool b) {
            h = 31 * h + Boolean.hashCode(b.bool());
        } else if (v instanceof Value.Formula f) {
            h = 31 * h + normalize(f.expression()).hashCode();
            h = 31 * h + valueHash(f.cached());
        }
        return h;
    }
}
