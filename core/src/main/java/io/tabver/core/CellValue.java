// file: src/main/java/io/tabver/core/CellValue.java
package io.tabver.core;

import java.util.Objects;
import java.util.Optional;

/**
 * Content of a single cell: the typed value plus the original string form it was
 * parsed from.
 */
public record CellValue(Value value, String rawText) {

    public CellValue {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(rawText, "rawText");
    }

    public static CellValue text(String text) {
        return new CellValue(new Value.Text(text), text);
    }

    public static CellValue number(double number) {
        return new CellValue(new Value.Numeric(number), formatNumber(number));
    }

    public static CellValue bool(boolean bool) {
        return new CellValue(new Value.Bool(bool), bool ? "TRUE" : "FALSE");
    }

    public static CellValue empty() {
        return new CellValue(Value.Empty.INSTANCE, "");
    }

    public static CellValue formula(String expression, Value cached) {
        return new CellValue(new Value.Formula(expression, cached), "=" + expression);
    }

    /** Source expression when the value is a formula. */
    public Optional<String> formula() {
        if (value instanceof Value.Formula f) return Optional.of(f.expression());
        return Optional.empty();
    }

    public Value.Type type() {
        return value.type();
    }

    static String formatNumber(double d) {
        if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
            return Long.toString((long) d);
        }
        return Double.toString(d);
    }
}
