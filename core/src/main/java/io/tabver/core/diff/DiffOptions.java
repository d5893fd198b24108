// file: src/main/java/io/tabver/core/diff/DiffOptions.java
package io.tabver.core.diff;

/**
 * Comparison options.
 *
 * @param ignoreWhitespace trim text and collapse internal whitespace runs before comparing
 * @param ignoreCase       compare text case-insensitively
 * @param structuralAware  align rows by content before comparing cells
 * @param includeUnchanged also emit UNCHANGED entries
 * @param numericEpsilon   numbers within this absolute distance are equal (0 = exact)
 */
public record DiffOptions(
        boolean ignoreWhitespace,
        boolean ignoreCase,
        boolean structuralAware,
        boolean includeUnchanged,
        double numericEpsilon
) {
    private static final DiffOptions DEFAULTS = new DiffOptions(false, false, false, false, 0.0);

    public DiffOptions {
        if (!(numericEpsilon >= 0.0) || Double.isInfinite(numericEpsilon)) {
            throw new IllegalArgumentException("numericEpsilon must be a finite value >= 0, got " + numericEpsilon);
        }
    }

    public static DiffOptions defaults() {
        return DEFAULTS;
    }

    public DiffOptions withStructuralAware(boolean v) {
        return new DiffOptions(ignoreWhitespace, ignoreCase, v, includeUnchanged, numericEpsilon);
    }

    public DiffOptions withIncludeUnchanged(boolean v) {
        return new DiffOptions(ignoreWhitespace, ignoreCase, structuralAware, v, numericEpsilon);
    }

    public DiffOptions withNumericEpsilon(double eps) {
        return new DiffOptions(ignoreWhitespace, ignoreCase, structuralAware, includeUnchanged, eps);
    }

    public DiffOptions withIgnoreWhitespace(boolean v) {
        return new DiffOptions(v, ignoreCase, structuralAware, includeUnchanged, numericEpsilon);
    }

    public DiffOptions withIgnoreCase(boolean v) {
        return new DiffOptions(ignoreWhitespace, v, structuralAware, includeUnchanged, numericEpsilon);
    }
}
