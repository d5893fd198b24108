// file: src/main/java/io/tabver/core/merge/ResolverSettings.java
package io.tabver.core.merge;

/**
 * Tunables of the conflict heuristic.
 *
 * @param autoResolveThreshold confidence at or above which a conflict is auto-resolved
 * @param typeWeight           weight of the type-agreement signal
 * @param numericWeight        weight of the numeric-closeness signal
 * @param historyWeight        weight of the history-dominance signal
 * @param minHistory           observations below which an author counts as neutral
 * @param numericEpsilon       numbers within this distance count as the same edit
 */
public record ResolverSettings(
        double autoResolveThreshold,
        double typeWeight,
        double numericWeight,
        double historyWeight,
        int minHistory,
        double numericEpsilon
) {
    public static final double DEFAULT_THRESHOLD = 0.85;
    public static final int DEFAULT_MIN_HISTORY = 5;

    public ResolverSettings {
        if (!(autoResolveThreshold >= 0.0 && autoResolveThreshold <= 1.0))
            throw new IllegalArgumentException("autoResolveThreshold must be in [0,1]");
        checkWeight("typeWeight", typeWeight);
        checkWeight("numericWeight", numericWeight);
        checkWeight("historyWeight", historyWeight);
        if (minHistory < 0) throw new IllegalArgumentException("minHistory must be >= 0");
        if (!(numericEpsilon >= 0.0) || Double.isInfinite(numericEpsilon))
            throw new IllegalArgumentException("numericEpsilon must be a finite value >= 0");
    }

    public static ResolverSettings defaults() {
        return new ResolverSettings(DEFAULT_THRESHOLD, 0.2, 0.3, 0.5, DEFAULT_MIN_HISTORY, 0.0);
    }

    public ResolverSettings withThreshold(double threshold) {
        return new ResolverSettings(threshold, typeWeight, numericWeight, historyWeight, minHistory, numericEpsilon);
    }

    public ResolverSettings withMinHistory(int min) {
        return new ResolverSettings(autoResolveThreshold, typeWeight, numericWeight, historyWeight, min, numericEpsilon);
    }

    public ResolverSettings withNumericEpsilon(double eps) {
        return new ResolverSettings(autoResolveThreshold, typeWeight, numericWeight, historyWeight, minHistory, eps);
    }

    private static void checkWeight(String name, double w) {
        if (!(w >= 0.0) || Double.isInfinite(w)) throw new IllegalArgumentException(name + " must be a finite value >= 0");
    }
}
