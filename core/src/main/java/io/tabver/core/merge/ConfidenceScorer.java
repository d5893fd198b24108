// file: src/main/java/io/tabver/core/merge/ConfidenceScorer.java
package io.tabver.core.merge;

import io.tabver.core.CellValue;

import java.util.Locale;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Explainable confidence that one side of a two-sided edit can be picked without
 * review.
 * <p>
 * Signals (each in [0,1]):
 *  - typeAgreement:    1 if both new values have the same type, else 0.
 *  - numericCloseness: for two numbers, 1 - min(1, |l - r| / scale) where scale is
 *                      max(|base|, 1) when the base is numeric, else
 *                      max(|l|, |r|, 1). 0 for non-numbers.
 *  - historyDominance: |wLeft - wRight| of the authors' effective weights; 0 when
 *                      the same author wrote both sides.
 * <p>
 * confidence = clamp(typeWeight * t + numericWeight * n + historyWeight * h, 0, 1).
 * The favoured side is the one with the higher effective weight, LEFT on ties.
 */
public final class ConfidenceScorer {
    private final ResolverSettings settings;

    public ConfidenceScorer(ResolverSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * Signal breakdown. divergence is |l - r| / scale for numbers (NaN otherwise);
     * baseScaled tells whether the scale came from the base value.
     */
    public record Score(
            double typeAgreement,
            double numericCloseness,
            double historyDominance,
            double confidence,
            Side favoured,
            double divergence,
            boolean baseScaled,
            double leftWeight,
            double rightWeight
    ) {}

    public Score score(CellValue base, CellValue left, CellValue right, AuthorHistory leftAuthor, AuthorHistory rightAuthor) {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");

        double type = left.type() == right.type() ? 1.0 : 0.0;

        double closeness = 0.0;
        double divergence = Double.NaN;
        boolean baseScaled = false;
        OptionalDouble l = left.value().asNumber();
        OptionalDouble r = right.value().asNumber();
        if (type == 1.0 && l.isPresent() && r.isPresent()) {
            OptionalDouble b = base == null ? OptionalDouble.empty() : base.value().asNumber();
            double scale;
            if (b.isPresent() && Double.isFinite(b.getAsDouble())) {
                scale = Math.max(Math.abs(b.getAsDouble()), 1.0);
                baseScaled = true;
            } else {
                scale = Math.max(Math.max(Math.abs(l.getAsDouble()), Math.abs(r.getAsDouble())), 1.0);
            }
            divergence = Math.abs(l.getAsDouble() - r.getAsDouble()) / scale;
            closeness = Double.isNaN(divergence) ? 0.0 : 1.0 - Math.min(1.0, divergence);
        }

        double wl = leftAuthor.effectiveWeight(settings.minHistory());
        double wr = rightAuthor.effectiveWeight(settings.minHistory());
        boolean sameAuthor = leftAuthor.actor().equals(rightAuthor.actor());
        double history = sameAuthor ? 0.0 : Math.abs(wl - wr);
        Side favoured = (sameAuthor || wl >= wr) ? Side.LEFT : Side.RIGHT;

        double raw = settings.typeWeight() * type
                + settings.numericWeight() * closeness
                + settings.historyWeight() * history;
        double confidence = Math.max(0.0, Math.min(1.0, raw));

        return new Score(type, closeness, history, confidence, favoured, divergence, baseScaled, wl, wr);
    }

    /** Human-readable explanation of a two-sided edit, used as a conflict reason. */
    public static String describe(ConflictKind kind, CellValue left, CellValue right, Score s) {
        StringBuilder sb = new StringBuilder();
        switch (kind) {
            case TYPE_MISMATCH:
                sb.append("sides disagree on value type (")
                        .append(typeName(left)).append(" vs ").append(typeName(right)).append(")");
                break;
            case FORMULA:
                sb.append("both sides changed the formula differently");
                break;
            default:
                if (!Double.isNaN(s.divergence())) {
                    sb.append("both sides changed to different numeric values (diverge by ")
                            .append(percent(s.divergence()))
                            .append(s.baseScaled() ? " of base)" : " of the larger value)");
                } else {
                    sb.append("both sides changed to different ").append(typeName(left)).append(" values");
                }
        }
        sb.append(", ");
        if (s.historyDominance() == 0.0) {
            sb.append("no dominant history");
        } else {
            sb.append(s.favoured() == Side.LEFT ? "left" : "right")
                    .append(" author preferred (")
                    .append(String.format(Locale.ROOT, "%.2f vs %.2f",
                            Math.max(s.leftWeight(), s.rightWeight()), Math.min(s.leftWeight(), s.rightWeight())))
                    .append(")");
        }
        return sb.toString();
    }

    private static String typeName(CellValue v) {
        return v.type().name().toLowerCase(Locale.ROOT);
    }

    private static String percent(double ratio) {
        return String.format(Locale.ROOT, "%.0f%%", ratio * 100.0);
    }
}
