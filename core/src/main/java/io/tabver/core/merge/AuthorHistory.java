// file: src/main/java/io/tabver/core/merge/AuthorHistory.java
package io.tabver.core.merge;

import java.util.Objects;

/**
 * What the resolver knows about a version author for one document: their
 * smoothed acceptance weight and how many times they were observed.
 */
public record AuthorHistory(String actor, double weight, long observations) {
    public static final double NEUTRAL = 0.5;

    public AuthorHistory {
        Objects.requireNonNull(actor, "actor");
        if (!(weight >= 0.0 && weight <= 1.0)) throw new IllegalArgumentException("weight must be in [0,1]");
        if (observations < 0) throw new IllegalArgumentException("observations must be >= 0");
    }

    public static AuthorHistory unknown(String actor) {
        return new AuthorHistory(actor, NEUTRAL, 0);
    }

    /** Weight used for scoring: neutral until the actor has at least minHistory observations. */
    public double effectiveWeight(int minHistory) {
        return observations < minHistory ? NEUTRAL : weight;
    }
}
