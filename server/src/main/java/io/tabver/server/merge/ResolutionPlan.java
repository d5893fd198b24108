// file: src/main/java/io/tabver/server/merge/ResolutionPlan.java
package io.tabver.server.merge;

import io.tabver.core.Version;
import io.tabver.core.merge.Conflict;
import io.tabver.core.merge.Decision;

import java.util.List;
import java.util.Objects;

/**
 * Output of {@link ConflictResolver#resolve}: the three versions involved and one
 * decision per touched location, in location order.
 */
public record ResolutionPlan(Version base, Version left, Version right, List<Decision> decisions) {
    public ResolutionPlan {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        decisions = List.copyOf(decisions);
    }

    public List<Conflict> conflicts() {
        return decisions.stream()
                .filter(d -> d instanceof Decision.Contested)
                .map(d -> ((Decision.Contested) d).conflict())
                .toList();
    }

    public boolean nothingTouched() {
        return decisions.isEmpty();
    }
}
