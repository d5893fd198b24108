// file: src/main/java/io/tabver/storage/PreferenceWeight.java
package io.tabver.storage;

import java.time.Instant;
import java.util.Objects;

/**
 * Acceptance history of one actor on one document.
 * <p>
 * weight() is the Laplace-smoothed acceptance ratio (accepted + 1) / (total + 2),
 * so an actor with no history sits at 0.5. revision is the optimistic-concurrency
 * token: 0 means "never stored", every stored update increments it by one.
 */
public record PreferenceWeight(
        String documentId,
        String actor,
        long accepted,
        long total,
        long revision,
        Instant updatedAt
) {
    public PreferenceWeight {
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(actor, "actor");
        Objects.requireNonNull(updatedAt, "updatedAt");
        if (accepted < 0 || total < 0 || accepted > total)
            throw new IllegalArgumentException("need 0 <= accepted <= total, got " + accepted + "/" + total);
        if (revision < 0) throw new IllegalArgumentException("revision must be >= 0");
    }

    public static PreferenceWeight initial(String documentId, String actor) {
        return new PreferenceWeight(documentId, actor, 0, 0, 0, Instant.EPOCH);
    }

    public double weight() {
        return (accepted + 1.0) / (total + 2.0);
    }

    /** Next revision after one more observed outcome. */
    public PreferenceWeight record(boolean wasAccepted, Instant at) {
        return new PreferenceWeight(documentId, actor, accepted + (wasAccepted ? 1 : 0), total + 1, revision + 1, at);
    }

    boolean sameKey(PreferenceWeight other) {
        return documentId.equals(other.documentId) && actor.equals(other.actor);
    }
}
