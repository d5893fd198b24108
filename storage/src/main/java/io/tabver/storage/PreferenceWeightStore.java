// file: src/main/java/io/tabver/storage/PreferenceWeightStore.java
package io.tabver.storage;

import io.tabver.core.TabVerException;

import java.time.Instant;

/**
 * Persisted (document, actor) -> acceptance history.
 * <p>
 * Updates are optimistic: read a weight, compute the next one, and
 * {@link #compareAndSet} it against the revision that was read.
 */
public interface PreferenceWeightStore {
    int MAX_UPDATE_ATTEMPTS = 8;

    /** Current weight, or {@link PreferenceWeight#initial} (revision 0) when there is no history. */
    PreferenceWeight get(String documentId, String actor);

    /**
     * Store {@code updated} if the stored revision still equals {@code expected.revision()}.
     *
     * @return false when another writer got there first
     */
    boolean compareAndSet(PreferenceWeight expected, PreferenceWeight updated);

    /**
     * Record one accepted / rejected outcome, retrying on lost races.
     *
     * @throws TabVerException after {@link #MAX_UPDATE_ATTEMPTS} lost races
     */
    default PreferenceWeight recordOutcome(String documentId, String actor, boolean accepted, Instant at) {
        for (int attempt = 0; attempt < MAX_UPDATE_ATTEMPTS; attempt++) {
            PreferenceWeight current = get(documentId, actor);
            PreferenceWeight next = current.record(accepted, at);
            if (compareAndSet(current, next)) return next;
        }
        throw new TabVerException("Gave up updating preference weight of " + actor + " on " + documentId
                + " after " + MAX_UPDATE_ATTEMPTS + " attempts");
    }
}
