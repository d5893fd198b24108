// file: src/main/java/io/tabver/storage/InMemoryPreferenceWeightStore.java
package io.tabver.storage;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/** Non-durable store, used in tests and benchmarks; also the index behind the durable one. */
public class InMemoryPreferenceWeightStore implements PreferenceWeightStore {
    private final Map<Key, PreferenceWeight> weights = new ConcurrentHashMap<>();

    record Key(String documentId, String actor) {}

    @Override
    public PreferenceWeight get(String documentId, String actor) {
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(actor, "actor");
        PreferenceWeight w = weights.get(new Key(documentId, actor));
        return w != null ? w : PreferenceWeight.initial(documentId, actor);
    }

    @Override
    public boolean compareAndSet(PreferenceWeight expected, PreferenceWeight updated) {
        checkTransition(expected, updated);
        Key key = new Key(expected.documentId(), expected.actor());
        if (expected.revision() == 0) {
            return weights.putIfAbsent(key, updated) == null;
        }
        return weights.replace(key, expected, updated);
    }

    /** Unconditional put used by recovery. Keeps the higher revision. */
    void restore(PreferenceWeight w) {
        weights.merge(new Key(w.documentId(), w.actor()), w,
                (current, incoming) -> incoming.revision() > current.revision() ? incoming : current);
    }

    static void checkTransition(PreferenceWeight expected, PreferenceWeight updated) {
        Objects.requireNonNull(expected, "expected");
        Objects.requireNonNull(updated, "updated");
        if (!expected.sameKey(updated)) {
            throw new IllegalArgumentException("expected and updated weights belong to different keys");
        }
        if (updated.revision() != expected.revision() + 1) {
            throw new IllegalArgumentException("updated revision must be expected revision + 1");
        }
    }
}
