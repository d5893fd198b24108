// file: src/main/java/io/tabver/storage/DurablePreferenceWeightStore.java
package io.tabver.storage;

import io.tabver.core.StorageException;

/**
 * Preference weights backed by their own WAL.
 * <p>
 * Every successful compare-and-set appends the new weight (full record, not a
 * delta) before it becomes visible. Recovery replays the log and keeps the
 * highest revision per key, so replay order and duplicates do not matter.
 * <p>
 * Weights are tiny and rarely written; the log is never snapshotted.
 */
public class DurablePreferenceWeightStore implements PreferenceWeightStore, AutoCloseable {
    private final InMemoryPreferenceWeightStore index = new InMemoryPreferenceWeightStore();
    private final Wal wal;

    public DurablePreferenceWeightStore(Wal wal) {
        this.wal = wal;
        recover();
    }

    @Override
    public PreferenceWeight get(String documentId, String actor) {
        return index.get(documentId, actor);
    }

    @Override
    public synchronized boolean compareAndSet(PreferenceWeight expected, PreferenceWeight updated) {
        InMemoryPreferenceWeightStore.checkTransition(expected, updated);
        PreferenceWeight current = index.get(expected.documentId(), expected.actor());
        if (current.revision() != expected.revision()) return false;

        wal.append(RecordCodec.encodePreference(updated));
        wal.rotateIfNeeded();
        if (!index.compareAndSet(current, updated)) {
            // only this method writes the index and it is synchronized
            throw new IllegalStateException("preference index changed under the store lock");
        }
        return true;
    }

    @Override
    public void close() {
        try {
            wal.close();
        } catch (Exception e) {
            throw new StorageException("WAL close failed", e);
        }
    }

    private void recover() {
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                if (RecordCodec.decode(payload) instanceof RecordCodec.PreferenceRecord rec) {
                    index.restore(rec.weight());
                }
            }
        }
    }
}
