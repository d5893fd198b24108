// file: src/main/java/io/tabver/storage/Snapshotter.java
package io.tabver.storage;

import java.util.Collection;
import java.util.List;

/**
 * Snapshot abstraction to bound recovery time.
 * <p>
 * A snapshot is a full copy of every stored version at some point in time.
 * On restart:
 *  - we load the latest snapshot, then
 *  - replay the WAL segments that survived pruning.
 */
public interface Snapshotter {

    /**
     * Persist a full copy of the store.
     *
     * @return snapshot identifier (e.g., filename).
     */
    String writeSnapshot(Collection<StoredVersion> versions);

    /** Load the latest snapshot if present, null otherwise. */
    LoadedSnapshot loadLatest();

    /** Simple holder for snapshot id and its data */
    record LoadedSnapshot(String id, List<StoredVersion> versions) {}
}
