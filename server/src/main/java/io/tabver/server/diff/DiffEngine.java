// file: src/main/java/io/tabver/server/diff/DiffEngine.java
package io.tabver.server.diff;

import io.tabver.core.CrossDocumentException;
import io.tabver.core.diff.CellDiffer;
import io.tabver.core.diff.DiffEntry;
import io.tabver.core.diff.DiffOptions;
import io.tabver.storage.StoredVersion;
import io.tabver.storage.VersionStore;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Cell-level comparison of two stored versions.
 * <p>
 * Responsibilities:
 *  - Load both versions (NotFound for unknown ids).
 *  - Reject pairs from different documents.
 *  - Run {@link CellDiffer} with the requested options.
 *  - Serve repeated comparisons from the {@link DiffCache}.
 * <p>
 * Thread-safety: stateless apart from the cache, which synchronizes itself.
 * Two threads racing on the same uncached key both compute; the results are
 * identical.
 */
public final class DiffEngine {
    private static final Logger LOG = Logger.getLogger(DiffEngine.class.getName());

    private final VersionStore store;
    private final DiffCache cache;

    public DiffEngine(VersionStore store) {
        this(store, new DiffCache());
    }

    public DiffEngine(VersionStore store, DiffCache cache) {
        this.store = Objects.requireNonNull(store, "store");
        this.cache = Objects.requireNonNull(cache, "cache");
    }

    /**
     * @throws io.tabver.core.VersionNotFoundException if either id is unknown
     * @throws CrossDocumentException                  if the versions belong to different documents
     * @throws java.util.concurrent.CancellationException if the calling thread is interrupted mid-way
     */
    public DiffReport compare(String fromVersionId, String toVersionId, DiffOptions options) {
        Objects.requireNonNull(options, "options");
        StoredVersion from = store.getVersion(fromVersionId);
        StoredVersion to = store.getVersion(toVersionId);
        if (!from.version().documentId().equals(to.version().documentId())) {
            throw new CrossDocumentException(
                    fromVersionId, from.version().documentId(),
                    toVersionId, to.version().documentId());
        }

        DiffReport cached = cache.get(fromVersionId, toVersionId, options);
        if (cached != null) return cached;

        long start = System.nanoTime();
        List<DiffEntry> entries = new CellDiffer(options).diff(fromVersionId, from.table(), toVersionId, to.table());
        DiffReport report = DiffReport.of(entries);
        cache.put(fromVersionId, toVersionId, options, report);

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(String.format("diff %s -> %s: %d entries in %dms",
                    fromVersionId, toVersionId, entries.size(), (System.nanoTime() - start) / 1_000_000L));
        }
        return report;
    }

    public DiffReport compare(String fromVersionId, String toVersionId) {
        return compare(fromVersionId, toVersionId, DiffOptions.defaults());
    }
}
