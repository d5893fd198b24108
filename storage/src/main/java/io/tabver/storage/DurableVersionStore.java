// file: src/main/java/io/tabver/storage/DurableVersionStore.java
package io.tabver.storage;

import io.tabver.core.DuplicateVersionException;
import io.tabver.core.Fingerprinter;
import io.tabver.core.InvalidParentException;
import io.tabver.core.NormalizedTable;
import io.tabver.core.StorageException;
import io.tabver.core.Version;
import io.tabver.core.VersionNotFoundException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable version store.
 * <p>
 * Responsibilities:
 *  - Maintain in-memory indexes: id -> version+cells, and per document
 *    version number -> version and content hash -> version id.
 *  - On create:
 *      1) Fingerprint the table (outside any lock).
 *      2) Under the document lock: check the parent, check for duplicate
 *         content, take max + 1 as version number.
 *      3) Serialize version+cells to one WAL record, append+fsync.
 *      4) Publish to the indexes (cells first, then the per-document entries).
 *      5) Rotate the WAL segment if needed, maybe take a snapshot.
 * <p>
 *  - On startup:
 *      1) Load the latest snapshot (if any) into memory.
 *      2) Replay the WAL, applying each version id at most once.
 * <p>
 * Concurrency:
 *  - Creates for different documents run in parallel; creates for the same
 *    document are serialized by that document's lock.
 *  - Writers hold the read side of a store-wide lock, a snapshot holds the write
 *    side, so a snapshot never misses a record that is in a pruned segment.
 *  - Reads take no locks.
 */
public class DurableVersionStore implements VersionStore, AutoCloseable {
    private static final Logger LOG = Logger.getLogger(DurableVersionStore.class.getName());

    private final Map<String, StoredVersion> byId = new ConcurrentHashMap<>();
    private final Map<String, DocumentIndex> documents = new ConcurrentHashMap<>();
    private final ReadWriteLock storeLock = new ReentrantReadWriteLock();

    private final Wal wal;
    private final Snapshotter snaps;
    private final SnapshotPolicy snapPolicy;
    private final Clock clock;
    private final Supplier<String> idGenerator;

    public DurableVersionStore(Wal wal, Snapshotter snaps, SnapshotPolicy snapPolicy) {
        this(wal, snaps, snapPolicy, Clock.systemUTC(), () -> UUID.randomUUID().toString());
    }

    public DurableVersionStore(Wal wal, Snapshotter snaps, SnapshotPolicy snapPolicy,
                               Clock clock, Supplier<String> idGenerator) {
        this.wal = Objects.requireNonNull(wal, "wal");
        this.snaps = Objects.requireNonNull(snaps, "snaps");
        this.snapPolicy = Objects.requireNonNull(snapPolicy, "snapPolicy");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
        recover();
    }

    @Override
    public Version createVersion(String documentId, String parentVersionId, NormalizedTable table, String actor, String tag) {
        requireText(documentId, "documentId");
        requireText(actor, "actor");
        Objects.requireNonNull(table, "table");
        if (tag != null && tag.length() > Version.MAX_TAG_LENGTH) {
            throw new IllegalArgumentException("tag longer than " + Version.MAX_TAG_LENGTH + " characters");
        }

        // 1) fingerprint outside the critical section
        String hash = Fingerprinter.fingerprint(table);

        Version created;
        storeLock.readLock().lock();
        try {
            DocumentIndex doc = documents.computeIfAbsent(documentId, DocumentIndex::new);
            synchronized (doc) {
                // 2) parent, duplicate, number
                String parent = resolveParent(doc, parentVersionId);
                String existing = doc.byHash.get(hash);
                if (existing != null) throw new DuplicateVersionException(documentId, existing);

                created = new Version(
                        idGenerator.get(),
                        documentId,
                        doc.maxNumber() + 1,
                        parent,
                        hash,
                        Instant.now(clock),
                        actor,
                        tag,
                        table.size());

                // 3) durable before visible
                wal.append(RecordCodec.encodeVersion(created, table));

                // 4) publish
                publish(created, table);
            }
            wal.rotateIfNeeded();
        } finally {
            storeLock.readLock().unlock();
        }

        // 5) snapshot outside the read lock (it needs the write side); the version is
        //    already durable in the WAL, so a failed snapshot only delays pruning
        if (snapPolicy.recordWrite()) {
            try {
                snapshot();
            } catch (StorageException e) {
                LOG.log(Level.WARNING, "Snapshot after " + created.id() + " failed, WAL kept", e);
            }
        }
        return created;
    }

    @Override
    public StoredVersion getVersion(String versionId) {
        StoredVersion sv = versionId == null ? null : byId.get(versionId);
        if (sv == null) throw new VersionNotFoundException(versionId);
        return sv;
    }

    @Override
    public Optional<Version> findVersion(String versionId) {
        if (versionId == null) return Optional.empty();
        return Optional.ofNullable(byId.get(versionId)).map(StoredVersion::version);
    }

    @Override
    public VersionPage listVersions(String documentId, Integer afterVersionNumber, Integer limit) {
        Objects.requireNonNull(documentId, "documentId");
        int pageSize = VersionPage.clampLimit(limit);
        DocumentIndex doc = documents.get(documentId);
        if (doc == null) return VersionPage.empty();

        ConcurrentNavigableMap<Integer, Version> tail = afterVersionNumber == null
                ? doc.byNumber
                : doc.byNumber.tailMap(afterVersionNumber, false);
        List<Version> page = new ArrayList<>(pageSize);
        boolean more = false;
        for (Version v : tail.values()) {
            if (page.size() == pageSize) { more = true; break; }
            page.add(v);
        }
        Integer next = more ? page.get(page.size() - 1).versionNumber() : null;
        return new VersionPage(page, next);
    }

    @Override
    public Optional<Version> findByHash(String documentId, String contentHash) {
        DocumentIndex doc = documentId == null ? null : documents.get(documentId);
        if (doc == null || contentHash == null) return Optional.empty();
        String id = doc.byHash.get(contentHash);
        return id == null ? Optional.empty() : findVersion(id);
    }

    @Override
    public Optional<Version> latest(String documentId) {
        DocumentIndex doc = documentId == null ? null : documents.get(documentId);
        if (doc == null) return Optional.empty();
        var last = doc.byNumber.lastEntry();
        return last == null ? Optional.empty() : Optional.of(last.getValue());
    }

    /**
     * Take a full snapshot and prune the WAL segments it covers.
     * Blocks writers for the duration.
     */
    public void snapshot() {
        storeLock.writeLock().lock();
        try {
            long firstKept = wal.rotate();
            String id = snaps.writeSnapshot(List.copyOf(byId.values()));
            wal.pruneBefore(firstKept);
            LOG.info(() -> "Snapshot " + id + " written with " + byId.size() + " versions");
        } finally {
            storeLock.writeLock().unlock();
        }
    }

    /** Number of stored versions across all documents. */
    public int size() {
        return byId.size();
    }

    @Override
    public void close() {
        try {
            wal.close();
        } catch (Exception e) {
            throw new StorageException("WAL close failed", e);
        }
    }

    /**
     * Recovery procedure called from constructor:
     *  1) Seed memory from the latest snapshot (if present).
     *  2) Replay WAL records in order, applying each version id at most once.
     */
    private void recover() {
        Snapshotter.LoadedSnapshot loaded = snaps.loadLatest();
        if (loaded != null) {
            loaded.versions().stream()
                    .sorted((a, b) -> Integer.compare(a.version().versionNumber(), b.version().versionNumber()))
                    .forEach(sv -> publish(sv.version(), sv.table()));
        }

        int replayed = 0;
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                if (RecordCodec.decode(payload) instanceof RecordCodec.VersionRecord rec
                        && !byId.containsKey(rec.version().id())) {
                    publish(rec.version(), rec.table());
                    replayed++;
                }
            }
        }
        if (loaded != null || replayed > 0) {
            int fromWal = replayed;
            LOG.info(() -> "Recovered " + byId.size() + " versions (" + fromWal + " from WAL"
                    + (loaded == null ? "" : ", snapshot " + loaded.id()) + ")");
        }
    }

    private String resolveParent(DocumentIndex doc, String parentVersionId) {
        if (parentVersionId == null) {
            var last = doc.byNumber.lastEntry();
            return last == null ? null : last.getValue().id();
        }
        StoredVersion parent = byId.get(parentVersionId);
        if (parent == null || !parent.version().documentId().equals(doc.documentId)) {
            throw new InvalidParentException(doc.documentId, parentVersionId);
        }
        return parentVersionId;
    }

    private void publish(Version v, NormalizedTable table) {
        byId.put(v.id(), new StoredVersion(v, table));
        DocumentIndex doc = documents.computeIfAbsent(v.documentId(), DocumentIndex::new);
        doc.byNumber.put(v.versionNumber(), v);
        doc.byHash.put(v.contentHash(), v.id());
    }

    private static void requireText(String s, String name) {
        Objects.requireNonNull(s, name);
        if (s.isBlank()) throw new IllegalArgumentException(name + " must not be blank");
    }

    /** Per-document indexes; the instance is also the document lock. */
    private static final class DocumentIndex {
        final String documentId;
        final ConcurrentSkipListMap<Integer, Version> byNumber = new ConcurrentSkipListMap<>();
        final Map<String, String> byHash = new ConcurrentHashMap<>();

        DocumentIndex(String documentId) {
            this.documentId = documentId;
        }

        int maxNumber() {
            return byNumber.isEmpty() ? 0 : byNumber.lastKey();
        }
    }
}
