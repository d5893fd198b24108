// file: src/main/java/io/tabver/storage/FileSnapshotter.java
package io.tabver.storage;

import io.tabver.core.StorageException;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * Binary snapshot implementation backed by a single file per snapshot.
 * <p>
 * Format:
 *   int32 magic = 0x7AB55AB7
 *   int32 count
 *   repeated 'count' times: one version with its cells, same layout as the
 *   version payload of {@link RecordCodec} (without the kind byte)
 * <p>
 * Atomicity:
 *   - We write to "snapshot-<seq>.bin.tmp" first,
 *   - then move to "snapshot-<seq>.bin" using ATOMIC_MOVE,
 *   - then delete older snapshots.
 */
public final class FileSnapshotter implements Snapshotter {
    private static final int MAGIC = 0x7AB55AB7;
    private static final String PREFIX = "snapshot-";
    private static final String SUFFIX = ".bin";

    private final Path dir;

    public FileSnapshotter(Path dir) {
        this.dir = dir;
        try { Files.createDirectories(dir); } catch (IOException e) { throw new StorageException("Cannot create snapshot dir " + dir, e); }
    }

    @Override
    public String writeSnapshot(Collection<StoredVersion> versions) {
        List<Path> existing = snapshots();
        long seq = Math.max(System.currentTimeMillis(),
                existing.isEmpty() ? 0 : sequenceOf(existing.get(existing.size() - 1)) + 1);
        String name = String.format("%s%020d%s", PREFIX, seq, SUFFIX);
        Path tmp = dir.resolve(name + ".tmp");
        Path dst = dir.resolve(name);

        try (var out = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(tmp,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.SYNC)))) {
            out.writeInt(MAGIC);
            out.writeInt(versions.size());
            for (StoredVersion sv : versions) {
                RecordCodec.writeVersion(out, sv.version(), sv.table());
            }
        } catch (IOException ex) { throw new StorageException("Snapshot write failed", ex); }

        try { Files.move(tmp, dst, ATOMIC_MOVE); }
        catch (IOException e) { throw new StorageException("Snapshot publish failed", e); }

        for (Path old : existing) {
            try {
                Files.deleteIfExists(old);
            } catch (IOException e) {
                throw new StorageException("Cannot delete old snapshot " + old, e);
            }
        }
        return name;
    }

    @Override
    public LoadedSnapshot loadLatest() {
        List<Path> all = snapshots();
        if (all.isEmpty()) return null;
        Path snap = all.get(all.size() - 1);

        try (var in = new DataInputStream(new BufferedInputStream(Files.newInputStream(snap)))) {
            if (in.readInt() != MAGIC) throw new IOException("bad snapshot magic");
            int count = in.readInt();
            List<StoredVersion> versions = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                versions.add(RecordCodec.readVersion(in));
            }
            return new LoadedSnapshot(snap.getFileName().toString(), versions);
        } catch (IOException | IllegalArgumentException e) {
            throw new StorageException("Cannot load snapshot " + snap, e);
        }
    }

    private List<Path> snapshots() {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> {
                        String n = p.getFileName().toString();
                        return n.startsWith(PREFIX) && n.endsWith(SUFFIX);
                    })
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new StorageException("Cannot list snapshot dir " + dir, e);
        }
    }

    private static long sequenceOf(Path snapshot) {
        String n = snapshot.getFileName().toString();
        return Long.parseLong(n.substring(PREFIX.length(), n.length() - SUFFIX.length()));
    }
}
