// file: src/test/java/io/tabver/storage/DurableVersionStoreDurabilityTest.java
package io.tabver.storage;

import io.tabver.core.CellValue;
import io.tabver.core.DuplicateVersionException;
import io.tabver.core.NormalizedTable;
import io.tabver.core.StorageException;
import io.tabver.core.Version;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Collection;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.APPEND;
import static org.junit.jupiter.api.Assertions.*;

class DurableVersionStoreDurabilityTest {

    @TempDir Path walDir;
    @TempDir Path snapDir;

    private DurableVersionStore open(int snapshotEvery) {
        return new DurableVersionStore(new FileWal(walDir, 1L << 60), new FileSnapshotter(snapDir), new SnapshotPolicy(snapshotEvery));
    }

    private static NormalizedTable table(String text) {
        return NormalizedTable.builder()
                .put("Samples", 0, 0, CellValue.text(text))
                .put("Samples", 0, 1, CellValue.number(text.length()))
                .sheet("Empty")
                .build();
    }

    @Test
    void versions_survive_restart() {
        var store1 = open(10_000);
        Version v1 = store1.createVersion("doc", null, table("a"), "alice");
        Version v2 = store1.createVersion("doc", v1.id(), table("b"), "bob", "second");
        store1.close();

        var store2 = open(10_000);

        assertEquals(v2, store2.getVersion(v2.id()).version());
        assertEquals(table("b"), store2.getVersion(v2.id()).table());
        assertEquals(2, store2.listVersions("doc", null, null).versions().size());
        // hash index is rebuilt too
        assertThrows(DuplicateVersionException.class, () -> store2.createVersion("doc", null, table("a"), "carol"));
        assertEquals(3, store2.createVersion("doc", null, table("c"), "carol").versionNumber());
        store2.close();
    }

    @Test
    void snapshot_prunes_the_log_and_recovery_combines_both() throws IOException {
        var store1 = open(3);
        for (int i = 0; i < 4; i++) store1.createVersion("doc", null, table("v" + i), "alice");
        store1.close();

        assertEquals(1, countFiles(snapDir), "one snapshot after the third write");
        assertEquals(1, countFiles(walDir), "segments covered by the snapshot are pruned");

        var store2 = open(3);
        assertEquals(4, store2.size());
        assertEquals(4, store2.latest("doc").orElseThrow().versionNumber());
        store2.close();
    }

    @Test
    void torn_tail_is_ignored_and_later_writes_still_recover() throws IOException {
        var store1 = open(10_000);
        store1.createVersion("doc", null, table("a"), "alice");
        Version v2 = store1.createVersion("doc", null, table("b"), "alice");
        store1.close();

        // a third record that only half made it to disk
        var stray = new Version("stray", "doc", 3, v2.id(), "00", Instant.now(), "alice", null, 2);
        byte[] torn = RecordCodec.encodeVersion(stray, table("c"));
        try (OutputStream out = Files.newOutputStream(walDir.resolve("00000001.log"), APPEND)) {
            out.write(torn, 0, torn.length - 5);
        }

        var store2 = open(10_000);
        assertEquals(2, store2.size());
        assertTrue(store2.findVersion("stray").isEmpty());
        Version v3 = store2.createVersion("doc", null, table("c"), "alice");
        assertEquals(3, v3.versionNumber());
        store2.close();

        var store3 = open(10_000);
        assertEquals(3, store3.size(), "writes after a torn tail are not lost");
        assertEquals(v3, store3.getVersion(v3.id()).version());
        store3.close();
    }

    private static long countFiles(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.count();
        }
    }

    @Test
    void failed_write_does_not_take_later_versions_down_at_restart() {
        var wal = new HalfWritingWal(walDir);
        var store1 = new DurableVersionStore(wal, new FileSnapshotter(snapDir), new SnapshotPolicy(10_000));
        Version v1 = store1.createVersion("doc", null, table("a"), "alice");
        wal.failNextWrite = true;
        assertThrows(StorageException.class, () -> store1.createVersion("doc", v1.id(), table("b"), "bob"));
        Version v3 = store1.createVersion("doc", v1.id(), table("c"), "carol");
        assertEquals(2, store1.size(), "the failed version was never published");
        store1.close();

        var store2 = open(10_000);
        assertEquals(2, store2.size());
        assertEquals(v3, store2.getVersion(v3.id()).version());
        assertEquals(2, v3.versionNumber());
        store2.close();
    }

    @Test
    void failed_snapshot_still_returns_the_created_version() {
        Snapshotter broken = new Snapshotter() {
            @Override
            public String writeSnapshot(Collection<StoredVersion> versions) {
                throw new StorageException("disk full", new IOException("No space left on device"));
            }

            @Override
            public LoadedSnapshot loadLatest() {
                return null;
            }
        };
        var store1 = new DurableVersionStore(new FileWal(walDir, 1L << 60), broken, new SnapshotPolicy(1));

        Version v1 = store1.createVersion("doc", null, table("a"), "alice");
        Version v2 = store1.createVersion("doc", v1.id(), table("b"), "bob");

        assertEquals(v2, store1.getVersion(v2.id()).version());
        store1.close();

        // nothing was pruned, the WAL alone recovers both
        var store2 = open(10_000);
        assertEquals(2, store2.size());
        store2.close();
    }
}
