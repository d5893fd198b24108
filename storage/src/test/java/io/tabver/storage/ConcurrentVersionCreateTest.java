// file: src/test/java/io/tabver/storage/ConcurrentVersionCreateTest.java
package io.tabver.storage;

import io.tabver.core.CellValue;
import io.tabver.core.NormalizedTable;
import io.tabver.core.Version;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrentVersionCreateTest {

    @TempDir Path walDir;
    @TempDir Path snapDir;

    @Test
    void fifty_concurrent_creates_get_numbers_one_to_fifty() throws Exception {
        // small snapshot interval so snapshots interleave with writers
        var store = new DurableVersionStore(new FileWal(walDir, 4096), new FileSnapshotter(snapDir), new SnapshotPolicy(7));
        ExecutorService pool = Executors.newFixedThreadPool(16);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Version>> futures = new ArrayList<>();
            for (int i = 0; i < 50; i++) {
                final int n = i;
                futures.add(pool.submit(() -> {
                    start.await();
                    var table = NormalizedTable.builder().put("S", 0, 0, CellValue.number(n)).build();
                    return store.createVersion("doc", null, table, "actor-" + n);
                }));
            }
            start.countDown();

            Set<Integer> numbers = new TreeSet<>();
            for (Future<Version> f : futures) numbers.add(f.get(30, TimeUnit.SECONDS).versionNumber());

            assertEquals(IntStream.rangeClosed(1, 50).boxed().collect(Collectors.toSet()), numbers);
        } finally {
            pool.shutdownNow();
            store.close();
        }

        var reopened = new DurableVersionStore(new FileWal(walDir, 4096), new FileSnapshotter(snapDir), new SnapshotPolicy(7));
        assertEquals(50, reopened.size());
        assertEquals(50, reopened.latest("doc").orElseThrow().versionNumber());
        reopened.close();
    }
}
