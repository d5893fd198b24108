// file: src/main/java/io/tabver/bench/DiffMergeBench.java
package io.tabver.bench;

import io.tabver.core.CellKey;
import io.tabver.core.CellValue;
import io.tabver.core.NormalizedTable;
import io.tabver.core.Version;
import io.tabver.core.diff.DiffOptions;
import io.tabver.core.merge.ResolverSettings;
import io.tabver.server.diff.DiffCache;
import io.tabver.server.diff.DiffEngine;
import io.tabver.server.merge.ConflictResolver;
import io.tabver.server.merge.MergeEngine;
import io.tabver.server.merge.MergeRequest;
import io.tabver.server.merge.MergeResult;
import io.tabver.storage.DurableVersionStore;
import io.tabver.storage.FileSnapshotter;
import io.tabver.storage.FileWal;
import io.tabver.storage.InMemoryPreferenceWeightStore;
import io.tabver.storage.SnapshotPolicy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-process workload driver for the diff and merge engines.
 *
 * Each round stores a base table plus two concurrent edits of it (Zipf-skewed
 * rows, so the hot rows collide), then times one compare and one three-way merge.
 *
 * Usage:
 *   java -cp bench.jar io.tabver.bench.DiffMergeBench \
 *     --rows 2000 \
 *     --columns 10 \
 *     --edits 200 \
 *     --rounds 50 \
 *     --threads 4 \
 *     --zipf-skew 0.99 \
 *     --structural false \
 *     --data-dir /tmp/tabver-bench
 *
 * Output:
 *   - Summary lines to stderr (one per op).
 *   - CSV to stdout with per-op samples:
 *       op,success,latency_ms,changes
 */
public final class DiffMergeBench {

    record Sample(String op, boolean ok, double latencyMs, int changes) {}

    /** Knobs of one run. */
    record BenchConfig(int rows, int columns, int edits, int rounds, int threads,
                       double zipfSkew, boolean structural, Path dataDir) {
        BenchConfig {
            if (rows <= 0 || columns <= 0) throw new IllegalArgumentException("rows and columns must be > 0");
            if (edits <= 0) throw new IllegalArgumentException("edits must be > 0");
            if (rounds <= 0 || threads <= 0) throw new IllegalArgumentException("rounds and threads must be > 0");
        }
    }

    private DiffMergeBench() {
    }

    public static void main(String[] args) throws Exception {
        BenchConfig cfg = parseArgs(args);
        List<Sample> all = run(cfg);
        summarizeAndPrint(all);
    }

    static BenchConfig parseArgs(String[] args) throws Exception {
        Map<String, String> kv = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a.startsWith("--")) {
                String key = a.substring(2);
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("missing value for " + a);
                }
                kv.put(key, args[++i]);
            } else {
                throw new IllegalArgumentException("unexpected arg: " + a);
            }
        }
        String dir = kv.get("data-dir");
        return new BenchConfig(
                Integer.parseInt(kv.getOrDefault("rows", "2000")),
                Integer.parseInt(kv.getOrDefault("columns", "10")),
                Integer.parseInt(kv.getOrDefault("edits", "200")),
                Integer.parseInt(kv.getOrDefault("rounds", "50")),
                Integer.parseInt(kv.getOrDefault("threads", "4")),
                Double.parseDouble(kv.getOrDefault("zipf-skew", "0.99")),
                Boolean.parseBoolean(kv.getOrDefault("structural", "false")),
                dir == null ? Files.createTempDirectory("tabver-bench") : Path.of(dir));
    }

    /** Run every round and return the collected samples, compare and merge interleaved per round. */
    static List<Sample> run(BenchConfig cfg) throws Exception {
        var store = new DurableVersionStore(
                new FileWal(cfg.dataDir().resolve("wal"), 64L * 1024 * 1024),
                new FileSnapshotter(cfg.dataDir().resolve("snap")),
                new SnapshotPolicy(10_000));
        var weights = new InMemoryPreferenceWeightStore();
        // no cache: every compare must do the work
        var diffs = new DiffEngine(store, new DiffCache(0));
        var resolver = new ConflictResolver(store, diffs, weights, ResolverSettings.defaults());
        var merges = new MergeEngine(resolver, store, weights, (request, documentId, result) -> { });
        DiffOptions options = DiffOptions.defaults().withStructuralAware(cfg.structural());

        ExecutorService exec = Executors.newFixedThreadPool(cfg.threads());
        BlockingQueue<Sample> samples = new LinkedBlockingQueue<>();
        AtomicLong nextRound = new AtomicLong();
        AtomicReference<Exception> firstError = new AtomicReference<>();

        List<Future<?>> workers = new ArrayList<>();
        try {
            for (int t = 0; t < cfg.threads(); t++) {
                final long seed = 42L + t;
                workers.add(exec.submit(() -> {
                    var zipf = new ZipfianRowGenerator(cfg.rows(), cfg.zipfSkew(), seed);
                    long round;
                    while ((round = nextRound.getAndIncrement()) < cfg.rounds()) {
                        String doc = "bench-" + round;
                        NormalizedTable base = baseTable(cfg);
                        Version b = store.createVersion(doc, null, base, "alice", null);
                        Version l = store.createVersion(doc, b.id(), edit(base, cfg, zipf, 0.25), "alice", null);
                        Version r = store.createVersion(doc, b.id(), edit(base, cfg, zipf, 0.75), "bob", null);

                        samples.add(timed("compare", firstError,
                                () -> diffs.compare(b.id(), l.id(), options).summary().total()));
                        samples.add(timed("merge", firstError, () -> {
                            MergeResult res = merges.merge(MergeRequest.of(b.id(), l.id(), r.id(), "bench")
                                    .withAllowPartial(true));
                            return res.conflicts().size();
                        }));
                    }
                    return null;
                }));
            }
            exec.shutdown();
            for (Future<?> w : workers) {
                w.get(); // setup failures (store writes) abort the run
            }
        } finally {
            exec.shutdownNow();
            store.close();
        }

        if (firstError.get() != null) {
            System.err.println("first failure: " + firstError.get());
        }
        List<Sample> all = new ArrayList<>(samples.size());
        samples.drainTo(all);
        return all;
    }

    // ---------- workload ----------

    /** Dense numeric grid: cell (r, c) holds r * columns + c. */
    static NormalizedTable baseTable(BenchConfig cfg) {
        NormalizedTable.Builder b = NormalizedTable.builder().sheet("Sheet1");
        for (int r = 0; r < cfg.rows(); r++) {
            for (int c = 0; c < cfg.columns(); c++) {
                b.put("Sheet1", r, c, CellValue.number((double) r * cfg.columns() + c));
            }
        }
        return b.build();
    }

    /** Shift {@code edits} Zipf-picked cells by {@code delta}; repeated picks shift again. */
    static NormalizedTable edit(NormalizedTable base, BenchConfig cfg, ZipfianRowGenerator zipf, double delta) {
        NormalizedTable.Builder b = base.toBuilder();
        Map<CellKey, Double> current = new HashMap<>();
        for (int i = 0; i < cfg.edits(); i++) {
            CellKey key = CellKey.of("Sheet1", zipf.nextRow(), zipf.nextColumn(cfg.columns()));
            double was = current.computeIfAbsent(key, k -> base.get(k).value().asNumber().orElse(0.0));
            double now = was + delta;
            current.put(key, now);
            b.set(key, CellValue.number(now));
        }
        return b.build();
    }

    private interface Op {
        int run() throws Exception;
    }

    private static Sample timed(String op, AtomicReference<Exception> firstError, Op body) {
        long start = System.nanoTime();
        boolean ok = false;
        int changes = 0;
        try {
            changes = body.run();
            ok = true;
        } catch (Exception e) {
            firstError.compareAndSet(null, e);
        }
        double latencyMs = (System.nanoTime() - start) / 1_000_000.0;
        return new Sample(op, ok, latencyMs, changes);
    }

    // ---------- reporting ----------

    private static void summarizeAndPrint(List<Sample> all) {
        if (all.isEmpty()) {
            System.err.println("no samples collected");
            return;
        }

        for (String op : List.of("compare", "merge")) {
            List<Double> latencies = new ArrayList<>();
            long err = 0;
            for (Sample s : all) {
                if (!s.op().equals(op)) continue;
                if (s.ok()) latencies.add(s.latencyMs());
                else err++;
            }
            Collections.sort(latencies);
            System.err.printf(
                    "%s: ok=%d, err=%d, p50=%.2fms, p95=%.2fms, p99=%.2fms%n",
                    op, latencies.size(), err,
                    percentile(latencies, 0.50), percentile(latencies, 0.95), percentile(latencies, 0.99));
        }

        // CSV to stdout.
        System.out.println("op,success,latency_ms,changes");
        for (Sample s : all) {
            System.out.printf("%s,%s,%.3f,%d%n", s.op(), s.ok() ? "1" : "0", s.latencyMs(), s.changes());
        }
    }

    static double percentile(List<Double> sorted, double q) {
        if (sorted.isEmpty()) return Double.NaN;
        double idx = q * (sorted.size() - 1);
        int lo = (int) Math.floor(idx);
        int hi = (int) Math.ceil(idx);
        if (lo == hi) return sorted.get(lo);
        double w = idx - lo;
        return sorted.get(lo) * (1 - w) + sorted.get(hi) * w;
    }
}
