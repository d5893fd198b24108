// file: src/main/java/io/tabver/server/Main.java
package io.tabver.server;

import io.tabver.core.merge.ResolverSettings;
import io.tabver.server.audit.JsonlMergeAuditLog;
import io.tabver.server.diff.DiffCache;
import io.tabver.server.diff.DiffEngine;
import io.tabver.server.merge.ConflictResolver;
import io.tabver.server.merge.MergeEngine;
import io.tabver.storage.DurablePreferenceWeightStore;
import io.tabver.storage.DurableVersionStore;
import io.tabver.storage.FileSnapshotter;
import io.tabver.storage.FileWal;
import io.tabver.storage.SnapshotPolicy;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point for a TabVer server.
 *
 * Responsibilities:
 *  - Parse configuration from CLI.
 *  - Wire storage (version WAL + snapshots, preference WAL, audit log).
 *  - Wire DiffEngine, ConflictResolver and MergeEngine.
 *  - Start the HTTP server and close everything on shutdown.
 */
public final class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());
    private static final long WAL_ROTATE_BYTES = 64L * 1024 * 1024; // rotate ~64MB

    private Main() {
        // no-op
    }

    public static void main(String[] args) throws IOException {
        configureLogging();
        var cfg = ServerConfig.fromArgs(args);
        ResolverSettings settings = cfg.resolverSettings();

        // ------ Storage Layer -------
        var wal = new FileWal(cfg.walDir(), WAL_ROTATE_BYTES);
        var snaps = new FileSnapshotter(cfg.snapDir());
        var store = new DurableVersionStore(wal, snaps, new SnapshotPolicy(cfg.snapshotEvery()));

        var prefWal = new FileWal(cfg.preferenceWalDir(), WAL_ROTATE_BYTES);
        var weights = new DurablePreferenceWeightStore(prefWal);

        var audit = new JsonlMergeAuditLog(cfg.auditFile());

        // ------ Engines ------
        var diffs = new DiffEngine(store, new DiffCache(cfg.diffCacheSize()));
        var resolver = new ConflictResolver(store, diffs, weights, settings);
        var merges = new MergeEngine(resolver, store, weights, audit);

        // ------ HTTP layer ------
        var web = new WebServer(cfg.httpPort(), store, diffs, merges);
        web.start();

        System.out.printf(
                "TabVer listening on http://%s:%d (data: %s, %d versions recovered)%n",
                "localhost", cfg.httpPort(), cfg.dataDir(), store.size());
        LOG.info(String.format("resolver threshold=%.2f weights=(%.2f, %.2f, %.2f) minHistory=%d epsilon=%s",
                settings.autoResolveThreshold(), settings.typeWeight(), settings.numericWeight(),
                settings.historyWeight(), settings.minHistory(), settings.numericEpsilon()));

        // Shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            web.stop();
            closeQuietly("version store", store);
            closeQuietly("preference store", weights);
            closeQuietly("audit log", audit);
        }));
    }

    private static void configureLogging() throws IOException {
        if (System.getProperty("java.util.logging.config.file") != null) return;
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) LogManager.getLogManager().readConfiguration(in);
        }
    }

    private static void closeQuietly(String what, AutoCloseable c) {
        try {
            c.close();
        } catch (Exception e) {
            LOG.log(Level.WARNING, "Failed to close " + what, e);
        }
    }
}
