// file: src/main/java/io/tabver/server/ServerConfig.java
package io.tabver.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.tabver.core.merge.ResolverSettings;
import io.tabver.server.diff.DiffCache;
import io.tabver.server.dto.ResolverConfigJson;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Server configuration parsed from CLI args.
 *
 * Supports:
 *  - httpPort:             external HTTP API port
 *  - dataDir:              root of wal/, snap/, prefs/ and audit/
 *  - autoResolveThreshold: confidence at or above which conflicts auto-resolve (null = file or default)
 *  - numericEpsilon:       resolver numeric tolerance (null = file or default)
 *  - minHistory:           observations before an author's weight counts (null = file or default)
 *  - snapshotEvery:        version writes between snapshots
 *  - diffCacheSize:        entries kept by the diff cache, 0 disables it
 *  - resolverConfigPath:   optional JSON file with resolver weights
 */
public record ServerConfig(
        int httpPort,
        String dataDir,
        Double autoResolveThreshold,
        Double numericEpsilon,
        Integer minHistory,
        int snapshotEvery,
        int diffCacheSize,
        String resolverConfigPath
) {

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --http-port, -p   <port>
     *   --data-dir,  -d   <path>
     *   --auto-resolve-threshold <0..1>
     *   --numeric-epsilon <eps>
     *   --min-history <n>
     *   --snapshot-every <n>
     *   --diff-cache-size <n>
     *   --resolver-config, -r <path>
     *   --help,      -h
     *
     * All flags are optional; defaults are reasonable for local dev.
     */
    public static ServerConfig fromArgs(String[] args) {
        // Defaults
        int httpPort = 8080;
        String dataDir = "./data";
        Double threshold = null;
        Double epsilon = null;
        Integer minHistory = null;
        int snapshotEvery = 1000;
        int diffCacheSize = DiffCache.DEFAULT_CAPACITY;
        String resolverConfigPath = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--http-port", "-p" -> {
                    ensureValue(args, i);
                    httpPort = parseInt(args, ++i, "http-port");
                }

                case "--data-dir", "-d" -> {
                    ensureValue(args, i);
                    dataDir = args[++i];
                }

                case "--auto-resolve-threshold" -> {
                    ensureValue(args, i);
                    threshold = parseDouble(args, ++i, "auto-resolve-threshold");
                }

                case "--numeric-epsilon" -> {
                    ensureValue(args, i);
                    epsilon = parseDouble(args, ++i, "numeric-epsilon");
                }

                case "--min-history" -> {
                    ensureValue(args, i);
                    minHistory = parseInt(args, ++i, "min-history");
                }

                case "--snapshot-every" -> {
                    ensureValue(args, i);
                    snapshotEvery = parseInt(args, ++i, "snapshot-every");
                }

                case "--diff-cache-size" -> {
                    ensureValue(args, i);
                    diffCacheSize = parseInt(args, ++i, "diff-cache-size");
                }

                case "--resolver-config", "-r" -> {
                    ensureValue(args, i);
                    resolverConfigPath = args[++i];
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new ServerConfig(
                httpPort,
                dataDir,
                threshold,
                epsilon,
                minHistory,
                snapshotEvery,
                diffCacheSize,
                resolverConfigPath
        );
    }

    public Path walDir() {
        return Path.of(dataDir, "wal");
    }

    public Path snapDir() {
        return Path.of(dataDir, "snap");
    }

    public Path preferenceWalDir() {
        return Path.of(dataDir, "prefs");
    }

    public Path auditFile() {
        return Path.of(dataDir, "audit", "merges.jsonl");
    }

    /**
     * Resolver settings: defaults, overridden by the --resolver-config file,
     * overridden by explicit flags.
     */
    public ResolverSettings resolverSettings() {
        ResolverSettings d = ResolverSettings.defaults();
        double t = d.autoResolveThreshold();
        double typeW = d.typeWeight();
        double numW = d.numericWeight();
        double histW = d.historyWeight();
        int minH = d.minHistory();
        double eps = d.numericEpsilon();

        if (resolverConfigPath != null && !resolverConfigPath.isBlank()) {
            ResolverConfigJson file = loadResolverConfig(Path.of(resolverConfigPath));
            if (file.autoResolveThreshold != null) t = file.autoResolveThreshold;
            if (file.typeWeight != null) typeW = file.typeWeight;
            if (file.numericWeight != null) numW = file.numericWeight;
            if (file.historyWeight != null) histW = file.historyWeight;
            if (file.minHistory != null) minH = file.minHistory;
            if (file.numericEpsilon != null) eps = file.numericEpsilon;
        }
        if (autoResolveThreshold != null) t = autoResolveThreshold;
        if (minHistory != null) minH = minHistory;
        if (numericEpsilon != null) eps = numericEpsilon;
        return new ResolverSettings(t, typeW, numW, histW, minH, eps);
    }

    static ResolverConfigJson loadResolverConfig(Path path) {
        try {
            return new ObjectMapper().readValue(path.toFile(), ResolverConfigJson.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load resolver config from " + path, e);
        }
    }

    // ---------- helpers ----------

    private static int parseInt(String[] args, int i, String name) {
        try {
            return Integer.parseInt(args[i]);
        } catch (NumberFormatException e) {
            System.err.println("Invalid " + name + ": " + args[i]);
            System.exit(1);
            return -1; // unreachable
        }
    }

    private static double parseDouble(String[] args, int i, String name) {
        try {
            return Double.parseDouble(args[i]);
        } catch (NumberFormatException e) {
            System.err.println("Invalid " + name + ": " + args[i]);
            System.exit(1);
            return -1; // unreachable
        }
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: tabver-server [options]

            Options:
              --http-port,       -p   HTTP port (default: 8080)
              --data-dir,        -d   Data directory (default: ./data)
              --auto-resolve-threshold   Confidence needed to auto-resolve a conflict (default: 0.85)
              --numeric-epsilon          Numbers closer than this are the same edit (default: 0)
              --min-history              Observations before an author's weight counts (default: 5)
              --snapshot-every           Version writes between snapshots (default: 1000)
              --diff-cache-size          Cached diff results, 0 disables (default: 256)
              --resolver-config, -r   JSON file with resolver weights (optional)
              --help,            -h   Show this help message
            """);
        System.exit(0);
    }
}
