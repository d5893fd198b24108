// file: src/main/java/io/tabver/bench/ZipfianRowGenerator.java
package io.tabver.bench;

import java.util.Random;

/**
 * Zipfian row picker for row indices in [0, n).
 *
 * Low rows are hot: edits cluster near the top of a sheet the way header and
 * summary rows do in real workbooks. Precomputes the CDF once and samples by
 * binary search.
 */
public final class ZipfianRowGenerator {

    private final int n;
    private final double[] cdf;
    private final Random rnd;

    public ZipfianRowGenerator(int n, double skew, long seed) {
        if (n <= 0) throw new IllegalArgumentException("n must be > 0");
        if (skew <= 0.0) throw new IllegalArgumentException("skew must be > 0");

        this.n = n;
        this.rnd = new Random(seed);

        double sum = 0.0;
        double[] w = new double[n];
        for (int i = 0; i < n; i++) {
            w[i] = 1.0 / Math.pow(i + 1, skew);
            sum += w[i];
        }
        this.cdf = new double[n];
        double running = 0.0;
        for (int i = 0; i < n; i++) {
            running += w[i] / sum;
            cdf[i] = running;
        }
        cdf[n - 1] = 1.0;
    }

    /** Return a row index in [0, n). */
    public int nextRow() {
        double u = rnd.nextDouble();
        int lo = 0;
        int hi = n - 1;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (u <= cdf[mid]) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return lo;
    }

    /** Uniform column pick from the same seeded source. */
    public int nextColumn(int columns) {
        return rnd.nextInt(columns);
    }
}
