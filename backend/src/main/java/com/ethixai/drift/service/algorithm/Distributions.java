package com.ethixai.drift.service.algorithm;

/**
 * Histogram helpers shared by the divergence measures.
 */
public final class Distributions {

    private Distributions() {
    }

    /**
     * Bin shares of {@code counts}, each floored at {@code epsilon}. An empty histogram yields all-epsilon shares.
     */
    public static double[] smoothedShares(long[] counts, double epsilon) {
        double[] shares = new double[counts.length];
        long total = 0;
        for (long count : counts) {
            total += count;
        }
        for (int i = 0; i < counts.length; i++) {
            double share = total == 0 ? 0.0 : (double) counts[i] / total;
            shares[i] = Math.max(share, epsilon);
        }
        return shares;
    }

    public static void requireSameShape(long[] baseline, long[] current) {
        if (baseline.length != current.length) {
            throw new IllegalArgumentException("Histogram shapes differ: baseline has " + baseline.length
                    + " bins, current has " + current.length);
        }
    }
}
