package com.ethixai.drift.service.algorithm;

import org.springframework.stereotype.Service;

import java.util.List;

/**
 * First Wasserstein (earth mover's) distance between two binned distributions on the same edges.
 * Reported alongside KL divergence and carries no severity of its own.
 */
@Service
public class WassersteinDistance {

    public double compute(List<Double> edges, long[] baseline, long[] current) {
        Distributions.requireSameShape(baseline, current);
        long baseTotal = sum(baseline);
        long curTotal = sum(current);
        if (baseTotal == 0 || curTotal == 0) {
            return 0.0;
        }
        boolean useEdges = edges != null && edges.size() == baseline.length + 1;
        double baseCdf = 0.0;
        double curCdf = 0.0;
        double distance = 0.0;
        for (int i = 0; i < baseline.length; i++) {
            baseCdf += (double) baseline[i] / baseTotal;
            curCdf += (double) current[i] / curTotal;
            // the last bin closes both CDFs at 1
            if (i == baseline.length - 1) {
                break;
            }
            double width = useEdges ? edges.get(i + 1) - edges.get(i) : 1.0;
            distance += Math.abs(baseCdf - curCdf) * width;
        }
        return distance;
    }

    private long sum(long[] counts) {
        long total = 0;
        for (long count : counts) {
            total += count;
        }
        return total;
    }
}
