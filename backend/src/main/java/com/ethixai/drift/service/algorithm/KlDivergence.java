package com.ethixai.drift.service.algorithm;

import com.ethixai.drift.config.DriftProperties;
import com.ethixai.drift.model.Severity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class KlDivergence {

    private final DriftProperties properties;

    /**
     * KL(current || baseline) over histogram shares floored at epsilon.
     */
    public double compute(long[] baseline, long[] current) {
        Distributions.requireSameShape(baseline, current);
        double epsilon = properties.getHistogram().getEpsilon();
        double[] base = Distributions.smoothedShares(baseline, epsilon);
        double[] cur = Distributions.smoothedShares(current, epsilon);
        double kl = 0.0;
        for (int i = 0; i < base.length; i++) {
            kl += cur[i] * Math.log(cur[i] / base[i]);
        }
        return Math.max(0.0, kl);
    }

    public Severity classify(double kl) {
        DriftProperties.Thresholds thresholds = properties.getThresholds();
        if (kl >= thresholds.getKlCritical()) {
            return Severity.CRITICAL;
        }
        if (kl >= thresholds.getKlWarning()) {
            return Severity.WARNING;
        }
        return Severity.STABLE;
    }
}
