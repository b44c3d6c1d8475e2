package com.ethixai.drift.service.algorithm;

import com.ethixai.drift.config.DriftProperties;
import com.ethixai.drift.dto.FeatureDrift;
import com.ethixai.drift.model.Severity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class PopulationStabilityIndex {

    private final DriftProperties properties;

    /**
     * PSI = sum((cur - base) * ln(cur / base)) over bin shares floored at epsilon.
     */
    public double compute(long[] baseline, long[] current) {
        Distributions.requireSameShape(baseline, current);
        double epsilon = properties.getHistogram().getEpsilon();
        double[] base = Distributions.smoothedShares(baseline, epsilon);
        double[] cur = Distributions.smoothedShares(current, epsilon);
        double psi = 0.0;
        for (int i = 0; i < base.length; i++) {
            psi += (cur[i] - base[i]) * Math.log(cur[i] / base[i]);
        }
        return Math.max(0.0, psi);
    }

    public Severity classify(double psi) {
        DriftProperties.Thresholds thresholds = properties.getThresholds();
        if (psi >= thresholds.getPsiCritical()) {
            return Severity.CRITICAL;
        }
        if (psi >= thresholds.getPsiWarning()) {
            return Severity.WARNING;
        }
        return Severity.STABLE;
    }

    public FeatureDrift evaluate(String feature, long[] baseline, long[] current) {
        double psi = compute(baseline, current);
        return FeatureDrift.builder()
                .feature(feature)
                .psi(psi)
                .severity(classify(psi))
                .build();
    }
}
