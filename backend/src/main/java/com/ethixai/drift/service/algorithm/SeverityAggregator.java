package com.ethixai.drift.service.algorithm;

import com.ethixai.drift.config.DriftProperties;
import com.ethixai.drift.model.Severity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Collection;

/**
 * Folds per-signal severities into the status of a window.
 * <ul>
 *     <li>WORST_CASE: the most severe signal wins.</li>
 *     <li>QUORUM: the window is critical only when at least {@code quorum} signals are critical; a smaller number of
 *     critical signals degrades to warning.</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
public class SeverityAggregator {

    private final DriftProperties properties;

    public Severity aggregate(Collection<Severity> severities) {
        Severity worst = Severity.STABLE;
        long critical = 0;
        for (Severity severity : severities) {
            worst = Severity.worst(worst, severity);
            if (severity == Severity.CRITICAL) {
                critical++;
            }
        }
        DriftProperties.Aggregation aggregation = properties.getAggregation();
        if (aggregation.getStrategy() == DriftProperties.AggregationStrategy.QUORUM
                && worst == Severity.CRITICAL
                && critical < aggregation.getQuorum()) {
            return Severity.WARNING;
        }
        return worst;
    }
}
