package com.ethixai.drift.service.algorithm;

import com.ethixai.drift.config.DriftProperties;
import com.ethixai.drift.dto.EvaluationSample;
import com.ethixai.drift.dto.FairnessDrift;
import com.ethixai.drift.dto.GroupOutcome;
import com.ethixai.drift.model.Severity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Demographic-parity drift: the absolute change of each protected group's positive outcome rate.
 */
@Service
@RequiredArgsConstructor
public class FairnessDriftCalculator {

    private final DriftProperties properties;

    /**
     * Outcome rates per group of one attribute. Rows without a numeric score or without the attribute are ignored.
     */
    public <T> Map<String, GroupOutcome> outcomeRates(Collection<T> rows,
                                                       Function<T, Object> attributeValue,
                                                       Function<T, Double> score) {
        double positiveThreshold = properties.getFairness().getPositiveThreshold();
        Map<String, long[]> tallies = new TreeMap<>();
        for (T row : rows) {
            String group = FeatureValues.toCategory(attributeValue.apply(row));
            Double value = score.apply(row);
            if (group == null || value == null) {
                continue;
            }
            long[] tally = tallies.computeIfAbsent(group, key -> new long[2]);
            tally[0]++;
            if (value >= positiveThreshold) {
                tally[1]++;
            }
        }
        Map<String, GroupOutcome> rates = new LinkedHashMap<>();
        tallies.forEach((group, tally) -> rates.put(group, GroupOutcome.builder()
                .count(tally[0])
                .positiveRate((double) tally[1] / tally[0])
                .build()));
        return rates;
    }

    /**
     * Compares every baseline group that also appears in the window. Keys are {@code attribute:group}.
     */
    public Map<String, FairnessDrift> compute(Map<String, Map<String, GroupOutcome>> baseline,
                                              List<EvaluationSample> window) {
        Map<String, FairnessDrift> drifts = new LinkedHashMap<>();
        if (baseline == null) {
            return drifts;
        }
        baseline.forEach((attribute, baselineGroups) -> {
            Map<String, GroupOutcome> current = outcomeRates(window,
                    sample -> sample.getProtectedAttributes() == null ? null : sample.getProtectedAttributes().get(attribute),
                    EvaluationSample::getScore);
            baselineGroups.forEach((group, baselineOutcome) -> {
                GroupOutcome currentOutcome = current.get(group);
                if (currentOutcome == null) {
                    return;
                }
                drifts.put(attribute + ":" + group, compare(attribute, group,
                        baselineOutcome.getPositiveRate(), currentOutcome.getPositiveRate(), currentOutcome.getCount()));
            });
        });
        return drifts;
    }

    public FairnessDrift compare(String attribute, String group, double baselineRate, double currentRate, long currentCount) {
        double delta = Math.abs(currentRate - baselineRate);
        return FairnessDrift.builder()
                .attribute(attribute)
                .group(group)
                .baselineRate(baselineRate)
                .currentRate(currentRate)
                .delta(delta)
                .currentCount(currentCount)
                .severity(classify(delta))
                .build();
    }

    public Severity classify(double delta) {
        DriftProperties.Thresholds thresholds = properties.getThresholds();
        if (delta >= thresholds.getFairnessCritical()) {
            return Severity.CRITICAL;
        }
        if (delta >= thresholds.getFairnessWarning()) {
            return Severity.WARNING;
        }
        return Severity.STABLE;
    }
}
