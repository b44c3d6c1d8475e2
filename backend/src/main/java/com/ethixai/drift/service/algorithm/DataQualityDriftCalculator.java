package com.ethixai.drift.service.algorithm;

import com.ethixai.drift.config.DriftProperties;
import com.ethixai.drift.dto.DataQualityDrift;
import com.ethixai.drift.dto.EvaluationSample;
import com.ethixai.drift.dto.FeatureQuality;
import com.ethixai.drift.model.Severity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

@Service
@RequiredArgsConstructor
public class DataQualityDriftCalculator {

    private final DriftProperties properties;

    public double nullRate(Collection<?> values, boolean categorical) {
        if (values.isEmpty()) {
            return 0.0;
        }
        long missing = values.stream().filter(value -> FeatureValues.isMissing(value, categorical)).count();
        return (double) missing / values.size();
    }

    public Map<String, DataQualityDrift> compute(Map<String, FeatureQuality> baseline, List<EvaluationSample> window) {
        Map<String, DataQualityDrift> drifts = new LinkedHashMap<>();
        if (baseline == null || window.isEmpty()) {
            return drifts;
        }
        baseline.forEach((feature, quality) -> {
            List<Object> values = new ArrayList<>(window.size());
            for (EvaluationSample sample : window) {
                values.add(sample.getFeatures() == null ? null : sample.getFeatures().get(feature));
            }
            drifts.put(feature, evaluate(feature, quality, values));
        });
        return drifts;
    }

    public DataQualityDrift evaluate(String feature, FeatureQuality baseline, List<Object> values) {
        double currentNullRate = nullRate(values, baseline.isCategorical());
        double delta = currentNullRate - baseline.getNullRate();

        List<String> newCategories = new ArrayList<>();
        double newCategoryRate = 0.0;
        if (baseline.isCategorical() && !values.isEmpty()) {
            Set<String> known = new HashSet<>(baseline.getCategories() == null ? List.of() : baseline.getCategories());
            Set<String> unseen = new TreeSet<>();
            long unseenRows = 0;
            for (Object value : values) {
                String category = FeatureValues.toCategory(value);
                if (category != null && !known.contains(category)) {
                    unseen.add(category);
                    unseenRows++;
                }
            }
            newCategories.addAll(unseen);
            newCategoryRate = (double) unseenRows / values.size();
        }
        boolean flagged = !newCategories.isEmpty();
        return DataQualityDrift.builder()
                .feature(feature)
                .baselineNullRate(baseline.getNullRate())
                .currentNullRate(currentNullRate)
                .nullRateDelta(delta)
                .nullRateSeverity(classifyNullRateDelta(delta))
                .newCategories(newCategories)
                .newCategoryRate(newCategoryRate)
                .newCategoryFlag(flagged)
                .newCategorySeverity(flagged && newCategoryRate > properties.getThresholds().getNewCategoryWarningRate()
                        ? Severity.WARNING : Severity.STABLE)
                .build();
    }

    // only increases in missing data count as drift
    public Severity classifyNullRateDelta(double delta) {
        DriftProperties.Thresholds thresholds = properties.getThresholds();
        if (delta >= thresholds.getNullRateCritical()) {
            return Severity.CRITICAL;
        }
        if (delta >= thresholds.getNullRateWarning()) {
            return Severity.WARNING;
        }
        return Severity.STABLE;
    }
}
