package com.ethixai.drift.service.algorithm;

import com.ethixai.drift.config.DriftProperties;
import com.ethixai.drift.dto.EvaluationSample;
import com.ethixai.drift.dto.ExplanationDrift;
import com.ethixai.drift.model.Severity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cosine similarity between the baseline feature-importance vector and the window's mean absolute importance.
 * Lower similarity means the model explains its scores differently than it did on reference data.
 */
@Service
@RequiredArgsConstructor
public class ExplanationStability {

    private final DriftProperties properties;

    /**
     * Returns null when either side has no importance data.
     */
    public ExplanationDrift compute(Map<String, Double> baselineImportance, List<EvaluationSample> window) {
        if (baselineImportance == null || baselineImportance.isEmpty()) {
            return null;
        }
        Map<String, Double> current = meanAbsoluteImportance(window);
        if (current.isEmpty()) {
            return null;
        }
        List<String> features = new ArrayList<>(baselineImportance.keySet());
        double[] base = new double[features.size()];
        double[] cur = new double[features.size()];
        for (int i = 0; i < features.size(); i++) {
            Double baseValue = baselineImportance.get(features.get(i));
            base[i] = baseValue == null ? 0.0 : Math.abs(baseValue);
            cur[i] = current.getOrDefault(features.get(i), 0.0);
        }
        Double similarity = cosine(base, cur);
        if (similarity == null) {
            return null;
        }
        return ExplanationDrift.builder()
                .cosineSimilarity(similarity)
                .featureCount(features.size())
                .severity(classify(similarity))
                .build();
    }

    public Map<String, Double> meanAbsoluteImportance(List<EvaluationSample> window) {
        Map<String, Double> sums = new LinkedHashMap<>();
        int rows = 0;
        for (EvaluationSample sample : window) {
            Map<String, Double> importance = sample.getFeatureImportance();
            if (importance == null || importance.isEmpty()) {
                continue;
            }
            rows++;
            importance.forEach((feature, value) -> {
                if (value != null && Double.isFinite(value)) {
                    sums.merge(feature, Math.abs(value), Double::sum);
                }
            });
        }
        if (rows == 0) {
            return Map.of();
        }
        int divisor = rows;
        sums.replaceAll((feature, sum) -> sum / divisor);
        return sums;
    }

    public Double cosine(double[] left, double[] right) {
        double dot = 0.0;
        double leftNorm = 0.0;
        double rightNorm = 0.0;
        for (int i = 0; i < left.length; i++) {
            dot += left[i] * right[i];
            leftNorm += left[i] * left[i];
            rightNorm += right[i] * right[i];
        }
        if (leftNorm == 0.0 || rightNorm == 0.0) {
            return null;
        }
        return dot / (Math.sqrt(leftNorm) * Math.sqrt(rightNorm));
    }

    public Severity classify(double similarity) {
        DriftProperties.Thresholds thresholds = properties.getThresholds();
        if (similarity < thresholds.getExplanationCritical()) {
            return Severity.CRITICAL;
        }
        if (similarity < thresholds.getExplanationWarning()) {
            return Severity.WARNING;
        }
        return Severity.STABLE;
    }
}
