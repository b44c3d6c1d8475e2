package com.ethixai.drift.service.algorithm;

import com.ethixai.drift.config.DriftProperties;
import com.ethixai.drift.dto.EvaluationSample;
import com.ethixai.drift.dto.ExplanationDrift;
import com.ethixai.drift.model.Severity;
import org.assertj.core.data.Offset;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ExplanationStabilityTest {

    private final ExplanationStability stability = new ExplanationStability(new DriftProperties());

    @Test
    void sameImportanceDirectionIsStable() {
        Map<String, Double> baseline = Map.of("age", 0.6, "income", 0.3);
        List<EvaluationSample> window = List.of(
                sample(Map.of("age", 1.2, "income", 0.6)),
                sample(Map.of("age", -1.2, "income", -0.6)));

        ExplanationDrift drift = stability.compute(baseline, window);

        assertThat(drift.getCosineSimilarity()).isCloseTo(1.0, Offset.offset(1e-9));
        assertThat(drift.getSeverity()).isEqualTo(Severity.STABLE);
        assertThat(drift.getFeatureCount()).isEqualTo(2);
    }

    @Test
    void swappedImportanceIsCritical() {
        Map<String, Double> baseline = Map.of("age", 1.0, "income", 0.0, "tenure", 0.0);
        List<EvaluationSample> window = List.of(sample(Map.of("age", 0.1, "income", 1.0)));

        ExplanationDrift drift = stability.compute(baseline, window);

        assertThat(drift.getCosineSimilarity()).isLessThan(0.7);
        assertThat(drift.getSeverity()).isEqualTo(Severity.CRITICAL);
    }

    @Test
    void missingImportanceOnEitherSideYieldsNoSignal() {
        assertThat(stability.compute(Map.of(), List.of(sample(Map.of("age", 1.0))))).isNull();
        assertThat(stability.compute(Map.of("age", 1.0), List.of(EvaluationSample.builder().score(0.5).build()))).isNull();
    }

    @Test
    void classifiesBySimilarityThresholds() {
        assertThat(stability.classify(0.95)).isEqualTo(Severity.STABLE);
        assertThat(stability.classify(0.8)).isEqualTo(Severity.WARNING);
        assertThat(stability.classify(0.5)).isEqualTo(Severity.CRITICAL);
    }

    private static EvaluationSample sample(Map<String, Double> importance) {
        return EvaluationSample.builder().score(0.5).featureImportance(importance).build();
    }
}
