package com.ethixai.drift.dto;

import com.ethixai.drift.config.DriftProperties;
import com.ethixai.drift.model.AlertType;
import com.ethixai.drift.model.Severity;
import com.ethixai.drift.util.MetricNames;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DriftAnalysis {

    private int sampleCount;
    private Map<String, FeatureDrift> featureDrifts;
    private ScoreDrift scoreDrift;
    // keyed "attribute:group"
    private Map<String, FairnessDrift> fairnessDrifts;
    private Map<String, DataQualityDrift> dataQualityDrifts;
    private ExplanationDrift explanationDrift;
    private Severity overallStatus;
    private int criticalCount;
    private int warningCount;

    /**
     * Every severity-bearing measurement of the window. Wasserstein distance has no severity and is not included.
     */
    public List<DriftSignal> signals(DriftProperties.Thresholds thresholds) {
        List<DriftSignal> signals = new ArrayList<>();
        if (featureDrifts != null) {
            featureDrifts.values().forEach(drift -> signals.add(new DriftSignal(
                    AlertType.POPULATION_DRIFT,
                    MetricNames.bounded("psi_" + drift.getFeature()),
                    drift.getPsi(),
                    threshold(drift.getSeverity(), thresholds.getPsiWarning(), thresholds.getPsiCritical()),
                    drift.getSeverity(),
                    details("feature", drift.getFeature()))));
        }
        if (scoreDrift != null) {
            Map<String, Object> details = details("wasserstein", scoreDrift.getWasserstein());
            details.put("baseline_mean", scoreDrift.getBaselineMean());
            details.put("current_mean", scoreDrift.getCurrentMean());
            signals.add(new DriftSignal(
                    AlertType.CONCEPT_DRIFT,
                    "kl_score",
                    scoreDrift.getKlDivergence(),
                    threshold(scoreDrift.getSeverity(), thresholds.getKlWarning(), thresholds.getKlCritical()),
                    scoreDrift.getSeverity(),
                    details));
        }
        if (fairnessDrifts != null) {
            fairnessDrifts.values().forEach(drift -> {
                Map<String, Object> details = details("attribute", drift.getAttribute());
                details.put("group", drift.getGroup());
                details.put("baseline_rate", drift.getBaselineRate());
                details.put("current_rate", drift.getCurrentRate());
                signals.add(new DriftSignal(
                        AlertType.FAIRNESS_DRIFT,
                        MetricNames.fairness(drift.getAttribute(), drift.getGroup()),
                        drift.getDelta(),
                        threshold(drift.getSeverity(), thresholds.getFairnessWarning(), thresholds.getFairnessCritical()),
                        drift.getSeverity(),
                        details));
            });
        }
        if (dataQualityDrifts != null) {
            dataQualityDrifts.values().forEach(drift -> {
                Map<String, Object> nullDetails = details("feature", drift.getFeature());
                nullDetails.put("baseline_null_rate", drift.getBaselineNullRate());
                nullDetails.put("current_null_rate", drift.getCurrentNullRate());
                signals.add(new DriftSignal(
                        AlertType.DATA_QUALITY_DRIFT,
                        MetricNames.bounded("null_rate_" + drift.getFeature()),
                        drift.getNullRateDelta(),
                        threshold(drift.getNullRateSeverity(), thresholds.getNullRateWarning(), thresholds.getNullRateCritical()),
                        drift.getNullRateSeverity(),
                        nullDetails));
                if (drift.isNewCategoryFlag()) {
                    Map<String, Object> categoryDetails = details("feature", drift.getFeature());
                    categoryDetails.put("new_categories", drift.getNewCategories());
                    signals.add(new DriftSignal(
                            AlertType.DATA_QUALITY_DRIFT,
                            MetricNames.bounded("new_categories_" + drift.getFeature()),
                            drift.getNewCategoryRate(),
                            thresholds.getNewCategoryWarningRate(),
                            drift.getNewCategorySeverity(),
                            categoryDetails));
                }
            });
        }
        if (explanationDrift != null) {
            signals.add(new DriftSignal(
                    AlertType.CONCEPT_DRIFT,
                    "explanation_stability",
                    explanationDrift.getCosineSimilarity(),
                    threshold(explanationDrift.getSeverity(),
                            thresholds.getExplanationWarning(), thresholds.getExplanationCritical()),
                    explanationDrift.getSeverity(),
                    details("feature_count", explanationDrift.getFeatureCount())));
        }
        return signals;
    }

    private static double threshold(Severity severity, double warning, double critical) {
        return severity == Severity.CRITICAL ? critical : warning;
    }

    private static Map<String, Object> details(String key, Object value) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put(key, value);
        return details;
    }
}
