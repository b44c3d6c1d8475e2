package com.ethixai.drift.service;

import com.ethixai.drift.config.DriftProperties;
import com.ethixai.drift.dto.BaselineDocument;
import com.ethixai.drift.dto.DriftAnalysis;
import com.ethixai.drift.dto.DriftSignal;
import com.ethixai.drift.dto.EvaluationSample;
import com.ethixai.drift.dto.FeatureDrift;
import com.ethixai.drift.dto.FeatureHistogram;
import com.ethixai.drift.dto.ScoreDistribution;
import com.ethixai.drift.dto.ScoreDrift;
import com.ethixai.drift.model.Severity;
import com.ethixai.drift.service.algorithm.DataQualityDriftCalculator;
import com.ethixai.drift.service.algorithm.ExplanationStability;
import com.ethixai.drift.service.algorithm.FairnessDriftCalculator;
import com.ethixai.drift.service.algorithm.HistogramBinner;
import com.ethixai.drift.service.algorithm.KlDivergence;
import com.ethixai.drift.service.algorithm.PopulationStabilityIndex;
import com.ethixai.drift.service.algorithm.SeverityAggregator;
import com.ethixai.drift.service.algorithm.WassersteinDistance;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs every drift measure of one window against a baseline. Pure computation, no I/O.
 */
@Service
@RequiredArgsConstructor
public class DriftAnalyzer {

    private final DriftProperties properties;
    private final HistogramBinner histogramBinner;
    private final PopulationStabilityIndex populationStabilityIndex;
    private final KlDivergence klDivergence;
    private final WassersteinDistance wassersteinDistance;
    private final FairnessDriftCalculator fairnessDriftCalculator;
    private final DataQualityDriftCalculator dataQualityDriftCalculator;
    private final ExplanationStability explanationStability;
    private final SeverityAggregator severityAggregator;

    public DriftAnalysis analyze(BaselineDocument baseline, List<EvaluationSample> window) {
        DriftAnalysis analysis = DriftAnalysis.builder()
                .sampleCount(window.size())
                .featureDrifts(featureDrifts(baseline, window))
                .scoreDrift(scoreDrift(baseline.getScoreDistribution(), window))
                .fairnessDrifts(fairnessDriftCalculator.compute(baseline.getFairnessStatistics(), window))
                .dataQualityDrifts(dataQualityDriftCalculator.compute(baseline.getDataQualityStatistics(), window))
                .explanationDrift(explanationStability.compute(baseline.getFeatureImportance(), window))
                .build();

        List<DriftSignal> signals = analysis.signals(properties.getThresholds());
        List<Severity> severities = new ArrayList<>(signals.size());
        int critical = 0;
        int warning = 0;
        for (DriftSignal signal : signals) {
            severities.add(signal.severity());
            if (signal.severity() == Severity.CRITICAL) {
                critical++;
            } else if (signal.severity() == Severity.WARNING) {
                warning++;
            }
        }
        analysis.setOverallStatus(severityAggregator.aggregate(severities));
        analysis.setCriticalCount(critical);
        analysis.setWarningCount(warning);
        return analysis;
    }

    private Map<String, FeatureDrift> featureDrifts(BaselineDocument baseline, List<EvaluationSample> window) {
        Map<String, FeatureDrift> drifts = new LinkedHashMap<>();
        if (baseline.getFeatureHistograms() == null) {
            return drifts;
        }
        baseline.getFeatureHistograms().forEach((feature, histogram) -> {
            List<Object> values = new ArrayList<>(window.size());
            for (EvaluationSample sample : window) {
                values.add(sample.getFeatures() == null ? null : sample.getFeatures().get(feature));
            }
            long[] current = histogramBinner.bin(histogram, values);
            // a feature with no usable values is reported by data quality drift only
            if (total(current) == 0) {
                return;
            }
            drifts.put(feature, populationStabilityIndex.evaluate(feature, histogram.countArray(), current));
        });
        return drifts;
    }

    private ScoreDrift scoreDrift(ScoreDistribution baseline, List<EvaluationSample> window) {
        if (baseline == null || baseline.getHistogram() == null) {
            return null;
        }
        List<Object> scores = new ArrayList<>(window.size());
        double sum = 0.0;
        int count = 0;
        for (EvaluationSample sample : window) {
            Double score = sample.getScore();
            if (score != null && Double.isFinite(score)) {
                scores.add(score);
                sum += score;
                count++;
            }
        }
        if (count == 0) {
            return null;
        }
        FeatureHistogram histogram = baseline.getHistogram();
        long[] reference = histogram.countArray();
        long[] current = histogramBinner.bin(histogram, scores);
        double kl = klDivergence.compute(reference, current);
        return ScoreDrift.builder()
                .klDivergence(kl)
                .wasserstein(wassersteinDistance.compute(histogram.getEdges(), reference, current))
                .baselineMean(baseline.getMean())
                .currentMean(sum / count)
                .severity(klDivergence.classify(kl))
                .build();
    }

    private static long total(long[] counts) {
        long total = 0;
        for (long count : counts) {
            total += count;
        }
        return total;
    }
}
