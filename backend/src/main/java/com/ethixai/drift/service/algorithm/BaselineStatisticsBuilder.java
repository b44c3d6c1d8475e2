package com.ethixai.drift.service.algorithm;

import com.ethixai.drift.dto.BaselineDocument;
import com.ethixai.drift.dto.FeatureHistogram;
import com.ethixai.drift.dto.FeatureQuality;
import com.ethixai.drift.dto.GroupOutcome;
import com.ethixai.drift.dto.ScoreDistribution;
import com.ethixai.drift.exception.BadRequestException;
import com.ethixai.drift.exception.InsufficientDataException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes the reference statistics of a model from raw reference rows.
 */
@Service
@RequiredArgsConstructor
public class BaselineStatisticsBuilder {

    private static final int[] PERCENTILES = {5, 25, 50, 75, 95};

    private final HistogramBinner histogramBinner;
    private final FairnessDriftCalculator fairnessDriftCalculator;
    private final DataQualityDriftCalculator dataQualityDriftCalculator;

    public BaselineDocument build(String modelId,
                                  List<Map<String, Object>> referenceSamples,
                                  List<String> featureNames,
                                  String scoreField,
                                  List<String> protectedAttributes,
                                  Map<String, Double> featureImportance) {
        if (referenceSamples == null || referenceSamples.isEmpty()) {
            throw new InsufficientDataException("Reference samples are empty for model " + modelId, 0, 1);
        }
        if (featureNames == null || featureNames.isEmpty()) {
            throw new BadRequestException("At least one feature name is required");
        }
        List<String> attributes = protectedAttributes == null ? List.of() : List.copyOf(protectedAttributes);

        Map<String, FeatureHistogram> histograms = new LinkedHashMap<>();
        Map<String, FeatureQuality> quality = new LinkedHashMap<>();
        for (String feature : featureNames) {
            List<Object> values = column(referenceSamples, feature);
            FeatureHistogram histogram = histogramBinner.reference(values);
            boolean categorical = histogram.getKind() == FeatureHistogram.Kind.CATEGORICAL;
            histograms.put(feature, histogram);
            quality.put(feature, FeatureQuality.builder()
                    .nullRate(dataQualityDriftCalculator.nullRate(values, categorical))
                    .categorical(categorical)
                    .categories(categorical ? histogram.getCategories() : List.of())
                    .build());
        }

        List<Object> rawScores = column(referenceSamples, scoreField);
        ScoreDistribution scoreDistribution = scoreDistribution(rawScores);

        Map<String, Map<String, GroupOutcome>> fairness = new LinkedHashMap<>();
        for (String attribute : attributes) {
            fairness.put(attribute, fairnessDriftCalculator.outcomeRates(referenceSamples,
                    row -> row.get(attribute),
                    row -> FeatureValues.toDouble(row.get(scoreField))));
        }

        return BaselineDocument.builder()
                .modelId(modelId)
                .scoreField(scoreField)
                .sampleCount(referenceSamples.size())
                .featureNames(List.copyOf(featureNames))
                .protectedAttributes(attributes)
                .featureHistograms(histograms)
                .scoreDistribution(scoreDistribution)
                .fairnessStatistics(fairness)
                .dataQualityStatistics(quality)
                .featureImportance(featureImportance == null ? Map.of() : new LinkedHashMap<>(featureImportance))
                .build();
    }

    public ScoreDistribution scoreDistribution(List<Object> rawScores) {
        double[] scores = rawScores.stream()
                .map(FeatureValues::toDouble)
                .filter(value -> value != null)
                .mapToDouble(Double::doubleValue)
                .sorted()
                .toArray();
        if (scores.length == 0) {
            throw new BadRequestException("Reference samples carry no numeric score values");
        }
        double mean = Arrays.stream(scores).average().orElse(0.0);
        double variance = Arrays.stream(scores).map(score -> (score - mean) * (score - mean)).sum() / scores.length;
        Map<String, Double> percentiles = new LinkedHashMap<>();
        for (int percentile : PERCENTILES) {
            percentiles.put("p" + percentile, percentile(scores, percentile));
        }
        List<Object> boxed = new ArrayList<>(scores.length);
        for (double score : scores) {
            boxed.add(score);
        }
        return ScoreDistribution.builder()
                .count(scores.length)
                .mean(mean)
                .std(Math.sqrt(variance))
                .min(scores[0])
                .max(scores[scores.length - 1])
                .percentiles(percentiles)
                .histogram(histogramBinner.numericReference(boxed))
                .build();
    }

    // linear interpolation between closest ranks
    static double percentile(double[] sorted, int percentile) {
        if (sorted.length == 1) {
            return sorted[0];
        }
        double rank = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = Math.min(lower + 1, sorted.length - 1);
        return sorted[lower] + (rank - lower) * (sorted[upper] - sorted[lower]);
    }

    private static List<Object> column(List<Map<String, Object>> rows, String name) {
        List<Object> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            values.add(row == null ? null : row.get(name));
        }
        return values;
    }
}
