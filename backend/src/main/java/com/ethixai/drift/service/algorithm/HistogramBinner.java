package com.ethixai.drift.service.algorithm;

import com.ethixai.drift.config.DriftProperties;
import com.ethixai.drift.dto.FeatureHistogram;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Builds reference histograms and bins window values onto them. Missing values never land in a bin.
 */
@Service
@RequiredArgsConstructor
public class HistogramBinner {

    private final DriftProperties properties;

    /**
     * A feature is categorical when any present reference value is not numeric.
     */
    public boolean isCategorical(Collection<?> values) {
        for (Object value : values) {
            if (FeatureValues.isPresent(value) && FeatureValues.toDouble(value) == null) {
                return true;
            }
        }
        return false;
    }

    public FeatureHistogram reference(Collection<?> values) {
        return isCategorical(values) ? categoricalReference(values) : numericReference(values);
    }

    public FeatureHistogram numericReference(Collection<?> values) {
        int binCount = properties.getHistogram().getBinCount();
        List<Double> numbers = values.stream()
                .map(FeatureValues::toDouble)
                .filter(Objects::nonNull)
                .toList();
        double min = numbers.stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
        double max = numbers.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        if (max <= min) {
            min -= 0.5;
            max += 0.5;
        }
        double width = (max - min) / binCount;
        List<Double> edges = new ArrayList<>(binCount + 1);
        for (int i = 0; i < binCount; i++) {
            edges.add(min + i * width);
        }
        edges.add(max);
        FeatureHistogram histogram = FeatureHistogram.builder()
                .kind(FeatureHistogram.Kind.NUMERIC)
                .edges(edges)
                .counts(zeros(binCount))
                .build();
        histogram.setCounts(toList(bin(histogram, numbers)));
        return histogram;
    }

    public FeatureHistogram categoricalReference(Collection<?> values) {
        TreeSet<String> categories = values.stream()
                .map(FeatureValues::toCategory)
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(TreeSet::new));
        FeatureHistogram histogram = FeatureHistogram.builder()
                .kind(FeatureHistogram.Kind.CATEGORICAL)
                .categories(new ArrayList<>(categories))
                .counts(zeros(categories.size() + 1))
                .build();
        histogram.setCounts(toList(bin(histogram, values)));
        return histogram;
    }

    /**
     * Counts {@code values} into the bins of {@code reference}. Numeric values outside the reference range
     * are clamped into the outer bins; unknown categories go to the trailing bin.
     */
    public long[] bin(FeatureHistogram reference, Collection<?> values) {
        if (reference.getKind() == FeatureHistogram.Kind.CATEGORICAL) {
            return binCategorical(reference.getCategories(), values);
        }
        return binNumeric(reference.getEdges(), values);
    }

    private long[] binNumeric(List<Double> edges, Collection<?> values) {
        int bins = edges.size() - 1;
        long[] counts = new long[bins];
        double min = edges.get(0);
        double max = edges.get(bins);
        double width = (max - min) / bins;
        for (Object value : values) {
            Double number = FeatureValues.toDouble(value);
            if (number == null) {
                continue;
            }
            int index = width <= 0 ? 0 : (int) Math.floor((number - min) / width);
            counts[Math.max(0, Math.min(bins - 1, index))]++;
        }
        return counts;
    }

    private long[] binCategorical(List<String> categories, Collection<?> values) {
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < categories.size(); i++) {
            positions.put(categories.get(i), i);
        }
        long[] counts = new long[categories.size() + 1];
        for (Object value : values) {
            String category = FeatureValues.toCategory(value);
            if (category == null) {
                continue;
            }
            counts[positions.getOrDefault(category, categories.size())]++;
        }
        return counts;
    }

    private static List<Long> zeros(int size) {
        List<Long> counts = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            counts.add(0L);
        }
        return counts;
    }

    private static List<Long> toList(long[] counts) {
        List<Long> list = new ArrayList<>(counts.length);
        for (long count : counts) {
            list.add(count);
        }
        return list;
    }
}
