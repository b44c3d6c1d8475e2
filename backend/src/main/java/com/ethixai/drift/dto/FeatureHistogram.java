package com.ethixai.drift.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Binned distribution of one feature (or of the model score).
 * <p>
 * NUMERIC histograms have {@code edges.size() == counts.size() + 1} equal-width bins; values outside the
 * outer edges fall into the first or last bin. CATEGORICAL histograms have one bin per entry of
 * {@code categories} followed by a trailing bin for values not in that list.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeatureHistogram {

    public enum Kind {
        NUMERIC,
        CATEGORICAL
    }

    private Kind kind;
    private List<Double> edges;
    private List<String> categories;
    private List<Long> counts;

    public long total() {
        long total = 0;
        if (counts != null) {
            for (Long count : counts) {
                total += count == null ? 0 : count;
            }
        }
        return total;
    }

    public long[] countArray() {
        long[] array = new long[counts == null ? 0 : counts.size()];
        for (int i = 0; i < array.length; i++) {
            Long count = counts.get(i);
            array[i] = count == null ? 0 : count;
        }
        return array;
    }
}
