package com.ethixai.drift.service.algorithm;

import com.ethixai.drift.config.DriftProperties;
import com.ethixai.drift.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SeverityAggregatorTest {

    @Test
    void worstCaseLetsOneCriticalSignalDecide() {
        SeverityAggregator aggregator = new SeverityAggregator(new DriftProperties());

        assertThat(aggregator.aggregate(List.of(Severity.STABLE, Severity.CRITICAL, Severity.WARNING)))
                .isEqualTo(Severity.CRITICAL);
        assertThat(aggregator.aggregate(List.of(Severity.STABLE, Severity.WARNING))).isEqualTo(Severity.WARNING);
        assertThat(aggregator.aggregate(List.of())).isEqualTo(Severity.STABLE);
    }

    @Test
    void quorumNeedsSeveralCriticalSignals() {
        DriftProperties properties = new DriftProperties();
        properties.getAggregation().setStrategy(DriftProperties.AggregationStrategy.QUORUM);
        properties.getAggregation().setQuorum(2);
        SeverityAggregator aggregator = new SeverityAggregator(properties);

        assertThat(aggregator.aggregate(List.of(Severity.CRITICAL, Severity.STABLE))).isEqualTo(Severity.WARNING);
        assertThat(aggregator.aggregate(List.of(Severity.CRITICAL, Severity.CRITICAL))).isEqualTo(Severity.CRITICAL);
        assertThat(aggregator.aggregate(List.of(Severity.STABLE, Severity.STABLE))).isEqualTo(Severity.STABLE);
    }
}
