package com.ethixai.drift.service.algorithm;

import com.ethixai.drift.config.DriftProperties;
import com.ethixai.drift.dto.FeatureDrift;
import com.ethixai.drift.model.Severity;
import org.assertj.core.data.Offset;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PopulationStabilityIndexTest {

    private static final long[] BASELINE = {100, 200, 150, 100, 50};

    private final PopulationStabilityIndex psi = new PopulationStabilityIndex(new DriftProperties());

    @Test
    void identicalHistogramsAreStable() {
        FeatureDrift drift = psi.evaluate("age", BASELINE, new long[]{100, 200, 150, 100, 50});

        assertThat(drift.getPsi()).isCloseTo(0.0, Offset.offset(1e-12));
        assertThat(drift.getSeverity()).isEqualTo(Severity.STABLE);
    }

    @Test
    void scaledCopyHasSameShareAndZeroPsi() {
        assertThat(psi.compute(BASELINE, new long[]{200, 400, 300, 200, 100})).isCloseTo(0.0, Offset.offset(1e-12));
    }

    @Test
    void smallShiftStaysBelowWarning() {
        double value = psi.compute(BASELINE, new long[]{80, 180, 160, 120, 60});

        assertThat(value).isCloseTo(0.0211, Offset.offset(1e-3));
        assertThat(psi.classify(value)).isEqualTo(Severity.STABLE);
    }

    @Test
    void moderateShiftIsWarning() {
        FeatureDrift drift = psi.evaluate("income", BASELINE, new long[]{50, 150, 170, 140, 90});

        assertThat(drift.getPsi()).isBetween(0.1, 0.2);
        assertThat(drift.getSeverity()).isEqualTo(Severity.WARNING);
    }

    @Test
    void reshuffledDistributionIsCritical() {
        FeatureDrift drift = psi.evaluate("income", BASELINE, new long[]{200, 50, 100, 150, 100});

        assertThat(drift.getPsi()).isGreaterThanOrEqualTo(0.25);
        assertThat(drift.getPsi()).isCloseTo(0.5874, Offset.offset(1e-3));
        assertThat(drift.getSeverity()).isEqualTo(Severity.CRITICAL);
    }

    @Test
    void emptyBinsAreSmoothedInsteadOfFailing() {
        double value = psi.compute(new long[]{10, 10, 0, 0}, new long[]{0, 0, 10, 10});

        assertThat(value).isPositive().isFinite();
        assertThat(psi.classify(value)).isEqualTo(Severity.CRITICAL);
    }

    @Test
    void growsMonotonicallyAsMassShiftsAway() {
        long[] baseline = {250, 250, 250, 250};
        double previous = -1.0;
        for (int shift = 0; shift <= 200; shift += 25) {
            long[] current = {250 - shift, 250, 250, 250 + shift};
            double value = psi.compute(baseline, current);
            assertThat(value).isGreaterThanOrEqualTo(0.0);
            if (shift > 0) {
                assertThat(value).isGreaterThan(previous);
            }
            previous = value;
        }
    }

    @Test
    void rejectsHistogramsOfDifferentShape() {
        assertThatThrownBy(() -> psi.compute(new long[]{1, 2}, new long[]{1, 2, 3}))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
