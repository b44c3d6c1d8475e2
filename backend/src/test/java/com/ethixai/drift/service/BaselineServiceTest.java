package com.ethixai.drift.service;

import com.ethixai.drift.config.DriftProperties;
import com.ethixai.drift.dto.BaselineDocument;
import com.ethixai.drift.dto.FeatureHistogram;
import com.ethixai.drift.exception.BadRequestException;
import com.ethixai.drift.exception.BaselineNotFoundException;
import com.ethixai.drift.exception.InsufficientDataException;
import com.ethixai.drift.model.DriftBaseline;
import com.ethixai.drift.repository.DriftBaselineRepository;
import com.ethixai.drift.service.algorithm.BaselineStatisticsBuilder;
import com.ethixai.drift.service.algorithm.DataQualityDriftCalculator;
import com.ethixai.drift.service.algorithm.FairnessDriftCalculator;
import com.ethixai.drift.service.algorithm.HistogramBinner;
import com.ethixai.drift.util.JsonCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BaselineServiceTest {

    private static final String MODEL = "credit-risk-v3";
    private static final Instant NOW = Instant.parse("2026-03-02T12:00:00Z");

    private final Map<String, DriftBaseline> rows = new HashMap<>();
    private final AtomicLong ids = new AtomicLong();
    private final DriftBaselineRepository repository = mock(DriftBaselineRepository.class);
    private final AuditEventService auditEventService = mock(AuditEventService.class);
    private final DriftProperties properties = new DriftProperties();
    private final BaselineStatisticsBuilder statisticsBuilder = new BaselineStatisticsBuilder(
            new HistogramBinner(properties),
            new FairnessDriftCalculator(properties),
            new DataQualityDriftCalculator(properties));
    private final JsonCodec jsonCodec = new JsonCodec(new ObjectMapper().findAndRegisterModules());

    @BeforeEach
    void setUp() {
        when(repository.findByModelId(anyString()))
                .thenAnswer(invocation -> Optional.ofNullable(rows.get(invocation.<String>getArgument(0))));
        when(repository.save(any(DriftBaseline.class))).thenAnswer(invocation -> {
            DriftBaseline row = invocation.getArgument(0);
            if (row.getId() == null) {
                row.setId(ids.incrementAndGet());
            }
            rows.put(row.getModelId(), row);
            return row;
        });
    }

    @Test
    void storedBaselineIsServedFromCache() {
        BaselineService service = service();
        BaselineDocument created = service.createOrReplace(MODEL, reference(100, 0), List.of("age", "region"),
                "score", List.of("gender"), Map.of("age", 0.6, "region", 0.4));

        BaselineDocument first = service.get(MODEL);
        BaselineDocument second = service.get(MODEL);

        assertThat(first).isSameAs(created).isSameAs(second);
        assertThat(first.getCreatedAt()).isEqualTo(NOW);
        assertThat(first.getSampleCount()).isEqualTo(100);
        verify(repository, times(1)).findByModelId(MODEL);
        verify(auditEventService).recordEvent(eq(AuditEventService.SYSTEM_ACTOR), eq(MODEL),
                eq("BASELINE_REPLACED"), anyString(), any());
    }

    @Test
    void replacementKeepsOneRowAndSwapsCache() {
        BaselineService service = service();
        service.createOrReplace(MODEL, reference(100, 0), List.of("age"), "score", null, null);
        BaselineDocument replacement = service.createOrReplace(MODEL, reference(60, 20), List.of("age"),
                "score", null, null);

        assertThat(rows).hasSize(1);
        assertThat(rows.get(MODEL).getId()).isEqualTo(1L);
        assertThat(rows.get(MODEL).getSampleCount()).isEqualTo(60);
        assertThat(service.get(MODEL)).isSameAs(replacement);
    }

    @Test
    void freshServiceReloadsEquivalentStatistics() {
        BaselineDocument created = service().createOrReplace(MODEL, reference(100, 0), List.of("age", "region"),
                "score", List.of("gender"), Map.of("age", 0.6));

        BaselineDocument reloaded = service().get(MODEL);

        assertThat(reloaded).isNotSameAs(created);
        assertThat(reloaded.getFeatureHistograms()).isEqualTo(created.getFeatureHistograms());
        assertThat(reloaded.getScoreDistribution()).isEqualTo(created.getScoreDistribution());
        assertThat(reloaded.getFairnessStatistics()).isEqualTo(created.getFairnessStatistics());
        assertThat(reloaded.getDataQualityStatistics()).isEqualTo(created.getDataQualityStatistics());
        assertThat(reloaded.getFeatureImportance()).isEqualTo(created.getFeatureImportance());
        assertThat(reloaded.getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    void exportedDocumentImportsUnderAnotherModel() {
        BaselineService service = service();
        service.createOrReplace(MODEL, reference(100, 0), List.of("age", "region"), "score", null, null);
        BaselineDocument exported = service.export(MODEL);
        BaselineDocument copy = jsonCodec.read(jsonCodec.write(exported), BaselineDocument.class);
        copy.setModelId("credit-risk-v4");

        service.importDocument(copy);

        BaselineDocument imported = service().get("credit-risk-v4");
        assertThat(imported.getFeatureHistograms()).isEqualTo(exported.getFeatureHistograms());
        assertThat(imported.getCreatedAt()).isEqualTo(exported.getCreatedAt());
    }

    @Test
    void importRejectsInconsistentHistogram() {
        BaselineService service = service();
        BaselineDocument document = service.createOrReplace(MODEL, reference(100, 0), List.of("age"), "score",
                null, null);
        FeatureHistogram broken = FeatureHistogram.builder()
                .kind(FeatureHistogram.Kind.NUMERIC)
                .edges(List.of(0.0, 1.0))
                .counts(List.of(3L, 4L))
                .build();
        document.setFeatureHistograms(Map.of("age", broken));

        assertThatThrownBy(() -> service.importDocument(document)).isInstanceOf(BadRequestException.class);
    }

    @Test
    void fieldNamesOutsideMetricAlphabetAreRejected() {
        BaselineService service = service();

        assertThatThrownBy(() -> service.createOrReplace(MODEL, reference(100, 0), List.of("bad name"), "score",
                null, null)).isInstanceOf(BadRequestException.class).hasMessageContaining("feature");
        assertThatThrownBy(() -> service.createOrReplace(MODEL, reference(100, 0), List.of("age"), "score",
                List.of("gender:group"), null)).isInstanceOf(BadRequestException.class)
                .hasMessageContaining("protected attribute");
        assertThatThrownBy(() -> service.createOrReplace(MODEL, reference(100, 0), List.of("a".repeat(101)),
                "score", null, null)).isInstanceOf(BadRequestException.class);
        verify(repository, never()).save(any());
    }

    @Test
    void importRejectsHistogramKeyThatIsNotAFieldName() {
        BaselineService service = service();
        BaselineDocument document = service.createOrReplace(MODEL, reference(100, 0), List.of("age"), "score",
                null, null);
        Map<String, FeatureHistogram> histograms = new HashMap<>(document.getFeatureHistograms());
        histograms.put("age band", histograms.get("age"));
        document.setFeatureHistograms(histograms);

        assertThatThrownBy(() -> service.importDocument(document)).isInstanceOf(BadRequestException.class)
                .hasMessageContaining("age band");
    }

    @Test
    void missingBaselineIsReported() {
        BaselineService service = service();

        assertThatThrownBy(() -> service.get(MODEL)).isInstanceOf(BaselineNotFoundException.class);
        assertThat(service.createdAt(MODEL)).isEmpty();
    }

    @Test
    void emptyReferenceIsRejectedBeforeWriting() {
        assertThatThrownBy(() -> service().createOrReplace(MODEL, List.of(), List.of("age"), "score", null, null))
                .isInstanceOf(InsufficientDataException.class);
        verify(repository, never()).save(any());
    }

    private BaselineService service() {
        return new BaselineService(repository, statisticsBuilder, auditEventService, jsonCodec,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static List<Map<String, Object>> reference(int rowsCount, int missingAge) {
        String[] regions = {"north", "south", "east"};
        List<Map<String, Object>> samples = new ArrayList<>();
        for (int i = 0; i < rowsCount; i++) {
            Map<String, Object> row = new HashMap<>();
            row.put("age", i < missingAge ? null : 20 + (i % 50));
            row.put("region", regions[i % regions.length]);
            row.put("gender", i % 2 == 0 ? "F" : "M");
            row.put("score", (i % 10) / 10.0);
            samples.add(row);
        }
        return samples;
    }
}
