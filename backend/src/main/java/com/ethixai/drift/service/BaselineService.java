package com.ethixai.drift.service;

import com.ethixai.drift.dto.BaselineDocument;
import com.ethixai.drift.dto.FeatureHistogram;
import com.ethixai.drift.dto.FeatureQuality;
import com.ethixai.drift.dto.GroupOutcome;
import com.ethixai.drift.dto.ScoreDistribution;
import com.ethixai.drift.exception.BadRequestException;
import com.ethixai.drift.exception.BaselineNotFoundException;
import com.ethixai.drift.exception.InsufficientDataException;
import com.ethixai.drift.model.DriftBaseline;
import com.ethixai.drift.repository.DriftBaselineRepository;
import com.ethixai.drift.service.algorithm.BaselineStatisticsBuilder;
import com.ethixai.drift.util.FieldNames;
import com.ethixai.drift.util.JsonCodec;
import com.ethixai.drift.util.ModelIds;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Baseline store: one reference document per model, replaced atomically and served from an in-memory cache.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BaselineService {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, FeatureHistogram>> HISTOGRAMS = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Map<String, GroupOutcome>>> FAIRNESS = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, FeatureQuality>> QUALITY = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Double>> IMPORTANCE = new TypeReference<>() {
    };

    private final DriftBaselineRepository baselineRepository;
    private final BaselineStatisticsBuilder statisticsBuilder;
    private final AuditEventService auditEventService;
    private final JsonCodec jsonCodec;
    private final Clock clock;
    private final BaselineCache cache = new BaselineCache();

    @Transactional
    public BaselineDocument createOrReplace(String modelId,
                                            List<Map<String, Object>> referenceSamples,
                                            List<String> featureNames,
                                            String scoreField,
                                            List<String> protectedAttributes,
                                            Map<String, Double> featureImportance) {
        ModelIds.validate(modelId);
        FieldNames.validateAll("feature", featureNames);
        FieldNames.validateAll("protected attribute", protectedAttributes);
        FieldNames.validate("score field", scoreField);
        if (referenceSamples == null || referenceSamples.isEmpty()) {
            throw new InsufficientDataException("Reference samples are empty for model " + modelId, 0, 1);
        }
        BaselineDocument document = statisticsBuilder.build(modelId, referenceSamples, featureNames, scoreField,
                protectedAttributes, featureImportance);
        document.setCreatedAt(clock.instant());
        store(document, "BASELINE_REPLACED");
        log.info("Baseline stored model={} samples={} features={}", modelId, document.getSampleCount(),
                document.getFeatureNames().size());
        return document;
    }

    public BaselineDocument get(String modelId) {
        ModelIds.validate(modelId);
        return cache.get(modelId, this::load);
    }

    public BaselineDocument export(String modelId) {
        return get(modelId);
    }

    @Transactional
    public BaselineDocument importDocument(BaselineDocument document) {
        ModelIds.validate(document.getModelId());
        ScoreDistribution score = document.getScoreDistribution();
        if (document.getFeatureHistograms() == null || document.getFeatureHistograms().isEmpty()
                || score == null || score.getHistogram() == null) {
            throw new BadRequestException("Baseline document is missing histograms");
        }
        FieldNames.validate("score field", document.getScoreField());
        FieldNames.validateAll("feature", document.getFeatureHistograms().keySet());
        FieldNames.validateAll("feature", document.getFeatureNames());
        FieldNames.validateAll("protected attribute", document.getProtectedAttributes());
        if (document.getFairnessStatistics() != null) {
            FieldNames.validateAll("protected attribute", document.getFairnessStatistics().keySet());
        }
        document.getFeatureHistograms().forEach((feature, histogram) -> validateHistogram(feature, histogram));
        validateHistogram("score", score.getHistogram());
        if (document.getCreatedAt() == null) {
            document.setCreatedAt(clock.instant());
        }
        store(document, "BASELINE_IMPORTED");
        log.info("Baseline imported model={}", document.getModelId());
        return document;
    }

    public Optional<Instant> createdAt(String modelId) {
        try {
            return Optional.ofNullable(get(modelId).getCreatedAt());
        } catch (BaselineNotFoundException e) {
            return Optional.empty();
        }
    }

    public List<String> listModelIds() {
        return baselineRepository.findAllModelIds();
    }

    BaselineCache cache() {
        return cache;
    }

    private void store(BaselineDocument document, String action) {
        DriftBaseline entity = baselineRepository.findByModelId(document.getModelId())
                .orElseGet(() -> DriftBaseline.builder().modelId(document.getModelId()).build());
        boolean replacing = entity.getId() != null;
        entity.setScoreField(document.getScoreField());
        entity.setSampleCount(document.getSampleCount());
        entity.setFeatureNames(jsonCodec.write(orEmpty(document.getFeatureNames())));
        entity.setProtectedAttributes(jsonCodec.write(orEmpty(document.getProtectedAttributes())));
        entity.setFeatureHistograms(jsonCodec.write(document.getFeatureHistograms()));
        entity.setScoreDistribution(jsonCodec.write(document.getScoreDistribution()));
        entity.setFairnessStatistics(jsonCodec.write(document.getFairnessStatistics() == null
                ? Map.of() : document.getFairnessStatistics()));
        entity.setDataQualityStatistics(jsonCodec.write(document.getDataQualityStatistics() == null
                ? Map.of() : document.getDataQualityStatistics()));
        entity.setFeatureImportance(jsonCodec.write(document.getFeatureImportance()));
        entity.setCreatedAt(document.getCreatedAt());
        baselineRepository.save(entity);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("sampleCount", document.getSampleCount());
        metadata.put("replaced", replacing);
        auditEventService.recordEvent(AuditEventService.SYSTEM_ACTOR, document.getModelId(), action,
                "Baseline stored for model " + document.getModelId(), metadata);
        swapAfterCommit(document);
    }

    // readers keep the previous baseline until the new one is committed
    private void swapAfterCommit(BaselineDocument document) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    cache.swap(document);
                }
            });
        } else {
            cache.swap(document);
        }
    }

    private BaselineDocument load(String modelId) {
        DriftBaseline entity = baselineRepository.findByModelId(modelId)
                .orElseThrow(() -> new BaselineNotFoundException(modelId));
        return BaselineDocument.builder()
                .modelId(entity.getModelId())
                .scoreField(entity.getScoreField())
                .sampleCount(entity.getSampleCount())
                .featureNames(jsonCodec.read(entity.getFeatureNames(), STRING_LIST))
                .protectedAttributes(jsonCodec.read(entity.getProtectedAttributes(), STRING_LIST))
                .featureHistograms(jsonCodec.read(entity.getFeatureHistograms(), HISTOGRAMS))
                .scoreDistribution(jsonCodec.read(entity.getScoreDistribution(), ScoreDistribution.class))
                .fairnessStatistics(jsonCodec.read(entity.getFairnessStatistics(), FAIRNESS))
                .dataQualityStatistics(jsonCodec.read(entity.getDataQualityStatistics(), QUALITY))
                .featureImportance(jsonCodec.read(entity.getFeatureImportance(), IMPORTANCE))
                .createdAt(entity.getCreatedAt())
                .build();
    }

    private static void validateHistogram(String name, FeatureHistogram histogram) {
        if (histogram == null || histogram.getKind() == null || histogram.getCounts() == null) {
            throw new BadRequestException("Histogram for " + name + " is incomplete");
        }
        int bins = histogram.getCounts().size();
        boolean valid = histogram.getKind() == FeatureHistogram.Kind.NUMERIC
                ? histogram.getEdges() != null && bins > 0 && histogram.getEdges().size() == bins + 1
                : histogram.getCategories() != null && histogram.getCategories().size() + 1 == bins;
        if (!valid) {
            throw new BadRequestException("Histogram for " + name + " has inconsistent bins");
        }
    }

    private static List<String> orEmpty(List<String> values) {
        return values == null ? List.of() : values;
    }
}
