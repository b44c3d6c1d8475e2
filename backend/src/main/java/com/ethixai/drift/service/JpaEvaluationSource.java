package com.ethixai.drift.service;

import com.ethixai.drift.dto.EvaluationSample;
import com.ethixai.drift.model.EvaluationRecord;
import com.ethixai.drift.repository.EvaluationRecordRepository;
import com.ethixai.drift.util.JsonCodec;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
@RequiredArgsConstructor
public class JpaEvaluationSource implements EvaluationSource {

    private static final TypeReference<Map<String, Object>> VALUES = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Double>> IMPORTANCE = new TypeReference<>() {
    };

    private final EvaluationRecordRepository evaluationRecordRepository;
    private final JsonCodec jsonCodec;

    @Override
    @Transactional(readOnly = true)
    public List<EvaluationSample> fetchWindow(String modelId, Instant from, Instant to, int limit) {
        List<EvaluationRecord> records = evaluationRecordRepository
                .findByModelIdAndEvaluatedAtGreaterThanEqualAndEvaluatedAtLessThanOrderByEvaluatedAtDesc(
                        modelId, from, to, PageRequest.of(0, limit));
        List<EvaluationSample> samples = new ArrayList<>(records.size());
        int unreadable = 0;
        for (EvaluationRecord record : records) {
            try {
                samples.add(EvaluationSample.builder()
                        .features(jsonCodec.read(record.getFeatures(), VALUES))
                        .score(record.getScore())
                        .protectedAttributes(jsonCodec.read(record.getProtectedAttributes(), VALUES))
                        .featureImportance(jsonCodec.read(record.getFeatureImportance(), IMPORTANCE))
                        .timestamp(record.getEvaluatedAt())
                        .build());
            } catch (IllegalStateException e) {
                unreadable++;
            }
        }
        if (unreadable > 0) {
            log.warn("Skipped {} unreadable evaluation records model={} window=[{}, {})", unreadable, modelId, from, to);
        }
        return samples;
    }
}
