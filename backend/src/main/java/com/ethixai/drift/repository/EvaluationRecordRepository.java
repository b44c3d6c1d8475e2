package com.ethixai.drift.repository;

import com.ethixai.drift.model.EvaluationRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;

public interface EvaluationRecordRepository extends JpaRepository<EvaluationRecord, Long> {

    // newest first so the sample cap keeps the most recent rows of the window
    List<EvaluationRecord> findByModelIdAndEvaluatedAtGreaterThanEqualAndEvaluatedAtLessThanOrderByEvaluatedAtDesc(
            String modelId, Instant from, Instant to, Pageable pageable);
}
