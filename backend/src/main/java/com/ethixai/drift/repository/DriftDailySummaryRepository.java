package com.ethixai.drift.repository;

import com.ethixai.drift.model.DriftDailySummary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface DriftDailySummaryRepository extends JpaRepository<DriftDailySummary, Long> {

    Optional<DriftDailySummary> findByModelIdAndSummaryDate(String modelId, LocalDate summaryDate);

    List<DriftDailySummary> findByModelIdOrderBySummaryDateDesc(String modelId);

    @Modifying
    @Query("delete from DriftDailySummary s where s.summaryDate < :cutoff")
    int deleteBySummaryDateBefore(@Param("cutoff") LocalDate cutoff);
}
