package com.ethixai.drift.repository;

import com.ethixai.drift.model.DriftAlert;
import com.ethixai.drift.model.Severity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface DriftAlertRepository extends JpaRepository<DriftAlert, Long> {

    Optional<DriftAlert> findByActiveFingerprint(String activeFingerprint);

    List<DriftAlert> findByFingerprintOrderByCreatedAtDesc(String fingerprint);

    @Query("select a from DriftAlert a where a.modelId = :modelId and a.resolved = :resolved "
            + "and (:severity is null or a.severity = :severity) order by a.createdAt desc, a.id desc")
    List<DriftAlert> search(@Param("modelId") String modelId,
                            @Param("severity") Severity severity,
                            @Param("resolved") boolean resolved,
                            Pageable pageable);

    List<DriftAlert> findByModelIdAndResolvedFalseOrderByCreatedAtDesc(String modelId, Pageable pageable);

    long countByModelIdAndResolvedFalseAndSeverity(String modelId, Severity severity);

    @Query("select count(distinct a.fingerprint) from DriftAlert a where a.modelId = :modelId "
            + "and a.resolved = false and a.severity = :severity and a.windowEnd >= :since")
    long countDistinctUnresolved(@Param("modelId") String modelId,
                                 @Param("severity") Severity severity,
                                 @Param("since") Instant since);

    @Query("select a from DriftAlert a where a.modelId = :modelId and a.resolved = false "
            + "and a.severity = :severity and a.windowEnd >= :since order by a.windowEnd desc")
    List<DriftAlert> findUnresolvedSince(@Param("modelId") String modelId,
                                         @Param("severity") Severity severity,
                                         @Param("since") Instant since);

    @Modifying
    @Query("delete from DriftAlert a where a.createdAt < :cutoff")
    int deleteByCreatedAtBefore(@Param("cutoff") Instant cutoff);
}
