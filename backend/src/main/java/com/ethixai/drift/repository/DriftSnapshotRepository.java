package com.ethixai.drift.repository;

import com.ethixai.drift.model.DriftSnapshot;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface DriftSnapshotRepository extends JpaRepository<DriftSnapshot, Long> {

    List<DriftSnapshot> findByModelIdAndWindowEndGreaterThanEqualOrderByWindowEndDesc(String modelId,
                                                                                     Instant since,
                                                                                     Pageable pageable);

    Optional<DriftSnapshot> findTopByModelIdOrderByWindowEndDescIdDesc(String modelId);

    // oldest first so the last element carries the closing status of the day
    List<DriftSnapshot> findByWindowEndGreaterThanEqualAndWindowEndLessThanOrderByModelIdAscWindowEndAscIdAsc(
            Instant from, Instant to);

    long countByModelId(String modelId);

    @Query("select distinct s.modelId from DriftSnapshot s order by s.modelId")
    List<String> findDistinctModelIds();

    @Modifying
    @Query("delete from DriftSnapshot s where s.windowEnd < :cutoff")
    int deleteByWindowEndBefore(@Param("cutoff") Instant cutoff);
}
