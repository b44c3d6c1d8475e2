package com.ethixai.drift.repository;

import com.ethixai.drift.model.DriftBaseline;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.Optional;

public interface DriftBaselineRepository extends JpaRepository<DriftBaseline, Long> {
    Optional<DriftBaseline> findByModelId(String modelId);

    @Query("select b.modelId from DriftBaseline b order by b.modelId")
    List<String> findAllModelIds();
}
