package com.ethixai.drift.repository;

import com.ethixai.drift.model.RetrainRequest;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface RetrainRequestRepository extends JpaRepository<RetrainRequest, Long> {

    Optional<RetrainRequest> findByPendingModelId(String pendingModelId);

    List<RetrainRequest> findByModelIdOrderByRequestedAtDesc(String modelId);

    List<RetrainRequest> findByModelIdAndStatus(String modelId, RetrainRequest.Status status);
}
