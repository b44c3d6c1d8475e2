package com.ethixai.drift.repository;

import com.ethixai.drift.model.AuditEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AuditEventRepository extends JpaRepository<AuditEvent, Long> {
    List<AuditEvent> findByModelIdOrderByCreatedAtDesc(String modelId);
}
