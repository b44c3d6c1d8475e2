package com.ethixai.drift.controller;

import com.ethixai.drift.dto.CleanupResult;
import com.ethixai.drift.dto.DriftCycleResult;
import com.ethixai.drift.model.WindowMode;
import com.ethixai.drift.service.DriftWorker;
import com.ethixai.drift.service.RetentionService;
import com.ethixai.drift.util.ModelIds;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Entry points for an external cron: one drift cycle per call, and the daily retention job.
 */
@Slf4j
@RestController
@RequestMapping("/v1/drift")
@RequiredArgsConstructor
@Tag(name = "Drift Ops")
public class DriftOpsController {

    private final DriftWorker driftWorker;
    private final RetentionService retentionService;

    @PostMapping("/cycles/{modelId}")
    @Operation(summary = "Run one drift cycle for a model")
    public ResponseEntity<DriftCycleResult> runCycle(
            @PathVariable @Pattern(regexp = ModelIds.REGEX) String modelId,
            @RequestParam(defaultValue = "STREAMING") WindowMode mode) {
        return ResponseEntity.ok(driftWorker.runCycle(modelId, mode));
    }

    @PostMapping("/maintenance/cleanup")
    @Operation(summary = "Aggregate daily summaries and enforce retention")
    public ResponseEntity<CleanupResult> cleanup() {
        log.info("Retention job triggered through API");
        return ResponseEntity.ok(retentionService.runCleanup());
    }
}
