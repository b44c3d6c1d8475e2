package com.ethixai.drift.controller;

import com.ethixai.drift.dto.AlertListResponse;
import com.ethixai.drift.dto.DriftStatusResponse;
import com.ethixai.drift.dto.ResolveAlertRequest;
import com.ethixai.drift.dto.ResolveAlertResponse;
import com.ethixai.drift.dto.SnapshotListResponse;
import com.ethixai.drift.model.Severity;
import com.ethixai.drift.service.DriftQueryService;
import com.ethixai.drift.util.ModelIds;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/drift")
@RequiredArgsConstructor
@Tag(name = "Drift")
public class DriftController {

    private final DriftQueryService driftQueryService;

    @GetMapping("/snapshots/{modelId}")
    @Operation(summary = "List recent drift snapshots, newest window first")
    public ResponseEntity<SnapshotListResponse> snapshots(
            @PathVariable @Pattern(regexp = ModelIds.REGEX) String modelId,
            @RequestParam(defaultValue = "7") @Min(1) @Max(365) int days,
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit) {
        return ResponseEntity.ok(driftQueryService.listSnapshots(modelId, days, limit));
    }

    @GetMapping("/alerts/{modelId}")
    @Operation(summary = "List drift alerts, newest first")
    public ResponseEntity<AlertListResponse> alerts(
            @PathVariable @Pattern(regexp = ModelIds.REGEX) String modelId,
            @RequestParam(required = false) Severity severity,
            @RequestParam(defaultValue = "false") boolean resolved,
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit) {
        return ResponseEntity.ok(driftQueryService.listAlerts(modelId, severity, resolved, limit));
    }

    @PostMapping("/alerts/{alertId}/resolve")
    @Operation(summary = "Resolve an alert; resolving twice is a no-op")
    public ResponseEntity<ResolveAlertResponse> resolve(
            @PathVariable Long alertId,
            @RequestHeader(value = "X-Actor", required = false) String actor,
            @Valid @RequestBody(required = false) ResolveAlertRequest request) {
        String note = request == null ? null : request.getResolutionNote();
        return ResponseEntity.ok(driftQueryService.resolve(alertId, note, actor));
    }

    @GetMapping("/status/{modelId}")
    @Operation(summary = "Current drift status of a model")
    public ResponseEntity<DriftStatusResponse> status(@PathVariable @Pattern(regexp = ModelIds.REGEX) String modelId) {
        return ResponseEntity.ok(driftQueryService.status(modelId));
    }
}
