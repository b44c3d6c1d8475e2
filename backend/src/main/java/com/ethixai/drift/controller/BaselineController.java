package com.ethixai.drift.controller;

import com.ethixai.drift.dto.BaselineDocument;
import com.ethixai.drift.dto.CreateBaselineRequest;
import com.ethixai.drift.service.BaselineService;
import com.ethixai.drift.util.ModelIds;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/drift/baselines")
@RequiredArgsConstructor
@Tag(name = "Baselines")
public class BaselineController {

    private final BaselineService baselineService;

    @PostMapping("/{modelId}")
    @Operation(summary = "Create or replace the baseline of a model from reference samples")
    public ResponseEntity<BaselineDocument> createOrReplace(
            @PathVariable @Pattern(regexp = ModelIds.REGEX) String modelId,
            @Valid @RequestBody CreateBaselineRequest request) {
        return ResponseEntity.ok(baselineService.createOrReplace(modelId,
                request.getReferenceSamples(),
                request.getFeatureNames(),
                request.getScoreField(),
                request.getProtectedAttributes(),
                request.getFeatureImportance()));
    }

    @GetMapping("/{modelId}")
    @Operation(summary = "Export the baseline document of a model")
    public ResponseEntity<BaselineDocument> export(@PathVariable @Pattern(regexp = ModelIds.REGEX) String modelId) {
        return ResponseEntity.ok(baselineService.export(modelId));
    }

    @PutMapping
    @Operation(summary = "Import a previously exported baseline document")
    public ResponseEntity<BaselineDocument> importDocument(@Valid @RequestBody BaselineDocument document) {
        return ResponseEntity.ok(baselineService.importDocument(document));
    }
}
