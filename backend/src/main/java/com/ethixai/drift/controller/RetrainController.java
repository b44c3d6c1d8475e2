package com.ethixai.drift.controller;

import com.ethixai.drift.dto.RetrainRequestResponse;
import com.ethixai.drift.dto.RetrainStatusUpdateRequest;
import com.ethixai.drift.dto.RetrainSubmissionResponse;
import com.ethixai.drift.dto.RetrainTriggerRequest;
import com.ethixai.drift.service.RetrainRequestService;
import com.ethixai.drift.util.ModelIds;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/v1/drift")
@RequiredArgsConstructor
@Tag(name = "Retraining")
public class RetrainController {

    private final RetrainRequestService retrainRequestService;

    @PostMapping("/models/{modelId}/trigger-retrain")
    @Operation(summary = "Submit a manual retrain request; returns the pending one if it exists")
    public ResponseEntity<RetrainSubmissionResponse> trigger(
            @PathVariable @Pattern(regexp = ModelIds.REGEX) String modelId,
            @Valid @RequestBody RetrainTriggerRequest request) {
        RetrainRequestService.RetrainSubmission submission =
                retrainRequestService.submitManual(modelId, request.getReason(), request.getRequestedBy());
        RetrainSubmissionResponse body = RetrainSubmissionResponse.builder()
                .success(true)
                .created(submission.created())
                .message(submission.created() ? "Retrain request submitted" : "A retrain request is already pending")
                .request(RetrainRequestResponse.from(submission.request()))
                .build();
        return ResponseEntity.status(submission.created() ? HttpStatus.CREATED : HttpStatus.OK).body(body);
    }

    @GetMapping("/models/{modelId}/retrain-requests")
    @Operation(summary = "List retrain requests of a model, newest first")
    public ResponseEntity<List<RetrainRequestResponse>> list(@PathVariable @Pattern(regexp = ModelIds.REGEX) String modelId) {
        return ResponseEntity.ok(retrainRequestService.list(modelId).stream()
                .map(RetrainRequestResponse::from)
                .toList());
    }

    @PostMapping("/retrain-requests/{requestId}/status")
    @Operation(summary = "Move a retrain request through its lifecycle")
    public ResponseEntity<RetrainRequestResponse> updateStatus(
            @PathVariable Long requestId,
            @RequestHeader(value = "X-Actor", required = false) String actor,
            @Valid @RequestBody RetrainStatusUpdateRequest request) {
        log.info("Retrain status change requested id={} target={}", requestId, request.getStatus());
        return ResponseEntity.ok(RetrainRequestResponse.from(
                retrainRequestService.updateStatus(requestId, request.getStatus(), request.getNote(), actor)));
    }
}
