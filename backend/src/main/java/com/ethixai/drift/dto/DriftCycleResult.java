package com.ethixai.drift.dto;

import com.ethixai.drift.model.Severity;
import com.ethixai.drift.model.WindowMode;

import java.time.Instant;

public record DriftCycleResult(String modelId,
                               WindowMode mode,
                               Outcome outcome,
                               Instant windowStart,
                               Instant windowEnd,
                               int sampleCount,
                               Long snapshotId,
                               Severity overallStatus,
                               int alertCount,
                               boolean needsRetraining,
                               String message) {

    public enum Outcome {
        COMPLETED,
        SKIPPED,
        FAILED,
        TIMED_OUT
    }

    public static DriftCycleResult skipped(String modelId, WindowMode mode, Instant windowStart, Instant windowEnd,
                                           int sampleCount, String message) {
        return new DriftCycleResult(modelId, mode, Outcome.SKIPPED, windowStart, windowEnd, sampleCount,
                null, null, 0, false, message);
    }

    public static DriftCycleResult failed(String modelId, WindowMode mode, Instant windowStart, Instant windowEnd,
                                          Outcome outcome, String message) {
        return new DriftCycleResult(modelId, mode, outcome, windowStart, windowEnd, 0,
                null, null, 0, false, message);
    }
}
