package com.ethixai.drift.dto;

public record CleanupResult(StepResult aggregation,
                            StepResult snapshotCleanup,
                            StepResult alertCleanup,
                            StepResult summaryArchive) {

    public record StepResult(boolean success, int affected, String error) {

        public static StepResult ok(int affected) {
            return new StepResult(true, affected, null);
        }

        public static StepResult failed(String error) {
            return new StepResult(false, 0, error);
        }
    }
}
