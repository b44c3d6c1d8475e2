package com.ethixai.drift.model;

public enum AlertType {
    POPULATION_DRIFT,
    CONCEPT_DRIFT,
    FAIRNESS_DRIFT,
    DATA_QUALITY_DRIFT
}
