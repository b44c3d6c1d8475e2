package com.ethixai.drift.dto;

import com.ethixai.drift.model.AlertType;
import com.ethixai.drift.model.Severity;

import java.util.Map;

/**
 * One named measurement taken in a window, in the shape the alert manager consumes.
 */
public record DriftSignal(AlertType type,
                          String metricName,
                          double value,
                          double threshold,
                          Severity severity,
                          Map<String, Object> details) {
}
