package com.ethixai.drift.service;

import com.ethixai.drift.model.AlertType;
import com.ethixai.drift.util.Digests;

/**
 * Identity of a recurring alert condition: SHA-256 over model id, alert type and metric name.
 */
public final class AlertFingerprint {

    private AlertFingerprint() {
    }

    public static String of(String modelId, AlertType type, String metricName) {
        return Digests.sha256Hex(modelId + "|" + type.name() + "|" + metricName);
    }
}
