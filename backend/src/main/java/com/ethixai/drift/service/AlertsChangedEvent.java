package com.ethixai.drift.service;

/**
 * Open alerts changed outside a drift cycle. A null model id means any model may be affected.
 */
public record AlertsChangedEvent(String modelId) {

    public static AlertsChangedEvent allModels() {
        return new AlertsChangedEvent(null);
    }
}
