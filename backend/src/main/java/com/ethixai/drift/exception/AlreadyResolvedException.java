package com.ethixai.drift.exception;

/**
 * Raised when resolving an alert that is already resolved. Callers that only need the alert to end up
 * resolved should treat this as success.
 */
public class AlreadyResolvedException extends ConflictException {

    private final Long alertId;

    public AlreadyResolvedException(Long alertId) {
        super("Alert " + alertId + " is already resolved");
        this.alertId = alertId;
    }

    public Long getAlertId() {
        return alertId;
    }
}
