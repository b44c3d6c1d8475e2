package com.ethixai.drift.exception;

public class CycleTimeoutException extends RuntimeException {
    public CycleTimeoutException(String message) {
        super(message);
    }
}
