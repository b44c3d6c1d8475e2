package com.ethixai.drift.exception;

public class InsufficientDataException extends RuntimeException {

    private final int sampleCount;
    private final int required;

    public InsufficientDataException(String message, int sampleCount, int required) {
        super(message);
        this.sampleCount = sampleCount;
        this.required = required;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    public int getRequired() {
        return required;
    }
}
