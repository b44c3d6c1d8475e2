package com.ethixai.drift.exception;

public class TransientStoreException extends RuntimeException {
    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
