package com.ethixai.drift.exception;

public class BaselineNotFoundException extends NotFoundException {

    private final String modelId;

    public BaselineNotFoundException(String modelId) {
        super("No baseline for model " + modelId);
        this.modelId = modelId;
    }

    public String getModelId() {
        return modelId;
    }
}
