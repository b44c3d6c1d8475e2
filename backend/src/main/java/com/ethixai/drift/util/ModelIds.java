package com.ethixai.drift.util;

import com.ethixai.drift.exception.BadRequestException;

import java.util.regex.Pattern;

public final class ModelIds {

    public static final String REGEX = "^[A-Za-z0-9._:-]{1,128}$";
    private static final Pattern PATTERN = Pattern.compile(REGEX);

    private ModelIds() {
    }

    public static boolean isValid(String modelId) {
        return modelId != null && PATTERN.matcher(modelId).matches();
    }

    public static String validate(String modelId) {
        if (!isValid(modelId)) {
            throw new BadRequestException("Invalid model id: " + modelId);
        }
        return modelId;
    }
}
