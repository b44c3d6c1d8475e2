package com.ethixai.drift.util;

public final class Texts {

    private static final String ELLIPSIS = "...";

    private Texts() {
    }

    /**
     * Shortens {@code value} to at most {@code maxLength} characters, marking the cut with an ellipsis.
     */
    public static String clip(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        if (maxLength <= ELLIPSIS.length()) {
            return value.substring(0, maxLength);
        }
        return value.substring(0, maxLength - ELLIPSIS.length()) + ELLIPSIS;
    }
}
