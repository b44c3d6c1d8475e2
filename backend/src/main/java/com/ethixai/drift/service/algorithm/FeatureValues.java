package com.ethixai.drift.service.algorithm;

/**
 * Interpretation of raw feature values as they arrive in JSON rows.
 */
public final class FeatureValues {

    private FeatureValues() {
    }

    public static boolean isPresent(Object value) {
        if (value == null) {
            return false;
        }
        return !(value instanceof String text) || !text.isBlank();
    }

    /**
     * Numeric reading of a value, or null for missing, non-numeric and non-finite values.
     */
    public static Double toDouble(Object value) {
        if (value instanceof Boolean) {
            return null;
        }
        if (value instanceof Number number) {
            double parsed = number.doubleValue();
            return Double.isFinite(parsed) ? parsed : null;
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                double parsed = Double.parseDouble(text.trim());
                return Double.isFinite(parsed) ? parsed : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public static String toCategory(Object value) {
        return isPresent(value) ? String.valueOf(value).trim() : null;
    }

    /**
     * Whether a value counts as missing for a feature of the given kind. Numeric features treat
     * unparseable values as missing.
     */
    public static boolean isMissing(Object value, boolean categorical) {
        return categorical ? toCategory(value) == null : toDouble(value) == null;
    }
}
