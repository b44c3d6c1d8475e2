package com.ethixai.drift.model;

/**
 * Severity of a single drift signal, and of a snapshot as a whole.
 * Declaration order is significant: later constants are more severe.
 */
public enum Severity {
    STABLE(0),
    WARNING(1),
    CRITICAL(2);

    private final int code;

    Severity(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public boolean isAlerting() {
        return this != STABLE;
    }

    public static Severity worst(Severity left, Severity right) {
        if (left == null) {
            return right;
        }
        if (right == null) {
            return left;
        }
        return left.compareTo(right) >= 0 ? left : right;
    }
}
