package com.ethixai.drift.util;

/**
 * Alert metric names, bounded to the {@code metric_name} column. Over-long names keep a readable prefix and
 * end in a digest of the full name, so distinct conditions keep distinct names.
 */
public final class MetricNames {

    public static final int MAX_LENGTH = 255;
    private static final int DIGEST_CHARS = 16;

    private MetricNames() {
    }

    public static String bounded(String name) {
        if (name.length() <= MAX_LENGTH) {
            return name;
        }
        String digest = Digests.sha256Hex(name).substring(0, DIGEST_CHARS);
        return name.substring(0, MAX_LENGTH - DIGEST_CHARS - 1) + "#" + digest;
    }

    public static String fairness(String attribute, String group) {
        return bounded("fairness_" + attribute + ":" + group);
    }
}
