package com.ethixai.drift.util;

import com.ethixai.drift.exception.BadRequestException;

import java.util.Collection;
import java.util.regex.Pattern;

/**
 * Names of features, protected attributes and the score column. They end up in metric names and alert
 * fingerprints, so they are short and never contain {@code ':'}, which separates attribute from group.
 */
public final class FieldNames {

    public static final String REGEX = "^[A-Za-z0-9_.-]{1,100}$";
    private static final Pattern PATTERN = Pattern.compile(REGEX);

    private FieldNames() {
    }

    public static boolean isValid(String name) {
        return name != null && PATTERN.matcher(name).matches();
    }

    public static String validate(String kind, String name) {
        if (!isValid(name)) {
            throw new BadRequestException("Invalid " + kind + " name: " + Texts.clip(name, 120)
                    + " (expected " + REGEX + ")");
        }
        return name;
    }

    public static void validateAll(String kind, Collection<String> names) {
        if (names != null) {
            names.forEach(name -> validate(kind, name));
        }
    }
}
