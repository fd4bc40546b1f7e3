package com.eyelevel.bordereaux.model;

import java.util.Locale;

/**
 * Severity of a validation rule. Only {@link #ERROR} violations make a row invalid.
 */
public enum Severity {
    ERROR,
    WARNING;

    public static Severity fromCode(final String value) {
        if (value == null || value.isBlank()) {
            return ERROR;
        }
        return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
