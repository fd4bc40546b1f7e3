package com.eyelevel.bordereaux.service.matching;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical form of a column header, shared by matching, mapping and suggestion:
 * {@code " Policy No. "} becomes {@code "policy_no"}.
 */
public final class HeaderNormalizer {

    private static final Pattern NON_IDENTIFIER = Pattern.compile("[^a-z0-9_]");
    private static final Pattern REPEATED_UNDERSCORE = Pattern.compile("_+");

    private HeaderNormalizer() {
    }

    public static String normalize(final String header) {
        if (header == null) {
            return "";
        }
        String normalized = header.trim().toLowerCase(Locale.ROOT);
        normalized = NON_IDENTIFIER.matcher(normalized).replaceAll("_");
        normalized = REPEATED_UNDERSCORE.matcher(normalized).replaceAll("_");
        int start = 0;
        int end = normalized.length();
        while (start < end && normalized.charAt(start) == '_') {
            start++;
        }
        while (end > start && normalized.charAt(end - 1) == '_') {
            end--;
        }
        return normalized.substring(start, end);
    }
}
