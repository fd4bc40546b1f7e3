package com.eyelevel.bordereaux.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Kind of bordereau a partner sent. Used as a hint to narrow the template catalog.
 */
public enum FileType {
    CLAIMS("claims", "claim"),
    PREMIUM("premium", "premium"),
    EXPOSURE("exposure", "exposure"),
    UNKNOWN("unknown", null);

    private final String code;
    private final String keyword;

    FileType(String code, String keyword) {
        this.code = code;
        this.keyword = keyword;
    }

    public String getCode() {
        return code;
    }

    /**
     * Parses a user or document supplied value such as {@code "claims"} or {@code "PREMIUM"}. Blank or
     * unrecognised values yield {@link #UNKNOWN}.
     */
    public static FileType fromCode(final String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        final String candidate = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.code.equals(candidate) || type.name().equalsIgnoreCase(candidate))
                .findFirst()
                .orElse(UNKNOWN);
    }

    /**
     * Infers the type from the email subject first, then from the filename, by keyword.
     */
    public static FileType infer(final String subject, final String filename) {
        return keywordMatch(subject).or(() -> keywordMatch(filename)).orElse(UNKNOWN);
    }

    /**
     * The hint handed to template matching: absent when the type is unknown.
     */
    public Optional<FileType> asHint() {
        return this == UNKNOWN ? Optional.empty() : Optional.of(this);
    }

    private static Optional<FileType> keywordMatch(final String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        final String lower = text.toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.keyword != null && lower.contains(type.keyword))
                .findFirst();
    }
}
