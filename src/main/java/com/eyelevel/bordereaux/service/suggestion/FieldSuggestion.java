package com.eyelevel.bordereaux.service.suggestion;

import com.eyelevel.bordereaux.model.canonical.CanonicalField;

/**
 * Candidate source column for one canonical field. {@code rawHeader} is {@code null} and confidence 0 when no
 * column was found.
 */
public record FieldSuggestion(CanonicalField field, String rawHeader, double confidence) {

    public static FieldSuggestion unmapped(CanonicalField field) {
        return new FieldSuggestion(field, null, 0.0);
    }

    public boolean isMapped() {
        return rawHeader != null;
    }
}
