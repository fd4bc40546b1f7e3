package com.eyelevel.bordereaux.service.suggestion;

import com.eyelevel.bordereaux.model.ProposalSource;
import com.eyelevel.bordereaux.model.canonical.CanonicalField;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A complete candidate mapping: one entry per canonical field in schema order, with the overall confidence
 * being the mean over all fields (unmapped fields count as 0).
 */
public record MappingSuggestion(List<FieldSuggestion> fields, double overallConfidence, ProposalSource source,
                                String reasoning) {

    public MappingSuggestion {
        fields = List.copyOf(fields);
    }

    /**
     * Builds a suggestion from the mapped fields only; every other canonical field is added as unmapped.
     */
    public static MappingSuggestion of(final Map<CanonicalField, FieldSuggestion> mapped, final ProposalSource source,
                                       final String reasoning) {
        final List<FieldSuggestion> fields = new ArrayList<>();
        for (CanonicalField field : CanonicalField.values()) {
            fields.add(mapped.getOrDefault(field, FieldSuggestion.unmapped(field)));
        }
        final double overall = fields.stream().mapToDouble(FieldSuggestion::confidence).sum()
                / CanonicalField.values().length;
        return new MappingSuggestion(fields, overall, source, reasoning);
    }

    public long mappedCount() {
        return fields.stream().filter(FieldSuggestion::isMapped).count();
    }
}
