package com.eyelevel.bordereaux.service.suggestion.ai;

import com.eyelevel.bordereaux.model.canonical.CanonicalField;
import com.eyelevel.bordereaux.service.suggestion.SuggestionContext;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Renders the chat prompt asking the model for a header mapping.
 */
@Component
public class MappingPromptBuilder {

    static final String SYSTEM_PROMPT = "You are a helpful assistant that maps insurance bordereaux file columns "
            + "to standardized field names. Always respond with valid JSON only.";

    private static final String RESPONSE_SHAPE = """
            Return a JSON object with this exact structure:
            {
              "mappings": {"column_name_from_file": "canonical_field_name"},
              "confidence_scores": {"column_name_from_file": 0.95},
              "reasoning": {"column_name_from_file": "Brief explanation of the mapping"}
            }

            Rules:
            - Only map columns that have a clear match to a canonical field
            - Use each canonical field at most once
            - Confidence scores must be between 0.0 and 1.0
            - Omit columns that do not match any canonical field
            - Only use high scores (0.8+) for very clear matches

            Return ONLY the JSON object, no additional text.""";

    public String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    public String userPrompt(final SuggestionContext context, final int sampleRows) {
        final StringBuilder prompt = new StringBuilder(
                "You are an expert at mapping insurance bordereaux file columns to standardized field names.\n\n");

        appendIfPresent(prompt, "Filename", context.filename());
        appendIfPresent(prompt, "Sender", context.sender());
        appendIfPresent(prompt, "Subject", context.subject());

        prompt.append("\nThe file has the following columns:\n");
        context.headers().forEach(header -> prompt.append("- ").append(header).append('\n'));

        final int rows = Math.min(sampleRows, context.sampleRows().size());
        if (rows > 0) {
            prompt.append("\nSample rows:\n");
            for (int i = 0; i < rows; i++) {
                prompt.append("- ").append(renderRow(context.sampleRows().get(i))).append('\n');
            }
        }

        prompt.append("\nAvailable canonical fields:\n");
        for (CanonicalField field : CanonicalField.values()) {
            prompt.append("- ").append(field.getFieldName()).append(": ").append(field.getDescription()).append('\n');
        }
        prompt.append('\n').append(RESPONSE_SHAPE);
        return prompt.toString();
    }

    private static void appendIfPresent(final StringBuilder prompt, final String label, final String value) {
        if (value != null && !value.isBlank()) {
            prompt.append(label).append(": ").append(value.trim()).append('\n');
        }
    }

    private static String renderRow(final Map<String, String> row) {
        final StringBuilder rendered = new StringBuilder();
        row.forEach((header, value) -> {
            if (!rendered.isEmpty()) {
                rendered.append(" | ");
            }
            rendered.append(header).append('=').append(value);
        });
        return rendered.toString();
    }
}
