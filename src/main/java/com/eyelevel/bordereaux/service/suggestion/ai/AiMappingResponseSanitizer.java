package com.eyelevel.bordereaux.service.suggestion.ai;

import com.eyelevel.bordereaux.exception.SuggestionGenerationException;
import com.eyelevel.bordereaux.model.ProposalSource;
import com.eyelevel.bordereaux.model.canonical.CanonicalField;
import com.eyelevel.bordereaux.service.matching.HeaderNormalizer;
import com.eyelevel.bordereaux.service.suggestion.FieldSuggestion;
import com.eyelevel.bordereaux.service.suggestion.MappingSuggestion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns an untrusted model reply into a {@link MappingSuggestion}. Pairs naming an unknown field, a header the
 * file does not have, or lacking a confidence in [0, 1] are dropped. When several headers claim the same field
 * the most confident one wins.
 */
@Slf4j
@Component
public class AiMappingResponseSanitizer {

    private static final Pattern LEADING_FENCE = Pattern.compile("^```[a-zA-Z]*\\s*");
    private static final Pattern TRAILING_FENCE = Pattern.compile("\\s*```$");

    /**
     * Removes Markdown code fences around a JSON reply.
     */
    public static String stripCodeFences(final String content) {
        if (content == null) {
            return "";
        }
        String stripped = content.trim();
        stripped = LEADING_FENCE.matcher(stripped).replaceFirst("");
        stripped = TRAILING_FENCE.matcher(stripped).replaceFirst("");
        return stripped.trim();
    }

    /**
     * @throws SuggestionGenerationException if nothing usable is left
     */
    public MappingSuggestion sanitize(final AiMappingReply reply, final List<String> fileHeaders) {
        if (reply == null || reply.getMappings() == null || reply.getMappings().isEmpty()) {
            throw new SuggestionGenerationException("AI reply contained no mappings");
        }
        final Map<String, String> headersByKey = new LinkedHashMap<>();
        fileHeaders.forEach(header -> headersByKey.putIfAbsent(HeaderNormalizer.normalize(header), header));
        final Map<String, Object> confidences = reply.getConfidenceScores() == null ? Map.of()
                                                                                    : reply.getConfidenceScores();

        final Map<CanonicalField, FieldSuggestion> accepted = new EnumMap<>(CanonicalField.class);
        int dropped = 0;
        for (Map.Entry<String, Object> entry : reply.getMappings().entrySet()) {
            final Optional<String> header = resolveHeader(entry.getKey(), fileHeaders, headersByKey);
            final Optional<CanonicalField> field = entry.getValue() instanceof String name
                                                   ? CanonicalField.fromName(name.trim().toLowerCase(Locale.ROOT))
                                                   : Optional.empty();
            final Optional<Double> confidence = confidence(confidences.get(entry.getKey()));
            if (header.isEmpty() || field.isEmpty() || confidence.isEmpty()) {
                dropped++;
                continue;
            }
            final FieldSuggestion current = accepted.get(field.get());
            if (current == null || confidence.get() > current.confidence()) {
                accepted.put(field.get(), new FieldSuggestion(field.get(), header.get(), confidence.get()));
            }
        }

        if (accepted.isEmpty()) {
            throw new SuggestionGenerationException(
                    "AI reply contained no usable mappings (" + dropped + " discarded)");
        }
        if (dropped > 0) {
            log.debug("Discarded {} AI mapping entries that failed validation.", dropped);
        }
        return MappingSuggestion.of(accepted, ProposalSource.AI, reasoning(reply.getReasoning()));
    }

    private static Optional<String> resolveHeader(final String proposed, final List<String> fileHeaders,
                                                  final Map<String, String> headersByKey) {
        if (proposed == null) {
            return Optional.empty();
        }
        if (fileHeaders.contains(proposed)) {
            return Optional.of(proposed);
        }
        return Optional.ofNullable(headersByKey.get(HeaderNormalizer.normalize(proposed)));
    }

    private static Optional<Double> confidence(final Object raw) {
        final Double value;
        if (raw instanceof Number number) {
            value = number.doubleValue();
        } else if (raw instanceof String text) {
            try {
                value = Double.valueOf(text.trim());
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        } else {
            return Optional.empty();
        }
        return value.isNaN() || value < 0.0 || value > 1.0 ? Optional.empty() : Optional.of(value);
    }

    private static String reasoning(final Object raw) {
        if (raw instanceof String text) {
            return text.isBlank() ? null : text.trim();
        }
        if (raw instanceof Map<?, ?> perHeader && !perHeader.isEmpty()) {
            return perHeader.entrySet().stream()
                    .map(entry -> entry.getKey() + ": " + entry.getValue())
                    .collect(Collectors.joining("\n"));
        }
        return null;
    }
}
