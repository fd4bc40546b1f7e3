package com.eyelevel.bordereaux.service.suggestion;

import com.eyelevel.bordereaux.service.suggestion.ai.AiMappingClient;
import com.eyelevel.bordereaux.service.suggestion.ai.AiMappingResponseSanitizer;
import com.eyelevel.bordereaux.service.suggestion.heuristic.HeuristicMappingSuggester;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Produces a mapping suggestion for a file no template matched: the AI collaborator first when it is enabled,
 * the heuristic otherwise or whenever the AI path fails. Never throws for an AI failure.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MappingSuggestionService {

    private final AiMappingClient aiMappingClient;
    private final AiMappingResponseSanitizer responseSanitizer;
    private final HeuristicMappingSuggester heuristicSuggester;

    public MappingSuggestion suggest(final SuggestionContext context) {
        if (aiMappingClient.isEnabled()) {
            try {
                final MappingSuggestion suggestion = responseSanitizer.sanitize(
                        aiMappingClient.suggestMapping(context), context.headers());
                log.info("AI suggested {} of {} field mappings (overall confidence {}).", suggestion.mappedCount(),
                         suggestion.fields().size(), String.format("%.2f", suggestion.overallConfidence()));
                return suggestion;
            } catch (RuntimeException e) {
                log.warn("AI mapping suggestion failed, falling back to heuristic: {}", e.getMessage());
                log.debug("AI failure detail", e);
            }
        }
        final MappingSuggestion suggestion = heuristicSuggester.suggest(context);
        log.info("Heuristic suggested {} of {} field mappings (overall confidence {}).", suggestion.mappedCount(),
                 suggestion.fields().size(), String.format("%.2f", suggestion.overallConfidence()));
        return suggestion;
    }
}
