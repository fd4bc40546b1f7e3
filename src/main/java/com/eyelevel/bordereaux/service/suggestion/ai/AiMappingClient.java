package com.eyelevel.bordereaux.service.suggestion.ai;

import com.eyelevel.bordereaux.service.suggestion.SuggestionContext;

/**
 * The external language-model collaborator that proposes a header to field mapping.
 */
public interface AiMappingClient {

    /**
     * {@code false} when no model is configured; callers then skip straight to the heuristic.
     */
    boolean isEnabled();

    /**
     * One timeout-bounded call to the model.
     *
     * @throws com.eyelevel.bordereaux.exception.SuggestionGenerationException on any failure, including transport
     *                                                                         errors and unparsable replies
     */
    AiMappingReply suggestMapping(SuggestionContext context);
}
