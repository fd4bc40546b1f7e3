package com.eyelevel.bordereaux.service.suggestion.ai;

import com.eyelevel.bordereaux.exception.SuggestionGenerationException;
import com.eyelevel.bordereaux.service.suggestion.SuggestionContext;

/**
 * Stand-in used when AI suggestions are switched off or no API key is configured.
 */
public class DisabledAiMappingClient implements AiMappingClient {

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public AiMappingReply suggestMapping(SuggestionContext context) {
        throw new SuggestionGenerationException("AI mapping suggestions are disabled");
    }
}
