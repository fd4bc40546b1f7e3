package com.eyelevel.bordereaux.exception;

import java.io.Serial;

/**
 * The AI-assisted mapping suggestion could not be produced. Never escapes the suggestion service; it only
 * triggers the heuristic fallback.
 */
public class SuggestionGenerationException extends BordereauxProcessingException {
    @Serial
    private static final long serialVersionUID = 1570248319916206437L;

    public SuggestionGenerationException(String message) {
        super(message);
    }

    public SuggestionGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
