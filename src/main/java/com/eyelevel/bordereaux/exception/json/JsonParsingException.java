package com.eyelevel.bordereaux.exception.json;

import java.io.Serial;

/**
 * Thrown when a JSON document (rule set, template document, model reply, JSON column) cannot be read or written.
 */
public class JsonParsingException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -4315221486898941505L;

    public JsonParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
