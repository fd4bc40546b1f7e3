package com.eyelevel.bordereaux.exception;

import java.io.Serial;

/**
 * The configured rule-set document is unreadable or references something the canonical schema does not know.
 */
public class RuleSetDefinitionException extends BordereauxProcessingException {
    @Serial
    private static final long serialVersionUID = -6230719285134729801L;

    public RuleSetDefinitionException(String message) {
        super(message);
    }

    public RuleSetDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
