package com.eyelevel.bordereaux.exception;

import java.io.Serial;

/**
 * A template document or an approval request describes a template that cannot exist, for example one without
 * mappings or with header keys that collide once normalized.
 */
public class TemplateDefinitionException extends BordereauxProcessingException {
    @Serial
    private static final long serialVersionUID = 8810291637482093311L;

    public TemplateDefinitionException(String message) {
        super(message);
    }

    public TemplateDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
