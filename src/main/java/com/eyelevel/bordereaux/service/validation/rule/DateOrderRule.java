package com.eyelevel.bordereaux.service.validation.rule;

import com.eyelevel.bordereaux.model.Severity;

/**
 * {@code inceptionField <= expiryField}. Both dates must be present unless {@code skipIfAbsent} is set.
 */
public record DateOrderRule(String name, String inceptionField, String expiryField, Severity severity,
                            String messageTemplate, boolean skipIfAbsent) implements ValidationRule {

    public static final String DEFAULT_MESSAGE =
            "'{inception_field}' must be on or before '{expiry_field}' (got {value})";

    @Override
    public <R> R accept(RuleVisitor<R> visitor) {
        return visitor.visitDateOrder(this);
    }
}
