package com.eyelevel.bordereaux.service.validation.rule;

import com.eyelevel.bordereaux.model.Severity;

/**
 * The field must be present and not blank.
 */
public record RequiredFieldRule(String name, String field, Severity severity, String messageTemplate)
        implements ValidationRule {

    public static final String DEFAULT_MESSAGE = "Required field '{field}' is missing or null";

    public static RequiredFieldRule of(String field) {
        return new RequiredFieldRule("required_" + field, field, Severity.ERROR, null);
    }

    @Override
    public <R> R accept(RuleVisitor<R> visitor) {
        return visitor.visitRequiredField(this);
    }
}
