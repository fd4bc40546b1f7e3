package com.eyelevel.bordereaux.service.validation.rule;

import com.eyelevel.bordereaux.model.Severity;

import java.math.BigDecimal;

/**
 * {@code min <= field <= max}, either bound optional. The field must be present unless {@code skipIfAbsent} is
 * set; a value that was in the file but could not be read as a number always fires.
 */
public record NumericRangeRule(String name, String field, BigDecimal min, BigDecimal max, Severity severity,
                               String messageTemplate, boolean skipIfAbsent) implements ValidationRule {

    public static final String DEFAULT_MESSAGE = "'{field}' must be within [{min}, {max}] (got {value})";
    public static final String INVALID_VALUE_MESSAGE = "Field '{field}' contains invalid numeric value";

    public boolean inRange(BigDecimal value) {
        return (min == null || value.compareTo(min) >= 0) && (max == null || value.compareTo(max) <= 0);
    }

    @Override
    public <R> R accept(RuleVisitor<R> visitor) {
        return visitor.visitNumericRange(this);
    }
}
