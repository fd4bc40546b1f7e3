package com.eyelevel.bordereaux.service.validation;

import com.eyelevel.bordereaux.model.Severity;

/**
 * One failed rule on one row. {@code field} is {@code null} for rules that do not target a single field.
 */
public record RuleViolation(int rowIndex, String field, String ruleName, ErrorCode errorCode, Severity severity,
                            String message, String value) {

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
