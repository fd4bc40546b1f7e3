package com.eyelevel.bordereaux.service.validation.rule;

import com.eyelevel.bordereaux.model.Severity;

/**
 * A single configured check. The set of rule kinds is closed; evaluation dispatches through
 * {@link RuleVisitor} so that a new kind cannot be added without every evaluator handling it.
 */
public sealed interface ValidationRule permits RequiredFieldRule, DateOrderRule, NumericRangeRule {

    String name();

    Severity severity();

    /**
     * Message template with {@code {placeholder}} variables, or {@code null} for the kind's default message.
     */
    String messageTemplate();

    <R> R accept(RuleVisitor<R> visitor);
}
