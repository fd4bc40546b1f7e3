package com.eyelevel.bordereaux.service.validation;

import com.eyelevel.bordereaux.service.mapping.CanonicalRow;

import java.util.List;

/**
 * Outcome of validating one row: the row plus its violations in rule order.
 */
public record RowValidationResult(CanonicalRow row, List<RuleViolation> violations) {

    public RowValidationResult {
        violations = List.copyOf(violations);
    }

    /**
     * A row is valid when none of its violations has error severity.
     */
    public boolean isValid() {
        return violations.stream().noneMatch(RuleViolation::isError);
    }
}
