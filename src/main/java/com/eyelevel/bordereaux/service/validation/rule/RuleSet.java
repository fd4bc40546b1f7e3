package com.eyelevel.bordereaux.service.validation.rule;

import java.util.List;

/**
 * Rules in evaluation order. Immutable and shared read-only across files and rows.
 */
public record RuleSet(List<ValidationRule> rules) {

    public RuleSet {
        rules = List.copyOf(rules);
    }

    public int size() {
        return rules.size();
    }
}
