package com.eyelevel.bordereaux.service.validation.rule;

public interface RuleVisitor<R> {

    R visitRequiredField(RequiredFieldRule rule);

    R visitDateOrder(DateOrderRule rule);

    R visitNumericRange(NumericRangeRule rule);
}
