package com.eyelevel.bordereaux.service.validation;

public enum ErrorCode {
    REQUIRED_FIELD_MISSING,
    DATE_VALIDATION_FAILED,
    NUMERIC_VALIDATION_FAILED,
    INVALID_NUMERIC_VALUE
}
