package com.eyelevel.bordereaux.model.canonical;

/**
 * Value type of a canonical field, which decides how the mapper normalizes raw cells.
 */
public enum FieldType {
    STRING,
    DATE,
    DECIMAL,
    CURRENCY
}
