package com.eyelevel.bordereaux.service.mapping;

/**
 * Result of normalizing one cell: either a typed value or the reason it could not be converted.
 */
public record NormalizedValue(Object value, String failureReason) {

    public static NormalizedValue of(Object value) {
        return new NormalizedValue(value, null);
    }

    public static NormalizedValue failed(String reason) {
        return new NormalizedValue(null, reason);
    }

    public boolean isConverted() {
        return failureReason == null;
    }
}
