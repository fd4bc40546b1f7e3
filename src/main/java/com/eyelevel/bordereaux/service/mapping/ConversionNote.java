package com.eyelevel.bordereaux.service.mapping;

/**
 * A raw cell that could not be normalized into its canonical type. The field stays absent on the row.
 */
public record ConversionNote(String field, String rawValue, String reason) {

    public String describe() {
        return String.format("could not convert '%s': %s", rawValue, reason);
    }
}
