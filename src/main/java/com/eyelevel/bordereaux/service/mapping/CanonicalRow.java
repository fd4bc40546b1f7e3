package com.eyelevel.bordereaux.service.mapping;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One source row in canonical form. Values are typed: {@link String}, {@link LocalDate} or {@link BigDecimal}.
 * Immutable once built by the {@link ColumnMapper}.
 */
@ToString
@EqualsAndHashCode
public final class CanonicalRow {

    private final int rowIndex;
    private final Map<String, Object> values;
    private final Map<String, ConversionNote> conversionNotes;
    private final Map<String, String> rawCells;

    public CanonicalRow(int rowIndex, Map<String, Object> values, Map<String, ConversionNote> conversionNotes,
                        Map<String, String> rawCells) {
        this.rowIndex = rowIndex;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.conversionNotes = Collections.unmodifiableMap(new LinkedHashMap<>(conversionNotes));
        this.rawCells = Collections.unmodifiableMap(new LinkedHashMap<>(rawCells));
    }

    /**
     * 0-based position in the source file's data rows.
     */
    public int getRowIndex() {
        return rowIndex;
    }

    public Map<String, Object> getValues() {
        return values;
    }

    public Map<String, ConversionNote> getConversionNotes() {
        return conversionNotes;
    }

    public Map<String, String> getRawCells() {
        return rawCells;
    }

    public Optional<Object> value(final String field) {
        return Optional.ofNullable(values.get(field));
    }

    /**
     * Present and, for strings, not blank.
     */
    public boolean hasValue(final String field) {
        final Object value = values.get(field);
        return value != null && !(value instanceof String text && text.isBlank());
    }

    public Optional<String> getString(final String field) {
        return value(field).map(Object::toString);
    }

    public Optional<LocalDate> getDate(final String field) {
        return value(field).filter(LocalDate.class::isInstance).map(LocalDate.class::cast);
    }

    public Optional<BigDecimal> getDecimal(final String field) {
        return value(field).filter(BigDecimal.class::isInstance).map(BigDecimal.class::cast);
    }

    public Optional<ConversionNote> noteFor(final String field) {
        return Optional.ofNullable(conversionNotes.get(field));
    }
}
