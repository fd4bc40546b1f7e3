package com.eyelevel.bordereaux.service.mapping;

import com.eyelevel.bordereaux.model.Template;
import com.eyelevel.bordereaux.model.canonical.CanonicalField;
import com.eyelevel.bordereaux.service.matching.HeaderNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Applies a matched {@link Template} to decoded rows.
 * <p>
 * Unmapped raw columns are dropped and canonical fields without a source column stay absent. A cell that fails
 * conversion leaves its field absent and records a {@link ConversionNote}; rows are never discarded here.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ColumnMapper {

    private final ValueNormalizer valueNormalizer;

    public List<CanonicalRow> mapRows(final Template template, final List<String> fileHeaders,
                                      final List<Map<String, String>> rawRows) {
        final List<ResolvedColumn> columns = resolveColumns(template, fileHeaders);
        log.debug("Template '{}' resolves {} of its {} mappings against the file headers.",
                  template.getTemplateId(), columns.size(), template.getColumnMappings().size());

        final List<CanonicalRow> rows = new ArrayList<>(rawRows.size());
        for (int index = 0; index < rawRows.size(); index++) {
            rows.add(mapRow(index, columns, rawRows.get(index)));
        }
        return rows;
    }

    CanonicalRow mapRow(final int rowIndex, final List<ResolvedColumn> columns, final Map<String, String> rawRow) {
        final Map<String, Object> values = new LinkedHashMap<>();
        final Map<String, ConversionNote> notes = new LinkedHashMap<>();

        for (ResolvedColumn column : columns) {
            final String fieldName = column.field().getFieldName();
            if (values.containsKey(fieldName)) {
                continue;
            }
            final String raw = rawRow.get(column.rawHeader());
            if (raw == null || raw.isBlank()) {
                continue;
            }
            final NormalizedValue normalized = valueNormalizer.normalize(column.field().getType(), raw);
            if (normalized.isConverted()) {
                values.put(fieldName, normalized.value());
                notes.remove(fieldName);
            } else {
                notes.putIfAbsent(fieldName, new ConversionNote(fieldName, raw, normalized.failureReason()));
            }
        }
        return new CanonicalRow(rowIndex, values, notes, rawRow);
    }

    /**
     * Pairs each template mapping, in template order, with the file header it refers to after normalization.
     */
    List<ResolvedColumn> resolveColumns(final Template template, final List<String> fileHeaders) {
        final Map<String, String> headersByKey = new LinkedHashMap<>();
        for (String header : fileHeaders) {
            headersByKey.putIfAbsent(HeaderNormalizer.normalize(header), header);
        }

        final List<ResolvedColumn> columns = new ArrayList<>();
        template.getColumnMappings().forEach((rawKey, fieldName) -> {
            final Optional<CanonicalField> field = CanonicalField.fromName(fieldName);
            final String header = headersByKey.get(HeaderNormalizer.normalize(rawKey));
            if (field.isEmpty()) {
                log.warn("Template '{}' maps '{}' to unknown field '{}'; mapping ignored.",
                         template.getTemplateId(), rawKey, fieldName);
            } else if (header != null) {
                columns.add(new ResolvedColumn(header, field.get()));
            }
        });
        return columns;
    }

    record ResolvedColumn(String rawHeader, CanonicalField field) {
    }
}
