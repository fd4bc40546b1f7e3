package com.eyelevel.bordereaux.service.mapping;

import com.eyelevel.bordereaux.config.BordereauxProcessingConfig;
import com.eyelevel.bordereaux.model.FileType;
import com.eyelevel.bordereaux.model.Template;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ColumnMapperTest {

    private final ColumnMapper mapper = new ColumnMapper(new ValueNormalizer(new BordereauxProcessingConfig()));

    private static Template template() {
        Map<String, String> mappings = new LinkedHashMap<>();
        mappings.put("Policy No", "policy_number");
        mappings.put("Start", "inception_date");
        mappings.put("Premium", "premium_amount");
        mappings.put("CCY", "currency");
        mappings.put("Broker", "broker_name");
        return Template.builder().templateId("t1").name("T1").fileType(FileType.PREMIUM)
                .columnMappings(mappings).build();
    }

    private static Map<String, String> row(String... keyValues) {
        Map<String, String> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put(keyValues[i], keyValues[i + 1]);
        }
        return row;
    }

    @Test
    @DisplayName("maps matching columns into typed canonical values")
    void mapsTypedValues() {
        List<String> headers = List.of("POLICY_NO", "start", "Premium", "CCY", "Notes");
        List<CanonicalRow> rows = mapper.mapRows(template(), headers, List.of(
                row("POLICY_NO", "P-1", "start", "01/02/2024", "Premium", "£1,000.00", "CCY", "gbp",
                    "Notes", "ignored")));

        CanonicalRow mapped = rows.get(0);
        assertThat(mapped.getRowIndex()).isZero();
        assertThat(mapped.getString("policy_number")).contains("P-1");
        assertThat(mapped.getDate("inception_date")).contains(LocalDate.of(2024, 2, 1));
        assertThat(mapped.getDecimal("premium_amount")).contains(new BigDecimal("1000.00"));
        assertThat(mapped.getString("currency")).contains("GBP");
        assertThat(mapped.getValues()).doesNotContainKey("broker_name");
        assertThat(mapped.getConversionNotes()).isEmpty();
        assertThat(mapped.getRawCells()).containsEntry("Notes", "ignored");
    }

    @Test
    @DisplayName("unconvertible cells leave the field absent and record a note")
    void conversionFailureRecorded() {
        List<String> headers = List.of("Policy No", "Start", "Premium");
        CanonicalRow mapped = mapper.mapRows(template(), headers, List.of(
                row("Policy No", "P-2", "Start", "soon", "Premium", "lots"))).get(0);

        assertThat(mapped.hasValue("inception_date")).isFalse();
        assertThat(mapped.hasValue("premium_amount")).isFalse();
        assertThat(mapped.noteFor("inception_date")).get()
                .extracting(ConversionNote::rawValue).isEqualTo("soon");
        assertThat(mapped.noteFor("premium_amount")).isPresent();
    }

    @Test
    @DisplayName("blank cells are treated as missing without a note")
    void blankCellsMissing() {
        List<String> headers = List.of("Policy No", "Premium");
        CanonicalRow mapped = mapper.mapRows(template(), headers, List.of(
                row("Policy No", "P-3", "Premium", "   "))).get(0);

        assertThat(mapped.hasValue("premium_amount")).isFalse();
        assertThat(mapped.getConversionNotes()).isEmpty();
    }

    @Test
    @DisplayName("every raw row produces one canonical row in source order")
    void oneRowPerSourceRow() {
        List<String> headers = List.of("Policy No");
        List<CanonicalRow> rows = mapper.mapRows(template(), headers, List.of(
                row("Policy No", "A"), row("Policy No", ""), row("Policy No", "C")));

        assertThat(rows).extracting(CanonicalRow::getRowIndex).containsExactly(0, 1, 2);
        assertThat(rows.get(1).getValues()).isEmpty();
    }

    @Test
    @DisplayName("mappings to unknown canonical fields are ignored")
    void unknownFieldIgnored() {
        Template template = template();
        template.getColumnMappings().put("Mystery", "not_a_field");

        List<ColumnMapper.ResolvedColumn> columns =
                mapper.resolveColumns(template, List.of("Policy No", "Mystery"));

        assertThat(columns).extracting(ColumnMapper.ResolvedColumn::rawHeader).containsExactly("Policy No");
    }
}
