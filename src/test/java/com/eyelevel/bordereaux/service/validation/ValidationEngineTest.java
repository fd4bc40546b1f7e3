package com.eyelevel.bordereaux.service.validation;

import com.eyelevel.bordereaux.common.json.jackson.JacksonJsonParser;
import com.eyelevel.bordereaux.model.Severity;
import com.eyelevel.bordereaux.service.mapping.CanonicalRow;
import com.eyelevel.bordereaux.service.mapping.ConversionNote;
import com.eyelevel.bordereaux.service.validation.rule.RequiredFieldRule;
import com.eyelevel.bordereaux.service.validation.rule.RuleSet;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ValidationEngineTest {

    private final ValidationEngine engine = new ValidationEngine();
    private final RuleSet defaultRules = new RuleSetLoader(new JacksonJsonParser(new ObjectMapper()))
            .load(new ClassPathResource("rules/default-rules.json"));

    private static Map<String, Object> validValues() {
        Map<String, Object> values = new HashMap<>();
        values.put("policy_number", "POL-1");
        values.put("inception_date", LocalDate.of(2024, 1, 1));
        values.put("expiry_date", LocalDate.of(2024, 12, 31));
        values.put("premium_amount", new BigDecimal("100.00"));
        return values;
    }

    private static CanonicalRow row(Map<String, Object> values) {
        return new CanonicalRow(3, values, Map.of(), Map.of());
    }

    @Nested
    @DisplayName("Default rule set")
    class DefaultRules {

        @Test
        @DisplayName("complete row passes with optional amounts absent")
        void validRow() {
            RowValidationResult result = engine.validate(defaultRules, row(validValues()));

            assertThat(result.isValid()).isTrue();
            assertThat(result.violations()).isEmpty();
        }

        @Test
        @DisplayName("missing policy number fails with the default required message")
        void missingPolicy() {
            Map<String, Object> values = validValues();
            values.remove("policy_number");

            RowValidationResult result = engine.validate(defaultRules, row(values));

            assertThat(result.isValid()).isFalse();
            RuleViolation violation = result.violations().get(0);
            assertThat(violation.rowIndex()).isEqualTo(3);
            assertThat(violation.errorCode()).isEqualTo(ErrorCode.REQUIRED_FIELD_MISSING);
            assertThat(violation.field()).isEqualTo("policy_number");
            assertThat(violation.message()).isEqualTo("Required field 'policy_number' is missing or null");
        }

        @Test
        @DisplayName("inception after expiry fails the date rule")
        void datesOutOfOrder() {
            Map<String, Object> values = validValues();
            values.put("inception_date", LocalDate.of(2025, 1, 1));

            RowValidationResult result = engine.validate(defaultRules, row(values));

            assertThat(result.violations()).singleElement().satisfies(violation -> {
                assertThat(violation.errorCode()).isEqualTo(ErrorCode.DATE_VALIDATION_FAILED);
                assertThat(violation.ruleName()).isEqualTo("inception_before_expiry");
                assertThat(violation.field()).isEqualTo("inception_date,expiry_date");
                assertThat(violation.value()).isEqualTo("2025-01-01,2024-12-31");
                assertThat(violation.message()).isEqualTo("Inception date must be before or equal to expiry date");
            });
        }

        @Test
        @DisplayName("equal inception and expiry dates pass")
        void sameDay() {
            Map<String, Object> values = validValues();
            values.put("expiry_date", LocalDate.of(2024, 1, 1));

            assertThat(engine.validate(defaultRules, row(values)).isValid()).isTrue();
        }

        @Test
        @DisplayName("missing date fails because the date rule does not skip absent values")
        void missingDate() {
            Map<String, Object> values = validValues();
            values.remove("expiry_date");

            RowValidationResult result = engine.validate(defaultRules, row(values));

            assertThat(result.violations()).extracting(RuleViolation::errorCode)
                    .containsExactly(ErrorCode.DATE_VALIDATION_FAILED);
        }

        @Test
        @DisplayName("negative premium fails the numeric rule")
        void negativePremium() {
            Map<String, Object> values = validValues();
            values.put("premium_amount", new BigDecimal("-5"));

            RowValidationResult result = engine.validate(defaultRules, row(values));

            assertThat(result.violations()).singleElement().satisfies(violation -> {
                assertThat(violation.errorCode()).isEqualTo(ErrorCode.NUMERIC_VALIDATION_FAILED);
                assertThat(violation.value()).isEqualTo("-5");
            });
        }

        @Test
        @DisplayName("unreadable amount is reported as an invalid numeric value even when skippable")
        void unreadableAmount() {
            Map<String, ConversionNote> notes = Map.of("claim_amount",
                    new ConversionNote("claim_amount", "n/a", "not a valid amount"));
            CanonicalRow row = new CanonicalRow(0, validValues(), notes, Map.of());

            RowValidationResult result = engine.validate(defaultRules, row);

            assertThat(result.violations()).singleElement().satisfies(violation -> {
                assertThat(violation.errorCode()).isEqualTo(ErrorCode.INVALID_NUMERIC_VALUE);
                assertThat(violation.value()).isEqualTo("n/a");
                assertThat(violation.message()).isEqualTo("Field 'claim_amount' contains invalid numeric value");
            });
        }

        @Test
        @DisplayName("every rule runs, so one row can collect several violations in rule order")
        void multipleViolations() {
            Map<String, Object> values = new HashMap<>();
            values.put("premium_amount", new BigDecimal("-1"));

            RowValidationResult result = engine.validate(defaultRules, row(values));

            assertThat(result.violations()).extracting(RuleViolation::ruleName)
                    .containsExactly("required_policy_number", "inception_before_expiry", "premium_non_negative");
        }
    }

    @Nested
    @DisplayName("Severity and messages")
    class SeverityAndMessages {

        @Test
        @DisplayName("warnings are reported but keep the row valid")
        void warningKeepsRowValid() {
            RuleSet ruleSet = new RuleSet(List.of(
                    new RequiredFieldRule("currency_expected", "currency", Severity.WARNING, null)));

            RowValidationResult result = engine.validate(ruleSet, row(validValues()));

            assertThat(result.isValid()).isTrue();
            assertThat(result.violations()).singleElement()
                    .extracting(RuleViolation::severity).isEqualTo(Severity.WARNING);
        }

        @Test
        @DisplayName("conversion note is appended to the default required message")
        void requiredWithNote() {
            Map<String, ConversionNote> notes = Map.of("currency",
                    new ConversionNote("currency", "XYZ", "unknown currency"));
            CanonicalRow row = new CanonicalRow(0, validValues(), notes, Map.of());

            RowValidationResult result = engine.validate(new RuleSet(List.of(RequiredFieldRule.of("currency"))), row);

            assertThat(result.violations().get(0).message())
                    .isEqualTo("Required field 'currency' is missing or null (could not convert 'XYZ': unknown currency)");
            assertThat(result.violations().get(0).value()).isEqualTo("XYZ");
        }

        @Test
        @DisplayName("placeholders in custom messages are filled and unknown ones left as written")
        void renderTemplate() {
            String message = ValidationEngine.render("{rule}: {field} was {value} {unknown}",
                                                     Map.of("rule", "r1", "field", "premium_amount", "value", "{field}"));

            assertThat(message).isEqualTo("r1: premium_amount was {field} {unknown}");
        }

        @Test
        @DisplayName("validating a batch keeps row order")
        void validateAllKeepsOrder() {
            List<CanonicalRow> rows = List.of(new CanonicalRow(0, validValues(), Map.of(), Map.of()),
                                              new CanonicalRow(1, Map.of(), Map.of(), Map.of()));

            List<RowValidationResult> results = engine.validateAll(defaultRules, rows);

            assertThat(results).extracting(RowValidationResult::isValid).containsExactly(true, false);
        }
    }
}
