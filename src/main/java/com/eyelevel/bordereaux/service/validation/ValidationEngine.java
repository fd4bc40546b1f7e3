package com.eyelevel.bordereaux.service.validation;

import com.eyelevel.bordereaux.service.mapping.CanonicalRow;
import com.eyelevel.bordereaux.service.mapping.ConversionNote;
import com.eyelevel.bordereaux.service.validation.rule.DateOrderRule;
import com.eyelevel.bordereaux.service.validation.rule.NumericRangeRule;
import com.eyelevel.bordereaux.service.validation.rule.RequiredFieldRule;
import com.eyelevel.bordereaux.service.validation.rule.RuleSet;
import com.eyelevel.bordereaux.service.validation.rule.RuleVisitor;
import com.eyelevel.bordereaux.service.validation.rule.ValidationRule;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.text.StringSubstitutor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Evaluates a {@link RuleSet} against canonical rows. Every rule runs on every row; violations come back in
 * rule order. Stateless, so rows may be validated in any order or concurrently.
 */
@Slf4j
@Component
public class ValidationEngine {

    private static final String UNBOUNDED = "unbounded";
    private static final String DATE_MISSING_MESSAGE =
            "'{inception_field}' and '{expiry_field}' must both be valid dates (got {value})";
    private static final String NUMBER_MISSING_MESSAGE = "'{field}' is missing and must be a number";

    public List<RowValidationResult> validateAll(final RuleSet ruleSet, final List<CanonicalRow> rows) {
        final List<RowValidationResult> results = rows.stream().map(row -> validate(ruleSet, row)).toList();
        if (log.isDebugEnabled()) {
            long invalid = results.stream().filter(result -> !result.isValid()).count();
            log.debug("Validated {} rows against {} rules: {} invalid.", rows.size(), ruleSet.size(), invalid);
        }
        return results;
    }

    public RowValidationResult validate(final RuleSet ruleSet, final CanonicalRow row) {
        final RowEvaluator evaluator = new RowEvaluator(row);
        final List<RuleViolation> violations = new ArrayList<>();
        for (ValidationRule rule : ruleSet.rules()) {
            rule.accept(evaluator).ifPresent(violations::add);
        }
        return new RowValidationResult(row, violations);
    }

    static String render(final String template, final Map<String, String> variables) {
        final StringSubstitutor substitutor = new StringSubstitutor(variables, "{", "}");
        substitutor.setDisableSubstitutionInValues(true);
        return substitutor.replace(template);
    }

    private static String plain(final BigDecimal bound) {
        return bound == null ? UNBOUNDED : bound.toPlainString();
    }

    /**
     * Evaluates rules against a single row; each visit yields zero or one violation.
     */
    private record RowEvaluator(CanonicalRow row) implements RuleVisitor<Optional<RuleViolation>> {

        @Override
        public Optional<RuleViolation> visitRequiredField(final RequiredFieldRule rule) {
            if (row.hasValue(rule.field())) {
                return Optional.empty();
            }
            final Optional<ConversionNote> note = row.noteFor(rule.field());
            final Map<String, String> variables = variables(rule);
            variables.put("field", rule.field());
            variables.put("value", note.map(ConversionNote::rawValue).orElse(""));
            variables.put("note", note.map(ConversionNote::describe).orElse(""));

            String template = rule.messageTemplate();
            if (template == null) {
                template = note.isPresent() ? RequiredFieldRule.DEFAULT_MESSAGE + " ({note})"
                                            : RequiredFieldRule.DEFAULT_MESSAGE;
            }
            return Optional.of(violation(rule, rule.field(), ErrorCode.REQUIRED_FIELD_MISSING,
                                         render(template, variables), note.map(ConversionNote::rawValue).orElse(null)));
        }

        @Override
        public Optional<RuleViolation> visitDateOrder(final DateOrderRule rule) {
            final Optional<LocalDate> inception = row.getDate(rule.inceptionField());
            final Optional<LocalDate> expiry = row.getDate(rule.expiryField());
            final boolean bothPresent = inception.isPresent() && expiry.isPresent();
            if (!bothPresent && rule.skipIfAbsent()) {
                return Optional.empty();
            }
            if (bothPresent && !inception.get().isAfter(expiry.get())) {
                return Optional.empty();
            }

            final String value = inception.map(LocalDate::toString).orElse("") + ","
                    + expiry.map(LocalDate::toString).orElse("");
            final Map<String, String> variables = variables(rule);
            variables.put("field", rule.inceptionField() + "," + rule.expiryField());
            variables.put("inception_field", rule.inceptionField());
            variables.put("expiry_field", rule.expiryField());
            variables.put("value", value);
            variables.put("note", notes(rule.inceptionField(), rule.expiryField()));

            final String template = Objects.requireNonNullElse(rule.messageTemplate(),
                                                               bothPresent ? DateOrderRule.DEFAULT_MESSAGE
                                                                           : DATE_MISSING_MESSAGE);
            return Optional.of(violation(rule, rule.inceptionField() + "," + rule.expiryField(),
                                         ErrorCode.DATE_VALIDATION_FAILED, render(template, variables), value));
        }

        @Override
        public Optional<RuleViolation> visitNumericRange(final NumericRangeRule rule) {
            final Map<String, String> variables = variables(rule);
            variables.put("field", rule.field());
            variables.put("min", plain(rule.min()));
            variables.put("max", plain(rule.max()));

            final Optional<BigDecimal> amount = row.getDecimal(rule.field());
            if (amount.isPresent()) {
                if (rule.inRange(amount.get())) {
                    return Optional.empty();
                }
                final String value = amount.get().toPlainString();
                variables.put("value", value);
                variables.put("note", "");
                final String template = Objects.requireNonNullElse(rule.messageTemplate(),
                                                                   NumericRangeRule.DEFAULT_MESSAGE);
                return Optional.of(violation(rule, rule.field(), ErrorCode.NUMERIC_VALIDATION_FAILED,
                                             render(template, variables), value));
            }

            final Optional<ConversionNote> note = row.noteFor(rule.field());
            if (note.isPresent()) {
                variables.put("value", note.get().rawValue());
                variables.put("note", note.get().describe());
                return Optional.of(violation(rule, rule.field(), ErrorCode.INVALID_NUMERIC_VALUE,
                                             render(NumericRangeRule.INVALID_VALUE_MESSAGE, variables),
                                             note.get().rawValue()));
            }
            if (rule.skipIfAbsent()) {
                return Optional.empty();
            }
            variables.put("value", "");
            variables.put("note", "");
            final String template = Objects.requireNonNullElse(rule.messageTemplate(), NUMBER_MISSING_MESSAGE);
            return Optional.of(violation(rule, rule.field(), ErrorCode.NUMERIC_VALIDATION_FAILED,
                                         render(template, variables), null));
        }

        private Map<String, String> variables(final ValidationRule rule) {
            final Map<String, String> variables = new HashMap<>();
            variables.put("rule", rule.name());
            return variables;
        }

        private String notes(final String... fields) {
            final List<String> described = new ArrayList<>();
            for (String field : fields) {
                row.noteFor(field).map(ConversionNote::describe).ifPresent(described::add);
            }
            return String.join("; ", described);
        }

        private RuleViolation violation(final ValidationRule rule, final String field, final ErrorCode code,
                                        final String message, final String value) {
            return new RuleViolation(row.getRowIndex(), field, rule.name(), code, rule.severity(), message, value);
        }
    }
}
