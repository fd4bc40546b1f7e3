package com.eyelevel.bordereaux.service.validation;

import com.eyelevel.bordereaux.common.json.JsonParser;
import com.eyelevel.bordereaux.exception.RuleSetDefinitionException;
import com.eyelevel.bordereaux.exception.json.JsonParsingException;
import com.eyelevel.bordereaux.model.Severity;
import com.eyelevel.bordereaux.model.canonical.CanonicalField;
import com.eyelevel.bordereaux.model.canonical.FieldType;
import com.eyelevel.bordereaux.service.validation.definition.DateRuleDefinition;
import com.eyelevel.bordereaux.service.validation.definition.NumericRuleDefinition;
import com.eyelevel.bordereaux.service.validation.definition.RequiredFieldDefinition;
import com.eyelevel.bordereaux.service.validation.definition.RuleSetDocument;
import com.eyelevel.bordereaux.service.validation.rule.DateOrderRule;
import com.eyelevel.bordereaux.service.validation.rule.NumericRangeRule;
import com.eyelevel.bordereaux.service.validation.rule.RequiredFieldRule;
import com.eyelevel.bordereaux.service.validation.rule.RuleSet;
import com.eyelevel.bordereaux.service.validation.rule.ValidationRule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads a rule-set JSON document into an immutable {@link RuleSet}: required rules first, then date rules, then
 * numeric rules, each in document order. Any problem with the document is a {@link RuleSetDefinitionException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RuleSetLoader {

    private final JsonParser jsonParser;

    public RuleSet load(final Resource resource) {
        if (!resource.exists()) {
            throw new RuleSetDefinitionException("Rule-set document not found: " + resource.getDescription());
        }
        try {
            final RuleSet ruleSet = parse(resource.getContentAsByteArray());
            log.info("Loaded {} validation rules from {}", ruleSet.size(), resource.getDescription());
            return ruleSet;
        } catch (IOException e) {
            throw new RuleSetDefinitionException("Cannot read rule-set document " + resource.getDescription(), e);
        }
    }

    public RuleSet parse(final byte[] json) {
        final RuleSetDocument document;
        try {
            document = jsonParser.parseObject(json, RuleSetDocument.class);
        } catch (JsonParsingException e) {
            throw new RuleSetDefinitionException("Malformed rule-set document", e);
        }
        return toRuleSet(document);
    }

    public RuleSet toRuleSet(final RuleSetDocument document) {
        final List<ValidationRule> rules = new ArrayList<>();
        nullSafe(document.getRequiredFields()).forEach(definition -> rules.add(requiredRule(definition)));
        nullSafe(document.getDateRules()).forEach(definition -> rules.add(dateRule(definition)));
        nullSafe(document.getNumericRules()).forEach(definition -> rules.add(numericRule(definition)));

        final Set<String> names = new HashSet<>();
        for (ValidationRule rule : rules) {
            if (!names.add(rule.name())) {
                throw new RuleSetDefinitionException("Duplicate rule name: " + rule.name());
            }
        }
        return new RuleSet(rules);
    }

    private RequiredFieldRule requiredRule(final RequiredFieldDefinition definition) {
        if (definition == null) {
            throw new RuleSetDefinitionException("Required-field entry must not be null");
        }
        final String field = requireField(definition.getField(), "required field", FieldTypeCheck.ANY);
        final String name = isBlank(definition.getName()) ? "required_" + field : definition.getName().trim();
        return new RequiredFieldRule(name, field, severity(definition.getSeverity(), name),
                                     blankToNull(definition.getMessage()));
    }

    private DateOrderRule dateRule(final DateRuleDefinition definition) {
        final String name = requireName(definition.getName(), "date rule");
        final String inception = requireField(definition.getInceptionField(), name, FieldTypeCheck.DATE);
        final String expiry = requireField(definition.getExpiryField(), name, FieldTypeCheck.DATE);
        return new DateOrderRule(name, inception, expiry, severity(definition.getSeverity(), name),
                                 blankToNull(definition.getMessage()), definition.isSkipIfAbsent());
    }

    private NumericRangeRule numericRule(final NumericRuleDefinition definition) {
        final String name = requireName(definition.getName(), "numeric rule");
        final String field = requireField(definition.getField(), name, FieldTypeCheck.DECIMAL);
        if (definition.getMinValue() == null && definition.getMaxValue() == null) {
            throw new RuleSetDefinitionException("Numeric rule '" + name + "' needs min_value or max_value");
        }
        if (definition.getMinValue() != null && definition.getMaxValue() != null
                && definition.getMinValue().compareTo(definition.getMaxValue()) > 0) {
            throw new RuleSetDefinitionException("Numeric rule '" + name + "' has min_value above max_value");
        }
        return new NumericRangeRule(name, field, definition.getMinValue(), definition.getMaxValue(),
                                    severity(definition.getSeverity(), name), blankToNull(definition.getMessage()),
                                    definition.isSkipIfAbsent());
    }

    private String requireField(final String field, final String owner, final FieldTypeCheck check) {
        final CanonicalField canonical = CanonicalField.fromName(field).orElseThrow(
                () -> new RuleSetDefinitionException(
                        String.format("'%s' references unknown canonical field '%s'", owner, field)));
        if (!check.accepts(canonical.getType())) {
            throw new RuleSetDefinitionException(
                    String.format("'%s' needs a %s field but '%s' is %s", owner, check, field, canonical.getType()));
        }
        return canonical.getFieldName();
    }

    private static String requireName(final String name, final String kind) {
        if (isBlank(name)) {
            throw new RuleSetDefinitionException("Every " + kind + " needs a name");
        }
        return name.trim();
    }

    private static Severity severity(final String value, final String ruleName) {
        try {
            return Severity.fromCode(value);
        } catch (IllegalArgumentException e) {
            throw new RuleSetDefinitionException(
                    String.format("Rule '%s' has unknown severity '%s'", ruleName, value), e);
        }
    }

    private static <T> List<T> nullSafe(final List<T> list) {
        return list == null ? List.of() : list;
    }

    private static boolean isBlank(final String value) {
        return value == null || value.isBlank();
    }

    private static String blankToNull(final String value) {
        return isBlank(value) ? null : value;
    }

    private enum FieldTypeCheck {
        ANY, DATE, DECIMAL;

        boolean accepts(final FieldType type) {
            return this == ANY || name().equals(type.name());
        }

        @Override
        public String toString() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
