package com.eyelevel.bordereaux.service.validation.definition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON shape of a rule-set document.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RuleSetDocument {

    @JsonProperty("required_fields")
    private List<RequiredFieldDefinition> requiredFields = new ArrayList<>();

    @JsonProperty("date_rules")
    private List<DateRuleDefinition> dateRules = new ArrayList<>();

    @JsonProperty("numeric_rules")
    private List<NumericRuleDefinition> numericRules = new ArrayList<>();
}
