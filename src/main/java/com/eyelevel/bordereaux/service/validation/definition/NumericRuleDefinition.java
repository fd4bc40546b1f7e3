package com.eyelevel.bordereaux.service.validation.definition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class NumericRuleDefinition {

    private String name;
    private String field;

    @JsonProperty("min_value")
    private BigDecimal minValue;

    @JsonProperty("max_value")
    private BigDecimal maxValue;

    private String message;
    private String severity;

    @JsonProperty("skip_if_absent")
    private boolean skipIfAbsent;
}
