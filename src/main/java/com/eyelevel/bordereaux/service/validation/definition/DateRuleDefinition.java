package com.eyelevel.bordereaux.service.validation.definition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DateRuleDefinition {

    private String name;

    @JsonProperty("inception_field")
    private String inceptionField;

    @JsonProperty("expiry_field")
    private String expiryField;

    private String message;
    private String severity;

    @JsonProperty("skip_if_absent")
    private boolean skipIfAbsent;
}
