package com.eyelevel.bordereaux.service.validation.definition;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Either a bare field name ({@code "policy_number"}) or an object with optional name, severity and message.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RequiredFieldDefinition {

    private String name;
    private String field;
    private String severity;
    private String message;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static RequiredFieldDefinition ofField(String field) {
        RequiredFieldDefinition definition = new RequiredFieldDefinition();
        definition.setField(field);
        return definition;
    }
}
