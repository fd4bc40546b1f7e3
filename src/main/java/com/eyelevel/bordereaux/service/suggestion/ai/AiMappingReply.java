package com.eyelevel.bordereaux.service.suggestion.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The JSON object the model is asked to return. Values are left loosely typed because the reply is untrusted;
 * {@link AiMappingResponseSanitizer} decides what is usable.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AiMappingReply {

    /**
     * Raw header to canonical field name.
     */
    private Map<String, Object> mappings = new LinkedHashMap<>();

    @JsonProperty("confidence_scores")
    private Map<String, Object> confidenceScores = new LinkedHashMap<>();

    /**
     * Either free text or an object of header to explanation.
     */
    private Object reasoning;
}
