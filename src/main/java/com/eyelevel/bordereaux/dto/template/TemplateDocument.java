package com.eyelevel.bordereaux.dto.template;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;

/**
 * JSON form of a template, as found in the seed documents:
 *
 * <pre>
 * {
 *   "template_id": "acme_premium_v1",
 *   "name": "ACME premium bordereau",
 *   "carrier": "ACME",
 *   "file_type": "premium",
 *   "version": 1,
 *   "column_mappings": { "Policy No": "policy_number", ... }
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TemplateDocument {

    @JsonProperty("template_id")
    private String templateId;

    private String name;

    private String carrier;

    @JsonProperty("file_type")
    private String fileType;

    private Integer version;

    @JsonProperty("active_flag")
    private Boolean active;

    @JsonProperty("column_mappings")
    private LinkedHashMap<String, String> columnMappings;
}
