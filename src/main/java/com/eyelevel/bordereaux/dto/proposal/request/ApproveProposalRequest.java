package com.eyelevel.bordereaux.dto.proposal.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Turns a pending mapping proposal into a new active template.")
public class ApproveProposalRequest {

    @NotBlank
    @Pattern(regexp = "[A-Za-z0-9_.-]{1,128}", message = "may only contain letters, digits, '_', '.' and '-'")
    @Schema(description = "Identifier of the template to create.", example = "acme_premium_v1")
    private String templateId;

    @NotBlank
    @Schema(description = "Display name of the template.", example = "ACME premium bordereau")
    private String name;

    @NotBlank
    @Schema(description = "claims, premium or exposure.", example = "premium")
    private String fileType;

    @Schema(description = "Carrier the layout belongs to.", example = "ACME")
    private String carrier;

    @Schema(description = "Raw header to canonical field overrides applied on top of the proposal. A blank field "
                          + "name removes the header from the mapping.")
    private LinkedHashMap<String, String> columnMappings;
}
