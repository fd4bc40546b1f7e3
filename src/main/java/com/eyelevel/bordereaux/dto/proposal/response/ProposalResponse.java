package com.eyelevel.bordereaux.dto.proposal.response;

import com.eyelevel.bordereaux.model.MappingProposal;
import com.eyelevel.bordereaux.model.ProposalSource;
import com.eyelevel.bordereaux.model.ReviewStatus;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDateTime;
import java.util.List;

@Schema(description = "A candidate column mapping for a file that matched no template.")
public record ProposalResponse(
        Long id,
        Long fileId,
        @Schema(description = "One entry per canonical field, in schema order.")
        List<FieldMappingResponse> fieldMappings,
        @Schema(description = "Mean confidence over all canonical fields; unmapped fields count as 0.", example = "0.62")
        double overallConfidence,
        ProposalSource source,
        ReviewStatus reviewStatus,
        List<String> fileHeaders,
        String reasoning,
        String sourceFilename,
        String sender,
        String subject,
        @Schema(description = "Template created when the proposal was approved.")
        String approvedTemplateId,
        LocalDateTime reviewedAt,
        LocalDateTime createdAt
) {

    public static ProposalResponse from(MappingProposal proposal) {
        final List<FieldMappingResponse> mappings = proposal.getFieldMappings().stream()
                .map(mapping -> new FieldMappingResponse(mapping.getCanonicalField(), mapping.getRawHeader(),
                                                         mapping.getConfidence()))
                .toList();
        return new ProposalResponse(proposal.getId(), proposal.getFile().getId(), mappings,
                                    proposal.getOverallConfidence(), proposal.getSource(),
                                    proposal.getReviewStatus(), List.copyOf(proposal.getFileHeaders()),
                                    proposal.getReasoning(), proposal.getSourceFilename(), proposal.getSender(),
                                    proposal.getSubject(), proposal.getApprovedTemplateId(),
                                    proposal.getReviewedAt(), proposal.getCreatedAt());
    }

    public record FieldMappingResponse(
            @Schema(example = "policy_number") String canonicalField,
            @Schema(description = "Null when no header qualified.", example = "Policy No") String rawHeader,
            @Schema(example = "0.91") double confidence
    ) {
    }
}
