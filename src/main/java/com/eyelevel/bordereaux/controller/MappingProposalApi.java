package com.eyelevel.bordereaux.controller;

import com.eyelevel.bordereaux.dto.common.ApiResponse;
import com.eyelevel.bordereaux.dto.proposal.request.ApproveProposalRequest;
import com.eyelevel.bordereaux.dto.proposal.response.ProposalResponse;
import com.eyelevel.bordereaux.model.ReviewStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.data.domain.Page;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;

@Tag(name = "Mapping Proposals", description = "Review of column mappings suggested for files that matched no template.")
public interface MappingProposalApi {

    @Operation(summary = "List Proposals", description = "Returns mapping proposals, newest first, optionally filtered by review status.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Proposals retrieved successfully.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<Page<ProposalResponse>>> listProposals(
            @Parameter(description = "Only proposals in this review status.", example = "PENDING")
            @RequestParam(value = "reviewStatus", required = false) ReviewStatus reviewStatus,
            @Parameter(description = "Zero-based page index.") @RequestParam(value = "page", defaultValue = "0") @Min(value = 0, message = "The 'page' must not be negative.") int page,
            @Parameter(description = "Page size, at most 200.") @RequestParam(value = "size", defaultValue = "20") @Min(value = 1, message = "The 'size' must be at least 1.") @Max(value = 200, message = "The 'size' cannot exceed 200.") int size);

    @Operation(summary = "Get Proposal", description = "Returns one mapping proposal with a candidate header and confidence for every canonical field.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Proposal retrieved successfully.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - The proposal does not exist.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<ProposalResponse>> getProposal(
            @Parameter(description = "The ID of the proposal.", required = true, example = "7") @PathVariable @Positive(message = "The 'proposalId' must be a positive number.") Long proposalId);

    @Operation(summary = "Approve Proposal",
            description = "Creates a new active template from a pending proposal, with optional mapping overrides, and marks the proposal APPROVED. The file is not reprocessed automatically.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Proposal approved and template created.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Success", value = """
                                    {
                                        "displayMessage": "Proposal approved; template 'acme_premium_v2' created.",
                                        "response": {
                                            "id": 7,
                                            "fileId": 42,
                                            "reviewStatus": "APPROVED",
                                            "approvedTemplateId": "acme_premium_v2"
                                        },
                                        "showMessage": true,
                                        "statusCode": 200
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - The resulting template is invalid.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - The proposal does not exist.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Conflict - The proposal was already reviewed or the template ID is taken.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<ProposalResponse>> approveProposal(
            @Parameter(description = "The ID of the proposal.", required = true, example = "7") @PathVariable @Positive(message = "The 'proposalId' must be a positive number.") Long proposalId,
            @Valid @RequestBody ApproveProposalRequest request);

    @Operation(summary = "Reject Proposal", description = "Marks a pending proposal REJECTED.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Proposal rejected.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - The proposal does not exist.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Conflict - The proposal was already reviewed.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<ProposalResponse>> rejectProposal(
            @Parameter(description = "The ID of the proposal.", required = true, example = "7") @PathVariable @Positive(message = "The 'proposalId' must be a positive number.") Long proposalId);
}
