package com.eyelevel.bordereaux.controller;

import com.eyelevel.bordereaux.dto.common.ApiResponse;
import com.eyelevel.bordereaux.dto.proposal.request.ApproveProposalRequest;
import com.eyelevel.bordereaux.dto.proposal.response.ProposalResponse;
import com.eyelevel.bordereaux.model.ReviewStatus;
import com.eyelevel.bordereaux.service.proposal.ProposalReviewService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/bordereaux")
@RequiredArgsConstructor
@Validated
public class MappingProposalController implements MappingProposalApi {

    private final ProposalReviewService proposalReviewService;

    @Override
    @GetMapping("/v1/proposals")
    public ResponseEntity<ApiResponse<Page<ProposalResponse>>> listProposals(
            @RequestParam(value = "reviewStatus", required = false) final ReviewStatus reviewStatus,
            @RequestParam(value = "page", defaultValue = "0") final int page,
            @RequestParam(value = "size", defaultValue = "20") final int size) {

        final Page<ProposalResponse> proposals = proposalReviewService.listProposals(reviewStatus, page, size);
        return ResponseEntity.ok(ApiResponse.success(proposals, "Proposals retrieved successfully.",
                                                     HttpStatus.OK.value()));
    }

    @Override
    @GetMapping("/v1/proposals/{proposalId}")
    public ResponseEntity<ApiResponse<ProposalResponse>> getProposal(
            @PathVariable final Long proposalId) {

        return ResponseEntity.ok(ApiResponse.success(proposalReviewService.getProposal(proposalId),
                                                     "Proposal retrieved successfully.", HttpStatus.OK.value()));
    }

    @Override
    @PostMapping("/v1/proposals/{proposalId}/approve")
    public ResponseEntity<ApiResponse<ProposalResponse>> approveProposal(
            @PathVariable final Long proposalId,
            @RequestBody final ApproveProposalRequest request) {

        log.info("Approving proposal {} as template '{}'.", proposalId, request.getTemplateId());
        final ProposalResponse proposal = proposalReviewService.approve(proposalId, request);
        return ResponseEntity.ok(ApiResponse.success(proposal, String.format(
                "Proposal approved; template '%s' created.", proposal.approvedTemplateId()), HttpStatus.OK.value()));
    }

    @Override
    @PostMapping("/v1/proposals/{proposalId}/reject")
    public ResponseEntity<ApiResponse<ProposalResponse>> rejectProposal(
            @PathVariable final Long proposalId) {

        log.info("Rejecting proposal {}.", proposalId);
        return ResponseEntity.ok(ApiResponse.success(proposalReviewService.reject(proposalId), "Proposal rejected.",
                                                     HttpStatus.OK.value()));
    }
}
