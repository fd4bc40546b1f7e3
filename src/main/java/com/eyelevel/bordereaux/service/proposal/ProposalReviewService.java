package com.eyelevel.bordereaux.service.proposal;

import com.eyelevel.bordereaux.dto.proposal.request.ApproveProposalRequest;
import com.eyelevel.bordereaux.dto.proposal.response.ProposalResponse;
import com.eyelevel.bordereaux.exception.apiclient.ConflictException;
import com.eyelevel.bordereaux.exception.apiclient.NotFoundException;
import com.eyelevel.bordereaux.model.MappingProposal;
import com.eyelevel.bordereaux.model.ReviewStatus;
import com.eyelevel.bordereaux.model.Template;
import com.eyelevel.bordereaux.repository.MappingProposalRepository;
import com.eyelevel.bordereaux.service.template.TemplateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * Human review of mapping proposals. Only PENDING proposals can be approved or rejected; approval creates a
 * new template but never reprocesses the file.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProposalReviewService {

    private final MappingProposalRepository proposalRepository;
    private final TemplateService templateService;

    @Transactional(readOnly = true)
    public Page<ProposalResponse> listProposals(ReviewStatus reviewStatus, int page, int size) {
        final PageRequest pageRequest = PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "createdAt")
                                                                       .and(Sort.by(Sort.Direction.DESC, "id")));
        final Page<MappingProposal> proposals = reviewStatus == null
                ? proposalRepository.findAll(pageRequest)
                : proposalRepository.findByReviewStatus(reviewStatus, pageRequest);
        return proposals.map(ProposalResponse::from);
    }

    @Transactional(readOnly = true)
    public ProposalResponse getProposal(Long proposalId) {
        return ProposalResponse.from(findProposal(proposalId));
    }

    @Transactional
    public ProposalResponse approve(Long proposalId, ApproveProposalRequest request) {
        final Template template = templateService.createFromProposal(proposalId, request);
        log.info("Proposal {} approved; template '{}' is now active.", proposalId, template.getTemplateId());
        return ProposalResponse.from(findProposal(proposalId));
    }

    @Transactional
    public ProposalResponse reject(Long proposalId) {
        final MappingProposal proposal = findProposal(proposalId);
        final int updated = proposalRepository.reviewIfPending(proposalId, ReviewStatus.REJECTED, null,
                                                               ReviewStatus.PENDING, LocalDateTime.now());
        if (updated != 1) {
            throw new ConflictException("Mapping proposal " + proposalId + " was already reviewed ("
                                        + proposal.getReviewStatus() + ").");
        }
        log.info("Proposal {} rejected.", proposalId);
        return ProposalResponse.from(findProposal(proposalId));
    }

    private MappingProposal findProposal(Long proposalId) {
        return proposalRepository.findById(proposalId).orElseThrow(
                () -> new NotFoundException("Mapping proposal with ID " + proposalId + " not found."));
    }
}
