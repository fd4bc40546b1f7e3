package com.eyelevel.bordereaux.service.proposal;

import com.eyelevel.bordereaux.dto.proposal.request.ApproveProposalRequest;
import com.eyelevel.bordereaux.dto.proposal.response.ProposalResponse;
import com.eyelevel.bordereaux.exception.apiclient.ConflictException;
import com.eyelevel.bordereaux.exception.apiclient.NotFoundException;
import com.eyelevel.bordereaux.model.BordereauxFile;
import com.eyelevel.bordereaux.model.MappingProposal;
import com.eyelevel.bordereaux.model.ProposalSource;
import com.eyelevel.bordereaux.model.ReviewStatus;
import com.eyelevel.bordereaux.model.Template;
import com.eyelevel.bordereaux.repository.MappingProposalRepository;
import com.eyelevel.bordereaux.service.template.TemplateService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProposalReviewServiceTest {

    @Mock
    private MappingProposalRepository proposalRepository;

    @Mock
    private TemplateService templateService;

    @InjectMocks
    private ProposalReviewService reviewService;

    private static MappingProposal proposal(ReviewStatus status) {
        return MappingProposal.builder()
                .id(8L)
                .file(BordereauxFile.builder().id(3L).build())
                .overallConfidence(0.5)
                .source(ProposalSource.HEURISTIC)
                .reviewStatus(status)
                .fileHeaders(List.of("Pol Ref", "Gross"))
                .build();
    }

    @Nested
    @DisplayName("Listing")
    class Listing {

        @Test
        @DisplayName("filters by review status, newest first")
        void filtered() {
            ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
            when(proposalRepository.findByReviewStatus(eq(ReviewStatus.PENDING), pageable.capture()))
                    .thenReturn(new PageImpl<>(List.of(proposal(ReviewStatus.PENDING))));

            Page<ProposalResponse> page = reviewService.listProposals(ReviewStatus.PENDING, 0, 20);

            assertThat(page.getContent()).singleElement()
                    .satisfies(response -> {
                        assertThat(response.id()).isEqualTo(8L);
                        assertThat(response.fileId()).isEqualTo(3L);
                        assertThat(response.fileHeaders()).containsExactly("Pol Ref", "Gross");
                    });
            Sort.Order createdAt = pageable.getValue().getSort().getOrderFor("createdAt");
            assertThat(createdAt).isNotNull();
            assertThat(createdAt.isDescending()).isTrue();
            verify(proposalRepository, never()).findAll(any(Pageable.class));
        }

        @Test
        @DisplayName("no status lists every proposal")
        void unfiltered() {
            when(proposalRepository.findAll(any(Pageable.class))).thenReturn(new PageImpl<>(List.of()));

            assertThat(reviewService.listProposals(null, 0, 20)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Review")
    class Review {

        @Test
        @DisplayName("approval creates the template and returns the updated proposal")
        void approve() {
            ApproveProposalRequest request = ApproveProposalRequest.builder()
                    .templateId("acme_premium_v1").name("ACME premium").fileType("premium").build();
            when(templateService.createFromProposal(8L, request))
                    .thenReturn(Template.builder().templateId("acme_premium_v1").build());
            MappingProposal approved = proposal(ReviewStatus.APPROVED);
            approved.setApprovedTemplateId("acme_premium_v1");
            when(proposalRepository.findById(8L)).thenReturn(Optional.of(approved));

            ProposalResponse response = reviewService.approve(8L, request);

            assertThat(response.reviewStatus()).isEqualTo(ReviewStatus.APPROVED);
            assertThat(response.approvedTemplateId()).isEqualTo("acme_premium_v1");
        }

        @Test
        @DisplayName("rejecting a pending proposal records the decision")
        void reject() {
            MappingProposal rejected = proposal(ReviewStatus.REJECTED);
            when(proposalRepository.findById(8L))
                    .thenReturn(Optional.of(proposal(ReviewStatus.PENDING)), Optional.of(rejected));
            when(proposalRepository.reviewIfPending(eq(8L), eq(ReviewStatus.REJECTED), isNull(),
                                                    eq(ReviewStatus.PENDING), any(LocalDateTime.class)))
                    .thenReturn(1);

            assertThat(reviewService.reject(8L).reviewStatus()).isEqualTo(ReviewStatus.REJECTED);
        }

        @Test
        @DisplayName("rejecting an already reviewed proposal is a conflict")
        void rejectTwice() {
            when(proposalRepository.findById(8L)).thenReturn(Optional.of(proposal(ReviewStatus.APPROVED)));
            when(proposalRepository.reviewIfPending(eq(8L), eq(ReviewStatus.REJECTED), isNull(),
                                                    eq(ReviewStatus.PENDING), any(LocalDateTime.class)))
                    .thenReturn(0);

            assertThatThrownBy(() -> reviewService.reject(8L))
                    .isInstanceOf(ConflictException.class)
                    .hasMessageContaining("APPROVED");
        }

        @Test
        @DisplayName("unknown proposal is not found")
        void unknown() {
            when(proposalRepository.findById(8L)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> reviewService.getProposal(8L)).isInstanceOf(NotFoundException.class);
        }
    }
}
