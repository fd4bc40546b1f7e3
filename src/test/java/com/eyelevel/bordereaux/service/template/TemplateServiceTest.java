package com.eyelevel.bordereaux.service.template;

import com.eyelevel.bordereaux.dto.proposal.request.ApproveProposalRequest;
import com.eyelevel.bordereaux.dto.template.TemplateDocument;
import com.eyelevel.bordereaux.exception.TemplateDefinitionException;
import com.eyelevel.bordereaux.exception.apiclient.ConflictException;
import com.eyelevel.bordereaux.exception.apiclient.NotFoundException;
import com.eyelevel.bordereaux.model.FileType;
import com.eyelevel.bordereaux.model.MappingProposal;
import com.eyelevel.bordereaux.model.ProposalFieldMapping;
import com.eyelevel.bordereaux.model.ProposalSource;
import com.eyelevel.bordereaux.model.ReviewStatus;
import com.eyelevel.bordereaux.model.Template;
import com.eyelevel.bordereaux.repository.MappingProposalRepository;
import com.eyelevel.bordereaux.repository.TemplateRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TemplateServiceTest {

    @Mock
    private TemplateRepository templateRepository;

    @Mock
    private MappingProposalRepository proposalRepository;

    private TemplateService templateService;

    @BeforeEach
    void setUp() {
        templateService = new TemplateService(templateRepository, proposalRepository);
    }

    private static TemplateDocument.TemplateDocumentBuilder document() {
        LinkedHashMap<String, String> mappings = new LinkedHashMap<>();
        mappings.put("Policy No", "policy_number");
        mappings.put("Premium", "premium_amount");
        return TemplateDocument.builder()
                .templateId(" acme_premium_v1 ")
                .name("ACME premium")
                .carrier("ACME")
                .fileType("Premium")
                .columnMappings(mappings);
    }

    @Nested
    @DisplayName("Document validation")
    class DocumentValidation {

        @Test
        @DisplayName("valid document becomes an active version-1 template")
        void validDocument() {
            Template template = templateService.toTemplate(document().build());

            assertThat(template.getTemplateId()).isEqualTo("acme_premium_v1");
            assertThat(template.getFileType()).isEqualTo(FileType.PREMIUM);
            assertThat(template.getVersion()).isEqualTo(1);
            assertThat(template.isActive()).isTrue();
            assertThat(template.getColumnMappings()).containsExactly(
                    entry("Policy No", "policy_number"),
                    entry("Premium", "premium_amount"));
        }

        @Test
        @DisplayName("explicit version and inactive flag are kept")
        void explicitVersionAndFlag() {
            Template template = templateService.toTemplate(document().version(3).active(false).build());

            assertThat(template.getVersion()).isEqualTo(3);
            assertThat(template.isActive()).isFalse();
        }

        @Test
        @DisplayName("missing identifier or name is rejected")
        void missingIdentity() {
            assertThatThrownBy(() -> templateService.toTemplate(document().templateId(" ").build()))
                    .isInstanceOf(TemplateDefinitionException.class);
            assertThatThrownBy(() -> templateService.toTemplate(document().name(null).build()))
                    .isInstanceOf(TemplateDefinitionException.class)
                    .hasMessageContaining("has no name");
        }

        @Test
        @DisplayName("unknown file type is rejected")
        void unknownFileType() {
            assertThatThrownBy(() -> templateService.toTemplate(document().fileType("marine").build()))
                    .isInstanceOf(TemplateDefinitionException.class)
                    .hasMessageContaining("marine");
        }

        @Test
        @DisplayName("empty mappings are rejected")
        void emptyMappings() {
            assertThatThrownBy(() -> templateService.toTemplate(
                    document().columnMappings(new LinkedHashMap<>()).build()))
                    .isInstanceOf(TemplateDefinitionException.class)
                    .hasMessageContaining("no column mappings");
        }

        @Test
        @DisplayName("headers colliding after normalization are rejected")
        void collidingHeaders() {
            LinkedHashMap<String, String> mappings = new LinkedHashMap<>();
            mappings.put("Policy No", "policy_number");
            mappings.put("POLICY_NO", "insured_name");

            assertThatThrownBy(() -> templateService.toTemplate(document().columnMappings(mappings).build()))
                    .isInstanceOf(TemplateDefinitionException.class)
                    .hasMessageContaining("policy_no");
        }

        @Test
        @DisplayName("unknown canonical field is rejected")
        void unknownField() {
            LinkedHashMap<String, String> mappings = new LinkedHashMap<>();
            mappings.put("Shoe", "shoe_size");

            assertThatThrownBy(() -> templateService.toTemplate(document().columnMappings(mappings).build()))
                    .isInstanceOf(TemplateDefinitionException.class)
                    .hasMessageContaining("shoe_size");
        }

        @Test
        @DisplayName("template without a policy_number column is rejected")
        void missingPolicyNumber() {
            LinkedHashMap<String, String> mappings = new LinkedHashMap<>();
            mappings.put("Insured", "insured_name");
            mappings.put("Premium", "premium_amount");

            assertThatThrownBy(() -> templateService.toTemplate(document().columnMappings(mappings).build()))
                    .isInstanceOf(TemplateDefinitionException.class)
                    .hasMessageContaining("policy_number");
        }

        @Test
        @DisplayName("punctuation-only header is rejected")
        void blankHeader() {
            LinkedHashMap<String, String> mappings = new LinkedHashMap<>();
            mappings.put("#", "policy_number");

            assertThatThrownBy(() -> templateService.toTemplate(document().columnMappings(mappings).build()))
                    .isInstanceOf(TemplateDefinitionException.class)
                    .hasMessageContaining("blank header");
        }
    }

    @Nested
    @DisplayName("Creating templates")
    class Creating {

        @Test
        @DisplayName("new template is saved")
        void saves() {
            when(templateRepository.existsById("acme_premium_v1")).thenReturn(false);
            when(templateRepository.saveAndFlush(any(Template.class))).thenAnswer(invocation -> invocation.getArgument(0));

            Template created = templateService.create(document().build());

            assertThat(created.getTemplateId()).isEqualTo("acme_premium_v1");
            verify(templateRepository).saveAndFlush(any(Template.class));
        }

        @Test
        @DisplayName("existing identifier is a conflict")
        void duplicate() {
            when(templateRepository.existsById("acme_premium_v1")).thenReturn(true);

            assertThatThrownBy(() -> templateService.create(document().build()))
                    .isInstanceOf(ConflictException.class);
            verify(templateRepository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("active listing uses the file type hint when present")
        void listActive() {
            List<Template> premium = List.of(Template.builder().templateId("p").build());
            when(templateRepository.findByActiveTrueAndFileTypeOrderByTemplateIdAsc(FileType.PREMIUM))
                    .thenReturn(premium);

            assertThat(templateService.listActive(Optional.of(FileType.PREMIUM))).isSameAs(premium);
            verify(templateRepository, never()).findByActiveTrueOrderByTemplateIdAsc();
        }
    }

    @Nested
    @DisplayName("Approving proposals")
    class Approving {

        private MappingProposal proposal(ReviewStatus status) {
            List<ProposalFieldMapping> fields = new ArrayList<>();
            fields.add(new ProposalFieldMapping("policy_number", "Pol Ref", 0.9));
            fields.add(new ProposalFieldMapping("insured_name", "Client", 0.7));
            fields.add(new ProposalFieldMapping("inception_date", null, 0.0));
            return MappingProposal.builder().id(7L).fieldMappings(fields).overallConfidence(0.3)
                    .source(ProposalSource.HEURISTIC).reviewStatus(status).build();
        }

        private ApproveProposalRequest request(LinkedHashMap<String, String> overrides) {
            return ApproveProposalRequest.builder().templateId("partner_x_v1").name("Partner X")
                    .fileType("claims").columnMappings(overrides).build();
        }

        @Test
        @DisplayName("mapped proposal columns plus overrides become the template, and the proposal is approved")
        void approves() {
            LinkedHashMap<String, String> overrides = new LinkedHashMap<>();
            overrides.put("Client", "");
            overrides.put("Start", "inception_date");
            when(proposalRepository.findById(7L)).thenReturn(Optional.of(proposal(ReviewStatus.PENDING)));
            when(templateRepository.existsById("partner_x_v1")).thenReturn(false);
            when(templateRepository.saveAndFlush(any(Template.class))).thenAnswer(invocation -> invocation.getArgument(0));
            when(proposalRepository.reviewIfPending(eq(7L), eq(ReviewStatus.APPROVED), eq("partner_x_v1"),
                                                    eq(ReviewStatus.PENDING), any())).thenReturn(1);

            Template template = templateService.createFromProposal(7L, request(overrides));

            ArgumentCaptor<Template> saved = ArgumentCaptor.forClass(Template.class);
            verify(templateRepository).saveAndFlush(saved.capture());
            assertThat(saved.getValue().getColumnMappings())
                    .containsOnlyKeys("Pol Ref", "Start")
                    .containsEntry("Start", "inception_date");
            assertThat(template.getFileType()).isEqualTo(FileType.CLAIMS);
        }

        @Test
        @DisplayName("missing proposal is not found")
        void missing() {
            when(proposalRepository.findById(7L)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> templateService.createFromProposal(7L, request(null)))
                    .isInstanceOf(NotFoundException.class);
        }

        @Test
        @DisplayName("already reviewed proposal is a conflict")
        void alreadyReviewed() {
            when(proposalRepository.findById(7L)).thenReturn(Optional.of(proposal(ReviewStatus.REJECTED)));

            assertThatThrownBy(() -> templateService.createFromProposal(7L, request(null)))
                    .isInstanceOf(ConflictException.class)
                    .hasMessageContaining("REJECTED");
            verify(templateRepository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("losing a concurrent review is a conflict")
        void concurrentReview() {
            when(proposalRepository.findById(7L)).thenReturn(Optional.of(proposal(ReviewStatus.PENDING)));
            when(templateRepository.existsById("partner_x_v1")).thenReturn(false);
            when(templateRepository.saveAndFlush(any(Template.class))).thenAnswer(invocation -> invocation.getArgument(0));
            when(proposalRepository.reviewIfPending(eq(7L), any(), any(), any(), any())).thenReturn(0);

            assertThatThrownBy(() -> templateService.createFromProposal(7L, request(null)))
                    .isInstanceOf(ConflictException.class)
                    .hasMessageContaining("concurrently");
        }
    }
}
