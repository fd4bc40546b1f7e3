package com.eyelevel.bordereaux.service.pipeline;

import com.eyelevel.bordereaux.dto.template.TemplateDocument;
import com.eyelevel.bordereaux.model.BordereauxFile;
import com.eyelevel.bordereaux.model.FileStatus;
import com.eyelevel.bordereaux.model.MappingProposal;
import com.eyelevel.bordereaux.model.ReviewStatus;
import com.eyelevel.bordereaux.model.ValidationError;
import com.eyelevel.bordereaux.repository.BordereauxFileRepository;
import com.eyelevel.bordereaux.repository.BordereauxRowRepository;
import com.eyelevel.bordereaux.repository.MappingProposalRepository;
import com.eyelevel.bordereaux.repository.TemplateRepository;
import com.eyelevel.bordereaux.repository.ValidationErrorRepository;
import com.eyelevel.bordereaux.service.file.FileIntakeService;
import com.eyelevel.bordereaux.service.file.IntakeResult;
import com.eyelevel.bordereaux.service.matching.TemplateMatcher;
import com.eyelevel.bordereaux.service.template.TemplateService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.domain.PageRequest;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs files through intake, the batch run and the real repositories on the in-memory database.
 */
@SpringBootTest
class BordereauxPipelineIntegrationTest {

    private static final String TEMPLATE_ID = "acme_premium_it_v1";

    @Autowired
    private FileIntakeService fileIntakeService;

    @Autowired
    private BatchProcessingService batchProcessingService;

    @Autowired
    private TemplateService templateService;

    @Autowired
    private TemplateMatcher templateMatcher;

    @Autowired
    private TemplateRepository templateRepository;

    @Autowired
    private BordereauxFileRepository fileRepository;

    @Autowired
    private BordereauxRowRepository rowRepository;

    @Autowired
    private ValidationErrorRepository validationErrorRepository;

    @Autowired
    private MappingProposalRepository proposalRepository;

    @BeforeEach
    void setUp() {
        if (!templateRepository.existsById(TEMPLATE_ID)) {
            LinkedHashMap<String, String> mappings = new LinkedHashMap<>();
            mappings.put("Policy Number", "policy_number");
            mappings.put("Inception Date", "inception_date");
            mappings.put("Expiry Date", "expiry_date");
            mappings.put("Premium Amount", "premium_amount");
            templateService.create(TemplateDocument.builder()
                                           .templateId(TEMPLATE_ID)
                                           .name("ACME premium")
                                           .fileType("premium")
                                           .columnMappings(mappings)
                                           .build());
        }
    }

    private BordereauxFile register(String filename, String csv) {
        IntakeResult result = fileIntakeService.register(filename, "bdx@acme.example", null,
                                                         csv.getBytes(StandardCharsets.UTF_8), Optional.empty());
        assertThat(result.duplicate()).isFalse();
        return result.file();
    }

    @Test
    @DisplayName("application context wires the matcher from configuration")
    void contextLoads() {
        assertThat(templateMatcher).isNotNull();
    }

    @Test
    @DisplayName("one valid row and one row without a policy number end partially processed")
    void partiallyProcessed() {
        BordereauxFile file = register("acme_premium_june.csv", """
                Policy Number,Inception Date,Expiry Date,Premium Amount
                POL-001,2024-01-01,2024-12-31,1500.00
                ,2024-02-01,2025-01-31,900.00
                """);

        BatchRunSummary summary = batchProcessingService.processReceivedFiles();

        assertThat(summary.partiallyProcessed()).isEqualTo(1);
        BordereauxFile processed = fileRepository.findById(file.getId()).orElseThrow();
        assertThat(processed.getStatus()).isEqualTo(FileStatus.PARTIALLY_PROCESSED);
        assertThat(processed.getTotalRows()).isEqualTo(2);
        assertThat(processed.getValidRows()).isEqualTo(1);
        assertThat(processed.getErrorRows()).isEqualTo(1);
        assertThat(processed.getTemplateId()).isEqualTo(TEMPLATE_ID);
        assertThat(processed.getProcessedAt()).isNotNull();

        assertThat(rowRepository.countByFileId(file.getId())).isEqualTo(1);
        assertThat(validationErrorRepository.countByFile_Id(file.getId())).isEqualTo(1);
        List<ValidationError> errors = validationErrorRepository
                .findByFile_IdOrderByRowIndexAscIdAsc(file.getId(), PageRequest.of(0, 10)).getContent();
        assertThat(errors).singleElement().satisfies(error -> {
            assertThat(error.getFieldName()).isEqualTo("policy_number");
            assertThat(error.getErrorCode()).isEqualTo("REQUIRED_FIELD_MISSING");
        });
    }

    @Test
    @DisplayName("unknown layout ends needing a template with a pending proposal")
    void needsTemplate() {
        BordereauxFile file = register("partner_claims.csv", """
                Pol Ref,Insured Party,Loss Paid
                X-1,Jane Doe,250.00
                """);

        BatchRunSummary summary = batchProcessingService.processReceivedFiles();

        assertThat(summary.needsTemplate()).isEqualTo(1);
        BordereauxFile waiting = fileRepository.findById(file.getId()).orElseThrow();
        assertThat(waiting.getStatus()).isEqualTo(FileStatus.NEEDS_TEMPLATE);
        assertThat(waiting.getTotalRows()).isEqualTo(1);
        assertThat(rowRepository.countByFileId(file.getId())).isZero();

        List<MappingProposal> proposals = proposalRepository.findByFile_IdOrderByCreatedAtDesc(file.getId());
        assertThat(proposals).singleElement().satisfies(proposal -> {
            assertThat(proposal.getReviewStatus()).isEqualTo(ReviewStatus.PENDING);
            assertThat(proposal.getFileHeaders()).containsExactly("Pol Ref", "Insured Party", "Loss Paid");
        });
    }
}
