package com.eyelevel.bordereaux.service.pipeline;

import com.eyelevel.bordereaux.exception.BordereauxProcessingException;
import com.eyelevel.bordereaux.exception.ReprocessFailedException;
import com.eyelevel.bordereaux.model.BordereauxFile;
import com.eyelevel.bordereaux.model.BordereauxRow;
import com.eyelevel.bordereaux.model.FileStatus;
import com.eyelevel.bordereaux.model.FileType;
import com.eyelevel.bordereaux.model.MappingProposal;
import com.eyelevel.bordereaux.model.ProposalSource;
import com.eyelevel.bordereaux.model.ReviewStatus;
import com.eyelevel.bordereaux.model.Severity;
import com.eyelevel.bordereaux.model.Template;
import com.eyelevel.bordereaux.model.ValidationError;
import com.eyelevel.bordereaux.model.canonical.CanonicalField;
import com.eyelevel.bordereaux.repository.BordereauxFileRepository;
import com.eyelevel.bordereaux.repository.BordereauxRowRepository;
import com.eyelevel.bordereaux.repository.MappingProposalRepository;
import com.eyelevel.bordereaux.repository.ValidationErrorRepository;
import com.eyelevel.bordereaux.service.mapping.CanonicalRow;
import com.eyelevel.bordereaux.service.suggestion.FieldSuggestion;
import com.eyelevel.bordereaux.service.suggestion.MappingSuggestion;
import com.eyelevel.bordereaux.service.suggestion.SuggestionContext;
import com.eyelevel.bordereaux.service.validation.ErrorCode;
import com.eyelevel.bordereaux.service.validation.RowValidationResult;
import com.eyelevel.bordereaux.service.validation.RuleViolation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PipelinePersistenceServiceTest {

    private static final Long FILE_ID = 9L;

    @Mock
    private BordereauxFileRepository fileRepository;

    @Mock
    private BordereauxRowRepository rowRepository;

    @Mock
    private ValidationErrorRepository validationErrorRepository;

    @Mock
    private MappingProposalRepository proposalRepository;

    @InjectMocks
    private PipelinePersistenceService persistenceService;

    private final Template template = Template.builder().templateId("premium_bordereaux_1").name("Premium")
            .fileType(FileType.PREMIUM).build();

    @BeforeEach
    void setUp() {
        lenient().when(fileRepository.getReferenceById(FILE_ID))
                .thenReturn(BordereauxFile.builder().id(FILE_ID).build());
    }

    private static RowValidationResult valid(int index, String policy) {
        CanonicalRow row = new CanonicalRow(index, Map.of("policy_number", policy,
                                                          "premium_amount", new BigDecimal("10.00")),
                                            Map.of(), Map.of("POLICY_NO", policy));
        return new RowValidationResult(row, List.of());
    }

    private static RowValidationResult invalid(int index) {
        CanonicalRow row = new CanonicalRow(index, Map.of(), Map.of(), Map.of("POLICY_NO", ""));
        RuleViolation violation = new RuleViolation(index, "policy_number", "required_policy_number",
                                                    ErrorCode.REQUIRED_FIELD_MISSING, Severity.ERROR,
                                                    "Required field 'policy_number' is missing or null", null);
        return new RowValidationResult(row, List.of(violation));
    }

    @Nested
    @DisplayName("Persisting matched results")
    class PersistResults {

        @Test
        @DisplayName("valid rows and all violations are written and the run completes")
        void writesRowsAndErrors() {
            when(fileRepository.completeRun(eq(FILE_ID), eq(FileStatus.PERSISTING),
                                            eq(FileStatus.PARTIALLY_PROCESSED), eq(2), eq(1), eq(1),
                                            eq("premium_bordereaux_1"), isNull(), any())).thenReturn(1);

            ProcessingOutcome outcome = persistenceService.persistResults(FILE_ID, template,
                                                                          List.of(valid(0, "P-1"), invalid(1)));

            assertThat(outcome.status()).isEqualTo(FileStatus.PARTIALLY_PROCESSED);
            verify(rowRepository).deleteByFileId(FILE_ID);
            verify(validationErrorRepository).deleteByFileId(FILE_ID);

            @SuppressWarnings("unchecked")
            ArgumentCaptor<List<BordereauxRow>> rows = ArgumentCaptor.forClass(List.class);
            verify(rowRepository).saveAllAndFlush(rows.capture());
            assertThat(rows.getValue()).singleElement().satisfies(row -> {
                assertThat(row.getPolicyNumber()).isEqualTo("P-1");
                assertThat(row.getPremiumAmount()).isEqualByComparingTo("10.00");
                assertThat(row.getRowIndex()).isZero();
                assertThat(row.getRawData()).containsEntry("POLICY_NO", "P-1");
            });

            @SuppressWarnings("unchecked")
            ArgumentCaptor<List<ValidationError>> errors = ArgumentCaptor.forClass(List.class);
            verify(validationErrorRepository).saveAllAndFlush(errors.capture());
            assertThat(errors.getValue()).singleElement().satisfies(error -> {
                assertThat(error.getRowIndex()).isEqualTo(1);
                assertThat(error.getErrorCode()).isEqualTo("REQUIRED_FIELD_MISSING");
                assertThat(error.getRuleName()).isEqualTo("required_policy_number");
            });
        }

        @Test
        @DisplayName("no valid row fails the file with an explanatory message")
        void allInvalid() {
            when(fileRepository.completeRun(eq(FILE_ID), eq(FileStatus.PERSISTING), eq(FileStatus.FAILED), eq(2),
                                            eq(0), eq(2), eq("premium_bordereaux_1"),
                                            eq("No valid rows: all 2 rows failed validation"), any())).thenReturn(1);

            ProcessingOutcome outcome = persistenceService.persistResults(FILE_ID, template,
                                                                          List.of(invalid(0), invalid(1)));

            assertThat(outcome.status()).isEqualTo(FileStatus.FAILED);
            assertThat(outcome.message()).isEqualTo("No valid rows: all 2 rows failed validation");
        }

        @Test
        @DisplayName("losing the final status write aborts the transaction")
        void lostFinalWrite() {
            when(fileRepository.completeRun(any(), any(), any(), anyInt(), anyInt(), anyInt(), any(), any(), any()))
                    .thenReturn(0);

            assertThatThrownBy(() -> persistenceService.persistResults(FILE_ID, template, List.of(valid(0, "P-1"))))
                    .isInstanceOf(BordereauxProcessingException.class)
                    .hasMessageContaining("left PERSISTING");
        }
    }

    @Nested
    @DisplayName("Persisting proposals")
    class PersistProposal {

        @Test
        @DisplayName("pending proposal is stored and the file needs a template")
        void storesProposal() {
            MappingSuggestion suggestion = MappingSuggestion.of(
                    Map.of(CanonicalField.POLICY_NUMBER,
                           new FieldSuggestion(CanonicalField.POLICY_NUMBER, "Pol Ref", 0.9)),
                    ProposalSource.AI, "policy reference column");
            SuggestionContext context = new SuggestionContext(List.of("Pol Ref", "Other"), List.of(), "x.csv",
                                                              "ops@mga.example", "March bdx");
            when(proposalRepository.saveAndFlush(any(MappingProposal.class)))
                    .thenAnswer(invocation -> invocation.getArgument(0));
            when(fileRepository.completeRun(eq(FILE_ID), eq(FileStatus.SUGGESTING), eq(FileStatus.NEEDS_TEMPLATE),
                                            eq(5), eq(0), eq(0), isNull(), isNull(), any())).thenReturn(1);

            ProcessingOutcome outcome = persistenceService.persistProposal(FILE_ID, context, suggestion, 5);

            assertThat(outcome.status()).isEqualTo(FileStatus.NEEDS_TEMPLATE);
            assertThat(outcome.totalRows()).isEqualTo(5);
            ArgumentCaptor<MappingProposal> proposal = ArgumentCaptor.forClass(MappingProposal.class);
            verify(proposalRepository).saveAndFlush(proposal.capture());
            assertThat(proposal.getValue().getReviewStatus()).isEqualTo(ReviewStatus.PENDING);
            assertThat(proposal.getValue().getFieldMappings()).hasSize(CanonicalField.values().length);
            assertThat(proposal.getValue().mappedColumns()).containsExactly(Map.entry("Pol Ref", "policy_number"));
            assertThat(proposal.getValue().getFileHeaders()).containsExactly("Pol Ref", "Other");
            assertThat(proposal.getValue().getSender()).isEqualTo("ops@mga.example");
        }
    }

    @Nested
    @DisplayName("Resetting for reprocess")
    class Reset {

        @Test
        @DisplayName("lost reset is a reprocess failure")
        void lostReset() {
            when(fileRepository.resetForReprocess(eq(FILE_ID), eq(FileStatus.FAILED), eq(FileStatus.RECEIVED), any()))
                    .thenReturn(0);

            assertThatThrownBy(() -> persistenceService.resetForReprocess(FILE_ID, FileStatus.FAILED))
                    .isInstanceOf(ReprocessFailedException.class);
        }
    }

    @ParameterizedTest(name = "{0} rows, {1} valid -> {2}")
    @CsvSource({"3,3,PROCESSED", "3,1,PARTIALLY_PROCESSED", "3,0,FAILED", "0,0,PROCESSED"})
    @DisplayName("terminal status follows the valid-row count")
    void terminalStatus(int total, int valid, FileStatus expected) {
        assertThat(PipelinePersistenceService.terminalStatus(total, valid)).isEqualTo(expected);
    }
}
