package com.eyelevel.bordereaux.service.pipeline;

import com.eyelevel.bordereaux.exception.BordereauxProcessingException;
import com.eyelevel.bordereaux.exception.ReprocessFailedException;
import com.eyelevel.bordereaux.model.BordereauxFile;
import com.eyelevel.bordereaux.model.BordereauxRow;
import com.eyelevel.bordereaux.model.FileStatus;
import com.eyelevel.bordereaux.model.MappingProposal;
import com.eyelevel.bordereaux.model.ProposalFieldMapping;
import com.eyelevel.bordereaux.model.ReviewStatus;
import com.eyelevel.bordereaux.model.Template;
import com.eyelevel.bordereaux.model.ValidationError;
import com.eyelevel.bordereaux.model.canonical.CanonicalField;
import com.eyelevel.bordereaux.repository.BordereauxFileRepository;
import com.eyelevel.bordereaux.repository.BordereauxRowRepository;
import com.eyelevel.bordereaux.repository.MappingProposalRepository;
import com.eyelevel.bordereaux.repository.ValidationErrorRepository;
import com.eyelevel.bordereaux.service.mapping.CanonicalRow;
import com.eyelevel.bordereaux.service.suggestion.MappingSuggestion;
import com.eyelevel.bordereaux.service.suggestion.SuggestionContext;
import com.eyelevel.bordereaux.service.validation.RowValidationResult;
import com.eyelevel.bordereaux.service.validation.RuleViolation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Final writes of a pipeline run. Each method is one transaction: the rows, errors or proposal it writes and
 * the terminal status with its counters either all commit or none do.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelinePersistenceService {

    private final BordereauxFileRepository fileRepository;
    private final BordereauxRowRepository rowRepository;
    private final ValidationErrorRepository validationErrorRepository;
    private final MappingProposalRepository proposalRepository;

    /**
     * Writes the valid rows and every violation, then moves the file from PERSISTING to its terminal status.
     * Rows from an earlier run of the same file are replaced.
     */
    @Transactional
    public ProcessingOutcome persistResults(final Long fileId, final Template template,
                                            final List<RowValidationResult> results) {
        final BordereauxFile file = fileRepository.getReferenceById(fileId);
        rowRepository.deleteByFileId(fileId);
        validationErrorRepository.deleteByFileId(fileId);

        final List<BordereauxRow> validRows = new ArrayList<>();
        final List<ValidationError> errors = new ArrayList<>();
        for (RowValidationResult result : results) {
            if (result.isValid()) {
                validRows.add(toEntity(file, result.row()));
            }
            for (RuleViolation violation : result.violations()) {
                errors.add(toEntity(file, violation));
            }
        }
        rowRepository.saveAllAndFlush(validRows);
        validationErrorRepository.saveAllAndFlush(errors);

        final int total = results.size();
        final int valid = validRows.size();
        final int invalid = total - valid;
        final FileStatus terminal = terminalStatus(total, valid);
        final String errorMessage = terminal == FileStatus.FAILED
                ? String.format("No valid rows: all %d rows failed validation", total)
                : null;

        final int updated = fileRepository.completeRun(fileId, FileStatus.PERSISTING,
                                                       FileStatus.PERSISTING.transitionTo(terminal), total, valid,
                                                       invalid, template.getTemplateId(), errorMessage,
                                                       LocalDateTime.now());
        if (updated != 1) {
            throw new BordereauxProcessingException(
                    "File " + fileId + " left PERSISTING before its results could be committed.");
        }
        log.info("File {} persisted with template '{}': {} rows, {} valid, {} invalid, {} validation errors -> {}.",
                 fileId, template.getTemplateId(), total, valid, invalid, errors.size(), terminal);
        return new ProcessingOutcome(fileId, terminal, total, valid, invalid, template.getTemplateId(),
                                     errorMessage);
    }

    /**
     * Stores a pending proposal and moves the file from SUGGESTING to NEEDS_TEMPLATE.
     */
    @Transactional
    public ProcessingOutcome persistProposal(final Long fileId, final SuggestionContext context,
                                             final MappingSuggestion suggestion, final int decodedRows) {
        final List<ProposalFieldMapping> fieldMappings = suggestion.fields().stream()
                .map(field -> new ProposalFieldMapping(field.field().getFieldName(), field.rawHeader(),
                                                       field.confidence()))
                .toList();
        final MappingProposal proposal = MappingProposal.builder()
                .file(fileRepository.getReferenceById(fileId))
                .fieldMappings(new ArrayList<>(fieldMappings))
                .overallConfidence(suggestion.overallConfidence())
                .source(suggestion.source())
                .reviewStatus(ReviewStatus.PENDING)
                .fileHeaders(new ArrayList<>(context.headers()))
                .reasoning(suggestion.reasoning())
                .sourceFilename(context.filename())
                .sender(context.sender())
                .subject(context.subject())
                .build();
        final MappingProposal saved = proposalRepository.saveAndFlush(proposal);

        final int updated = fileRepository.completeRun(fileId, FileStatus.SUGGESTING,
                                                       FileStatus.SUGGESTING.transitionTo(FileStatus.NEEDS_TEMPLATE),
                                                       decodedRows, 0, 0, null, null, LocalDateTime.now());
        if (updated != 1) {
            throw new BordereauxProcessingException(
                    "File " + fileId + " left SUGGESTING before its proposal could be committed.");
        }
        log.info("File {} needs a template; proposal {} stored ({} source, {} fields mapped).", fileId,
                 saved.getId(), suggestion.source(), suggestion.mappedCount());
        return new ProcessingOutcome(fileId, FileStatus.NEEDS_TEMPLATE, decodedRows, 0, 0, null,
                                     "Mapping proposal " + saved.getId() + " awaits review");
    }

    /**
     * Discards a finished run's rows and errors and puts the file back to RECEIVED with cleared counters.
     * Mapping proposals are kept.
     *
     * @throws ReprocessFailedException if the file was no longer in {@code expected}; the transaction rolls back
     */
    @Transactional
    public void resetForReprocess(final Long fileId, final FileStatus expected) {
        final FileStatus target = expected.transitionTo(FileStatus.RECEIVED);
        final int rows = rowRepository.deleteByFileId(fileId);
        final int errors = validationErrorRepository.deleteByFileId(fileId);
        if (fileRepository.resetForReprocess(fileId, expected, target, LocalDateTime.now()) != 1) {
            throw new ReprocessFailedException(
                    "File " + fileId + " changed status while it was being reset; nothing was discarded.");
        }
        log.info("File {} reset from {} to RECEIVED; discarded {} rows and {} validation errors.", fileId, expected,
                 rows, errors);
    }

    static FileStatus terminalStatus(final int total, final int valid) {
        if (valid == total) {
            return FileStatus.PROCESSED;
        }
        return valid == 0 ? FileStatus.FAILED : FileStatus.PARTIALLY_PROCESSED;
    }

    private static BordereauxRow toEntity(final BordereauxFile file, final CanonicalRow row) {
        return BordereauxRow.builder()
                .file(file)
                .rowIndex(row.getRowIndex())
                .policyNumber(row.getString(CanonicalField.POLICY_NUMBER.getFieldName()).orElse(null))
                .insuredName(row.getString(CanonicalField.INSURED_NAME.getFieldName()).orElse(null))
                .inceptionDate(row.getDate(CanonicalField.INCEPTION_DATE.getFieldName()).orElse(null))
                .expiryDate(row.getDate(CanonicalField.EXPIRY_DATE.getFieldName()).orElse(null))
                .premiumAmount(row.getDecimal(CanonicalField.PREMIUM_AMOUNT.getFieldName()).orElse(null))
                .currency(row.getString(CanonicalField.CURRENCY.getFieldName()).orElse(null))
                .claimAmount(row.getDecimal(CanonicalField.CLAIM_AMOUNT.getFieldName()).orElse(null))
                .commissionAmount(row.getDecimal(CanonicalField.COMMISSION_AMOUNT.getFieldName()).orElse(null))
                .netPremium(row.getDecimal(CanonicalField.NET_PREMIUM.getFieldName()).orElse(null))
                .brokerName(row.getString(CanonicalField.BROKER_NAME.getFieldName()).orElse(null))
                .productType(row.getString(CanonicalField.PRODUCT_TYPE.getFieldName()).orElse(null))
                .coverageType(row.getString(CanonicalField.COVERAGE_TYPE.getFieldName()).orElse(null))
                .riskLocation(row.getString(CanonicalField.RISK_LOCATION.getFieldName()).orElse(null))
                .rawData(new LinkedHashMap<>(row.getRawCells()))
                .build();
    }

    private static ValidationError toEntity(final BordereauxFile file, final RuleViolation violation) {
        return ValidationError.builder()
                .file(file)
                .rowIndex(violation.rowIndex())
                .fieldName(violation.field())
                .ruleName(violation.ruleName())
                .errorCode(violation.errorCode().name())
                .severity(violation.severity())
                .message(violation.message())
                .fieldValue(violation.value())
                .build();
    }
}
