package com.eyelevel.bordereaux.service.pipeline;

import com.eyelevel.bordereaux.config.BordereauxProcessingConfig;
import com.eyelevel.bordereaux.exception.BordereauxProcessingException;
import com.eyelevel.bordereaux.model.BordereauxFile;
import com.eyelevel.bordereaux.model.FileStatus;
import com.eyelevel.bordereaux.model.FileType;
import com.eyelevel.bordereaux.model.Template;
import com.eyelevel.bordereaux.repository.BordereauxFileRepository;
import com.eyelevel.bordereaux.service.decoder.DecodedTable;
import com.eyelevel.bordereaux.service.decoder.TabularFileDecoderFactory;
import com.eyelevel.bordereaux.service.mapping.CanonicalRow;
import com.eyelevel.bordereaux.service.mapping.ColumnMapper;
import com.eyelevel.bordereaux.service.matching.MatchResult;
import com.eyelevel.bordereaux.service.matching.TemplateMatcher;
import com.eyelevel.bordereaux.service.storage.BlobStore;
import com.eyelevel.bordereaux.service.suggestion.MappingSuggestion;
import com.eyelevel.bordereaux.service.suggestion.MappingSuggestionService;
import com.eyelevel.bordereaux.service.suggestion.SuggestionContext;
import com.eyelevel.bordereaux.service.template.TemplateService;
import com.eyelevel.bordereaux.service.validation.RowValidationResult;
import com.eyelevel.bordereaux.service.validation.ValidationEngine;
import com.eyelevel.bordereaux.service.validation.rule.RuleSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Runs one file through the pipeline:
 *
 * <pre>
 * RECEIVED -> MATCHING -> MAPPING -> VALIDATING -> PERSISTING -> PROCESSED | PARTIALLY_PROCESSED | FAILED
 *                      -> SUGGESTING -> NEEDS_TEMPLATE
 * </pre>
 *
 * Every stage change is committed before the stage starts. Any exception stops the run and moves the file
 * from whatever stage it reached to FAILED; it never escapes {@link #process(Long)}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BordereauxPipelineService {

    private final BordereauxFileRepository fileRepository;
    private final FileStatusService fileStatusService;
    private final PipelinePersistenceService persistenceService;
    private final BlobStore blobStore;
    private final TabularFileDecoderFactory decoderFactory;
    private final TemplateService templateService;
    private final TemplateMatcher templateMatcher;
    private final ColumnMapper columnMapper;
    private final ValidationEngine validationEngine;
    private final RuleSet ruleSet;
    private final MappingSuggestionService suggestionService;
    private final BordereauxProcessingConfig processingConfig;

    public ProcessingOutcome process(final Long fileId) {
        if (!fileStatusService.claim(fileId)) {
            log.warn("File {} could not be claimed; another run owns it or it is no longer RECEIVED.", fileId);
            return ProcessingOutcome.skipped(fileId);
        }
        log.info("Pipeline started for file {}.", fileId);

        final StageTracker stage = new StageTracker(fileId, FileStatus.MATCHING);
        try {
            final ProcessingOutcome outcome = run(fileId, stage);
            log.info("Pipeline finished for file {}: {} ({} rows, {} valid, {} invalid).", fileId, outcome.status(),
                     outcome.totalRows(), outcome.validRows(), outcome.errorRows());
            return outcome;
        } catch (RuntimeException e) {
            final String message = describe(e);
            log.error("Pipeline failed for file {} during {}: {}", fileId, stage.current, message, e);
            fileStatusService.markFailed(fileId, stage.current, message);
            return ProcessingOutcome.failed(fileId, message);
        }
    }

    private ProcessingOutcome run(final Long fileId, final StageTracker stage) {
        final BordereauxFile file = fileRepository.findById(fileId).orElseThrow(
                () -> new BordereauxProcessingException("File " + fileId + " disappeared after it was claimed."));

        final byte[] content = blobStore.fetch(file.getContentHash());
        final DecodedTable table = decoderFactory.decode(file.getFilename(), content);
        log.debug("File {} decoded: {} headers, {} rows.", fileId, table.headers().size(), table.rowCount());

        final Optional<FileType> hint = file.getFileType() == null ? Optional.empty() : file.getFileType().asHint();
        final MatchResult match = templateMatcher.match(table.headers(), hint, templateService.listActive(hint));

        if (match.isMatch()) {
            return runMatched(file, table, match.template(), match.score(), stage);
        }
        log.info("No template matched file {} (best score {}); generating a mapping proposal.", fileId,
                 String.format("%.2f", match.score()));
        return runSuggestion(file, table, stage);
    }

    private ProcessingOutcome runMatched(final BordereauxFile file, final DecodedTable table, final Template template,
                                         final double score, final StageTracker stage) {
        log.info("File {} matched template '{}' with score {}.", file.getId(), template.getTemplateId(),
                 String.format("%.2f", score));

        stage.advance(FileStatus.MAPPING);
        final List<CanonicalRow> rows = columnMapper.mapRows(template, table.headers(), table.rows());

        stage.advance(FileStatus.VALIDATING);
        final List<RowValidationResult> results = validationEngine.validateAll(ruleSet, rows);

        stage.advance(FileStatus.PERSISTING);
        return persistenceService.persistResults(file.getId(), template, results);
    }

    private ProcessingOutcome runSuggestion(final BordereauxFile file, final DecodedTable table,
                                            final StageTracker stage) {
        stage.advance(FileStatus.SUGGESTING);
        final int sampleSize = Math.max(0, processingConfig.getSuggestion().getSampleRows());
        final SuggestionContext context = new SuggestionContext(
                table.headers(), table.rows().subList(0, Math.min(sampleSize, table.rowCount())),
                file.getFilename(), file.getSender(), file.getSubject());
        final MappingSuggestion suggestion = suggestionService.suggest(context);
        return persistenceService.persistProposal(file.getId(), context, suggestion, table.rowCount());
    }

    private static String describe(final RuntimeException e) {
        final String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    /**
     * The stage a run has reached, so that a failure is recorded against the status actually stored.
     */
    private final class StageTracker {
        private final Long fileId;
        private FileStatus current;

        private StageTracker(final Long fileId, final FileStatus initial) {
            this.fileId = fileId;
            this.current = initial;
        }

        private void advance(final FileStatus next) {
            current = fileStatusService.advance(fileId, current, next);
        }
    }
}
