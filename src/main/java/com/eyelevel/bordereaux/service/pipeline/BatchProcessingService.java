package com.eyelevel.bordereaux.service.pipeline;

import com.eyelevel.bordereaux.model.FileStatus;
import com.eyelevel.bordereaux.repository.BordereauxFileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Processes every RECEIVED file, one after another. A failing file never stops the batch.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchProcessingService {

    private final BordereauxFileRepository fileRepository;
    private final BordereauxPipelineService pipelineService;

    public BatchRunSummary processReceivedFiles() {
        final List<Long> fileIds = fileRepository.findIdsByStatus(FileStatus.RECEIVED);
        if (fileIds.isEmpty()) {
            log.debug("No RECEIVED files to process.");
            return BatchRunSummary.empty();
        }
        log.info("Batch run started for {} RECEIVED files.", fileIds.size());

        final List<ProcessingOutcome> outcomes = new ArrayList<>(fileIds.size());
        for (final Long fileId : fileIds) {
            try {
                outcomes.add(pipelineService.process(fileId));
            } catch (RuntimeException e) {
                // The pipeline records its own failures; this only happens when that bookkeeping itself failed.
                log.error("Unhandled error while processing file {}. Continuing with the next file.", fileId, e);
                outcomes.add(ProcessingOutcome.failed(fileId, e.getMessage()));
            }
        }

        final BatchRunSummary summary = BatchRunSummary.of(outcomes);
        log.info("Batch run finished: {} processed, {} partially processed, {} need a template, {} failed, "
                 + "{} skipped.", summary.processed(), summary.partiallyProcessed(), summary.needsTemplate(),
                 summary.failed(), summary.skipped());
        return summary;
    }
}
