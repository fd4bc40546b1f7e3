package com.eyelevel.bordereaux.service.file;

import com.eyelevel.bordereaux.exception.ReprocessFailedException;
import com.eyelevel.bordereaux.exception.apiclient.NotFoundException;
import com.eyelevel.bordereaux.model.BordereauxFile;
import com.eyelevel.bordereaux.repository.BordereauxFileRepository;
import com.eyelevel.bordereaux.service.pipeline.BordereauxPipelineService;
import com.eyelevel.bordereaux.service.pipeline.PipelinePersistenceService;
import com.eyelevel.bordereaux.service.pipeline.ProcessingOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Forced reprocessing of a finished file: the previous run's output is discarded, the file goes back to
 * RECEIVED and the pipeline runs again straight away.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReprocessService {

    private final BordereauxFileRepository fileRepository;
    private final PipelinePersistenceService persistenceService;
    private final BordereauxPipelineService pipelineService;

    /**
     * @throws NotFoundException        if the file does not exist
     * @throws ReprocessFailedException if the file is not in a terminal state
     */
    public ProcessingOutcome reprocess(final Long fileId) {
        log.info("Attempting to reprocess file ID: {}", fileId);
        final BordereauxFile file = fileRepository.findById(fileId).orElseThrow(
                () -> new NotFoundException("File with ID " + fileId + " not found."));

        if (!file.getStatus().isTerminal()) {
            throw new ReprocessFailedException("Cannot reprocess: file " + fileId + " is still " + file.getStatus()
                                               + ". Only finished files can be reprocessed.");
        }

        persistenceService.resetForReprocess(fileId, file.getStatus());
        final ProcessingOutcome outcome = pipelineService.process(fileId);
        log.info("Reprocessing of file {} ended in {}.", fileId,
                 outcome.isSkipped() ? "a skipped run" : outcome.status());
        return outcome;
    }
}
