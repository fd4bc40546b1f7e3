package com.eyelevel.bordereaux.service.pipeline;

import com.eyelevel.bordereaux.exception.BordereauxProcessingException;
import com.eyelevel.bordereaux.model.FileStatus;
import com.eyelevel.bordereaux.repository.BordereauxFileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * Status writes for a {@code BordereauxFile}, each committed in its own transaction so that progress is visible
 * to other instances as soon as it happens. Every write is a compare-and-set on the current status.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FileStatusService {

    private final BordereauxFileRepository fileRepository;

    /**
     * Moves a file from RECEIVED to MATCHING.
     *
     * @return {@code true} if this caller owns the run, {@code false} if another worker claimed it first or the
     *         file is no longer RECEIVED.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean claim(final Long fileId) {
        final FileStatus target = FileStatus.RECEIVED.transitionTo(FileStatus.MATCHING);
        return fileRepository.updateStatusIfExpected(fileId, target, FileStatus.RECEIVED, LocalDateTime.now()) == 1;
    }

    /**
     * Advances a claimed file by one stage.
     *
     * @throws com.eyelevel.bordereaux.exception.InvalidStatusTransitionException if the move is not defined
     * @throws BordereauxProcessingException if the file was not in {@code from} any more
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public FileStatus advance(final Long fileId, final FileStatus from, final FileStatus to) {
        final FileStatus target = from.transitionTo(to);
        if (fileRepository.updateStatusIfExpected(fileId, target, from, LocalDateTime.now()) != 1) {
            throw new BordereauxProcessingException(String.format(
                    "File %d left status %s before it could move to %s.", fileId, from, target));
        }
        log.debug("File {} moved {} -> {}.", fileId, from, target);
        return target;
    }

    /**
     * Moves a file to FAILED if it is still in {@code expected}.
     *
     * @return {@code true} if the status was written.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean markFailed(final Long fileId, final FileStatus expected, final String errorMessage) {
        final FileStatus target = expected.transitionTo(FileStatus.FAILED);
        final int updated = fileRepository.failIfInStatus(fileId, expected, target, errorMessage,
                                                          LocalDateTime.now());
        if (updated == 0) {
            log.warn("File {} was no longer {} and was not marked FAILED.", fileId, expected);
        }
        return updated == 1;
    }
}
