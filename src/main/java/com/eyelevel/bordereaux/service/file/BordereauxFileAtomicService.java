package com.eyelevel.bordereaux.service.file;

import com.eyelevel.bordereaux.model.BordereauxFile;
import com.eyelevel.bordereaux.repository.BordereauxFileRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * File registration steps that must each run in their own transaction, so that a lost insert race can be
 * resolved by reading the winner.
 */
@Service
@RequiredArgsConstructor
public class BordereauxFileAtomicService {

    private final BordereauxFileRepository fileRepository;

    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public Optional<BordereauxFile> findByContentHash(String contentHash) {
        return fileRepository.findByContentHash(contentHash);
    }

    /**
     * @throws DataIntegrityViolationException if a file with the same content hash was registered concurrently.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public BordereauxFile attemptToCreate(BordereauxFile file) throws DataIntegrityViolationException {
        return fileRepository.saveAndFlush(file);
    }
}
