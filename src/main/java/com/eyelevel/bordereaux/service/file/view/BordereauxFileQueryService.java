package com.eyelevel.bordereaux.service.file.view;

import com.eyelevel.bordereaux.dto.file.response.FileDetailResponse;
import com.eyelevel.bordereaux.dto.file.response.FileSummaryResponse;
import com.eyelevel.bordereaux.dto.file.response.ValidationErrorResponse;
import com.eyelevel.bordereaux.exception.apiclient.BadRequestException;
import com.eyelevel.bordereaux.exception.apiclient.NotFoundException;
import com.eyelevel.bordereaux.model.BordereauxFile;
import com.eyelevel.bordereaux.model.FileStatus;
import com.eyelevel.bordereaux.model.Severity;
import com.eyelevel.bordereaux.repository.BordereauxFileRepository;
import com.eyelevel.bordereaux.repository.ValidationErrorRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.Map;

/**
 * Read-only queries behind the file endpoints.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class BordereauxFileQueryService {

    private final BordereauxFileRepository fileRepository;
    private final ValidationErrorRepository validationErrorRepository;

    /**
     * Files matching every given filter, newest first.
     */
    public Page<FileSummaryResponse> listFiles(FileStatus status, String sender, LocalDateTime createdFrom,
                                               LocalDateTime createdTo, int page, int size) {
        if (createdFrom != null && createdTo != null && createdFrom.isAfter(createdTo)) {
            throw new BadRequestException("'createdFrom' must not be after 'createdTo'.");
        }
        final Specification<BordereauxFile> filter = Specification
                .where(BordereauxFileSpecifications.hasStatus(status))
                .and(BordereauxFileSpecifications.senderContains(sender))
                .and(BordereauxFileSpecifications.createdFrom(createdFrom))
                .and(BordereauxFileSpecifications.createdBefore(createdTo));
        log.debug("Listing files: status={}, sender={}, createdFrom={}, createdTo={}, page={}, size={}", status,
                  sender, createdFrom, createdTo, page, size);
        return fileRepository.findAll(filter, PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "createdAt")
                                                                           .and(Sort.by(Sort.Direction.DESC, "id"))))
                             .map(FileSummaryResponse::from);
    }

    public FileDetailResponse getFile(Long fileId) {
        final BordereauxFile file = findFile(fileId);
        final Map<Severity, Long> bySeverity = new EnumMap<>(Severity.class);
        for (Object[] row : validationErrorRepository.countBySeverity(fileId)) {
            bySeverity.put((Severity) row[0], ((Number) row[1]).longValue());
        }
        return FileDetailResponse.from(file, bySeverity);
    }

    /**
     * Validation errors of the file's last run, ordered by row index and then by insertion order.
     */
    public Page<ValidationErrorResponse> getValidationErrors(Long fileId, int page, int size) {
        findFile(fileId);
        return validationErrorRepository.findByFile_IdOrderByRowIndexAscIdAsc(fileId, PageRequest.of(page, size))
                                        .map(ValidationErrorResponse::from);
    }

    private BordereauxFile findFile(Long fileId) {
        return fileRepository.findById(fileId).orElseThrow(
                () -> new NotFoundException("File with ID " + fileId + " not found."));
    }
}
