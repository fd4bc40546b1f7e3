package com.eyelevel.bordereaux.dto.file.response;

import com.eyelevel.bordereaux.model.BordereauxFile;
import com.eyelevel.bordereaux.model.FileStatus;
import com.eyelevel.bordereaux.model.FileType;
import com.eyelevel.bordereaux.model.Severity;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDateTime;
import java.util.Map;

@Schema(description = "A file with the statistics of its last run.")
public record FileDetailResponse(
        Long id,
        String filename,
        String sender,
        String subject,
        FileType fileType,
        FileStatus status,
        @Schema(description = "SHA-256 of the stored content.") String contentHash,
        Long fileSize,
        String templateId,
        int totalRows,
        int validRows,
        int errorRows,
        @Schema(description = "Why the last run failed, if it did.") String errorMessage,
        @Schema(description = "Validation errors of the last run, by severity.", example = "{\"ERROR\": 3, \"WARNING\": 1}")
        Map<Severity, Long> errorCountBySeverity,
        LocalDateTime processedAt,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {

    public static FileDetailResponse from(BordereauxFile file, Map<Severity, Long> errorCountBySeverity) {
        return new FileDetailResponse(file.getId(), file.getFilename(), file.getSender(), file.getSubject(),
                                      file.getFileType(), file.getStatus(), file.getContentHash(),
                                      file.getFileSize(), file.getTemplateId(), file.getTotalRows(),
                                      file.getValidRows(), file.getErrorRows(), file.getErrorMessage(),
                                      errorCountBySeverity, file.getProcessedAt(), file.getCreatedAt(),
                                      file.getUpdatedAt());
    }
}
