package com.eyelevel.bordereaux.dto.file.response;

import com.eyelevel.bordereaux.model.BordereauxFile;
import com.eyelevel.bordereaux.model.FileStatus;
import com.eyelevel.bordereaux.model.FileType;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDateTime;

@Schema(description = "One row of the file list.")
public record FileSummaryResponse(
        @Schema(example = "42") Long id,
        @Schema(example = "acme_premium_2024_06.xlsx") String filename,
        @Schema(example = "bdx@acme-insurance.com") String sender,
        FileType fileType,
        FileStatus status,
        @Schema(description = "Template used by the last run, if one matched.", example = "acme_premium_v1")
        String templateId,
        int totalRows,
        int validRows,
        int errorRows,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {

    public static FileSummaryResponse from(BordereauxFile file) {
        return new FileSummaryResponse(file.getId(), file.getFilename(), file.getSender(), file.getFileType(),
                                       file.getStatus(), file.getTemplateId(), file.getTotalRows(),
                                       file.getValidRows(), file.getErrorRows(), file.getCreatedAt(),
                                       file.getUpdatedAt());
    }
}
