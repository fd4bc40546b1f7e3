package com.eyelevel.bordereaux.dto.file.response;

import com.eyelevel.bordereaux.model.FileStatus;
import com.eyelevel.bordereaux.service.pipeline.ProcessingOutcome;

public record ProcessingOutcomeResponse(Long fileId, FileStatus status, int totalRows, int validRows,
                                        int errorRows, String templateId, String message) {

    public static ProcessingOutcomeResponse from(ProcessingOutcome outcome) {
        return new ProcessingOutcomeResponse(outcome.fileId(), outcome.status(), outcome.totalRows(),
                                             outcome.validRows(), outcome.errorRows(), outcome.templateId(),
                                             outcome.message());
    }
}
