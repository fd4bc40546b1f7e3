package com.eyelevel.bordereaux.service.pipeline;

import com.eyelevel.bordereaux.model.FileStatus;

/**
 * Result of one pipeline run for one file. {@code status} is {@code null} when the run was skipped because
 * another worker had already claimed the file.
 */
public record ProcessingOutcome(Long fileId, FileStatus status, int totalRows, int validRows, int errorRows,
                                String templateId, String message) {

    public static ProcessingOutcome skipped(final Long fileId) {
        return new ProcessingOutcome(fileId, null, 0, 0, 0, null, "File was not in RECEIVED; run skipped");
    }

    public static ProcessingOutcome failed(final Long fileId, final String message) {
        return new ProcessingOutcome(fileId, FileStatus.FAILED, 0, 0, 0, null, message);
    }

    public boolean isSkipped() {
        return status == null;
    }
}
