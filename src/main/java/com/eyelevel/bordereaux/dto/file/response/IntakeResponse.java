package com.eyelevel.bordereaux.dto.file.response;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Result of registering a file.")
public record IntakeResponse(
        FileSummaryResponse file,
        @Schema(description = "True when the same content had already been received; no new file was created.")
        boolean duplicate
) {
}
