package com.eyelevel.bordereaux.dto.file.response;

import com.eyelevel.bordereaux.model.Severity;
import com.eyelevel.bordereaux.model.ValidationError;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "One rule violation on one row.")
public record ValidationErrorResponse(
        Long id,
        @Schema(description = "0-based index of the data row in the source file.", example = "7") int rowIndex,
        @Schema(example = "policy_number") String fieldName,
        @Schema(example = "required_policy_number") String ruleName,
        @Schema(example = "REQUIRED_FIELD_MISSING") String errorCode,
        Severity severity,
        @Schema(example = "Required field 'policy_number' is missing or null") String message,
        String fieldValue
) {

    public static ValidationErrorResponse from(ValidationError error) {
        return new ValidationErrorResponse(error.getId(), error.getRowIndex(), error.getFieldName(),
                                           error.getRuleName(), error.getErrorCode(), error.getSeverity(),
                                           error.getMessage(), error.getFieldValue());
    }
}
