package com.eyelevel.bordereaux.controller;

import com.eyelevel.bordereaux.dto.common.ApiResponse;
import com.eyelevel.bordereaux.dto.file.response.FileDetailResponse;
import com.eyelevel.bordereaux.dto.file.response.FileSummaryResponse;
import com.eyelevel.bordereaux.dto.file.response.IntakeResponse;
import com.eyelevel.bordereaux.dto.file.response.ProcessingOutcomeResponse;
import com.eyelevel.bordereaux.dto.file.response.ValidationErrorResponse;
import com.eyelevel.bordereaux.model.FileStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.data.domain.Page;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.multipart.MultipartFile;

import java.time.LocalDateTime;

@Tag(name = "Bordereaux Files", description = "Intake, inspection and reprocessing of received bordereaux.")
public interface BordereauxFileApi {

    @Operation(summary = "Register a File",
            description = "Stores an uploaded bordereau and registers it as RECEIVED. The next batch run processes it. Content that was already received returns the existing file.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "File registered.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Success", value = """
                                    {
                                        "displayMessage": "File registered and queued for processing.",
                                        "response": {
                                            "file": {
                                                "id": 42,
                                                "filename": "acme_premium_2024_06.xlsx",
                                                "sender": "bdx@acme-insurance.com",
                                                "fileType": "PREMIUM",
                                                "status": "RECEIVED",
                                                "totalRows": 0,
                                                "validRows": 0,
                                                "errorRows": 0
                                            },
                                            "duplicate": false
                                        },
                                        "showMessage": true,
                                        "statusCode": 201
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "The same content was already registered.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Empty file or unsupported file type.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<IntakeResponse>> registerFile(
            @Parameter(description = "The bordereau: csv, txt, xlsx or xls.", required = true)
            @RequestPart("file") MultipartFile file,
            @Parameter(description = "Sender of the email the file came with.", example = "bdx@acme-insurance.com")
            @RequestParam(value = "sender", required = false) String sender,
            @Parameter(description = "Subject of the email the file came with. Used to infer the file type.", example = "June premium bordereau")
            @RequestParam(value = "subject", required = false) String subject,
            @Parameter(description = "claims, premium or exposure. Inferred when omitted.", example = "premium")
            @RequestParam(value = "fileType", required = false) String fileType);

    @Operation(summary = "List Files",
            description = "Returns a paginated list of files, newest first, optionally filtered by status, sender and creation time.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Files retrieved successfully.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Invalid filter or paging parameters.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<Page<FileSummaryResponse>>> listFiles(
            @Parameter(description = "Only files in this status.") @RequestParam(value = "status", required = false) FileStatus status,
            @Parameter(description = "Only files whose sender contains this text.") @RequestParam(value = "sender", required = false) String sender,
            @Parameter(description = "Created at or after (ISO date-time).", example = "2024-06-01T00:00:00")
            @RequestParam(value = "createdFrom", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime createdFrom,
            @Parameter(description = "Created before (ISO date-time).", example = "2024-07-01T00:00:00")
            @RequestParam(value = "createdTo", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime createdTo,
            @Parameter(description = "Zero-based page index.") @RequestParam(value = "page", defaultValue = "0") @Min(value = 0, message = "The 'page' must not be negative.") int page,
            @Parameter(description = "Page size, at most 200.") @RequestParam(value = "size", defaultValue = "20") @Min(value = 1, message = "The 'size' must be at least 1.") @Max(value = 200, message = "The 'size' cannot exceed 200.") int size);

    @Operation(summary = "Get File Detail",
            description = "Returns a file with the counters of its last run, the template used, the failure message if any and its validation error count by severity.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "File retrieved successfully.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - The file does not exist.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<FileDetailResponse>> getFile(
            @Parameter(description = "The ID of the file.", required = true, example = "42") @PathVariable @Positive(message = "The 'fileId' must be a positive number.") Long fileId);

    @Operation(summary = "List Validation Errors",
            description = "Returns the validation errors of the file's last run, ordered by row index.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Validation errors retrieved successfully.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - The file does not exist.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<Page<ValidationErrorResponse>>> getValidationErrors(
            @Parameter(description = "The ID of the file.", required = true, example = "42") @PathVariable @Positive(message = "The 'fileId' must be a positive number.") Long fileId,
            @Parameter(description = "Zero-based page index.") @RequestParam(value = "page", defaultValue = "0") @Min(value = 0, message = "The 'page' must not be negative.") int page,
            @Parameter(description = "Page size, at most 500.") @RequestParam(value = "size", defaultValue = "50") @Min(value = 1, message = "The 'size' must be at least 1.") @Max(value = 500, message = "The 'size' cannot exceed 500.") int size);

    @Operation(summary = "Reprocess a File",
            description = "Discards the output of a finished run, resets the file to RECEIVED and runs the pipeline again immediately. Mapping proposals are kept.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "The file was reprocessed; the body carries the new outcome.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - The file does not exist.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Conflict - The file is still being processed.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<ProcessingOutcomeResponse>> reprocessFile(
            @Parameter(description = "The ID of the file.", required = true, example = "42") @PathVariable @Positive(message = "The 'fileId' must be a positive number.") Long fileId);
}
