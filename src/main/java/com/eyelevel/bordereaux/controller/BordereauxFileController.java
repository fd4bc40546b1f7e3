package com.eyelevel.bordereaux.controller;

import com.eyelevel.bordereaux.dto.common.ApiResponse;
import com.eyelevel.bordereaux.dto.file.response.FileDetailResponse;
import com.eyelevel.bordereaux.dto.file.response.FileSummaryResponse;
import com.eyelevel.bordereaux.dto.file.response.IntakeResponse;
import com.eyelevel.bordereaux.dto.file.response.ProcessingOutcomeResponse;
import com.eyelevel.bordereaux.dto.file.response.ValidationErrorResponse;
import com.eyelevel.bordereaux.exception.apiclient.BadRequestException;
import com.eyelevel.bordereaux.model.FileStatus;
import com.eyelevel.bordereaux.model.FileType;
import com.eyelevel.bordereaux.service.file.FileIntakeService;
import com.eyelevel.bordereaux.service.file.IntakeResult;
import com.eyelevel.bordereaux.service.file.ReprocessService;
import com.eyelevel.bordereaux.service.file.view.BordereauxFileQueryService;
import com.eyelevel.bordereaux.service.pipeline.ProcessingOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * REST controller for bordereaux files. All responses follow the {@link ApiResponse} format.
 */
@Slf4j
@RestController
@RequestMapping("/bordereaux")
@RequiredArgsConstructor
@Validated
public class BordereauxFileController implements BordereauxFileApi {

    private final FileIntakeService fileIntakeService;
    private final BordereauxFileQueryService fileQueryService;
    private final ReprocessService reprocessService;

    @Override
    @PostMapping(value = "/v1/files", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<IntakeResponse>> registerFile(
            @RequestPart("file") final MultipartFile file,
            @RequestParam(value = "sender", required = false) final String sender,
            @RequestParam(value = "subject", required = false) final String subject,
            @RequestParam(value = "fileType", required = false) final String fileType) {

        log.info("Registering file '{}' ({} bytes) from sender '{}'.", file.getOriginalFilename(), file.getSize(),
                 sender);
        final IntakeResult result = fileIntakeService.register(file.getOriginalFilename(), sender, subject,
                                                               readContent(file), parseFileType(fileType));

        final IntakeResponse responseData = new IntakeResponse(FileSummaryResponse.from(result.file()),
                                                               result.duplicate());
        final HttpStatus status = result.duplicate() ? HttpStatus.OK : HttpStatus.CREATED;
        final String message = result.duplicate()
                ? "This content was already received as file " + result.file().getId() + "."
                : "File registered and queued for processing.";
        return new ResponseEntity<>(ApiResponse.success(responseData, message, status.value()), status);
    }

    @Override
    @GetMapping("/v1/files")
    public ResponseEntity<ApiResponse<Page<FileSummaryResponse>>> listFiles(
            @RequestParam(value = "status", required = false) final FileStatus status,
            @RequestParam(value = "sender", required = false) final String sender,
            @RequestParam(value = "createdFrom", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) final LocalDateTime createdFrom,
            @RequestParam(value = "createdTo", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) final LocalDateTime createdTo,
            @RequestParam(value = "page", defaultValue = "0") final int page,
            @RequestParam(value = "size", defaultValue = "20") final int size) {

        log.debug("Listing files with status={}, sender={}, page={}, size={}", status, sender, page, size);
        final Page<FileSummaryResponse> files = fileQueryService.listFiles(status, sender, createdFrom, createdTo,
                                                                           page, size);
        return ResponseEntity.ok(ApiResponse.success(files, "Files retrieved successfully.", HttpStatus.OK.value()));
    }

    @Override
    @GetMapping("/v1/files/{fileId}")
    public ResponseEntity<ApiResponse<FileDetailResponse>> getFile(
            @PathVariable final Long fileId) {

        final FileDetailResponse detail = fileQueryService.getFile(fileId);
        return ResponseEntity.ok(ApiResponse.success(detail, "File retrieved successfully.", HttpStatus.OK.value()));
    }

    @Override
    @GetMapping("/v1/files/{fileId}/errors")
    public ResponseEntity<ApiResponse<Page<ValidationErrorResponse>>> getValidationErrors(
            @PathVariable final Long fileId,
            @RequestParam(value = "page", defaultValue = "0") final int page,
            @RequestParam(value = "size", defaultValue = "50") final int size) {

        final Page<ValidationErrorResponse> errors = fileQueryService.getValidationErrors(fileId, page, size);
        return ResponseEntity.ok(ApiResponse.success(errors, "Validation errors retrieved successfully.",
                                                     HttpStatus.OK.value()));
    }

    @Override
    @PostMapping("/v1/files/{fileId}/reprocess")
    public ResponseEntity<ApiResponse<ProcessingOutcomeResponse>> reprocessFile(
            @PathVariable final Long fileId) {

        log.warn("Reprocessing fileId: {}", fileId);
        final ProcessingOutcome outcome = reprocessService.reprocess(fileId);
        final String message = outcome.isSkipped()
                ? "The file was reset but another run picked it up first."
                : "File reprocessed with outcome " + outcome.status() + ".";
        return ResponseEntity.ok(ApiResponse.success(ProcessingOutcomeResponse.from(outcome), message,
                                                     HttpStatus.OK.value()));
    }

    private static byte[] readContent(final MultipartFile file) {
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new BadRequestException("The uploaded file could not be read: " + e.getMessage());
        }
    }

    private static Optional<FileType> parseFileType(final String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        final FileType type = FileType.fromCode(value);
        if (type == FileType.UNKNOWN && !"unknown".equalsIgnoreCase(value.trim())) {
            throw new BadRequestException("Unknown file type '" + value + "'. Expected claims, premium or exposure.");
        }
        return type.asHint();
    }
}
