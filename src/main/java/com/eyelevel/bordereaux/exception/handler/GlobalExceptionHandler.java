package com.eyelevel.bordereaux.exception.handler;

import com.eyelevel.bordereaux.dto.common.ApiResponse;
import com.eyelevel.bordereaux.exception.BordereauxProcessingException;
import com.eyelevel.bordereaux.exception.InvalidStatusTransitionException;
import com.eyelevel.bordereaux.exception.ReprocessFailedException;
import com.eyelevel.bordereaux.exception.TemplateDefinitionException;
import com.eyelevel.bordereaux.exception.apiclient.ApiException;
import com.eyelevel.bordereaux.exception.apiclient.BadRequestException;
import com.eyelevel.bordereaux.exception.apiclient.ConflictException;
import com.eyelevel.bordereaux.exception.apiclient.NotFoundException;
import com.eyelevel.bordereaux.exception.json.JsonParsingException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Converts exceptions thrown from controllers into the {@link ApiResponse} envelope with the matching HTTP
 * status. Stack traces and responses of outbound collaborators never reach the client.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    // --- 4xx Client Error Handlers ---

    /**
     * Business rule violations in the request itself. (400 Bad Request)
     */
    @ExceptionHandler({BadRequestException.class,
            TemplateDefinitionException.class,
            JsonParsingException.class})
    public ResponseEntity<ApiResponse<Object>> handleBadRequest(RuntimeException ex) {
        log.warn("Bad Request Exception: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Object>> handleHttpMessageNotReadable(HttpMessageNotReadableException ex) {
        log.warn("Handling HttpMessageNotReadableException: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Malformed request body.",
                       "The request body is missing or could not be parsed.");
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiResponse<Object>> handleMissingServletRequestParameter(
            MissingServletRequestParameterException ex) {
        String errorMessage = String.format("Required parameter '%s' of type '%s' is missing.",
                                            ex.getParameterName(), ex.getParameterType());
        log.warn("Handling MissingServletRequestParameterException: {}", errorMessage);
        return respond(HttpStatus.BAD_REQUEST, "Required parameter is missing.", errorMessage);
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ApiResponse<Object>> handleMissingServletRequestPart(MissingServletRequestPartException ex) {
        String errorMessage = String.format("Required part '%s' is missing.", ex.getRequestPartName());
        log.warn("Handling MissingServletRequestPartException: {}", errorMessage);
        return respond(HttpStatus.BAD_REQUEST, "Required file is missing.", errorMessage);
    }

    /**
     * Validation errors from {@code @Valid} request bodies. (400 Bad Request)
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Object>> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String errors = ex.getBindingResult().getFieldErrors().stream()
                          .map(error -> String.format("'%s': %s", error.getField(), error.getDefaultMessage()))
                          .collect(Collectors.joining(", "));
        String errorMessage = "Validation failed: " + errors;
        log.warn("Handling validation exception: {}", errorMessage);
        return respond(HttpStatus.BAD_REQUEST, "Invalid input provided.", errorMessage);
    }

    /**
     * Validation errors from {@code @Validated} path variables and request parameters. (400 Bad Request)
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse<Object>> handleConstraintViolation(ConstraintViolationException ex) {
        String errors = ex.getConstraintViolations().stream()
                          .map(violation -> {
                              String path = violation.getPropertyPath().toString();
                              return String.format("'%s': %s", path.substring(path.lastIndexOf('.') + 1),
                                                   violation.getMessage());
                          })
                          .collect(Collectors.joining(", "));
        String errorMessage = "Validation failed: " + errors;
        log.warn("Handling constraint violation exception: {}", errorMessage);
        return respond(HttpStatus.BAD_REQUEST, "Invalid input provided.", errorMessage);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String errorMessage = String.format("Invalid value '%s' for parameter '%s'. Expected type '%s'.",
                                            ex.getValue(), ex.getName(), ex.getRequiredType() != null
                                                    ? ex.getRequiredType().getSimpleName()
                                                    : "unknown");
        log.warn("Handling type mismatch exception: {}", errorMessage);
        return respond(HttpStatus.BAD_REQUEST, "Invalid parameter type provided.", errorMessage);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiResponse<Object>> handleNotFound(NotFoundException ex) {
        log.warn("Resource Not Found Exception: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getMessage(), null);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiResponse<Object>> handleNoResourceFound(NoResourceFoundException ex) {
        String errorMessage = String.format("No endpoint %s /%s", ex.getHttpMethod(), ex.getResourcePath());
        log.warn("Handling NoResourceFoundException: {}", errorMessage);
        return respond(HttpStatus.NOT_FOUND, "Resource not found.", errorMessage);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiResponse<Object>> handleHttpRequestMethodNotSupported(
            HttpRequestMethodNotSupportedException ex) {
        String supportedMethods = String.join(", ", Objects.requireNonNull(ex.getSupportedMethods()));
        String errorMessage = String.format("Request method '%s' not supported. Supported methods are: %s",
                                            ex.getMethod(), supportedMethods);
        log.warn("Handling HttpRequestMethodNotSupportedException: {}", errorMessage);
        return respond(HttpStatus.METHOD_NOT_ALLOWED, "Method not allowed.", errorMessage);
    }

    /**
     * The request conflicts with the current state of a file or proposal. (409 Conflict)
     */
    @ExceptionHandler({ConflictException.class,
            ReprocessFailedException.class,
            InvalidStatusTransitionException.class})
    public ResponseEntity<ApiResponse<Object>> handleConflict(RuntimeException ex) {
        log.warn("Conflict Exception: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getMessage(), null);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiResponse<Object>> handleMaxUploadSize(MaxUploadSizeExceededException ex) {
        log.warn("Upload rejected: {}", ex.getMessage());
        return respond(HttpStatus.PAYLOAD_TOO_LARGE, "The uploaded file is too large.", null);
    }

    /**
     * Any other status-carrying exception, such as an outbound call failure that was not absorbed.
     */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiResponse<Object>> handleApiException(ApiException ex) {
        HttpStatus status = Objects.requireNonNullElse(HttpStatus.resolve(ex.getStatusCode()),
                                                       HttpStatus.INTERNAL_SERVER_ERROR);
        if (status.is5xxServerError()) {
            log.error("{}: {}", ex.getClass().getSimpleName(), ex.getMessage());
            return respond(status, "An upstream service failed. Please try again later.",
                           ex.getClass().getSimpleName());
        }
        log.warn("{}: {}", ex.getClass().getSimpleName(), ex.getMessage());
        return respond(status, ex.getMessage(), null);
    }

    // --- 5xx Server Error Handlers ---

    @ExceptionHandler(BordereauxProcessingException.class)
    public ResponseEntity<ApiResponse<Object>> handleProcessingException(BordereauxProcessingException ex) {
        log.error("Processing error while handling a request", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "The file could not be processed.",
                       ex.getClass().getSimpleName());
    }

    /**
     * A final catch-all handler for any other unexpected exceptions. (500 Internal Server Error)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Object>> handleGenericException(Exception ex) {
        log.error("An unexpected internal server error occurred", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR,
                       "An unexpected internal error occurred. Please contact support.",
                       ex.getClass().getSimpleName());
    }

    private static ResponseEntity<ApiResponse<Object>> respond(HttpStatus status, String displayMessage,
                                                               String detail) {
        ApiResponse<Object> body = ApiResponse.builder()
                                              .displayMessage(displayMessage)
                                              .response(detail)
                                              .showMessage(true)
                                              .statusCode(status.value())
                                              .build();
        return new ResponseEntity<>(body, status);
    }
}
