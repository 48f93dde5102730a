package com.flamingo.ai.clauses.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(ClauseExtractionException.class)
  public ResponseEntity<ApiError> handleExtraction(
      ClauseExtractionException ex, HttpServletRequest request) {

    incrementErrorCounter(ex.getKind().name().toLowerCase(Locale.ROOT));
    String errorId = generateErrorId();
    log.warn("Extraction failed [{}] {}: {}", errorId, ex.getKind(), ex.getMessage());

    return ResponseEntity.status(statusOf(ex.getKind()))
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(codeOf(ex.getKind()))
                .message(ex.getUserMessage())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(InvalidUploadException.class)
  public ResponseEntity<ApiError> handleInvalidUpload(
      InvalidUploadException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_upload");
    String errorId = generateErrorId();
    log.warn("Upload rejected [{}]: {}", errorId, ex.getMessage());

    HttpStatus status = ex.isTooLarge() ? HttpStatus.PAYLOAD_TOO_LARGE : HttpStatus.BAD_REQUEST;
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ex.getCode())
                .message(ex.getMessage())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ApiError> handleMaxUploadSize(
      MaxUploadSizeExceededException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_upload");
    String errorId = generateErrorId();
    log.warn("Upload rejected [{}]: {}", errorId, ex.getMessage());

    return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.UPLOAD_TOO_LARGE)
                .message("Upload exceeds size limit.")
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.INTERNAL_ERROR)
                .message("Failed to process PDF. Please try again later.")
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  static HttpStatus statusOf(ExtractionErrorKind kind) {
    return switch (kind) {
      case NOT_FOUND -> HttpStatus.NOT_FOUND;
      case PERMISSION_DENIED -> HttpStatus.FORBIDDEN;
      case MALFORMED_INPUT, EMPTY_EXTRACTION, NO_STRUCTURE_DETECTED ->
          HttpStatus.UNPROCESSABLE_ENTITY;
    };
  }

  static String codeOf(ExtractionErrorKind kind) {
    return switch (kind) {
      case NOT_FOUND -> ApiError.DOCUMENT_NOT_FOUND;
      case PERMISSION_DENIED -> ApiError.EXTRACTION_NOT_PERMITTED;
      case MALFORMED_INPUT -> ApiError.MALFORMED_DOCUMENT;
      case EMPTY_EXTRACTION -> ApiError.EMPTY_EXTRACTION;
      case NO_STRUCTURE_DETECTED -> ApiError.NO_CLAUSES_DETECTED;
    };
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
