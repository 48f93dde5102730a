package com.flamingo.ai.clauses.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String DOCUMENT_NOT_FOUND = "DOCUMENT_001";
  public static final String EXTRACTION_NOT_PERMITTED = "DOCUMENT_002";
  public static final String MALFORMED_DOCUMENT = "DOCUMENT_003";
  public static final String EMPTY_EXTRACTION = "EXTRACTION_001";
  public static final String NO_CLAUSES_DETECTED = "EXTRACTION_002";
  public static final String EMPTY_UPLOAD = "UPLOAD_001";
  public static final String MISSING_UPLOAD = "UPLOAD_002";
  public static final String UPLOAD_TOO_LARGE = "UPLOAD_003";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
