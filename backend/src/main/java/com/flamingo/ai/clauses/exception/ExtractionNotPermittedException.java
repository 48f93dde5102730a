package com.flamingo.ai.clauses.exception;

/** Exception thrown when the PDF forbids text extraction or cannot be decrypted. */
public class ExtractionNotPermittedException extends ClauseExtractionException {

  public ExtractionNotPermittedException(String message) {
    super(
        ExtractionErrorKind.PERMISSION_DENIED,
        message,
        "Text extraction is not permitted for this PDF.");
  }

  public ExtractionNotPermittedException(String message, Throwable cause) {
    super(
        ExtractionErrorKind.PERMISSION_DENIED,
        message,
        "Text extraction is not permitted for this PDF.",
        cause);
  }
}
