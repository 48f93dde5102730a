package com.flamingo.ai.clauses.exception;

/** Exception thrown when a PDF yields no text lines at all. */
public class EmptyExtractionException extends ClauseExtractionException {

  public EmptyExtractionException() {
    super(
        ExtractionErrorKind.EMPTY_EXTRACTION,
        "No text extracted from PDF",
        "No text extracted from PDF.");
  }
}
