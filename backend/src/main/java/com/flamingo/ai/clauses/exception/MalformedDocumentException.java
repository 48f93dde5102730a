package com.flamingo.ai.clauses.exception;

/** Exception thrown when the layout engine cannot decode the PDF structure. */
public class MalformedDocumentException extends ClauseExtractionException {

  public MalformedDocumentException(String message, Throwable cause) {
    super(
        ExtractionErrorKind.MALFORMED_INPUT,
        message,
        "Failed to parse PDF structure: " + message,
        cause);
  }
}
