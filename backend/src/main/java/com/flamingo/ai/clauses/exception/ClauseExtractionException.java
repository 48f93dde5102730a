package com.flamingo.ai.clauses.exception;

/**
 * Base type for failures that stop the extraction of a document.
 *
 * <p>None of these are retried. Heuristic misses (an unrecognised heading, an orphaned subclause)
 * are not reported through this hierarchy.
 */
public abstract class ClauseExtractionException extends RuntimeException {

  private final ExtractionErrorKind kind;
  private final String userMessage;

  protected ClauseExtractionException(
      ExtractionErrorKind kind, String message, String userMessage) {
    super(message);
    this.kind = kind;
    this.userMessage = userMessage;
  }

  protected ClauseExtractionException(
      ExtractionErrorKind kind, String message, String userMessage, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.userMessage = userMessage;
  }

  public ExtractionErrorKind getKind() {
    return kind;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
