package com.flamingo.ai.clauses.exception;

/** Exception thrown when text was extracted but no numbered clause could be recognised. */
public class NoClausesDetectedException extends ClauseExtractionException {

  private final int lineCount;

  public NoClausesDetectedException(int lineCount) {
    super(
        ExtractionErrorKind.NO_STRUCTURE_DETECTED,
        "No clauses detected in " + lineCount + " extracted lines",
        "No clauses were detected in the document.");
    this.lineCount = lineCount;
  }

  public int getLineCount() {
    return lineCount;
  }
}
