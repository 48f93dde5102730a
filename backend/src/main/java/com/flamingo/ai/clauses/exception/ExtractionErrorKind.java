package com.flamingo.ai.clauses.exception;

/** Terminal failure categories of a single document extraction. */
public enum ExtractionErrorKind {
  NOT_FOUND,
  PERMISSION_DENIED,
  MALFORMED_INPUT,
  EMPTY_EXTRACTION,
  NO_STRUCTURE_DETECTED
}
