package com.flamingo.ai.clauses.exception;

import java.nio.file.Path;

/** Exception thrown when the PDF to extract does not exist. */
public class SourceDocumentNotFoundException extends ClauseExtractionException {

  private final Path path;

  public SourceDocumentNotFoundException(Path path) {
    super(ExtractionErrorKind.NOT_FOUND, "PDF not found: " + path, "PDF not found: " + path);
    this.path = path;
  }

  public Path getPath() {
    return path;
  }
}
