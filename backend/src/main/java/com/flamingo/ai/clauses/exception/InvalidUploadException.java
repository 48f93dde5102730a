package com.flamingo.ai.clauses.exception;

/** Exception thrown when an uploaded file is rejected before extraction starts. */
public class InvalidUploadException extends RuntimeException {

  private final String code;
  private final boolean tooLarge;

  public InvalidUploadException(String code, String message) {
    this(code, message, false);
  }

  public InvalidUploadException(String code, String message, boolean tooLarge) {
    super(message);
    this.code = code;
    this.tooLarge = tooLarge;
  }

  public String getCode() {
    return code;
  }

  public boolean isTooLarge() {
    return tooLarge;
  }
}
