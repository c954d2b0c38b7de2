package com.flamingo.ai.md2db.exception;

/** Exception thrown when chunk text cannot be turned into questions. */
public class QuestionParseException extends RuntimeException {

  public QuestionParseException(String message) {
    super(message);
  }

  public QuestionParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
