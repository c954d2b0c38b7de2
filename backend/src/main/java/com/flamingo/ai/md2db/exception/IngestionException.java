package com.flamingo.ai.md2db.exception;

import java.nio.file.Path;

/** Exception thrown when a whole ingestion run cannot proceed. */
public class IngestionException extends RuntimeException {

  private final Path sourceFile;

  public IngestionException(Path sourceFile, String message, Throwable cause) {
    super(message, cause);
    this.sourceFile = sourceFile;
  }

  public Path getSourceFile() {
    return sourceFile;
  }
}
