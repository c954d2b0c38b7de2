package com.flamingo.ai.md2db.exception;

import com.flamingo.ai.md2db.domain.enums.EntityKind;

/**
 * Thrown by the store when an insert violates the unique content-hash index of a canonical
 * collection. Callers are expected to re-read the existing entity rather than fail.
 */
public class DuplicateContentException extends RuntimeException {

  private final EntityKind kind;
  private final String hash;

  public DuplicateContentException(EntityKind kind, String hash, Throwable cause) {
    super("Duplicate " + kind.getCollection() + " hash " + hash, cause);
    this.kind = kind;
    this.hash = hash;
  }

  public EntityKind getKind() {
    return kind;
  }

  public String getHash() {
    return hash;
  }
}
