package com.flamingo.ai.md2db.domain.document;

/**
 * A deduplicated sub-entity stored once per distinct payload.
 *
 * <p>{@link #getHash()} is unique within the entity's collection; the store enforces it with a
 * unique index.
 */
public interface CanonicalEntity {

  String getId();

  String getHash();
}
