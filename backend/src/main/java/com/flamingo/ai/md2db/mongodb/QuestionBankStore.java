package com.flamingo.ai.md2db.mongodb;

import com.flamingo.ai.md2db.domain.document.QuestionDocument;
import com.flamingo.ai.md2db.domain.enums.EntityKind;
import com.flamingo.ai.md2db.exception.DuplicateContentException;
import java.util.List;
import java.util.Optional;

/**
 * Document store holding the {@code questions} collection and the three canonical sub-entity
 * collections.
 *
 * <p>Each canonical collection carries a unique index on its content hash. That index is the only
 * cross-thread and cross-process synchronization the pipeline relies on.
 */
public interface QuestionBankStore {

  /** Creates the collections' indexes if they are missing. Safe to call repeatedly. */
  void initCollections();

  /**
   * Looks up a canonical entity by content hash.
   *
   * @param kind the sub-entity collection
   * @param hash the content digest
   * @return the entity id, if present
   */
  Optional<String> findEntityIdByHash(EntityKind kind, String hash);

  /**
   * Inserts a new canonical entity.
   *
   * @param kind the sub-entity collection
   * @param payload option text, image URL or formula source
   * @param hash the content digest of {@code payload}
   * @param altText alt text kept with an image, {@code null} otherwise
   * @return the new entity id
   * @throws DuplicateContentException if an entity with this hash already exists
   */
  String insertEntity(EntityKind kind, String payload, String hash, String altText);

  /**
   * Inserts questions as one unordered bulk write. A refused document does not stop the others.
   *
   * @param questions documents to insert
   * @return which documents were accepted and which were refused
   */
  BulkWriteReport insertQuestions(List<QuestionDocument> questions);

  long countEntities(EntityKind kind);

  long countQuestions();
}
