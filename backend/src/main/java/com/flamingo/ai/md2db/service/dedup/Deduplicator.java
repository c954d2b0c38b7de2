package com.flamingo.ai.md2db.service.dedup;

import com.flamingo.ai.md2db.domain.enums.EntityKind;
import com.flamingo.ai.md2db.exception.DuplicateContentException;
import com.flamingo.ai.md2db.mongodb.QuestionBankStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Resolves option, image and formula payloads to canonical entity ids.
 *
 * <p>The protocol is lookup, then insert, then on conflict lookup again. Another actor may insert
 * the same digest between our lookup and our insert; the store's unique hash index rejects the
 * second insert and the re-lookup returns the winner's id. No in-memory state is kept, so any
 * number of threads or processes may resolve concurrently.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class Deduplicator {

  private final QuestionBankStore store;
  private final MeterRegistry meterRegistry;

  /**
   * Returns the id of the canonical entity for {@code payload}, creating it on first sight.
   *
   * @param kind the sub-entity collection
   * @param payload option text, image URL or formula source
   * @return the canonical entity id
   */
  public String getOrCreate(EntityKind kind, String payload) {
    return getOrCreate(kind, payload, null);
  }

  /**
   * Same as {@link #getOrCreate(EntityKind, String)}, storing {@code altText} with a newly created
   * image. Alt text is not part of the content key: the first image stored for a URL keeps its
   * text.
   *
   * @param kind the sub-entity collection
   * @param payload option text, image URL or formula source
   * @param altText image alt text, or {@code null}
   * @return the canonical entity id
   */
  public String getOrCreate(EntityKind kind, String payload, String altText) {
    String hash = ContentKey.of(payload);

    Optional<String> existing = store.findEntityIdByHash(kind, hash);
    if (existing.isPresent()) {
      count("dedup.entities.reused", kind);
      return existing.get();
    }

    try {
      String id = store.insertEntity(kind, payload, hash, altText);
      count("dedup.entities.created", kind);
      return id;
    } catch (DuplicateContentException e) {
      count("dedup.conflicts", kind);
      log.debug("Concurrent insert of {} {}, re-reading winner", e.getKind(), e.getHash());
      return store
          .findEntityIdByHash(kind, hash)
          .orElseThrow(
              () ->
                  new IllegalStateException(
                      "Insert of "
                          + kind
                          + " "
                          + hash
                          + " conflicted but no entity with that hash exists",
                      e));
    }
  }

  private void count(String name, EntityKind kind) {
    meterRegistry.counter(name, "kind", kind.getCollection()).increment();
  }
}
