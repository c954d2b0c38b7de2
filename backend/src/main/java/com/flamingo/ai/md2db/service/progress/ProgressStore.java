package com.flamingo.ai.md2db.service.progress;

import java.io.IOException;
import java.util.List;

/** Durable home of chunk progress, keyed by the source file being ingested. */
public interface ProgressStore {

  /**
   * Loads the last saved progress for a source.
   *
   * @param sourceKey identifies the source file
   * @return saved entries, empty if the source was never seen
   * @throws IOException if saved progress exists but cannot be read
   */
  List<ChunkProgress> load(String sourceKey) throws IOException;

  /**
   * Replaces the saved progress for a source.
   *
   * @param sourceKey identifies the source file
   * @param entries every chunk's current entry
   * @throws IOException if the progress cannot be written
   */
  void save(String sourceKey, List<ChunkProgress> entries) throws IOException;
}
