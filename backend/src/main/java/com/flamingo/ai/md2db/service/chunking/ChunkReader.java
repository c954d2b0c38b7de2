package com.flamingo.ai.md2db.service.chunking;

import java.io.Closeable;
import java.io.IOException;

/** Reads the text of one chunk from an open source file. Implementations are thread-safe. */
public interface ChunkReader extends Closeable {

  /**
   * Reads exactly the bytes of {@code range} and decodes them as UTF-8.
   *
   * @param range the span to read
   * @return the decoded text
   * @throws IOException if the bytes cannot be read or are not valid UTF-8
   */
  String read(ByteRange range) throws IOException;
}
