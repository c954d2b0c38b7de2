package com.flamingo.ai.md2db.service.chunking;

import java.io.IOException;
import java.nio.file.Path;

/** Opens a {@link ChunkReader} over a source file for the duration of one run. */
@FunctionalInterface
public interface ChunkReaderFactory {

  ChunkReader open(Path file) throws IOException;
}
