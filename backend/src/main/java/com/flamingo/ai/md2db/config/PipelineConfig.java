package com.flamingo.ai.md2db.config;

import com.flamingo.ai.md2db.service.chunking.ChunkReaderFactory;
import com.flamingo.ai.md2db.service.chunking.FileChannelChunkReader;
import com.flamingo.ai.md2db.service.ingest.IngestionOptions;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wiring for pipeline collaborators that are not components themselves. */
@Configuration
public class PipelineConfig {

  @Bean
  public ChunkReaderFactory chunkReaderFactory() {
    return FileChannelChunkReader::open;
  }

  /**
   * Run settings resolved from {@code ingestion.*} properties.
   *
   * @param config bound ingestion properties
   * @return default options for runs started by the application
   */
  @Bean
  public IngestionOptions ingestionOptions(IngestionConfig config) {
    return IngestionOptions.from(config);
  }
}
