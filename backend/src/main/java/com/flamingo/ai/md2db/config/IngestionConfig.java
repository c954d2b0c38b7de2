package com.flamingo.ai.md2db.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the ingestion pipeline. */
@Configuration
@ConfigurationProperties(prefix = "ingestion")
@Getter
@Setter
public class IngestionConfig {

  /** Markdown file to ingest on start-up; the batch runner stays idle when unset. */
  private String inputFile;

  private Chunking chunking = new Chunking();
  private Workers workers = new Workers();
  private Batch batch = new Batch();
  private Retry retry = new Retry();
  private Progress progress = new Progress();

  @Getter
  @Setter
  public static class Chunking {
    /** Rough size of each chunk before boundary alignment. */
    private long targetSizeBytes = 10L * 1024 * 1024; // 10 MiB

    /** How far past a rough cut the chunker looks for a question separator. */
    private int maxBoundarySearchBytes = 10_000;
  }

  @Getter
  @Setter
  public static class Workers {
    /** Parse workers. Zero or less means the available processors. */
    private int count = Runtime.getRuntime().availableProcessors();

    /**
     * Chunks allowed to wait for a free worker. Together with {@link #count} this bounds how many
     * parsed-but-undrained chunks can be held in memory. Zero means {@code 2 * count}.
     */
    private int queueDepth = 0;
  }

  @Getter
  @Setter
  public static class Batch {
    private int size = 1000;
  }

  @Getter
  @Setter
  public static class Retry {
    /** Re-attempts allowed for a chunk after its first failed attempt. */
    private int limit = 2;
  }

  @Getter
  @Setter
  public static class Progress {
    private String directory = "data/progress";
  }
}
