package com.flamingo.ai.md2db.service.ingest;

import com.flamingo.ai.md2db.config.IngestionConfig;
import lombok.Builder;

/**
 * Settings for one ingestion run.
 *
 * @param targetChunkSizeBytes rough chunk size before boundary alignment
 * @param maxBoundarySearchBytes forward-scan limit when aligning a boundary
 * @param workerCount parsing threads
 * @param queueDepth chunks allowed to wait for a free worker
 * @param batchSize questions per bulk write
 * @param retryLimit re-attempts per chunk after its first failure
 */
@Builder(toBuilder = true)
public record IngestionOptions(
    long targetChunkSizeBytes,
    int maxBoundarySearchBytes,
    int workerCount,
    int queueDepth,
    int batchSize,
    int retryLimit) {

  public IngestionOptions {
    if (targetChunkSizeBytes <= 0) {
      throw new IllegalArgumentException("targetChunkSizeBytes must be positive");
    }
    if (maxBoundarySearchBytes <= 0) {
      throw new IllegalArgumentException("maxBoundarySearchBytes must be positive");
    }
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be positive");
    }
    if (retryLimit < 0) {
      throw new IllegalArgumentException("retryLimit must not be negative");
    }
    if (workerCount <= 0) {
      workerCount = Runtime.getRuntime().availableProcessors();
    }
    if (queueDepth <= 0) {
      queueDepth = 2 * workerCount;
    }
  }

  public static IngestionOptions from(IngestionConfig config) {
    return IngestionOptions.builder()
        .targetChunkSizeBytes(config.getChunking().getTargetSizeBytes())
        .maxBoundarySearchBytes(config.getChunking().getMaxBoundarySearchBytes())
        .workerCount(config.getWorkers().getCount())
        .queueDepth(config.getWorkers().getQueueDepth())
        .batchSize(config.getBatch().getSize())
        .retryLimit(config.getRetry().getLimit())
        .build();
  }
}
