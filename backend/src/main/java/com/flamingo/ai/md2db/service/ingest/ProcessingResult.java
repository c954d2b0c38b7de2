package com.flamingo.ai.md2db.service.ingest;

import com.flamingo.ai.md2db.domain.enums.RunStatus;
import com.flamingo.ai.md2db.service.chunking.BoundaryWarning;
import com.flamingo.ai.md2db.service.writer.WriteFailure;
import java.time.Duration;
import java.util.List;

/**
 * Summary of an ingestion run.
 *
 * @param status overall outcome
 * @param sourceFile the ingested file
 * @param questionsWritten questions inserted by this run
 * @param duplicatesSkipped questions already stored under the same id, for example by an earlier
 *     partial run
 * @param chunksPlanned chunks in the plan
 * @param chunksProcessed chunks parsed and written in this run
 * @param chunksSkipped chunks already done in a previous run
 * @param failedChunks chunks that exhausted their attempts or whose batch write failed
 * @param writeFailures questions the store refused
 * @param boundaryWarnings boundaries that could not be aligned to a separator
 * @param workerCount parsing threads used
 * @param elapsed wall-clock duration
 */
public record ProcessingResult(
    RunStatus status,
    String sourceFile,
    long questionsWritten,
    long duplicatesSkipped,
    int chunksPlanned,
    int chunksProcessed,
    int chunksSkipped,
    List<FailedChunk> failedChunks,
    List<WriteFailure> writeFailures,
    List<BoundaryWarning> boundaryWarnings,
    int workerCount,
    Duration elapsed) {

  public ProcessingResult {
    failedChunks = List.copyOf(failedChunks);
    writeFailures = List.copyOf(writeFailures);
    boundaryWarnings = List.copyOf(boundaryWarnings);
  }

  public int chunksFailed() {
    return failedChunks.size();
  }
}
