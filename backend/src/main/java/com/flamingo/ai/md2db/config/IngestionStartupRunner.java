package com.flamingo.ai.md2db.config;

import com.flamingo.ai.md2db.domain.enums.EntityKind;
import com.flamingo.ai.md2db.domain.enums.RunStatus;
import com.flamingo.ai.md2db.mongodb.QuestionBankStore;
import com.flamingo.ai.md2db.service.ingest.FailedChunk;
import com.flamingo.ai.md2db.service.ingest.IngestionCoordinator;
import com.flamingo.ai.md2db.service.ingest.IngestionOptions;
import com.flamingo.ai.md2db.service.ingest.ProcessingResult;
import com.flamingo.ai.md2db.service.writer.WriteFailure;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Ingests {@code ingestion.input-file} once on start-up.
 *
 * <p>Failed chunks and refused questions are logged individually so they can be replayed; the
 * summary ends with the size of each collection.
 */
@Component
@ConditionalOnProperty(prefix = "ingestion", name = "input-file")
@RequiredArgsConstructor
@Slf4j
public class IngestionStartupRunner implements CommandLineRunner {

  private final IngestionConfig ingestionConfig;
  private final IngestionOptions ingestionOptions;
  private final IngestionCoordinator ingestionCoordinator;
  private final QuestionBankStore questionBankStore;

  @Override
  public void run(String... args) {
    Path input = Path.of(ingestionConfig.getInputFile());
    log.info("Starting ingestion of {}", input);

    ProcessingResult result = ingestionCoordinator.process(input, ingestionOptions);

    for (FailedChunk failed : result.failedChunks()) {
      log.error(
          "Failed chunk {} after {} attempts: {}",
          failed.chunkId(),
          failed.attempts(),
          failed.reason());
    }
    for (WriteFailure failure : result.writeFailures()) {
      log.error(
          "Unwritten question {} (chunk {}, content {}): {}",
          failure.questionId(),
          failure.sourceChunk(),
          failure.contentHash(),
          failure.reason());
    }

    log.info(
        "Question bank now holds {} questions, {} options, {} images, {} formulas",
        questionBankStore.countQuestions(),
        questionBankStore.countEntities(EntityKind.OPTION),
        questionBankStore.countEntities(EntityKind.IMAGE),
        questionBankStore.countEntities(EntityKind.FORMULA));

    if (result.status() != RunStatus.COMPLETED) {
      log.warn("Ingestion of {} ended with status {}", input, result.status());
    }
  }
}
