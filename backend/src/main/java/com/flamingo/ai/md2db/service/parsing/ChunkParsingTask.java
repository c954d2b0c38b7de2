package com.flamingo.ai.md2db.service.parsing;

import com.flamingo.ai.md2db.service.chunking.ByteRange;
import com.flamingo.ai.md2db.service.chunking.ChunkReader;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;
import lombok.extern.slf4j.Slf4j;

/**
 * Worker unit: reads one chunk's bytes and parses them.
 *
 * <p>Never throws. Read and parse failures, including unexpected runtime errors from the parser,
 * come back inside the {@link ChunkParseResult} so one bad chunk cannot take down the pool.
 */
@Slf4j
public class ChunkParsingTask implements Callable<ChunkParseResult> {

  private final ChunkReader reader;
  private final QuestionParser parser;
  private final ByteRange range;
  private final int attempt;

  public ChunkParsingTask(ChunkReader reader, QuestionParser parser, ByteRange range, int attempt) {
    this.reader = reader;
    this.parser = parser;
    this.range = range;
    this.attempt = attempt;
  }

  @Override
  public ChunkParseResult call() {
    try {
      String text = reader.read(range);
      List<RawQuestion> questions = parser.parse(text);
      log.debug(
          "Chunk {} attempt {} parsed into {} questions", range.id(), attempt, questions.size());
      return ChunkParseResult.success(range, attempt, questions);
    } catch (IOException e) {
      log.debug("Chunk {} attempt {} could not be read: {}", range.id(), attempt, e.toString());
      return ChunkParseResult.failure(range, attempt, e);
    } catch (RuntimeException e) {
      log.debug("Chunk {} attempt {} could not be parsed: {}", range.id(), attempt, e.toString());
      return ChunkParseResult.failure(range, attempt, e);
    }
  }
}
