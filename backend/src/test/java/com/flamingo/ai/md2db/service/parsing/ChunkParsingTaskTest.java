package com.flamingo.ai.md2db.service.parsing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.flamingo.ai.md2db.exception.QuestionParseException;
import com.flamingo.ai.md2db.service.chunking.ByteRange;
import com.flamingo.ai.md2db.service.chunking.ChunkReader;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ChunkParsingTask Tests")
class ChunkParsingTaskTest {

  private static final ByteRange RANGE = new ByteRange(0, 42);

  @Mock private ChunkReader reader;
  @Mock private QuestionParser parser;

  @Test
  @DisplayName("should return parsed questions on success")
  void shouldReturnQuestions() throws IOException {
    RawQuestion question =
        new RawQuestion("Q?", "subjective", null, null, null, null, null, null);
    when(reader.read(RANGE)).thenReturn("1. Q?");
    when(parser.parse("1. Q?")).thenReturn(List.of(question));

    ChunkParseResult result = new ChunkParsingTask(reader, parser, RANGE, 1).call();

    assertThat(result.succeeded()).isTrue();
    assertThat(result.questions()).containsExactly(question);
    assertThat(result.attempt()).isEqualTo(1);
  }

  @Test
  @DisplayName("should report read failures instead of throwing")
  void shouldCaptureReadFailure() throws IOException {
    when(reader.read(RANGE)).thenThrow(new IOException("device gone"));

    ChunkParseResult result = new ChunkParsingTask(reader, parser, RANGE, 2).call();

    assertThat(result.succeeded()).isFalse();
    assertThat(result.failure()).isInstanceOf(IOException.class).hasMessage("device gone");
    assertThat(result.questions()).isEmpty();
    assertThat(result.attempt()).isEqualTo(2);
  }

  @Test
  @DisplayName("should report parser failures instead of throwing")
  void shouldCaptureParseFailure() throws IOException {
    when(reader.read(RANGE)).thenReturn("garbage");
    when(parser.parse("garbage")).thenThrow(new QuestionParseException("not text"));

    ChunkParseResult result = new ChunkParsingTask(reader, parser, RANGE, 1).call();

    assertThat(result.failure()).isInstanceOf(QuestionParseException.class);
    assertThat(result.range()).isEqualTo(RANGE);
  }
}
