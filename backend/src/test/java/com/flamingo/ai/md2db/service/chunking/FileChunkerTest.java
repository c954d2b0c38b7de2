package com.flamingo.ai.md2db.service.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("FileChunker Tests")
class FileChunkerTest {

  @TempDir Path tempDir;

  private SimpleMeterRegistry meterRegistry;
  private FileChunker chunker;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    chunker = new FileChunker(meterRegistry);
  }

  @Test
  @DisplayName("should return a single chunk when the file is smaller than the target size")
  void shouldReturnSingleChunk_whenFileSmallerThanTarget() throws IOException {
    Path file = write("bank.md", "1. What is 2+2?\nA. 3\nB. 4\nAnswer: B\n");

    ChunkPlan plan = chunker.createChunks(file, 1024, 100);

    assertThat(plan.ranges()).containsExactly(new ByteRange(0, Files.size(file)));
    assertThat(plan.warnings()).isEmpty();
  }

  @Test
  @DisplayName("should return no chunks for an empty file")
  void shouldReturnNoChunks_whenFileEmpty() throws IOException {
    Path file = write("empty.md", "");

    ChunkPlan plan = chunker.createChunks(file, 1024, 100);

    assertThat(plan.fileSize()).isZero();
    assertThat(plan.ranges()).isEmpty();
  }

  @Test
  @DisplayName("should cover the file without gaps and start every chunk on a numbered question")
  void shouldAlignBoundariesToNumberedQuestions() throws IOException {
    Path file = write("bank.md", numberedBank(40));
    long size = Files.size(file);

    ChunkPlan plan = chunker.createChunks(file, 128, 10_000);

    List<ByteRange> ranges = plan.ranges();
    assertThat(ranges.size()).isGreaterThan(1);
    assertContiguous(ranges, size);
    assertThat(plan.warnings()).isEmpty();
    try (FileChannelChunkReader reader = FileChannelChunkReader.open(file)) {
      for (ByteRange range : ranges.subList(1, ranges.size())) {
        String text = reader.read(range);
        assertThat(QuestionSeparators.NUMBERED.matcher(text).lookingAt())
            .as("chunk %s starts a question", range)
            .isTrue();
      }
    }
  }

  @Test
  @DisplayName("should split on horizontal rules when questions are not numbered")
  void shouldAlignBoundariesToHorizontalRules() throws IOException {
    StringBuilder text = new StringBuilder();
    for (int i = 0; i < 20; i++) {
      text.append("Question about topic ").append(i).append(" goes here\n");
      text.append("Answer: something\n---\n");
    }
    Path file = write("ruled.md", text.toString());

    ChunkPlan plan = chunker.createChunks(file, 100, 1_000);

    assertContiguous(plan.ranges(), Files.size(file));
    try (FileChannelChunkReader reader = FileChannelChunkReader.open(file)) {
      for (ByteRange range : plan.ranges().subList(1, plan.ranges().size())) {
        assertThat(reader.read(range)).startsWith("---\n");
      }
    }
  }

  @Test
  @DisplayName("should cut at the first of two blank lines when no other separator exists")
  void shouldAlignBoundariesToBlankRuns() throws IOException {
    List<String> prompts = new ArrayList<>();
    for (int i = 0; i < 10; i++) {
      prompts.add("Essay prompt " + i + " with some words");
    }
    String text = String.join("\n\n\n", prompts) + "\n";
    Path file = write("essays.md", text);

    ChunkPlan plan = chunker.createChunks(file, 70, 1_000);

    assertContiguous(plan.ranges(), Files.size(file));
    assertThat(plan.warnings()).isEmpty();
    try (FileChannelChunkReader reader = FileChannelChunkReader.open(file)) {
      for (ByteRange range : plan.ranges().subList(1, plan.ranges().size())) {
        assertThat(reader.read(range)).startsWith("\n\nEssay prompt");
      }
    }
  }

  @Test
  @DisplayName("should keep the rough cut and record a warning when no separator is in reach")
  void shouldFallBackToRoughCut_whenNoSeparatorWithinWindow() throws IOException {
    Path file = write("oneline.md", "x".repeat(300));

    ChunkPlan plan = chunker.createChunks(file, 100, 10);

    assertThat(plan.ranges())
        .containsExactly(new ByteRange(0, 100), new ByteRange(100, 200), new ByteRange(200, 300));
    assertThat(plan.warnings())
        .extracting(BoundaryWarning::boundary)
        .containsExactly(100L, 200L);
    assertThat(meterRegistry.counter("chunker.boundary.fallback").count()).isEqualTo(2.0);
  }

  @Test
  @DisplayName("should keep the tail in the current chunk when no separator follows before EOF")
  void shouldNotSplitLastQuestion_whenScanReachesEndOfFile() throws IOException {
    Path file = write("tail.md", "1. Describe the following.\n" + "More detail here.\n".repeat(20));

    ChunkPlan plan = chunker.createChunks(file, 50, 10_000);

    assertThat(plan.ranges()).containsExactly(new ByteRange(0, Files.size(file)));
    assertThat(plan.warnings()).isEmpty();
  }

  @Test
  @DisplayName("should never split a multi-byte UTF-8 character on fallback")
  void shouldNotSplitMultiByteCharacters() throws IOException {
    // Each character is three bytes, so most rough cuts land inside one.
    Path file = write("cjk.md", "中".repeat(200));

    ChunkPlan plan = chunker.createChunks(file, 100, 10);

    assertContiguous(plan.ranges(), 600);
    assertThat(plan.ranges()).allSatisfy(range -> assertThat(range.start() % 3).isZero());
    StringBuilder joined = new StringBuilder();
    try (FileChannelChunkReader reader = FileChannelChunkReader.open(file)) {
      for (ByteRange range : plan.ranges()) {
        joined.append(reader.read(range));
      }
    }
    assertThat(joined.toString()).isEqualTo("中".repeat(200));
  }

  @Test
  @DisplayName("should merge ranges when an aligned boundary passes the next rough cut")
  void shouldMergeRanges_whenBoundaryOvershootsNextCut() throws IOException {
    String filler = "word ".repeat(60) + "\n";
    Path file = write("long.md", "1. " + filler + "2. short\n");

    ChunkPlan plan = chunker.createChunks(file, 100, 10_000);

    assertThat(plan.ranges()).hasSize(2);
    assertContiguous(plan.ranges(), Files.size(file));
    assertThat(plan.ranges().get(1).start()).isEqualTo(3 + filler.length());
  }

  @Test
  @DisplayName("should reject a non-positive target size")
  void shouldRejectNonPositiveTargetSize() throws IOException {
    Path file = write("bank.md", "1. Q\n");

    assertThatThrownBy(() -> chunker.createChunks(file, 0, 100))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("should fail with IOException when the file does not exist")
  void shouldFail_whenFileMissing() {
    assertThatThrownBy(() -> chunker.createChunks(tempDir.resolve("missing.md"), 100, 100))
        .isInstanceOf(IOException.class);
  }

  private static void assertContiguous(List<ByteRange> ranges, long size) {
    assertThat(ranges.get(0).start()).isZero();
    assertThat(ranges.get(ranges.size() - 1).end()).isEqualTo(size);
    for (int i = 1; i < ranges.size(); i++) {
      assertThat(ranges.get(i).start()).isEqualTo(ranges.get(i - 1).end());
    }
    assertThat(ranges).allSatisfy(range -> assertThat(range.length()).isPositive());
  }

  private static String numberedBank(int count) {
    StringBuilder text = new StringBuilder("# Practice set\n\n");
    for (int i = 1; i <= count; i++) {
      text.append(i).append(". Which value is correct for item ").append(i).append("?\n");
      text.append("A. first\nB. second\nAnswer: A\n\n");
    }
    return text.toString();
  }

  private Path write(String name, String content) throws IOException {
    return Files.writeString(tempDir.resolve(name), content, StandardCharsets.UTF_8);
  }
}
