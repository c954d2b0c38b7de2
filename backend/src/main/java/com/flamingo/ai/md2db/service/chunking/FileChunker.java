package com.flamingo.ai.md2db.service.chunking;

import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Divides a source file into byte ranges that start on question boundaries.
 *
 * <p>Planning is two-phase. The file is first cut every {@code targetChunkSizeBytes}. Each
 * internal cut is then moved forward to the start of the first line that opens a new question: a
 * numbered line, a horizontal rule, or the first of two or more blank lines (see {@link
 * QuestionSeparators}). The forward scan is limited to {@code maxBoundarySearchBytes}; when it
 * finds nothing the rough cut is kept (shifted to the next UTF-8 character start) and a {@link
 * BoundaryWarning} is recorded. If the scan reaches the end of the file instead, the tail stays
 * with the current chunk.
 *
 * <p>The returned ranges are contiguous, gapless and never empty. A boundary that would not move
 * past the previous one, or that reaches the end of the file, is dropped so the neighbouring
 * ranges merge. The last range always ends at the file size.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FileChunker {

  private final MeterRegistry meterRegistry;

  /**
   * Plans the chunks of {@code file}.
   *
   * @param file the source file
   * @param targetChunkSizeBytes rough chunk size before alignment
   * @param maxBoundarySearchBytes forward-scan limit for each boundary
   * @return the chunk plan; empty for an empty file
   * @throws IOException if the file cannot be opened, sized or read
   */
  public ChunkPlan createChunks(Path file, long targetChunkSizeBytes, int maxBoundarySearchBytes)
      throws IOException {
    if (targetChunkSizeBytes <= 0) {
      throw new IllegalArgumentException("targetChunkSizeBytes must be positive");
    }
    if (maxBoundarySearchBytes <= 0) {
      throw new IllegalArgumentException("maxBoundarySearchBytes must be positive");
    }

    long fileSize = Files.size(file);
    List<ByteRange> ranges = new ArrayList<>();
    List<BoundaryWarning> warnings = new ArrayList<>();
    if (fileSize == 0) {
      log.info("File {} is empty, nothing to chunk", file);
      return new ChunkPlan(0, ranges, warnings);
    }

    try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
      long start = 0;
      for (long cut = targetChunkSizeBytes; cut < fileSize; cut += targetChunkSizeBytes) {
        if (cut <= start) {
          // The previous boundary was pushed past this rough cut.
          continue;
        }
        long boundary =
            alignBoundary(channel, cut, fileSize, maxBoundarySearchBytes, warnings, file);
        if (boundary <= start || boundary >= fileSize) {
          continue;
        }
        ranges.add(new ByteRange(start, boundary));
        start = boundary;
      }
      ranges.add(new ByteRange(start, fileSize));
    }

    log.info(
        "Planned {} chunks for {} ({} bytes, target {} bytes, {} unaligned boundaries)",
        ranges.size(),
        file,
        fileSize,
        targetChunkSizeBytes,
        warnings.size());
    return new ChunkPlan(fileSize, ranges, warnings);
  }

  private long alignBoundary(
      FileChannel channel,
      long cut,
      long fileSize,
      int window,
      List<BoundaryWarning> warnings,
      Path file)
      throws IOException {
    int length = (int) Math.min(window, fileSize - cut);
    ByteBuffer buffer = ByteBuffer.allocate(length);
    FileChannelChunkReader.readFully(channel, buffer, cut);
    byte[] bytes = buffer.array();
    boolean windowReachesEof = cut + length == fileSize;

    int pos = 0;
    if (!startsLine(channel, cut)) {
      int newline = indexOf(bytes, (byte) '\n', 0, length);
      pos = newline < 0 ? length : newline + 1;
    }

    int blankRun = 0;
    int blankRunStart = -1;
    while (pos < length) {
      int newline = indexOf(bytes, (byte) '\n', pos, length);
      if (newline < 0 && !windowReachesEof) {
        break; // last line is cut off by the window
      }
      int lineEnd = newline < 0 ? length : newline;
      String line = new String(bytes, pos, lineEnd - pos, StandardCharsets.UTF_8);

      if (QuestionSeparators.isBlank(line)) {
        if (blankRun == 0) {
          blankRunStart = pos;
        }
        blankRun++;
        if (blankRun >= QuestionSeparators.BLANK_RUN_LENGTH) {
          return cut + blankRunStart;
        }
      } else {
        blankRun = 0;
        if (QuestionSeparators.isSeparatorLine(line)) {
          return cut + pos;
        }
      }
      pos = lineEnd + 1;
    }

    if (windowReachesEof) {
      // The rest of the file belongs to the question already in progress.
      return fileSize;
    }

    long fallback = cut + characterStart(bytes, length);
    warnings.add(new BoundaryWarning(cut, fallback, length));
    meterRegistry.counter("chunker.boundary.fallback").increment();
    log.warn(
        "No question separator within {} bytes after offset {} in {}; cutting at {}",
        length,
        cut,
        file,
        fallback);
    return fallback;
  }

  private boolean startsLine(FileChannel channel, long offset) throws IOException {
    if (offset == 0) {
      return true;
    }
    ByteBuffer previous = ByteBuffer.allocate(1);
    FileChannelChunkReader.readFully(channel, previous, offset - 1);
    return previous.get(0) == '\n';
  }

  /** First index that is not a UTF-8 continuation byte, so the cut never splits a character. */
  private static int characterStart(byte[] bytes, int length) {
    int i = 0;
    while (i < length && (bytes[i] & 0xC0) == 0x80) {
      i++;
    }
    return i;
  }

  private static int indexOf(byte[] bytes, byte target, int from, int to) {
    for (int i = from; i < to; i++) {
      if (bytes[i] == target) {
        return i;
      }
    }
    return -1;
  }
}
