package com.flamingo.ai.md2db.service.chunking;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * {@link ChunkReader} backed by a single read-only {@link FileChannel}.
 *
 * <p>Positional reads do not touch the channel's position, so concurrent workers can share one
 * channel without coordination.
 */
public class FileChannelChunkReader implements ChunkReader {

  private final Path file;
  private final FileChannel channel;

  private FileChannelChunkReader(Path file, FileChannel channel) {
    this.file = file;
    this.channel = channel;
  }

  public static FileChannelChunkReader open(Path file) throws IOException {
    return new FileChannelChunkReader(file, FileChannel.open(file, StandardOpenOption.READ));
  }

  @Override
  public String read(ByteRange range) throws IOException {
    if (range.length() > Integer.MAX_VALUE) {
      throw new IOException("Chunk " + range + " of " + file + " is too large to read at once");
    }
    ByteBuffer buffer = ByteBuffer.allocate((int) range.length());
    readFully(channel, buffer, range.start());
    buffer.flip();
    // A decoder is not thread-safe, so each read gets its own.
    CharsetDecoder decoder =
        StandardCharsets.UTF_8
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
    return decoder.decode(buffer).toString();
  }

  @Override
  public void close() throws IOException {
    channel.close();
  }

  static void readFully(FileChannel channel, ByteBuffer buffer, long position)
      throws IOException {
    long offset = position;
    while (buffer.hasRemaining()) {
      int read = channel.read(buffer, offset);
      if (read < 0) {
        throw new EOFException(
            "Unexpected end of file at " + offset + " (wanted " + buffer.remaining() + " more)");
      }
      offset += read;
    }
  }
}
