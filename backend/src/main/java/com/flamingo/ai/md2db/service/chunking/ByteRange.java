package com.flamingo.ai.md2db.service.chunking;

/**
 * Half-open byte span {@code [start, end)} of the source file.
 *
 * @param start first byte offset, inclusive
 * @param end last byte offset, exclusive
 */
public record ByteRange(long start, long end) {

  public ByteRange {
    if (start < 0 || end < start) {
      throw new IllegalArgumentException("Invalid byte range [" + start + ", " + end + ")");
    }
  }

  public long length() {
    return end - start;
  }

  /** Stable chunk identifier, {@code "<start>-<end>"}, used as the progress key. */
  public String id() {
    return start + "-" + end;
  }

  @Override
  public String toString() {
    return "[" + start + ", " + end + ")";
  }
}
