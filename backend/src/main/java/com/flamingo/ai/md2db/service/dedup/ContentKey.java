package com.flamingo.ai.md2db.service.dedup;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** Content digest used as the deduplication key: lowercase hex SHA-256 of the UTF-8 bytes. */
public final class ContentKey {

  private static final HexFormat HEX = HexFormat.of();

  private ContentKey() {}

  public static String of(String payload) {
    return HEX.formatHex(sha256(payload.getBytes(StandardCharsets.UTF_8)));
  }

  /**
   * Short digest for identifiers that only need to be distinct within one deployment.
   *
   * @param payload text to digest
   * @param hexChars number of hex characters to keep
   * @return the first {@code hexChars} characters of {@link #of(String)}
   */
  public static String shortKey(String payload, int hexChars) {
    return of(payload).substring(0, hexChars);
  }

  private static byte[] sha256(byte[] bytes) {
    try {
      return MessageDigest.getInstance("SHA-256").digest(bytes);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
