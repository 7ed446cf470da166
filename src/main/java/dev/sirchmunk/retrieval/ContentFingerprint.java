package dev.sirchmunk.retrieval;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Static utility for SHA-256 hashing. Used for duplicate-file detection during ranking, for
 * evidence source fingerprints, and for deterministic cluster ids.
 */
public final class ContentFingerprint {

  /** Bytes read from the head of a file for a fast fingerprint. */
  static final int HEAD_BYTES = 64 * 1024;

  private ContentFingerprint() {
    // utility class
  }

  /**
   * Compute the SHA-256 hash of the given text.
   *
   * @param content the content to hash
   * @return lowercase hex string of the SHA-256 hash
   */
  public static String sha256(String content) {
    MessageDigest digest = newDigest();
    return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
  }

  /**
   * Fast fingerprint of a file: SHA-256 over its size and first {@value #HEAD_BYTES} bytes.
   * Identical files always collide; different files collide only if they share size and head.
   *
   * @param file file to fingerprint
   * @return lowercase hex fingerprint
   * @throws IOException if the file cannot be read
   */
  public static String ofFile(Path file) throws IOException {
    MessageDigest digest = newDigest();
    digest.update(ByteBuffer.allocate(Long.BYTES).putLong(Files.size(file)).array());
    try (InputStream in = Files.newInputStream(file)) {
      digest.update(in.readNBytes(HEAD_BYTES));
    }
    return HexFormat.of().formatHex(digest.digest());
  }

  private static MessageDigest newDigest() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }
}
