package dev.granary.storage;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** Static utility for computing SHA-256 content hashes used as content-level dedup keys. */
public final class ContentHasher {

  private ContentHasher() {
    // utility class
  }

  /**
   * Compute the SHA-256 hash of the given payload.
   *
   * @param content the raw bytes to hash
   * @return lowercase hex string of the SHA-256 hash
   */
  public static String sha256(byte[] content) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(content));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }
}
