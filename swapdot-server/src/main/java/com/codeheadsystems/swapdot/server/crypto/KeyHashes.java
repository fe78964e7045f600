package com.codeheadsystems.swapdot.server.crypto;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.regex.Pattern;
import org.bouncycastle.util.encoders.Hex;

/**
 * SHA-256 fingerprints of token keys. The ledger only ever stores these; plaintext keys stay in
 * the request that generated them.
 */
public final class KeyHashes {

  private static final Pattern SHA256_HEX = Pattern.compile("[0-9a-fA-F]{64}");

  private KeyHashes() {
  }

  /**
   * Checks that {@code keyHash} looks like a SHA-256 hex digest and lowercases it.
   *
   * @param field   name used in the error message
   * @param keyHash the candidate
   * @return the lowercase digest
   * @throws IllegalArgumentException if it is null or not 64 hex characters
   */
  public static String requireSha256Hex(String field, String keyHash) {
    if (keyHash == null || !SHA256_HEX.matcher(keyHash).matches()) {
      throw new IllegalArgumentException(field + " must be a SHA-256 hex digest");
    }
    return keyHash.toLowerCase();
  }

  /**
   * Lowercase hex SHA-256 of the key bytes.
   *
   * @param key the key
   * @return 64 hex characters
   */
  public static String sha256Hex(byte[] key) {
    return Hex.toHexString(sha256(key));
  }

  /**
   * Constant-time comparison of two hex fingerprints, case-insensitive. A null on either side
   * never matches.
   *
   * @param a first hash
   * @param b second hash
   * @return true if equal
   */
  public static boolean matches(String a, String b) {
    if (a == null || b == null) {
      return false;
    }
    return MessageDigest.isEqual(
        a.toLowerCase().getBytes(StandardCharsets.US_ASCII),
        b.toLowerCase().getBytes(StandardCharsets.US_ASCII));
  }

  static byte[] sha256(byte[] data) {
    try {
      return MessageDigest.getInstance("SHA-256").digest(data);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
