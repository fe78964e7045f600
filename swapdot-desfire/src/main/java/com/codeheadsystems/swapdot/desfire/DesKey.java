package com.codeheadsystems.swapdot.desfire;

import java.util.Arrays;

/**
 * A normalized DES-family key. The variant is fixed once, by {@link #of(byte[])}, from the raw
 * key length; every later stage works only with the 16 or 24 bytes of {@link #material()}.
 * <p>
 * Normalization:
 * <ul>
 *   <li>8 bytes (single DES) are duplicated to {@code K || K}</li>
 *   <li>16 bytes (two-key 3DES) and 24 bytes (three-key 3DES) pass through</li>
 *   <li>every byte then gets odd parity in its low bit; the 7 data bits are never touched</li>
 * </ul>
 */
public final class DesKey {

  /**
   * Key variant, chosen by raw key length.
   */
  public enum Variant {
    SINGLE_DES,
    TWO_KEY_TRIPLE_DES,
    THREE_KEY_TRIPLE_DES
  }

  private final Variant variant;
  private final byte[] bytes;

  private DesKey(Variant variant, byte[] bytes) {
    this.variant = variant;
    this.bytes = bytes;
  }

  /**
   * Normalizes a raw key.
   *
   * @param rawKey 8, 16 or 24 bytes
   * @return the key
   * @throws IllegalArgumentException for any other length
   */
  public static DesKey of(byte[] rawKey) {
    if (rawKey == null) {
      throw new IllegalArgumentException("Key is required");
    }
    return switch (rawKey.length) {
      case 8 -> new DesKey(Variant.SINGLE_DES, withOddParity(ByteUtils.concat(rawKey, rawKey)));
      case 16 -> new DesKey(Variant.TWO_KEY_TRIPLE_DES, withOddParity(rawKey));
      case 24 -> new DesKey(Variant.THREE_KEY_TRIPLE_DES, withOddParity(rawKey));
      default -> throw new IllegalArgumentException("Invalid DES/3DES key length: " + rawKey.length);
    };
  }

  /**
   * Sets the low bit of each byte so that every byte has an odd number of set bits.
   *
   * @param key the key bytes
   * @return a parity-adjusted copy
   */
  static byte[] withOddParity(byte[] key) {
    byte[] adjusted = key.clone();
    for (int i = 0; i < adjusted.length; i++) {
      int b = adjusted[i] & 0xFF;
      int ones = Integer.bitCount(b & 0xFE);
      adjusted[i] = (byte) ((ones % 2 == 0) ? (b | 0x01) : (b & 0xFE));
    }
    return adjusted;
  }

  public Variant variant() {
    return variant;
  }

  public boolean isSingleDes() {
    return variant == Variant.SINGLE_DES;
  }

  /**
   * The normalized key bytes (16 or 24), suitable for a DESede engine.
   *
   * @return a copy of the key material
   */
  public byte[] material() {
    return bytes.clone();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof DesKey other && variant == other.variant && Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return 31 * variant.hashCode() + Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return "DesKey[" + variant + ", redacted]";
  }
}
