package com.codeheadsystems.swapdot.desfire;

/**
 * Utility methods for byte array manipulation used by the DESFire wire protocol.
 * <p>
 * All multi-byte integers on the DESFire wire are little-endian.
 */
public class ByteUtils {

  private ByteUtils() {
  }

  /**
   * Encodes a non-negative integer as a little-endian octet string of the given length.
   *
   * @param value  the value
   * @param length the number of bytes
   * @return the byte [ ]
   */
  public static byte[] littleEndian(int value, int length) {
    if (value < 0 || (length < 4 && value >= (1 << (8 * length)))) {
      throw new IllegalArgumentException("Value too large for specified length");
    }
    byte[] result = new byte[length];
    for (int i = 0; i < length; i++) {
      result[i] = (byte) (value & 0xFF);
      value >>= 8;
    }
    return result;
  }

  /**
   * Decodes a little-endian unsigned integer.
   *
   * @param data   the source
   * @param offset first byte
   * @param length number of bytes, at most 3
   * @return the value
   */
  public static int fromLittleEndian(byte[] data, int offset, int length) {
    int value = 0;
    for (int i = length - 1; i >= 0; i--) {
      value = (value << 8) | (data[offset + i] & 0xFF);
    }
    return value;
  }

  /**
   * Concatenates multiple byte arrays into a single array.
   *
   * @param arrays the arrays
   * @return the byte [ ]
   */
  public static byte[] concat(byte[]... arrays) {
    int totalLength = 0;
    for (byte[] arr : arrays) {
      totalLength += arr.length;
    }
    byte[] result = new byte[totalLength];
    int offset = 0;
    for (byte[] arr : arrays) {
      System.arraycopy(arr, 0, result, offset, arr.length);
      offset += arr.length;
    }
    return result;
  }

  /**
   * XOR two byte arrays of equal length.
   *
   * @param a the a
   * @param b the b
   * @return the byte [ ]
   */
  public static byte[] xor(byte[] a, byte[] b) {
    if (a.length != b.length) {
      throw new IllegalArgumentException("XOR arrays must have equal length: " + a.length + " vs " + b.length);
    }
    byte[] out = new byte[a.length];
    for (int i = 0; i < a.length; i++) {
      out[i] = (byte) (a[i] ^ b[i]);
    }
    return out;
  }

  /**
   * Rotates the array left by one byte: {@code b0 b1 .. bn} becomes {@code b1 .. bn b0}.
   *
   * @param data the data
   * @return a new rotated array
   */
  public static byte[] rotateLeft(byte[] data) {
    byte[] out = new byte[data.length];
    if (data.length == 0) {
      return out;
    }
    System.arraycopy(data, 1, out, 0, data.length - 1);
    out[data.length - 1] = data[0];
    return out;
  }

  /**
   * Returns a copy of {@code length} bytes of {@code data} starting at {@code from}.
   *
   * @param data   the data
   * @param from   first byte
   * @param length number of bytes
   * @return the byte [ ]
   */
  public static byte[] slice(byte[] data, int from, int length) {
    byte[] out = new byte[length];
    System.arraycopy(data, from, out, 0, length);
    return out;
  }
}
