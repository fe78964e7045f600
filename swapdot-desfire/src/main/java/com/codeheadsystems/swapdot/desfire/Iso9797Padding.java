package com.codeheadsystems.swapdot.desfire;

import java.util.Arrays;

/**
 * ISO/IEC 9797-1 padding method 2: a single 0x80 byte followed by zeros up to the block boundary.
 * A full block of padding is added when the input is already aligned.
 */
public class Iso9797Padding {

  private Iso9797Padding() {
  }

  /**
   * Pads the data.
   *
   * @param data      the data
   * @param blockSize the block size in bytes
   * @return a new padded array whose length is a multiple of {@code blockSize}
   */
  public static byte[] pad(byte[] data, int blockSize) {
    if (blockSize <= 0) {
      throw new IllegalArgumentException("Block size must be positive: " + blockSize);
    }
    int paddedLength = ((data.length / blockSize) + 1) * blockSize;
    byte[] out = Arrays.copyOf(data, paddedLength);
    out[data.length] = (byte) 0x80;
    return out;
  }

  /**
   * Strips the padding by scanning backward over trailing zeros and then a single 0x80.
   * Data without a recognisable 0x80 marker is returned unchanged.
   *
   * @param data the padded data
   * @return the unpadded data
   */
  public static byte[] unpad(byte[] data) {
    int i = data.length - 1;
    while (i >= 0 && data[i] == 0x00) {
      i--;
    }
    if (i >= 0 && data[i] == (byte) 0x80) {
      return Arrays.copyOf(data, i);
    }
    return data.clone();
  }
}
