package com.codeheadsystems.swapdot.desfire;

/**
 * Integrity checksums appended to DESFire data and key cryptograms.
 */
public class Checksums {

  private Checksums() {
  }

  /**
   * CRC16 as used by DES/3DES sessions: reflected, polynomial 0xA001, initial value 0xFFFF,
   * no final XOR. Output is two bytes, little-endian.
   *
   * @param data the data
   * @return the 2-byte checksum
   */
  public static byte[] crc16(byte[] data) {
    int crc = 0xFFFF;
    for (byte b : data) {
      crc ^= b & 0xFF;
      for (int bit = 0; bit < 8; bit++) {
        boolean lsb = (crc & 1) != 0;
        crc >>>= 1;
        if (lsb) {
          crc ^= 0xA001;
        }
      }
    }
    return ByteUtils.littleEndian(crc & 0xFFFF, 2);
  }

  /**
   * CRC32 belongs to AES sessions, which this implementation does not support.
   *
   * @param data the data
   * @return never returns
   * @throws UnsupportedOperationException always
   */
  public static byte[] crc32(byte[] data) {
    throw new UnsupportedOperationException(
        "CRC32 is only used by AES sessions, which are not supported (DES/3DES sessions only)");
  }
}
