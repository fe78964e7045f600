package com.codeheadsystems.swapdot.desfire;

/**
 * Native DESFire command APDUs, wrapped in ISO 7816 framing with {@code CLA = 0x90}.
 */
public class DesfireCommands {

  public static final byte CLA = (byte) 0x90;
  public static final byte INS_AUTHENTICATE = (byte) 0x1A;
  public static final byte INS_ADDITIONAL_FRAME = (byte) 0xAF;
  public static final byte INS_WRITE_DATA = (byte) 0x3D;
  public static final byte INS_READ_DATA = (byte) 0xBD;
  public static final byte INS_CHANGE_KEY = (byte) 0xC4;

  /**
   * Largest command body accepted in a single frame.
   */
  public static final int MAX_FRAME_BODY = 59;

  private DesfireCommands() {
  }

  /**
   * Wraps a native command: {@code 90 INS 00 00 [Lc body] 00}. An empty body omits Lc.
   *
   * @param ins  instruction byte
   * @param body command body, at most {@link #MAX_FRAME_BODY} bytes
   * @return the APDU
   */
  public static byte[] wrap(byte ins, byte[] body) {
    if (body.length > MAX_FRAME_BODY) {
      throw new IllegalArgumentException("Frame body too long: " + body.length);
    }
    if (body.length == 0) {
      return new byte[]{CLA, ins, 0x00, 0x00, 0x00};
    }
    return ByteUtils.concat(
        new byte[]{CLA, ins, 0x00, 0x00, (byte) body.length},
        body,
        new byte[]{0x00});
  }

  /**
   * Legacy (DES/3DES) authenticate: {@code 90 1A 00 00 01 keyNo 00}.
   *
   * @param keyNo the key number
   * @return the APDU
   */
  public static byte[] authenticate(int keyNo) {
    return wrap(INS_AUTHENTICATE, new byte[]{(byte) keyNo});
  }

  /**
   * Additional frame carrying {@code body}.
   *
   * @param body the body
   * @return the APDU
   */
  public static byte[] additionalFrame(byte[] body) {
    return wrap(INS_ADDITIONAL_FRAME, body);
  }

  /**
   * Additional frame with an empty body, used to pull more data from the card during a read.
   *
   * @return {@code 90 AF 00 00 00}
   */
  public static byte[] readContinuation() {
    return wrap(INS_ADDITIONAL_FRAME, new byte[0]);
  }

  /**
   * ReadData request: {@code 90 BD 00 00 07 fileNo offset(3) length(3) 00}.
   *
   * @param fileNo the file number
   * @param offset the offset
   * @param length number of bytes, zero for the whole file
   * @return the APDU
   */
  public static byte[] readData(int fileNo, int offset, int length) {
    return wrap(INS_READ_DATA, ByteUtils.concat(
        new byte[]{(byte) fileNo},
        ByteUtils.littleEndian(offset, 3),
        ByteUtils.littleEndian(length, 3)));
  }
}
