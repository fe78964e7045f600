package com.codeheadsystems.swapdot.desfire;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds byte-exact WriteData and ChangeKey command frames for DES/3DES sessions.
 * <p>
 * Stateless. The session key is supplied per call and never retained. Multi-frame commands are
 * returned in the order they must be sent; every frame but the last is answered by the card
 * with {@code 91 AF}.
 */
public class SecureMessaging {

  private static final Logger log = LoggerFactory.getLogger(SecureMessaging.class);

  /**
   * Size of the CBC-MAC appended to MACed payloads.
   */
  public static final int MAC_LENGTH = 8;

  /**
   * WriteData header: fileNo(1) offset(3) length(3).
   */
  public static final int WRITE_HEADER_LENGTH = 7;

  /**
   * Payload bytes that fit in the first WriteData frame.
   */
  public static final int WRITE_FIRST_FRAME_CAPACITY = 48;

  /**
   * Cryptogram bytes that fit in the first ChangeKey frame, after the keyNo byte.
   */
  public static final int CHANGE_KEY_FIRST_FRAME_CAPACITY = 54;

  /**
   * Payload bytes that fit in a continuation frame.
   */
  public static final int CONTINUATION_CAPACITY = DesfireCommands.MAX_FRAME_BODY;

  private static final int MAX_WRITE_LENGTH = 0xFFFFFF;

  private final DesCipher cipher;

  public SecureMessaging() {
    this(DesCipher.SESSION);
  }

  SecureMessaging(DesCipher cipher) {
    this.cipher = cipher;
  }

  /**
   * CBC-MAC: pads {@code data}, encrypts it under a zero IV and returns the last block.
   *
   * @param key  the session key
   * @param data the data
   * @return the 8-byte MAC
   * @throws WeakKeyException if the key contains a weak DES block
   */
  public byte[] macCbc(DesKey key, byte[] data) {
    byte[] encrypted = cipher.encrypt(key, DesCipher.zeroIv(), Iso9797Padding.pad(data, DesCipher.BLOCK_SIZE));
    return ByteUtils.slice(encrypted, encrypted.length - MAC_LENGTH, MAC_LENGTH);
  }

  /**
   * Builds the WriteData command frames.
   *
   * @param fileNo     the file number
   * @param offset     the offset within the file
   * @param data       the plaintext to write
   * @param sessionKey the authenticated session key, unused for {@link CommMode#PLAIN}
   * @param mode       the file's communication mode
   * @return the frames in send order
   */
  public List<byte[]> buildWriteFrames(int fileNo, int offset, byte[] data, DesKey sessionKey, CommMode mode) {
    if (data.length > MAX_WRITE_LENGTH) {
      throw new IllegalArgumentException("Write length exceeds 3-byte length field: " + data.length);
    }
    byte[] header = ByteUtils.concat(
        new byte[]{(byte) fileNo},
        ByteUtils.littleEndian(offset, 3),
        ByteUtils.littleEndian(data.length, 3));
    byte[] covered = ByteUtils.concat(new byte[]{DesfireCommands.INS_WRITE_DATA}, header, data);
    byte[] payload = switch (mode) {
      case PLAIN -> data.clone();
      case MACED -> {
        byte[] withCrc = ByteUtils.concat(data, Checksums.crc16(covered));
        byte[] mac = macCbc(sessionKey, ByteUtils.concat(new byte[]{DesfireCommands.INS_WRITE_DATA}, header, withCrc));
        yield ByteUtils.concat(withCrc, mac);
      }
      case ENCIPHERED -> {
        byte[] plain = Iso9797Padding.pad(ByteUtils.concat(data, Checksums.crc16(covered)), DesCipher.BLOCK_SIZE);
        yield cipher.encrypt(sessionKey, DesCipher.zeroIv(), plain);
      }
    };
    List<byte[]> frames = chain(DesfireCommands.INS_WRITE_DATA, header, payload, WRITE_FIRST_FRAME_CAPACITY);
    log.debug("buildWriteFrames(fileNo={}, length={}, mode={}) -> {} frame(s)", fileNo, data.length, mode, frames.size());
    return frames;
  }

  /**
   * Builds the ChangeKey command frames. The cryptogram is
   * {@code enc(pad(xor(new, old) || crc16(new) || keyVersion))} under the session key with a zero
   * IV.
   *
   * @param keyNo      the key number being changed
   * @param oldKey     the current raw key (8, 16 or 24 bytes)
   * @param newKey     the new raw key (8, 16 or 24 bytes)
   * @param sessionKey the authenticated session key
   * @param keyVersion the new key version
   * @return the frames in send order
   * @throws IllegalArgumentException if the normalized keys differ in length
   */
  public List<byte[]> buildChangeKeyFrames(int keyNo, byte[] oldKey, byte[] newKey, DesKey sessionKey,
                                           int keyVersion) {
    byte[] oldMaterial = DesKey.of(oldKey).material();
    byte[] newMaterial = DesKey.of(newKey).material();
    if (oldMaterial.length != newMaterial.length) {
      throw new IllegalArgumentException("Old and new keys must normalize to the same length: "
          + oldMaterial.length + " vs " + newMaterial.length);
    }
    byte[] cryptogram = ByteUtils.concat(
        ByteUtils.xor(newMaterial, oldMaterial),
        Checksums.crc16(newMaterial),
        new byte[]{(byte) keyVersion});
    byte[] encrypted = cipher.encrypt(sessionKey, DesCipher.zeroIv(),
        Iso9797Padding.pad(cryptogram, DesCipher.BLOCK_SIZE));
    List<byte[]> frames = chain(DesfireCommands.INS_CHANGE_KEY, new byte[]{(byte) keyNo}, encrypted,
        CHANGE_KEY_FIRST_FRAME_CAPACITY);
    log.debug("buildChangeKeyFrames(keyNo={}) -> {} frame(s)", keyNo, frames.size());
    return frames;
  }

  private static List<byte[]> chain(byte ins, byte[] header, byte[] payload, int firstCapacity) {
    List<byte[]> frames = new ArrayList<>();
    int first = Math.min(firstCapacity, payload.length);
    frames.add(DesfireCommands.wrap(ins, ByteUtils.concat(header, ByteUtils.slice(payload, 0, first))));
    int position = first;
    while (position < payload.length) {
      int chunk = Math.min(CONTINUATION_CAPACITY, payload.length - position);
      frames.add(DesfireCommands.additionalFrame(ByteUtils.slice(payload, position, chunk)));
      position += chunk;
    }
    return frames;
  }
}
