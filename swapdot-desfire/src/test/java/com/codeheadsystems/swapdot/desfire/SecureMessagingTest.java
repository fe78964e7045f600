package com.codeheadsystems.swapdot.desfire;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayOutputStream;
import java.util.HexFormat;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class SecureMessagingTest {

  private static final HexFormat HEX = HexFormat.of();
  private static final DesKey SESSION_KEY = DesKey.of(HEX.parseHex("0123456789abcdeffedcba9876543210"));

  private SecureMessaging secureMessaging;

  @BeforeEach
  void setUp() {
    secureMessaging = new SecureMessaging();
  }

  @ParameterizedTest
  @EnumSource(CommMode.class)
  void writeFrames_roundTrip_allLengths(CommMode mode) {
    Random random = new Random(42);
    for (int length = 0; length <= 300; length++) {
      byte[] data = new byte[length];
      random.nextBytes(data);
      List<byte[]> frames = secureMessaging.buildWriteFrames(1, 0x10, data, SESSION_KEY, mode);
      assertThat(decodeWrite(frames, mode))
          .as("mode %s length %d", mode, length)
          .isEqualTo(data);
    }
  }

  @Test
  void writeFrames_plain_splitsAtCapacityBoundaries() {
    assertThat(secureMessaging.buildWriteFrames(1, 0, new byte[48], SESSION_KEY, CommMode.PLAIN)).hasSize(1);
    assertThat(secureMessaging.buildWriteFrames(1, 0, new byte[49], SESSION_KEY, CommMode.PLAIN)).hasSize(2);
    assertThat(secureMessaging.buildWriteFrames(1, 0, new byte[48 + 59], SESSION_KEY, CommMode.PLAIN)).hasSize(2);
    assertThat(secureMessaging.buildWriteFrames(1, 0, new byte[48 + 60], SESSION_KEY, CommMode.PLAIN)).hasSize(3);
  }

  @Test
  void writeFrames_firstFrameLayout() {
    byte[] data = {(byte) 0xAA, (byte) 0xBB};
    byte[] frame = secureMessaging.buildWriteFrames(3, 0x0102, data, SESSION_KEY, CommMode.PLAIN).get(0);
    assertThat(HEX.formatHex(frame)).isEqualTo("903d000009" + "03" + "020100" + "020000" + "aabb" + "00");
  }

  @Test
  void writeFrames_continuationFrameLayout() {
    List<byte[]> frames = secureMessaging.buildWriteFrames(1, 0, new byte[50], SESSION_KEY, CommMode.PLAIN);
    assertThat(HEX.formatHex(frames.get(1))).isEqualTo("90af0000020000" + "00");
  }

  @Test
  void writeFrames_maced_endsWithMacOverCommandHeaderAndData() {
    byte[] data = HEX.parseHex("00112233445566778899");
    byte[] payload = payload(secureMessaging.buildWriteFrames(1, 0, data, SESSION_KEY, CommMode.MACED));
    assertThat(payload).hasSize(data.length + 2 + 8);
    byte[] covered = HEX.parseHex("3d" + "01" + "000000" + "0a0000");
    byte[] expectedCrc = Checksums.crc16(ByteUtils.concat(covered, data));
    byte[] expectedMac = ReferenceCrypto.mac(SESSION_KEY.material(), ByteUtils.concat(covered, data, expectedCrc));
    assertThat(ByteUtils.slice(payload, data.length, 2)).isEqualTo(expectedCrc);
    assertThat(ByteUtils.slice(payload, data.length + 2, 8)).isEqualTo(expectedMac);
  }

  @Test
  void macCbc_weakSessionKey_throwsWeakKey() {
    assertThatThrownBy(() -> secureMessaging.macCbc(DesKey.of(new byte[16]), new byte[]{1, 2, 3}))
        .isInstanceOf(WeakKeyException.class);
  }

  @Test
  void changeKeyFrames_decryptToCryptogram() {
    byte[] oldKey = new byte[16];
    byte[] newKey = HEX.parseHex("00112233445566778899aabbccddeeff");
    List<byte[]> frames = secureMessaging.buildChangeKeyFrames(0, oldKey, newKey, SESSION_KEY, 1);
    assertThat(frames).hasSize(1);
    byte[] frame = frames.get(0);
    assertThat(frame[1]).isEqualTo(DesfireCommands.INS_CHANGE_KEY);
    int lc = frame[4] & 0xFF;
    assertThat(frame[5]).isEqualTo((byte) 0);
    byte[] encrypted = ByteUtils.slice(frame, 6, lc - 1);
    assertThat(encrypted).hasSize(24);

    byte[] decrypted = ReferenceCrypto.decrypt(SESSION_KEY.material(), new byte[8], encrypted);
    byte[] newMaterial = DesKey.of(newKey).material();
    byte[] oldMaterial = DesKey.of(oldKey).material();
    assertThat(ByteUtils.slice(decrypted, 0, 16)).isEqualTo(ByteUtils.xor(newMaterial, oldMaterial));
    assertThat(ByteUtils.slice(decrypted, 16, 2)).isEqualTo(Checksums.crc16(newMaterial));
    assertThat(decrypted[18]).isEqualTo((byte) 1);
    assertThat(Iso9797Padding.unpad(decrypted)).hasSize(19);
  }

  @Test
  void changeKeyFrames_mismatchedKeyLengths_throws() {
    assertThatThrownBy(() -> secureMessaging.buildChangeKeyFrames(0, new byte[16], new byte[24], SESSION_KEY, 0))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("same length");
  }

  @Test
  void changeKeyFrames_singleDesNewKey_normalizesToSixteen() {
    List<byte[]> frames = secureMessaging.buildChangeKeyFrames(0, new byte[16], new byte[8], SESSION_KEY, 0);
    assertThat(frames).hasSize(1);
  }

  private static byte[] payload(List<byte[]> frames) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    byte[] first = frames.get(0);
    assertThat(first[0]).isEqualTo(DesfireCommands.CLA);
    int lc = first[4] & 0xFF;
    assertThat(first).hasSize(lc + 6);
    assertThat(first[first.length - 1]).isZero();
    out.write(first, 5 + SecureMessaging.WRITE_HEADER_LENGTH, lc - SecureMessaging.WRITE_HEADER_LENGTH);
    for (byte[] frame : frames.subList(1, frames.size())) {
      assertThat(frame[1]).isEqualTo(DesfireCommands.INS_ADDITIONAL_FRAME);
      int len = frame[4] & 0xFF;
      assertThat(len).isBetween(1, SecureMessaging.CONTINUATION_CAPACITY);
      out.write(frame, 5, len);
    }
    return out.toByteArray();
  }

  private static byte[] decodeWrite(List<byte[]> frames, CommMode mode) {
    byte[] first = frames.get(0);
    assertThat(first[1]).isEqualTo(DesfireCommands.INS_WRITE_DATA);
    byte[] header = ByteUtils.slice(first, 5, SecureMessaging.WRITE_HEADER_LENGTH);
    int length = ByteUtils.fromLittleEndian(header, 4, 3);
    byte[] covered = ByteUtils.concat(new byte[]{DesfireCommands.INS_WRITE_DATA}, header);
    byte[] payload = payload(frames);
    return switch (mode) {
      case PLAIN -> payload;
      case MACED -> {
        assertThat(payload).hasSize(length + 10);
        byte[] data = ByteUtils.slice(payload, 0, length);
        byte[] crc = ByteUtils.slice(payload, length, 2);
        assertThat(crc).isEqualTo(Checksums.crc16(ByteUtils.concat(covered, data)));
        byte[] mac = ByteUtils.slice(payload, length + 2, 8);
        assertThat(mac).isEqualTo(ReferenceCrypto.mac(SESSION_KEY.material(), ByteUtils.concat(covered, data, crc)));
        yield data;
      }
      case ENCIPHERED -> {
        byte[] plain = Iso9797Padding.unpad(ReferenceCrypto.decrypt(SESSION_KEY.material(), new byte[8], payload));
        assertThat(plain).hasSize(length + 2);
        byte[] data = ByteUtils.slice(plain, 0, length);
        assertThat(ByteUtils.slice(plain, length, 2)).isEqualTo(Checksums.crc16(ByteUtils.concat(covered, data)));
        yield data;
      }
    };
  }
}
