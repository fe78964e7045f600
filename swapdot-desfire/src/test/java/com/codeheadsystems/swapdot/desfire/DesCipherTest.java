package com.codeheadsystems.swapdot.desfire;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HexFormat;
import org.junit.jupiter.api.Test;

class DesCipherTest {

  private static final HexFormat HEX = HexFormat.of();

  @Test
  void card_acceptsFactoryZeroKey_knownVector() {
    byte[] out = DesCipher.CARD.encrypt(DesKey.of(new byte[16]), DesCipher.zeroIv(), new byte[8]);
    assertThat(HEX.formatHex(out)).isEqualTo("8ca64de9c1b123a7");
  }

  @Test
  void session_rejectsWeakKey() {
    assertThatThrownBy(() -> DesCipher.SESSION.encrypt(DesKey.of(new byte[16]), DesCipher.zeroIv(), new byte[8]))
        .isInstanceOf(WeakKeyException.class);
  }

  @Test
  void requireStrong_checksEveryBlock() {
    DesCipher.requireStrong(DesKey.of(HEX.parseHex("0123456789abcdeffedcba9876543210")));

    assertThatThrownBy(() -> DesCipher.requireStrong(DesKey.of(HEX.parseHex("0123456789abcdef0101010101010101"))))
        .isInstanceOf(WeakKeyException.class)
        .hasMessageContaining("offset 8");
  }

  @Test
  void encryptDecrypt_matchesJce() {
    byte[] key = HEX.parseHex("0123456789abcdeffedcba9876543210");
    byte[] iv = HEX.parseHex("1122334455667788");
    byte[] data = HEX.parseHex("000102030405060708090a0b0c0d0e0f");
    DesKey desKey = DesKey.of(key);
    byte[] encrypted = DesCipher.SESSION.encrypt(desKey, iv, data);
    assertThat(encrypted).isEqualTo(ReferenceCrypto.encrypt(desKey.material(), iv, data));
    assertThat(DesCipher.SESSION.decrypt(desKey, iv, encrypted)).isEqualTo(data);
  }

  @Test
  void unalignedData_throws() {
    assertThatThrownBy(() -> DesCipher.CARD.encrypt(DesKey.of(new byte[16]), DesCipher.zeroIv(), new byte[5]))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("multiple of 8");
  }
}
