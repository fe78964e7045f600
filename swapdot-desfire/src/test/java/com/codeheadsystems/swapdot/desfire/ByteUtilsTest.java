package com.codeheadsystems.swapdot.desfire;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ByteUtilsTest {

  @Test
  void littleEndian_threeBytes() {
    assertThat(ByteUtils.littleEndian(0x123456, 3)).containsExactly(0x56, 0x34, 0x12);
    assertThat(ByteUtils.fromLittleEndian(new byte[]{0x00, 0x56, 0x34, 0x12}, 1, 3)).isEqualTo(0x123456);
  }

  @Test
  void littleEndian_tooLarge_throws() {
    assertThatThrownBy(() -> ByteUtils.littleEndian(0x1000000, 3))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rotateLeft_movesFirstByteToEnd() {
    assertThat(ByteUtils.rotateLeft(new byte[]{1, 2, 3, 4})).containsExactly(2, 3, 4, 1);
    assertThat(ByteUtils.rotateLeft(new byte[0])).isEmpty();
  }

  @Test
  void xor_unequalLengths_throws() {
    assertThatThrownBy(() -> ByteUtils.xor(new byte[2], new byte[3]))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("equal length");
  }

  @Test
  void xor_combinesBytewise() {
    assertThat(ByteUtils.xor(new byte[]{0x0F, (byte) 0xF0}, new byte[]{(byte) 0xFF, (byte) 0xFF}))
        .containsExactly(0xF0, 0x0F);
  }
}
