package com.codeheadsystems.swapdot.desfire;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class ChecksumsTest {

  @Test
  void crc16_checkValue() {
    // reflected 0x8005, init 0xFFFF: check value 0x4B37
    byte[] crc = Checksums.crc16("123456789".getBytes(StandardCharsets.US_ASCII));
    assertThat(crc).containsExactly(0x37, 0x4B);
  }

  @Test
  void crc16_empty_isInitialValue() {
    assertThat(Checksums.crc16(new byte[0])).containsExactly(0xFF, 0xFF);
  }

  @Test
  void crc32_failsLoudly() {
    assertThatThrownBy(() -> Checksums.crc32(new byte[]{1}))
        .isInstanceOf(UnsupportedOperationException.class)
        .hasMessageContaining("AES");
  }
}
