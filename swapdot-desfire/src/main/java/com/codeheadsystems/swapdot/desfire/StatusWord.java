package com.codeheadsystems.swapdot.desfire;

import java.util.Arrays;

/**
 * DESFire native status codes, carried as {@code 91 xx} at the end of every response.
 */
public enum StatusWord {

  OPERATION_OK(0x00, "Success"),
  ADDITIONAL_FRAME(0xAF, "More frames"),
  LENGTH_ERROR(0x7E, "Length error"),
  PERMISSION_DENIED(0x9D, "Permission denied"),
  FILE_NOT_FOUND(0xF0, "File not found"),
  APPLICATION_NOT_FOUND(0xA0, "Application not found"),
  BOUNDARY_ERROR(0xBE, "Boundary error"),
  COMMAND_NOT_SUPPORTED(0x1C, "Command not supported"),
  AUTHENTICATION_ERROR(0xAE, "Authentication error"),
  INTEGRITY_ERROR(0x1E, "Integrity error"),
  NOT_FOUND(0xBD, "Not found"),
  UNKNOWN(-1, "Unknown status");

  /**
   * SW1 of every native DESFire response.
   */
  public static final int NATIVE_SW1 = 0x91;

  private final int code;
  private final String description;

  StatusWord(int code, String description) {
    this.code = code;
    this.description = description;
  }

  /**
   * Maps a status word pair to its named status.
   *
   * @param sw1 first status byte
   * @param sw2 second status byte
   * @return the status, or {@link #UNKNOWN}
   */
  public static StatusWord of(int sw1, int sw2) {
    if ((sw1 & 0xFF) != NATIVE_SW1) {
      return UNKNOWN;
    }
    return Arrays.stream(values())
        .filter(s -> s.code == (sw2 & 0xFF))
        .findFirst()
        .orElse(UNKNOWN);
  }

  public int code() {
    return code;
  }

  public String description() {
    return description;
  }
}
