package com.codeheadsystems.swapdot.model;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Base64 helpers shared by the wire models. Every byte array on the wire (APDUs, card
 * responses, challenges) travels as standard base64.
 */
public final class WireBytes {

  private static final Base64.Encoder B64 = Base64.getEncoder();
  private static final Base64.Decoder B64D = Base64.getDecoder();

  private WireBytes() {
  }

  /**
   * Encodes bytes, passing null through.
   *
   * @param bytes the bytes
   * @return the base64 string or null
   */
  public static String encode(byte[] bytes) {
    return bytes == null ? null : B64.encodeToString(bytes);
  }

  /**
   * Encodes a list of frames.
   *
   * @param frames the frames
   * @return base64 strings in the same order
   */
  public static List<String> encodeAll(List<byte[]> frames) {
    List<String> out = new ArrayList<>(frames.size());
    frames.forEach(f -> out.add(encode(f)));
    return out;
  }

  /**
   * Decodes a required base64 field.
   *
   * @param value     the base64 value
   * @param fieldName the JSON field name, for the error message
   * @return the bytes
   * @throws IllegalArgumentException if the value is missing or not base64
   */
  public static byte[] decode(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Missing required field: " + fieldName);
    }
    try {
      return B64D.decode(value);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid base64 in field: " + fieldName, e);
    }
  }

  /**
   * Checks a required string field.
   *
   * @param value     the value
   * @param fieldName the JSON field name, for the error message
   * @return the value
   * @throws IllegalArgumentException if the value is missing
   */
  public static String require(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Missing required field: " + fieldName);
    }
    return value;
  }
}
