package com.codeheadsystems.swapdot.desfire;

/**
 * A card response with its trailing status word removed.
 */
public final class CardResponse {

  private final StatusWord status;
  private final byte[] data;
  private final int sw1;
  private final int sw2;

  private CardResponse(StatusWord status, byte[] data, int sw1, int sw2) {
    this.status = status;
    this.data = data;
    this.sw1 = sw1;
    this.sw2 = sw2;
  }

  /**
   * Splits a raw response into body and status word.
   *
   * @param raw response bytes as relayed from the card, status word last
   * @return the classified response
   * @throws MalformedFrameException if fewer than two bytes were supplied
   */
  public static CardResponse parse(byte[] raw) {
    if (raw == null || raw.length < 2) {
      throw new MalformedFrameException("Card response must include a status word");
    }
    byte[] data = ByteUtils.slice(raw, 0, raw.length - 2);
    int sw1 = raw[raw.length - 2] & 0xFF;
    int sw2 = raw[raw.length - 1] & 0xFF;
    return new CardResponse(StatusWord.of(sw1, sw2), data, sw1, sw2);
  }

  public StatusWord status() {
    return status;
  }

  /**
   * Response body without the status word.
   *
   * @return a copy of the body
   */
  public byte[] data() {
    return data.clone();
  }

  /**
   * Status {@code 91 00}.
   */
  public boolean isSuccess() {
    return status == StatusWord.OPERATION_OK;
  }

  /**
   * Status {@code 91 AF}: the card expects another frame.
   */
  public boolean hasMoreFrames() {
    return status == StatusWord.ADDITIONAL_FRAME;
  }

  public boolean isFailure() {
    return !isSuccess() && !hasMoreFrames();
  }

  /**
   * Human readable description including the raw status bytes.
   *
   * @return the string
   */
  public String describe() {
    return String.format("%s (%02X %02X)", status.description(), sw1, sw2);
  }

  @Override
  public String toString() {
    return "CardResponse[" + describe() + ", " + data.length + " bytes]";
  }
}
