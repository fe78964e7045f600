package com.codeheadsystems.swapdot.model.auth;

import com.codeheadsystems.swapdot.model.WireBytes;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Relays the card's answer to the previous authentication command.
 * <p>
 * Used by: {@code POST /auth/continue}
 *
 * @param sessionId          the authentication session
 * @param cardResponseBase64 base64-encoded raw card response, status word included
 */
public record ContinueAuthRequest(
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("cardResponse") String cardResponseBase64) {

  public String requiredSessionId() {
    return WireBytes.require(sessionId, "sessionId");
  }

  public byte[] cardResponse() {
    return WireBytes.decode(cardResponseBase64, "cardResponse");
  }
}
