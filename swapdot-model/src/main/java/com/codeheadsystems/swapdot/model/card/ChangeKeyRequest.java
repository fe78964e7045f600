package com.codeheadsystems.swapdot.model.card;

import com.codeheadsystems.swapdot.model.WireBytes;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Rotates a card key to a freshly generated one.
 * <p>
 * Used by: {@code POST /card/change-key}
 *
 * @param sessionId  an authenticated session
 * @param keyNo      key number to change, defaults to 0
 * @param keyVersion version byte stored with the new key, defaults to 0
 */
public record ChangeKeyRequest(
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("keyNo") Integer keyNo,
    @JsonProperty("keyVersion") Integer keyVersion) {

  public String requiredSessionId() {
    return WireBytes.require(sessionId, "sessionId");
  }

  public int keyNoOrDefault() {
    return keyNo == null ? 0 : keyNo;
  }

  public int keyVersionOrDefault() {
    return keyVersion == null ? 0 : keyVersion;
  }
}
