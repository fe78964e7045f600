package com.codeheadsystems.swapdot.model.card;

import com.codeheadsystems.swapdot.model.WireBytes;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Writes a fresh token key to the card as part of a transfer.
 * <p>
 * Used by: {@code POST /card/write-transfer-data}
 *
 * @param sessionId         an authenticated session
 * @param transferSessionId the transfer session that records the new key hash
 * @param mode              PLAIN, MACED or ENCIPHERED; defaults to MACED
 */
public record WriteTransferDataRequest(
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("transferSessionId") String transferSessionId,
    @JsonProperty("mode") String mode) {

  public String requiredSessionId() {
    return WireBytes.require(sessionId, "sessionId");
  }

  public String requiredTransferSessionId() {
    return WireBytes.require(transferSessionId, "transferSessionId");
  }

  public String modeOrDefault() {
    return mode == null || mode.isBlank() ? "MACED" : mode;
  }
}
