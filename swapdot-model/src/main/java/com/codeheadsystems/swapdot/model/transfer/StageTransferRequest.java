package com.codeheadsystems.swapdot.model.transfer;

import com.codeheadsystems.swapdot.model.WireBytes;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Prepares the ledger for a transfer without touching the token.
 * <p>
 * Used by: {@code POST /transfers/stage}
 *
 * @param sessionId  the validated transfer session
 * @param newKeyHash SHA-256 hex of the key about to be written to the card
 * @param toUid      the recipient, or null for the session's receiver
 */
public record StageTransferRequest(
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("newKeyHash") String newKeyHash,
    @JsonProperty("toUid") String toUid) {

  public String requiredSessionId() {
    return WireBytes.require(sessionId, "sessionId");
  }

  public String requiredNewKeyHash() {
    return WireBytes.require(newKeyHash, "newKeyHash");
  }
}
