package com.codeheadsystems.swapdot.model.transfer;

import com.codeheadsystems.swapdot.model.WireBytes;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Opens a two-phase transfer session. Only the current owner may open one.
 * <p>
 * Used by: {@code POST /transfers/sessions}
 *
 * @param tokenId the token identifier
 * @param toUid   intended recipient, optional until staging
 */
public record OpenTransferSessionRequest(
    @JsonProperty("tokenId") String tokenId,
    @JsonProperty("toUid") String toUid) {

  public String requiredTokenId() {
    return WireBytes.require(tokenId, "tokenId");
  }
}
