package com.codeheadsystems.swapdot.model.transfer;

import com.codeheadsystems.swapdot.model.WireBytes;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Opens a legacy pending transfer. Only the current owner may initiate.
 * <p>
 * Used by: {@code POST /transfers/initiate}
 *
 * @param tokenId the token identifier
 */
public record InitiateTransferRequest(
    @JsonProperty("tokenId") String tokenId) {

  public String requiredTokenId() {
    return WireBytes.require(tokenId, "tokenId");
  }
}
