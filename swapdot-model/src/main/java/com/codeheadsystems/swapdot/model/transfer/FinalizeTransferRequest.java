package com.codeheadsystems.swapdot.model.transfer;

import com.codeheadsystems.swapdot.model.WireBytes;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Claims a pending transfer for the caller.
 * <p>
 * Used by: {@code POST /transfers/finalize}
 *
 * @param tokenId the token identifier
 * @param tagUid  hex UID read from the physical tag, checked when the token has one on record
 */
public record FinalizeTransferRequest(
    @JsonProperty("tokenId") String tokenId,
    @JsonProperty("tagUid") String tagUid) {

  public String requiredTokenId() {
    return WireBytes.require(tokenId, "tokenId");
  }
}
