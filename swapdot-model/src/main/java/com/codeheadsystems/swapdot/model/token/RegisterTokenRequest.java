package com.codeheadsystems.swapdot.model.token;

import com.codeheadsystems.swapdot.model.WireBytes;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Registers a token to the caller.
 * <p>
 * Used by: {@code POST /tokens}
 *
 * @param tokenId        the token identifier
 * @param keyHash        SHA-256 hex of the token key already on the card
 * @param tagUid         hex UID of the physical tag, optional
 * @param forceOverwrite re-register an existing token; the previous owner is kept in history
 */
public record RegisterTokenRequest(
    @JsonProperty("tokenId") String tokenId,
    @JsonProperty("keyHash") String keyHash,
    @JsonProperty("tagUid") String tagUid,
    @JsonProperty("forceOverwrite") Boolean forceOverwrite) {

  public String requiredTokenId() {
    return WireBytes.require(tokenId, "tokenId");
  }

  public String requiredKeyHash() {
    return WireBytes.require(keyHash, "keyHash");
  }

  public boolean forceOverwriteOrDefault() {
    return Boolean.TRUE.equals(forceOverwrite);
  }
}
