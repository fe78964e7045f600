package com.codeheadsystems.swapdot.model.auth;

import com.codeheadsystems.swapdot.model.WireBytes;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Starts mutual authentication with a token.
 * <p>
 * The caller must be the token's current owner unless {@code allowUnowned} is set, which is
 * only honoured for tokens that have no owner yet (initial provisioning).
 * <p>
 * Used by: {@code POST /auth/begin}
 *
 * @param tokenId      the token identifier
 * @param keyNo        key number on the card, defaults to 0 (the master key)
 * @param allowUnowned true to authenticate a token that has never been registered
 */
public record BeginAuthRequest(
    @JsonProperty("tokenId") String tokenId,
    @JsonProperty("keyNo") Integer keyNo,
    @JsonProperty("allowUnowned") Boolean allowUnowned) {

  public String requiredTokenId() {
    return WireBytes.require(tokenId, "tokenId");
  }

  public int keyNoOrDefault() {
    return keyNo == null ? 0 : keyNo;
  }

  public boolean allowUnownedOrDefault() {
    return Boolean.TRUE.equals(allowUnowned);
  }
}
