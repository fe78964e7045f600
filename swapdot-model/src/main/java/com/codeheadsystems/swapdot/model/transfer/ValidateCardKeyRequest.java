package com.codeheadsystems.swapdot.model.transfer;

import com.codeheadsystems.swapdot.model.WireBytes;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Submits the data read from the token's key file so the server can check it.
 * <p>
 * Used by: {@code POST /transfers/sessions/validate-key}
 *
 * @param authSessionId      the authenticated session the file was read under
 * @param transferSessionId  the transfer session
 * @param cardDataBase64     base64-encoded file contents, status word removed
 */
public record ValidateCardKeyRequest(
    @JsonProperty("authSessionId") String authSessionId,
    @JsonProperty("transferSessionId") String transferSessionId,
    @JsonProperty("cardData") String cardDataBase64) {

  public String requiredAuthSessionId() {
    return WireBytes.require(authSessionId, "authSessionId");
  }

  public String requiredTransferSessionId() {
    return WireBytes.require(transferSessionId, "transferSessionId");
  }

  public byte[] cardData() {
    return WireBytes.decode(cardDataBase64, "cardData");
  }
}
