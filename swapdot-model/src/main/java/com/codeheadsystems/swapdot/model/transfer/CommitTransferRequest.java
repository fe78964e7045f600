package com.codeheadsystems.swapdot.model.transfer;

import com.codeheadsystems.swapdot.model.WireBytes;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Confirms the physical write succeeded.
 * <p>
 * Used by: {@code POST /transfers/commit}
 *
 * @param stagedId the staged transfer
 */
public record CommitTransferRequest(
    @JsonProperty("stagedId") String stagedId) {

  public String requiredStagedId() {
    return WireBytes.require(stagedId, "stagedId");
  }
}
