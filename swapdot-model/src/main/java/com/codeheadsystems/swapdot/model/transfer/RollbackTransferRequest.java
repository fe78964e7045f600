package com.codeheadsystems.swapdot.model.transfer;

import com.codeheadsystems.swapdot.model.WireBytes;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Reports that the physical write failed.
 * <p>
 * Used by: {@code POST /transfers/rollback}
 *
 * @param stagedId the staged transfer
 * @param reason   free-text reason, recorded in the audit log
 */
public record RollbackTransferRequest(
    @JsonProperty("stagedId") String stagedId,
    @JsonProperty("reason") String reason) {

  public String requiredStagedId() {
    return WireBytes.require(stagedId, "stagedId");
  }

  public String reasonOrDefault() {
    return reason == null || reason.isBlank() ? "unspecified" : reason;
  }
}
