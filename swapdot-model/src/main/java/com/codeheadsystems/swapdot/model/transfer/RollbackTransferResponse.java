package com.codeheadsystems.swapdot.model.transfer;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code POST /transfers/rollback} response
 *
 * @param stagedId  the staged transfer, now ROLLED_BACK
 * @param sessionId the transfer session, back to PENDING and retryable
 */
public record RollbackTransferResponse(
    @JsonProperty("stagedId") String stagedId,
    @JsonProperty("sessionId") String sessionId) {
}
