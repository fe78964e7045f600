package com.codeheadsystems.swapdot.model.transfer;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code POST /transfers/stage} response
 *
 * @param stagedId  the staged transfer, used to commit or roll back
 * @param expiresAt ISO-8601 deadline for commit
 */
public record StageTransferResponse(
    @JsonProperty("stagedId") String stagedId,
    @JsonProperty("expiresAt") String expiresAt) {
}
