package com.codeheadsystems.swapdot.model.transfer;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code POST /transfers/initiate} response
 *
 * @param tokenId     the token identifier
 * @param nextCounter the counter the token will carry once finalized
 * @param expiresAt   ISO-8601 deadline for finalize
 */
public record InitiateTransferResponse(
    @JsonProperty("tokenId") String tokenId,
    @JsonProperty("nextCounter") long nextCounter,
    @JsonProperty("expiresAt") String expiresAt) {
}
