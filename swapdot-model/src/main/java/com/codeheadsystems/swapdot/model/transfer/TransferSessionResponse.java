package com.codeheadsystems.swapdot.model.transfer;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code POST /transfers/sessions} and {@code POST /transfers/sessions/validate-key}
 * responses
 *
 * @param sessionId          the transfer session
 * @param tokenId            the token identifier
 * @param state              PENDING, STAGED, COMPLETED or EXPIRED
 * @param challengeValidated true once the card key has been checked server-side
 * @param expiresAt          ISO-8601 session deadline
 */
public record TransferSessionResponse(
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("tokenId") String tokenId,
    @JsonProperty("state") String state,
    @JsonProperty("challengeValidated") boolean challengeValidated,
    @JsonProperty("expiresAt") String expiresAt) {
}
