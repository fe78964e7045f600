package com.codeheadsystems.swapdot.model.transfer;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Token state after a completed transfer.
 * <p>
 * Used by: {@code POST /transfers/finalize} and {@code POST /transfers/commit} responses
 *
 * @param tokenId  the token identifier
 * @param ownerUid the new owner
 * @param counter  the token counter after the transfer
 */
public record TransferResultResponse(
    @JsonProperty("tokenId") String tokenId,
    @JsonProperty("ownerUid") String ownerUid,
    @JsonProperty("counter") long counter) {
}
