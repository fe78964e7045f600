package com.codeheadsystems.swapdot.model.token;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Public view of a token. The key hash is never exposed.
 * <p>
 * Used by: {@code GET /tokens/{id}} and {@code POST /tokens} responses
 *
 * @param tokenId        the token identifier
 * @param ownerUid       current owner
 * @param previousOwners ownership history, oldest first
 * @param counter        number of completed transfers
 * @param status         OK or PENDING
 * @param tagUid         hex UID of the physical tag, if known
 */
public record TokenResponse(
    @JsonProperty("tokenId") String tokenId,
    @JsonProperty("ownerUid") String ownerUid,
    @JsonProperty("previousOwners") List<String> previousOwners,
    @JsonProperty("counter") long counter,
    @JsonProperty("status") String status,
    @JsonProperty("tagUid") String tagUid) {
}
