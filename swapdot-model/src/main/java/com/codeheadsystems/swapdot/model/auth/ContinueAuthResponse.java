package com.codeheadsystems.swapdot.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of one authentication step. While {@code authenticated} is false, {@code apdu}
 * holds the next command for the card.
 * <p>
 * Used by: {@code POST /auth/continue} response
 *
 * @param sessionId     the authentication session
 * @param phase         the session phase after this step
 * @param apduBase64    next command for the card, null once authenticated
 * @param authenticated true once the card has proven knowledge of the key
 */
public record ContinueAuthResponse(
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("phase") String phase,
    @JsonProperty("apdu") String apduBase64,
    @JsonProperty("authenticated") boolean authenticated) {
}
