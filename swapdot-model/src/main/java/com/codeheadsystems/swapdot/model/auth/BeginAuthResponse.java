package com.codeheadsystems.swapdot.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The first native authenticate command, to be relayed to the card.
 * <p>
 * Used by: {@code POST /auth/begin} response
 *
 * @param sessionId  the authentication session, echoed on every continue call
 * @param apduBase64 base64-encoded command APDU
 * @param expiresAt  ISO-8601 instant after which the session is gone
 */
public record BeginAuthResponse(
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("apdu") String apduBase64,
    @JsonProperty("expiresAt") String expiresAt) {
}
