package com.codeheadsystems.swapdot.model.card;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * ReadData command plus the frame used to pull each further chunk while the card answers
 * {@code 91 AF}.
 * <p>
 * Used by: {@code POST /card/read-file} response
 *
 * @param apduBase64         base64-encoded ReadData APDU
 * @param continuationBase64 base64-encoded additional-frame APDU with an empty body
 */
public record ReadFileResponse(
    @JsonProperty("apdu") String apduBase64,
    @JsonProperty("continuation") String continuationBase64) {
}
