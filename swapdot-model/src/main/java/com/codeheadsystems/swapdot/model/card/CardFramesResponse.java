package com.codeheadsystems.swapdot.model.card;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Command frames to send to the card in order. Every frame but the last should be answered
 * with {@code 91 AF}.
 * <p>
 * Used by: {@code POST /card/change-key} and {@code POST /card/write-transfer-data} responses
 *
 * @param framesBase64 base64-encoded command APDUs
 * @param keyHash      SHA-256 hex of the key being written; the key itself never leaves the server
 */
public record CardFramesResponse(
    @JsonProperty("frames") List<String> framesBase64,
    @JsonProperty("keyHash") String keyHash) {
}
