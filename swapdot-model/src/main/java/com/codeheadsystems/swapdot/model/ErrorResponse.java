package com.codeheadsystems.swapdot.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body returned by every endpoint.
 *
 * @param kind    error category, e.g. CONFLICT or EXPIRED
 * @param message human readable detail
 */
public record ErrorResponse(
    @JsonProperty("kind") String kind,
    @JsonProperty("message") String message) {
}
