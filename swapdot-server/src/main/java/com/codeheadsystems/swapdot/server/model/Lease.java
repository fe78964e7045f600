package com.codeheadsystems.swapdot.server.model;

import java.time.Instant;

/**
 * Short-lived exclusive claim on a token while a card authentication is in flight.
 *
 * @param leaseId   random lease identifier
 * @param sessionId the auth session holding the lease
 * @param expiresAt when the lease lapses on its own
 */
public record Lease(String leaseId, String sessionId, Instant expiresAt) {

  public boolean isLive(Instant now) {
    return expiresAt.isAfter(now);
  }
}
