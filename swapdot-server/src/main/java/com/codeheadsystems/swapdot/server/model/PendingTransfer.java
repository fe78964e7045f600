package com.codeheadsystems.swapdot.server.model;

import java.time.Instant;

/**
 * Legacy pending transfer, at most one per token and keyed by the token id.
 *
 * @param tokenId     the token
 * @param fromUid     the owner who initiated
 * @param toUid       receiver, null until bound by finalize
 * @param nextCounter counter value the token will take
 * @param expiresAt   deadline
 * @param state       state
 * @param createdAt   creation time
 */
public record PendingTransfer(
    String tokenId,
    String fromUid,
    String toUid,
    long nextCounter,
    Instant expiresAt,
    PendingState state,
    Instant createdAt) {

  public boolean isExpired(Instant now) {
    return !expiresAt.isAfter(now);
  }

  public boolean isLiveOpen(Instant now) {
    return state == PendingState.OPEN && !isExpired(now);
  }

  public PendingTransfer withState(PendingState newState) {
    return new PendingTransfer(tokenId, fromUid, toUid, nextCounter, expiresAt, newState, createdAt);
  }
}
