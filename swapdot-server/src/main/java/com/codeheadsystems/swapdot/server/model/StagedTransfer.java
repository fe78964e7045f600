package com.codeheadsystems.swapdot.server.model;

import java.time.Instant;

/**
 * Ledger preparation for a two-phase transfer. The token itself is only touched on commit,
 * which applies {@code proposed}; {@code original} is kept for audit and conflict detection.
 *
 * @param stagedId       staged transfer id
 * @param sessionId      the transfer session
 * @param tokenId        the token
 * @param fromUid        current owner at staging
 * @param toUid          receiver
 * @param original       token pre-image
 * @param proposed       token post-image
 * @param state          state
 * @param expiresAt      commit deadline
 * @param createdAt      creation time
 * @param rollbackReason reason given on rollback, or null
 */
public record StagedTransfer(
    String stagedId,
    String sessionId,
    String tokenId,
    String fromUid,
    String toUid,
    TokenSnapshot original,
    TokenSnapshot proposed,
    StagedState state,
    Instant expiresAt,
    Instant createdAt,
    String rollbackReason) {

  public boolean isExpired(Instant now) {
    return !expiresAt.isAfter(now);
  }

  public StagedTransfer withState(StagedState newState) {
    return new StagedTransfer(stagedId, sessionId, tokenId, fromUid, toUid, original, proposed, newState,
        expiresAt, createdAt, rollbackReason);
  }

  public StagedTransfer rolledBack(String reason) {
    return new StagedTransfer(stagedId, sessionId, tokenId, fromUid, toUid, original, proposed,
        StagedState.ROLLED_BACK, expiresAt, createdAt, reason);
  }
}
