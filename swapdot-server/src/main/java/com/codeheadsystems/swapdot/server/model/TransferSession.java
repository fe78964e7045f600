package com.codeheadsystems.swapdot.server.model;

import java.time.Instant;

/**
 * Preamble of a two-phase transfer: binds an owner, a token and a random challenge, and
 * records whether the card key has been checked server-side.
 *
 * @param sessionId          session id
 * @param tokenId            the token
 * @param fromUid            the owner who opened the session
 * @param toUid              intended receiver, or null
 * @param challengeHex       16-byte random challenge, hex
 * @param challengeValidated true once the card key matched
 * @param validatedKeyHash   the key hash that matched, or null
 * @param pendingKeyHash     SHA-256 hex of a key written during this session, or null
 * @param state              state
 * @param stagedId           the active staged transfer, or null
 * @param expiresAt          deadline while PENDING
 * @param createdAt          creation time
 */
public record TransferSession(
    String sessionId,
    String tokenId,
    String fromUid,
    String toUid,
    String challengeHex,
    boolean challengeValidated,
    String validatedKeyHash,
    String pendingKeyHash,
    TransferSessionState state,
    String stagedId,
    Instant expiresAt,
    Instant createdAt) {

  public boolean isExpired(Instant now) {
    return !expiresAt.isAfter(now);
  }

  public TransferSession withState(TransferSessionState newState) {
    return new TransferSession(sessionId, tokenId, fromUid, toUid, challengeHex, challengeValidated,
        validatedKeyHash, pendingKeyHash, newState, stagedId, expiresAt, createdAt);
  }

  public TransferSession withPendingKeyHash(String keyHash) {
    return new TransferSession(sessionId, tokenId, fromUid, toUid, challengeHex, challengeValidated,
        validatedKeyHash, keyHash, state, stagedId, expiresAt, createdAt);
  }

  public TransferSession validated(String keyHash) {
    return new TransferSession(sessionId, tokenId, fromUid, toUid, challengeHex, true,
        keyHash, pendingKeyHash, state, stagedId, expiresAt, createdAt);
  }

  public TransferSession staged(String newStagedId) {
    return new TransferSession(sessionId, tokenId, fromUid, toUid, challengeHex, challengeValidated,
        validatedKeyHash, pendingKeyHash, TransferSessionState.STAGED, newStagedId, expiresAt, createdAt);
  }

  /**
   * Back to PENDING after a rollback or an expired stage, so the transfer can be retried.
   *
   * @return the session
   */
  public TransferSession reopened() {
    return new TransferSession(sessionId, tokenId, fromUid, toUid, challengeHex, challengeValidated,
        validatedKeyHash, pendingKeyHash, TransferSessionState.PENDING, null, expiresAt, createdAt);
  }
}
